package FAST.Ast;

import static FAST.Words.word;

import java.util.List;
import java.util.Map;

import FAST.Model.InvalidInputException;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PatternsTest {
  private static final Map<String, CompactDFA<Character>> ALL = Patterns.defaults();

  private static void assertMatches(String name, String... infixes) {
    for (String infix : infixes) {
      Assertions.assertTrue(ALL.get(name).accepts(word(infix)), name + " rejects \"" + infix + "\"");
    }
  }

  private static void assertNoMatch(String name, String... infixes) {
    for (String infix : infixes) {
      Assertions.assertFalse(ALL.get(name).accepts(word(infix)), name + " accepts \"" + infix + "\"");
    }
  }

  @Test
  void testNames() {
    Assertions.assertEquals(List.of("alnum", "bool", "delimiter", "float", "hexa", "int", "ipv4", "letters",
        "path", "spaces", "uint", "word"), Patterns.names());
    Assertions.assertEquals(Patterns.names(), List.copyOf(ALL.keySet()));
    Assertions.assertEquals(List.of("uint", "spaces"), List.copyOf(Patterns.of(List.of("uint", "spaces")).keySet()));
    Assertions.assertThrows(InvalidInputException.class, () -> Patterns.of(List.of("uint", "date")));
  }

  @Test
  void testNumbers() {
    assertMatches("uint", "0", "123");
    assertNoMatch("uint", "", "-1", "1.5");
    assertMatches("int", "7", "-12", "+3");
    assertNoMatch("int", "-", "1.5");
    assertMatches("float", "1", "-1.5", "10.25");
    assertNoMatch("float", "1.", ".5", "1.2.3");
    assertMatches("hexa", "ff0A", "9");
    assertNoMatch("hexa", "0xg");
    assertMatches("bool", "0", "1");
    assertNoMatch("bool", "2", "01");
  }

  @Test
  void testAddresses() {
    assertMatches("ipv4", "192.168.0.255", "0.0.0.0", "10.1.20.249");
    assertNoMatch("ipv4", "256.1.1.1", "1.2.3", "1.2.3.4.5");
    assertMatches("path", "/usr/lib", "/tmp/a-b_c.txt");
    assertNoMatch("path", "usr/lib", "/");
  }

  @Test
  void testText() {
    assertMatches("spaces", " ", " \t\n");
    assertNoMatch("spaces", "", " a");
    assertMatches("letters", "abcXYZ");
    assertNoMatch("letters", "ab1");
    assertMatches("alnum", "ab1", "42");
    assertMatches("word", "a.b", "x=1");
    assertNoMatch("word", "a b");
    assertMatches("delimiter", "--", "==", "#");
    assertNoMatch("delimiter", "-+");
  }
}
