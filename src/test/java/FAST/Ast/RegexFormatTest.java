package FAST.Ast;

import static FAST.Words.lit;
import static FAST.Words.seq;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexFormatTest {
  @Test
  void testInfix() {
    Assertions.assertEquals("ab|aabb", RegexFormat.toInfix(Regexes.union(seq("ab"), seq("aabb"))));
    Assertions.assertEquals("ab*", RegexFormat.toInfix(Regexes.concat(lit('a'), Regexes.star(lit('b')))));
    Assertions.assertEquals("(ab)*", RegexFormat.toInfix(Regexes.star(seq("ab"))));
    Assertions.assertEquals("(a|b)*", RegexFormat.toInfix(Regexes.star(Regexes.union(lit('a'), lit('b')))));
    Assertions.assertEquals("a(b|c)", RegexFormat.toInfix(Regexes.concat(lit('a'), Regexes.union(lit('b'), lit('c')))));
    Assertions.assertEquals("aa*bb*", RegexFormat.toInfix(Regexes.concat(
        Regexes.concat(Regexes.concat(lit('a'), Regexes.star(lit('a'))), lit('b')), Regexes.star(lit('b')))));
  }

  @Test
  void testInfixEpsilonAndEmpty() {
    Assertions.assertEquals("", RegexFormat.toInfix(Regexes.epsilon()));
    Assertions.assertEquals("∅", RegexFormat.toInfix(Regexes.emptySet()));
    Assertions.assertEquals("|a", RegexFormat.toInfix(Regexes.union(Regexes.epsilon(), lit('a'))));
    // not reachable through the smart constructors
    Assertions.assertEquals("()*", RegexFormat.toInfix(new Regex.Star<>(Regexes.<Character>epsilon())));
  }

  @Test
  void testPrefix() {
    Assertions.assertEquals(".(a,b)", RegexFormat.toPrefix(seq("ab")));
    Assertions.assertEquals("|(.(a,b),c)", RegexFormat.toPrefix(Regexes.union(seq("ab"), lit('c'))));
    Assertions.assertEquals("*a", RegexFormat.toPrefix(Regexes.star(lit('a'))));
    Assertions.assertEquals("|(ε,a)", RegexFormat.toPrefix(Regexes.union(Regexes.epsilon(), lit('a'))));
    Assertions.assertEquals("∅", RegexFormat.toPrefix(Regexes.emptySet()));
  }
}
