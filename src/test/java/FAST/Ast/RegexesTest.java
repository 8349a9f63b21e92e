package FAST.Ast;

import static FAST.Words.lit;
import static FAST.Words.seq;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexesTest {
  @Test
  void testConcatLaws() {
    Regex<Character> a = lit('a');
    Assertions.assertEquals(a, Regexes.concat(Regexes.epsilon(), a));
    Assertions.assertEquals(a, Regexes.concat(a, Regexes.epsilon()));
    Assertions.assertEquals(Regexes.emptySet(), Regexes.concat(a, Regexes.emptySet()));
    Assertions.assertEquals(Regexes.emptySet(), Regexes.concat(Regexes.emptySet(), a));
    Assertions.assertEquals(new Regex.Concat<>(a, lit('b')), Regexes.concat(a, lit('b')));
  }

  @Test
  void testUnionLaws() {
    Regex<Character> a = lit('a');
    Regex<Character> aStar = Regexes.star(a);
    Assertions.assertEquals(a, Regexes.union(Regexes.emptySet(), a));
    Assertions.assertEquals(a, Regexes.union(a, Regexes.emptySet()));
    Assertions.assertEquals(a, Regexes.union(a, lit('a')));
    // ε is already part of a nullable alternative
    Assertions.assertEquals(aStar, Regexes.union(Regexes.epsilon(), aStar));
    Assertions.assertEquals(aStar, Regexes.union(aStar, Regexes.epsilon()));
    Assertions.assertEquals(new Regex.Union<>(Regexes.epsilon(), a), Regexes.union(Regexes.epsilon(), a));
  }

  @Test
  void testStarLaws() {
    Regex<Character> a = lit('a');
    Assertions.assertEquals(Regexes.epsilon(), Regexes.star(Regexes.<Character>epsilon()));
    Assertions.assertEquals(Regexes.epsilon(), Regexes.star(Regexes.<Character>emptySet()));
    Regex<Character> aStar = Regexes.star(a);
    Assertions.assertEquals(aStar, Regexes.star(aStar));
    Assertions.assertEquals(aStar, Regexes.star(Regexes.union(Regexes.epsilon(), a)));
    Assertions.assertEquals(aStar, Regexes.star(Regexes.union(a, Regexes.epsilon())));
  }

  @Test
  void testSizeAndNullable() {
    Regex<Character> ab = seq("ab");
    Assertions.assertEquals(3, ab.size());
    Assertions.assertFalse(ab.isNullable());
    Regex<Character> expr = Regexes.union(ab, seq("aabb"));
    Assertions.assertEquals(11, expr.size());
    Assertions.assertEquals(1, Regexes.<Character>epsilon().size());
    Assertions.assertTrue(Regexes.<Character>epsilon().isNullable());
    Assertions.assertFalse(Regexes.<Character>emptySet().isNullable());
    Assertions.assertTrue(Regexes.star(ab).isNullable());
    Assertions.assertEquals(4, Regexes.star(ab).size());
  }

  @Test
  void testWordAndUnionList() {
    Assertions.assertEquals(Regexes.epsilon(), seq(""));
    Assertions.assertEquals(new Regex.Concat<>(new Regex.Concat<>(lit('a'), lit('b')), lit('c')), seq("abc"));
    Assertions.assertEquals(Regexes.emptySet(), Regexes.union(List.<Regex<Character>>of()));
    Assertions.assertEquals(new Regex.Union<>(lit('a'), lit('b')), Regexes.union(List.of(lit('a'), lit('b'))));
  }

  @Test
  void testContainsStar() {
    Assertions.assertFalse(Regexes.containsStar(Regexes.union(seq("ab"), seq("aabb"))));
    Assertions.assertTrue(Regexes.containsStar(Regexes.concat(lit('a'), Regexes.star(lit('b')))));
  }
}
