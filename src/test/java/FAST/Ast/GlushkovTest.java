package FAST.Ast;

import static FAST.Words.lit;
import static FAST.Words.seq;
import static FAST.Words.word;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class GlushkovTest {
  private static final Alphabet<Character> AB = Alphabets.characters('a', 'b');

  @Test
  void testPositions() {
    // (a|b)*abb: 5 positions plus the initial state
    Regex<Character> r = Regexes.concat(Regexes.star(Regexes.union(lit('a'), lit('b'))), seq("abb"));
    CompactNFA<Character> nfa = Glushkov.toNFA(r, AB);
    Assertions.assertEquals(6, nfa.size());
    Assertions.assertTrue(nfa.accepts(word("abb")));
    Assertions.assertTrue(nfa.accepts(word("babb")));
    Assertions.assertFalse(nfa.accepts(word("ab")));
    Assertions.assertFalse(nfa.accepts(word("abba")));
  }

  @Test
  void testEpsilonAndEmptySet() {
    Assertions.assertTrue(Glushkov.accepts(Regexes.epsilon(), AB, word("")));
    Assertions.assertFalse(Glushkov.accepts(Regexes.epsilon(), AB, word("a")));
    Assertions.assertFalse(Glushkov.accepts(Regexes.emptySet(), AB, word("")));
    Assertions.assertEquals(1, Glushkov.toNFA(Regexes.<Character>emptySet(), AB).size());
  }

  @Test
  void testSymbolOutsideAlphabet() {
    Assertions.assertFalse(Glushkov.accepts(lit('a'), AB, word("c")));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Glushkov.toNFA(lit('c'), AB));
  }

  @Test
  void testEquivalentExpressions() {
    Regex<Character> a = lit('a');
    Regex<Character> b = lit('b');
    Regex<Character> all = Regexes.star(Regexes.union(a, b));
    Regex<Character> starOfStars = Regexes.star(Regexes.concat(Regexes.star(a), Regexes.star(b)));
    Assertions.assertTrue(Automata.testEquivalence(Glushkov.toDFA(all, AB), Glushkov.toDFA(starOfStars, AB), AB));

    Regex<Character> plus = Regexes.concat(Regexes.concat(a, Regexes.star(a)), Regexes.concat(b, Regexes.star(b)));
    Regex<Character> plus2 = Regexes.concat(Regexes.concat(Regexes.star(a), a), Regexes.concat(Regexes.star(b), b));
    Assertions.assertTrue(Automata.testEquivalence(Glushkov.toDFA(plus, AB), Glushkov.toDFA(plus2, AB), AB));
    Assertions.assertFalse(Automata.testEquivalence(Glushkov.toDFA(plus, AB), Glushkov.toDFA(all, AB), AB));
  }
}
