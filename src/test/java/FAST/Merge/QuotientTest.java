package FAST.Merge;

import static FAST.Words.edge;
import static FAST.Words.word;

import java.util.List;

import FAST.Model.Sample;
import FAST.PTABuilder;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class QuotientTest {
  private static final Alphabet<Character> AB = Alphabets.characters('a', 'b');

  private static TransitionTable ptaTable() {
    Sample<Character> sample = Sample.fromStrings(List.of("ab", "aabb"));
    return TransitionTable.of(PTABuilder.build(sample), sample.getAlphabet());
  }

  @Test
  void testMergeFoldsTargets() {
    TransitionTable t = ptaTable();
    // merging 1 and 3 forces 2 and 4 together
    CompactDFA<Character> merged = Quotient.merge(t, AB, 1, 3);
    Assertions.assertEquals(4, merged.size());
    TransitionTable m = TransitionTable.of(merged, AB);
    Assertions.assertEquals(1, m.successor(0, 0));
    Assertions.assertEquals(1, m.successor(1, 0));
    Assertions.assertEquals(2, m.successor(1, 1));
    Assertions.assertEquals(3, m.successor(2, 1));
    Assertions.assertTrue(m.isAccepting(2));
    Assertions.assertTrue(m.isAccepting(3));
    Assertions.assertFalse(m.isAccepting(1));

    Assertions.assertTrue(merged.accepts(word("ab")));
    Assertions.assertTrue(merged.accepts(word("aaab")));
    Assertions.assertTrue(merged.accepts(word("aabb")));
    Assertions.assertFalse(merged.accepts(word("abbb")));
    Assertions.assertFalse(merged.accepts(word("ba")));

    // the input is left untouched
    Assertions.assertEquals(3, t.successor(1, 0));
    Assertions.assertEquals(6, t.size());
  }

  @Test
  void testMergeRecursive() {
    // 0 and 1 collapse everything on 'a': a*b(b|ε)
    CompactDFA<Character> merged = Quotient.merge(ptaTable(), AB, 0, 1);
    Assertions.assertEquals(3, merged.size());
    Assertions.assertTrue(merged.accepts(word("b")));
    Assertions.assertTrue(merged.accepts(word("aaabb")));
    Assertions.assertFalse(merged.accepts(word("bbb")));
  }

  @Test
  void testMergeDropsUnreachable() {
    // merging the two final leaves
    CompactDFA<Character> merged = Quotient.merge(ptaTable(), AB, 2, 5);
    Assertions.assertEquals(5, merged.size());
    Assertions.assertTrue(merged.accepts(word("ab")));
    Assertions.assertTrue(merged.accepts(word("aabb")));
    Assertions.assertFalse(merged.accepts(word("aab")));
  }

  @Test
  void testEnlarges() {
    TransitionTable t = ptaTable();
    Assertions.assertFalse(Quotient.enlarges(t, 2, 5));
    // a(ab)*b
    Assertions.assertTrue(Quotient.enlarges(t, 1, 4));
    // 4 becomes accepting: "aab"
    Assertions.assertTrue(Quotient.enlarges(t, 4, 5));
  }

  @Test
  void testSignatureIgnoresNumbering() {
    // a(b|ε) numbered two ways
    CompactDFA<Character> first = new CompactDFA<>(AB);
    first.addInitialState(false);
    first.addState(true);
    first.addState(true);
    edge(first, 0, 'a', 1);
    edge(first, 1, 'b', 2);

    CompactDFA<Character> second = new CompactDFA<>(AB);
    second.addState(true);
    second.addState(true);
    second.addInitialState(false);
    edge(second, 2, 'a', 1);
    edge(second, 1, 'b', 0);

    Assertions.assertEquals(Quotient.signature(TransitionTable.of(first, AB)),
        Quotient.signature(TransitionTable.of(second, AB)));

    second.setAccepting(0, false);
    Assertions.assertNotEquals(Quotient.signature(TransitionTable.of(first, AB)),
        Quotient.signature(TransitionTable.of(second, AB)));
  }
}
