package FAST.Extract;

import static FAST.Words.edge;
import static FAST.Words.seq;

import java.util.List;

import FAST.Ast.Glushkov;
import FAST.Ast.Regex;
import FAST.Ast.RegexFormat;
import FAST.Ast.Regexes;
import FAST.Merge.Quotient;
import FAST.Merge.TransitionTable;
import FAST.Model.InconsistentAutomatonException;
import FAST.Model.Sample;
import FAST.PTABuilder;
import FAST.Words;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StateEliminationTest {
  private static final Alphabet<Character> AB = Alphabets.characters('a', 'b');

  private static final List<EliminationOrder> ORDERS = List.of(
      EliminationOrder.creationOrder(),
      EliminationOrder.outDegreeAscending(),
      EliminationOrder.inDegreeAscending(),
      EliminationOrder.degreeProductAscending());

  private static void assertAllOrdersEquivalent(CompactDFA<Character> dfa, Alphabet<Character> alphabet) {
    CompactDFA<Character> reference =
        Glushkov.toDFA(StateElimination.toRegex(dfa, alphabet, EliminationOrder.creationOrder()), alphabet);
    for (EliminationOrder order : ORDERS) {
      Regex<Character> ast = StateElimination.toRegex(dfa, alphabet, order);
      String debug = order.getName() + ": " + RegexFormat.toInfix(ast);
      Words.assertSameLanguage(dfa, ast, alphabet, 7, debug);
      Assertions.assertTrue(Automata.testEquivalence(reference, Glushkov.toDFA(ast, alphabet), alphabet), debug);
    }
  }

  @Test
  void testPrefixTreeCreationOrder() {
    Sample<Character> sample = Sample.fromStrings(List.of("ab", "aabb"));
    CompactDFA<Character> pta = PTABuilder.build(sample);
    Regex<Character> ast = StateElimination.toRegex(pta, sample.getAlphabet(), EliminationOrder.creationOrder());
    Assertions.assertEquals(Regexes.union(seq("ab"), seq("aabb")), ast);
    Assertions.assertEquals("ab|aabb", RegexFormat.toInfix(ast));
    Assertions.assertEquals(11, ast.size());
    assertAllOrdersEquivalent(pta, sample.getAlphabet());
  }

  @Test
  void testMergedAutomaton() {
    Sample<Character> sample = Sample.fromStrings(List.of("ab", "aabb"));
    TransitionTable t = TransitionTable.of(PTABuilder.build(sample), sample.getAlphabet());
    CompactDFA<Character> merged = Quotient.merge(t, sample.getAlphabet(), 1, 3);
    for (EliminationOrder order : ORDERS) {
      Assertions.assertTrue(Regexes.containsStar(StateElimination.toRegex(merged, sample.getAlphabet(), order)));
    }
    assertAllOrdersEquivalent(merged, sample.getAlphabet());
  }

  @Test
  void testCycles() {
    // 0 (acc) -a-> 1 -b-> 0, 1 -a-> 2 (acc), 2 -b-> 2, 2 -a-> 0
    CompactDFA<Character> dfa = new CompactDFA<>(AB);
    dfa.addInitialState(true);
    dfa.addState(false);
    dfa.addState(true);
    edge(dfa, 0, 'a', 1);
    edge(dfa, 1, 'b', 0);
    edge(dfa, 1, 'a', 2);
    edge(dfa, 2, 'b', 2);
    edge(dfa, 2, 'a', 0);
    assertAllOrdersEquivalent(dfa, AB);
  }

  @Test
  void testUniversal() {
    CompactDFA<Character> dfa = new CompactDFA<>(AB);
    dfa.addInitialState(true);
    edge(dfa, 0, 'a', 0);
    edge(dfa, 0, 'b', 0);
    Regex<Character> ast = StateElimination.toRegex(dfa, AB, EliminationOrder.creationOrder());
    Assertions.assertEquals("(a|b)*", RegexFormat.toInfix(ast));
    Assertions.assertEquals(4, ast.size());
  }

  @Test
  void testEmptyWord() {
    CompactDFA<Character> dfa = new CompactDFA<>(AB);
    dfa.addInitialState(true);
    Assertions.assertEquals(Regexes.epsilon(), StateElimination.toRegex(dfa, AB, EliminationOrder.creationOrder()));
  }

  @Test
  void testInconsistent() {
    CompactDFA<Character> unreachable = new CompactDFA<>(AB);
    unreachable.addInitialState(false);
    unreachable.addState(true);
    unreachable.addState(true);
    edge(unreachable, 0, 'a', 1);
    Assertions.assertThrows(InconsistentAutomatonException.class,
        () -> StateElimination.toRegex(unreachable, AB, EliminationOrder.creationOrder()));

    CompactDFA<Character> noInit = new CompactDFA<>(AB);
    noInit.addState(true);
    Assertions.assertThrows(InconsistentAutomatonException.class,
        () -> StateElimination.toRegex(noInit, AB, EliminationOrder.creationOrder()));
  }

  @Test
  void testExtractorDeduplicates() {
    CompactDFA<Character> dfa = new CompactDFA<>(AB);
    dfa.addInitialState(false);
    dfa.addState(true);
    edge(dfa, 0, 'a', 1);
    // a single shape whatever the order
    List<Regex<Character>> asts = new RegexExtractor().extract(dfa, AB);
    Assertions.assertEquals(List.of(Regexes.literal('a')), asts);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new RegexExtractor(List.of()));
  }
}
