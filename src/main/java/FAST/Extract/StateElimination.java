package FAST.Extract;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import FAST.AutomatonChecks;
import FAST.Ast.Regex;
import FAST.Ast.RegexFormat;
import FAST.Ast.Regexes;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;

/**
 * Automaton to regular expression conversion by state elimination.
 * <p>
 * The automaton is embedded in a generalized NFA whose edges carry expressions, with a fresh source
 * (ε-edge to the initial state) and a fresh sink (ε-edges from every accepting state). Every automaton
 * state is then eliminated: for each predecessor p and successor q of the eliminated state k, the edge
 * p→q receives (p→k)·(k→k)*·(k→q), parallel edges being combined by Union. The label left on
 * source→sink denotes the language of the automaton, whatever the elimination order.
 */
public class StateElimination {
    private static final Logger LOGGER = Logger.getLogger(StateElimination.class.getName());

    /**
     * @param dfa - trim deterministic automaton
     * @param alphabet - Input symbols
     * @param order - elimination order policy
     * @return expression denoting the language of dfa
     * @throws FAST.Model.InconsistentAutomatonException if dfa has no initial state, unreachable or dead states
     * @param <S> - State type
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <S, I> Regex<I> toRegex(DFA<S, I> dfa, Alphabet<I> alphabet, EliminationOrder order) {
        AutomatonChecks.requireSingleInitial(dfa);
        AutomatonChecks.requireTrim(dfa, alphabet);

        final List<S> states = new ArrayList<>(dfa.getStates());
        final Map<S, Integer> index = new HashMap<>();
        for (S s : states) {
            index.put(s, index.size());
        }
        final Graph<I> graph = new Graph<>(states.size());
        graph.addEdge(graph.source, index.get(dfa.getInitialState()), Regexes.epsilon());
        for (S s : states) {
            int from = index.get(s);
            for (I symbol : alphabet) {
                S t = dfa.getSuccessor(s, symbol);
                if (t != null) {
                    graph.addEdge(from, index.get(t), Regexes.literal(symbol));
                }
            }
            if (dfa.isAccepting(s)) {
                graph.addEdge(from, graph.sink, Regexes.epsilon());
            }
        }

        while (!graph.remaining.isEmpty()) {
            int k = order.select(graph.remaining, graph::inDegree, graph::outDegree);
            graph.eliminate(k);
        }

        final Regex<I> result = graph.label(graph.source, graph.sink);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(order.getName() + " elimination: " + RegexFormat.toInfix(result));
        }
        return result;
    }

    /**
     * Generalized NFA over int nodes; nodes 0..n-1 are the automaton states.
     */
    private static final class Graph<I> {
        final int source;
        final int sink;
        final List<Int2ObjectRBTreeMap<Regex<I>>> out;
        final List<IntRBTreeSet> in;
        final IntSortedSet remaining = new IntRBTreeSet();

        Graph(int n) {
            this.source = n;
            this.sink = n + 1;
            this.out = new ArrayList<>(n + 2);
            this.in = new ArrayList<>(n + 2);
            for (int i = 0; i < n + 2; i++) {
                out.add(new Int2ObjectRBTreeMap<>());
                in.add(new IntRBTreeSet());
            }
            for (int i = 0; i < n; i++) {
                remaining.add(i);
            }
        }

        void addEdge(int from, int to, Regex<I> label) {
            out.get(from).merge(to, label, Regexes::union);
            in.get(to).add(from);
        }

        Regex<I> label(int from, int to) {
            Regex<I> label = out.get(from).get(to);
            return label == null ? Regexes.emptySet() : label;
        }

        int inDegree(int s) {
            return in.get(s).size() - (in.get(s).contains(s) ? 1 : 0);
        }

        int outDegree(int s) {
            return out.get(s).size() - (out.get(s).containsKey(s) ? 1 : 0);
        }

        void eliminate(int k) {
            if (!remaining.remove(k)) {
                throw new IllegalStateException("State " + k + " was already eliminated");
            }
            final Regex<I> loop = out.get(k).get(k);
            final Regex<I> star = loop == null ? Regexes.epsilon() : Regexes.star(loop);

            final Int2ObjectRBTreeMap<Regex<I>> succs = out.get(k);
            succs.remove(k);
            final IntRBTreeSet preds = in.get(k);
            preds.remove(k);

            for (int p : preds) {
                final Regex<I> incoming = out.get(p).remove(k);
                final Regex<I> prefix = Regexes.concat(incoming, star);
                for (Int2ObjectMap.Entry<Regex<I>> e : succs.int2ObjectEntrySet()) {
                    addEdge(p, e.getIntKey(), Regexes.concat(prefix, e.getValue()));
                }
            }
            for (int q : succs.keySet()) {
                in.get(q).remove(k);
            }
            succs.clear();
            preds.clear();
        }
    }
}
