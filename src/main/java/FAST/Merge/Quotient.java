package FAST.Merge;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Merging two states of a deterministic automaton.
 * The input is never touched: a merge produces a fresh, reachability-pruned {@link CompactDFA}
 * whose states are numbered in breadth-first order (symbols in alphabet order).
 */
public class Quotient {

    /**
     * Merge p and q, then keep merging the targets of conflicting transitions until the result is
     * deterministic again (the fixed point of one merge step).
     * @param table - automaton to generalize
     * @param alphabet - Input symbols
     * @param p - first state
     * @param q - second state
     * @return merged automaton
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> CompactDFA<I> merge(TransitionTable table, Alphabet<I> alphabet, int p, int q) {
        final Folding folding = new Folding(table);
        folding.fold(p, q);
        return folding.toDFA(alphabet);
    }

    /**
     * Checks whether merging p and q makes the automaton accept some word it rejected before.
     * A quotient never loses a word, so this is the strict growth of the language.
     * @param table - automaton to generalize
     * @param p - first state
     * @param q - second state
     * @return whether the merged automaton accepts a word the table rejects
     */
    public static boolean enlarges(TransitionTable table, int p, int q) {
        final Folding folding = new Folding(table);
        folding.fold(p, q);
        return folding.acceptsOutside(table);
    }

    /**
     * Canonical key of the automaton structure: two automata get equal keys iff they are identical
     * up to the renaming of states.
     */
    public static IntArrayList signature(TransitionTable table) {
        final Folding folding = new Folding(table);
        final int[] order = folding.breadthFirstOrder();
        final int[] newId = new int[table.size()];
        Arrays.fill(newId, TransitionTable.NO_STATE);
        for (int i = 0; i < order.length; i++) {
            newId[order[i]] = i;
        }
        final IntArrayList key = new IntArrayList(order.length * (table.numSymbols() + 1) + 1);
        key.add(order.length);
        for (int s : order) {
            key.add(table.isAccepting(s) ? 1 : 0);
            for (int a = 0; a < table.numSymbols(); a++) {
                int t = table.successor(s, a);
                key.add(t == TransitionTable.NO_STATE ? TransitionTable.NO_STATE : newId[t]);
            }
        }
        return key;
    }

    private static final class Folding {
        final int[] parent;
        final int[][] succ;
        final boolean[] accepting;
        final int initial;
        final int numSymbols;

        Folding(TransitionTable table) {
            this.parent = new int[table.size()];
            for (int s = 0; s < parent.length; s++) {
                parent[s] = s;
            }
            this.succ = table.copySuccessors();
            this.accepting = table.copyAccepting();
            this.initial = table.initial();
            this.numSymbols = table.numSymbols();
        }

        int find(int s) {
            int root = s;
            while (parent[root] != root) {
                root = parent[root];
            }
            // path compression
            while (parent[s] != root) {
                int next = parent[s];
                parent[s] = root;
                s = next;
            }
            return root;
        }

        void fold(int p, int q) {
            final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
            pending.enqueue(p);
            pending.enqueue(q);
            while (!pending.isEmpty()) {
                int a = find(pending.dequeueInt());
                int b = find(pending.dequeueInt());
                if (a == b) {
                    continue;
                }
                // the older state represents the class
                int root = Math.min(a, b);
                int other = Math.max(a, b);
                parent[other] = root;
                accepting[root] |= accepting[other];
                for (int sym = 0; sym < numSymbols; sym++) {
                    int t1 = succ[root][sym];
                    int t2 = succ[other][sym];
                    if (t1 == TransitionTable.NO_STATE) {
                        succ[root][sym] = t2;
                    } else if (t2 != TransitionTable.NO_STATE) {
                        pending.enqueue(t1);
                        pending.enqueue(t2);
                    }
                }
            }
        }

        /**
         * @return representatives reachable from the initial class, in breadth-first order
         */
        int[] breadthFirstOrder() {
            final IntArrayList order = new IntArrayList();
            if (initial == TransitionTable.NO_STATE) {
                return order.toIntArray();
            }
            final boolean[] seen = new boolean[parent.length];
            int init = find(initial);
            seen[init] = true;
            order.add(init);
            for (int i = 0; i < order.size(); i++) {
                int r = order.getInt(i);
                for (int sym = 0; sym < numSymbols; sym++) {
                    int t = succ[r][sym];
                    if (t != TransitionTable.NO_STATE) {
                        int rt = find(t);
                        if (!seen[rt]) {
                            seen[rt] = true;
                            order.add(rt);
                        }
                    }
                }
            }
            return order.toIntArray();
        }

        /**
         * Walks the merged automaton in lockstep with the unmerged one, NO_STATE standing for the
         * rejecting sink of the latter.
         */
        boolean acceptsOutside(TransitionTable unmerged) {
            if (initial == TransitionTable.NO_STATE) {
                return false;
            }
            final long width = unmerged.size() + 1L;
            final LongOpenHashSet visited = new LongOpenHashSet();
            final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
            int init = find(initial);
            visited.add(init * width + initial + 1);
            pending.enqueue(init);
            pending.enqueue(initial);
            while (!pending.isEmpty()) {
                int r = pending.dequeueInt();
                int s = pending.dequeueInt();
                if (accepting[r] && (s == TransitionTable.NO_STATE || !unmerged.isAccepting(s))) {
                    return true;
                }
                for (int sym = 0; sym < numSymbols; sym++) {
                    int t = succ[r][sym];
                    if (t == TransitionTable.NO_STATE) {
                        continue;
                    }
                    int rt = find(t);
                    int st = s == TransitionTable.NO_STATE ? TransitionTable.NO_STATE : unmerged.successor(s, sym);
                    if (visited.add(rt * width + st + 1)) {
                        pending.enqueue(rt);
                        pending.enqueue(st);
                    }
                }
            }
            return false;
        }

        <I> CompactDFA<I> toDFA(Alphabet<I> alphabet) {
            final int[] order = breadthFirstOrder();
            final int[] newId = new int[parent.length];
            Arrays.fill(newId, TransitionTable.NO_STATE);
            final CompactDFA<I> out = new CompactDFA<>(alphabet, order.length);
            for (int i = 0; i < order.length; i++) {
                int r = order[i];
                newId[r] = i == 0 ? out.addInitialState(accepting[r]) : out.addState(accepting[r]);
            }
            for (int r : order) {
                for (int sym = 0; sym < numSymbols; sym++) {
                    int t = succ[r][sym];
                    if (t != TransitionTable.NO_STATE) {
                        int target = newId[find(t)];
                        if (target == TransitionTable.NO_STATE) {
                            throw new IllegalStateException("Merge left state " + t + " without a class");
                        }
                        out.setTransition(newId[r], sym, target);
                    }
                }
            }
            return out;
        }
    }
}
