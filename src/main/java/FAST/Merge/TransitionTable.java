package FAST.Merge;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;

/**
 * Read-only int view of a deterministic automaton: states and symbols are indices,
 * a missing transition is {@link #NO_STATE}.
 */
public final class TransitionTable {
    public static final int NO_STATE = -1;

    private final int[][] succ;
    private final boolean[] accepting;
    private final int initial;

    TransitionTable(int[][] succ, boolean[] accepting, int initial) {
        this.succ = succ;
        this.accepting = accepting;
        this.initial = initial;
    }

    /**
     * @param dfa - automaton whose states are numbered 0..size-1
     * @param alphabet - Input symbols
     * @return table view of dfa
     */
    public static <I> TransitionTable of(DFA<Integer, I> dfa, Alphabet<I> alphabet) {
        final int n = dfa.size();
        final int[][] succ = new int[n][alphabet.size()];
        final boolean[] accepting = new boolean[n];
        for (int s = 0; s < n; s++) {
            accepting[s] = dfa.isAccepting(s);
            for (int a = 0; a < alphabet.size(); a++) {
                Integer t = dfa.getSuccessor(s, alphabet.getSymbol(a));
                succ[s][a] = t == null ? NO_STATE : t;
            }
        }
        Integer init = dfa.getInitialState();
        return new TransitionTable(succ, accepting, init == null ? NO_STATE : init);
    }

    public int size() {
        return succ.length;
    }

    public int numSymbols() {
        return succ.length == 0 ? 0 : succ[0].length;
    }

    public int initial() {
        return initial;
    }

    public boolean isAccepting(int state) {
        return accepting[state];
    }

    public int successor(int state, int symbol) {
        return succ[state][symbol];
    }

    /**
     * @return whether state has no outgoing transition
     */
    public boolean isLeaf(int state) {
        for (int t : succ[state]) {
            if (t != NO_STATE) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return whether both states have a transition on at least one common symbol
     */
    public boolean overlaps(int p, int q) {
        for (int a = 0; a < numSymbols(); a++) {
            if (succ[p][a] != NO_STATE && succ[q][a] != NO_STATE) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return whether both states are defined on exactly the same, non-empty, set of symbols
     */
    public boolean sameSignature(int p, int q) {
        boolean any = false;
        for (int a = 0; a < numSymbols(); a++) {
            boolean dp = succ[p][a] != NO_STATE;
            if (dp != (succ[q][a] != NO_STATE)) {
                return false;
            }
            any |= dp;
        }
        return any;
    }

    /**
     * Product walk from (p, q): is some word accepted from both states?
     */
    public boolean sharesSuffix(int p, int q) {
        final long width = size();
        final LongOpenHashSet visited = new LongOpenHashSet();
        final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        visited.add(p * width + q);
        pending.enqueue(p);
        pending.enqueue(q);
        while (!pending.isEmpty()) {
            int s = pending.dequeueInt();
            int t = pending.dequeueInt();
            if (accepting[s] && accepting[t]) {
                return true;
            }
            for (int a = 0; a < numSymbols(); a++) {
                int s2 = succ[s][a];
                int t2 = succ[t][a];
                if (s2 != NO_STATE && t2 != NO_STATE && visited.add(s2 * width + t2)) {
                    pending.enqueue(s2);
                    pending.enqueue(t2);
                }
            }
        }
        return false;
    }

    int[][] copySuccessors() {
        final int[][] copy = new int[succ.length][];
        for (int s = 0; s < succ.length; s++) {
            copy[s] = Arrays.copyOf(succ[s], succ[s].length);
        }
        return copy;
    }

    boolean[] copyAccepting() {
        return Arrays.copyOf(accepting, accepting.length);
    }
}
