package FAST.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import FAST.Merge.TransitionTable;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.word.Word;
import net.automatalib.word.WordBuilder;

/**
 * Draws accepted words by uniform random walks over a deterministic automaton.
 * From an accepting state the walk stops with probability stopProbability; otherwise it follows one of
 * the transitions leading to a state that can still reach acceptance, chosen uniformly. A walk trapped
 * in a state without such a transition, or longer than maxWalkLength, is rejected and drawn again.
 * @param <I> - Input symbol type, e.g., Character
 */
public class RandomWords<I> {
    public static final int DEFAULT_MAX_ATTEMPTS = 1000;
    public static final int DEFAULT_MAX_WALK_LENGTH = 1000;

    private final TransitionTable table;
    private final boolean[] live;
    private final Alphabet<I> alphabet;
    private final double stopProbability;
    private final Random random;
    private final int maxAttempts;
    private final int maxWalkLength;

    public RandomWords(DFA<Integer, I> dfa, Alphabet<I> alphabet, double stopProbability, Random random) {
        this(dfa, alphabet, stopProbability, random, DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_WALK_LENGTH);
    }

    /**
     * @param dfa - automaton to walk, states numbered 0..size-1
     * @param alphabet - Input symbols
     * @param stopProbability - probability to stop on an accepting state, in (0, 1]
     * @param random - source of randomness; a seeded instance makes the draws reproducible
     * @param maxAttempts - walks tried per word before giving up
     * @param maxWalkLength - longest walk before rejecting it
     */
    public RandomWords(DFA<Integer, I> dfa, Alphabet<I> alphabet, double stopProbability, Random random,
                       int maxAttempts, int maxWalkLength) {
        if (!(stopProbability > 0 && stopProbability <= 1)) {
            throw new IllegalArgumentException("stopProbability must be in (0, 1]: " + stopProbability);
        }
        if (maxAttempts < 1 || maxWalkLength < 0) {
            throw new IllegalArgumentException(
                "Invalid bounds: maxAttempts=" + maxAttempts + ", maxWalkLength=" + maxWalkLength);
        }
        this.table = TransitionTable.of(dfa, alphabet);
        this.live = liveStates(table);
        this.alphabet = alphabet;
        this.stopProbability = stopProbability;
        this.random = random;
        this.maxAttempts = maxAttempts;
        this.maxWalkLength = maxWalkLength;
    }

    /**
     * @return an accepted word
     * @throws InvalidInputException if no walk succeeded within maxAttempts, e.g., for an empty language
     */
    public Word<I> next() {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Word<I> word = walk();
            if (word != null) {
                return word;
            }
        }
        throw new InvalidInputException("No accepted word found after " + maxAttempts + " random walks");
    }

    /**
     * @param n - number of words
     * @return n words, possibly with repetitions
     */
    public List<Word<I>> next(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Number of words must be positive: " + n);
        }
        final List<Word<I>> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(next());
        }
        return result;
    }

    // null if rejected
    private Word<I> walk() {
        int curr = table.initial();
        if (curr == TransitionTable.NO_STATE || !live[curr]) {
            return null;
        }
        final WordBuilder<I> word = new WordBuilder<>();
        final IntArrayList defined = new IntArrayList(table.numSymbols());
        while (word.size() <= maxWalkLength) {
            if (table.isAccepting(curr) && random.nextDouble() < stopProbability) {
                return word.toWord();
            }
            defined.clear();
            for (int a = 0; a < table.numSymbols(); a++) {
                int succ = table.successor(curr, a);
                if (succ != TransitionTable.NO_STATE && live[succ]) {
                    defined.add(a);
                }
            }
            if (defined.isEmpty()) {
                // trapped on an accepting state without successor
                return null;
            }
            int symbol = defined.getInt(random.nextInt(defined.size()));
            word.append(alphabet.getSymbol(symbol));
            curr = table.successor(curr, symbol);
        }
        return null;
    }

    /**
     * @return states from which an accepting state is reachable; skips sink states of complete automata
     */
    private static boolean[] liveStates(TransitionTable table) {
        final boolean[] live = new boolean[table.size()];
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int s = 0; s < table.size(); s++) {
                if (live[s]) {
                    continue;
                }
                boolean reaches = table.isAccepting(s);
                for (int a = 0; a < table.numSymbols() && !reaches; a++) {
                    int t = table.successor(s, a);
                    reaches = t != TransitionTable.NO_STATE && live[t];
                }
                if (reaches) {
                    live[s] = true;
                    changed = true;
                }
            }
        }
        return live;
    }
}
