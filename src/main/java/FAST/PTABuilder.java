package FAST;

import java.util.logging.Logger;

import FAST.Model.Sample;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;

/**
 * Prefix tree acceptor: the trie-shaped deterministic automaton that accepts exactly the sample.
 */
public class PTABuilder {
    private static final Logger LOGGER = Logger.getLogger(PTABuilder.class.getName());

    /**
     * States are numbered in creation order: examples in sample order, each walked symbol by symbol.
     * @param sample - non-empty sample
     * @return prefix tree acceptor
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> CompactDFA<I> build(Sample<I> sample) {
        final Alphabet<I> alphabet = sample.getAlphabet();
        final CompactDFA<I> pta = new CompactDFA<>(alphabet, sample.totalLength() + 1);
        final int init = pta.addInitialState(false);
        for (Word<I> example : sample.getExamples()) {
            int curr = init;
            for (I symbol : example) {
                int symIdx = alphabet.getSymbolIndex(symbol);
                int succ = pta.getSuccessor(curr, symIdx);
                if (succ < 0) {
                    succ = pta.addState(false);
                    pta.setTransition(curr, symIdx, succ);
                }
                curr = succ;
            }
            pta.setAccepting(curr, true);
        }
        LOGGER.fine(() -> "Prefix tree of " + sample.size() + " examples: " + pta.size() + " states");
        return pta;
    }
}
