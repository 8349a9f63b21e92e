package FAST.Score;

import FAST.Merge.TransitionTable;
import FAST.Model.Sample;
import net.automatalib.word.Word;

/**
 * Language density: probability that a uniformly drawn word is accepted, with the word length drawn
 * like the lengths of the examples.
 */
public class Density {
    private final double[] lengthProba;
    private final double charProba;

    public <I> Density(Sample<I> sample) {
        this.lengthProba = new double[sample.maxLength() + 1];
        for (Word<I> example : sample.getExamples()) {
            lengthProba[example.length()] += 1.0 / sample.size();
        }
        int alphabetSize = sample.getAlphabet().size();
        this.charProba = alphabetSize == 0 ? 0.0 : 1.0 / alphabetSize;
    }

    /**
     * Propagates the probability mass of the initial state one symbol at a time.
     * Exact for deterministic automata.
     */
    public double of(TransitionTable table) {
        if (table.initial() == TransitionTable.NO_STATE) {
            return 0.0;
        }
        double[] mass = new double[table.size()];
        mass[table.initial()] = 1.0;
        double result = 0.0;
        for (int length = 0; length < lengthProba.length; length++) {
            if (lengthProba[length] > 0) {
                double accepted = 0.0;
                for (int s = 0; s < mass.length; s++) {
                    if (table.isAccepting(s)) {
                        accepted += mass[s];
                    }
                }
                result += lengthProba[length] * accepted;
            }
            if (length + 1 < lengthProba.length) {
                final double[] next = new double[mass.length];
                for (int s = 0; s < mass.length; s++) {
                    if (mass[s] == 0.0) {
                        continue;
                    }
                    for (int a = 0; a < table.numSymbols(); a++) {
                        int t = table.successor(s, a);
                        if (t != TransitionTable.NO_STATE) {
                            next[t] += charProba * mass[s];
                        }
                    }
                }
                mass = next;
            }
        }
        return result;
    }
}
