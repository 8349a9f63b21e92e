package FAST.Score;

import FAST.Ast.Regex;
import FAST.Merge.TransitionTable;
import FAST.Model.Measures;
import FAST.Model.Sample;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Measures candidates against the prefix tree of their sample and scores them with an {@link Objective}.
 * <ul>
 *     <li>size: AST node count; penalizes spelling the examples out</li>
 *     <li>generalization: share of prefix tree states removed by merging</li>
 *     <li>overgeneralization: density gained over the prefix tree; penalizes the universal language</li>
 *     <li>density: probability that a random word of an example length is accepted</li>
 * </ul>
 * For the unmerged prefix tree both generalization terms are zero.
 */
public class Scorer {
    private final Objective objective;
    private final Sample<?> sample;
    private final Density density;
    private final int prefixTreeSize;
    private final double prefixTreeDensity;

    /**
     * @param objective - turns measures into scores
     * @param sample - examples
     * @param prefixTree - prefix tree acceptor of the sample
     */
    public <I> Scorer(Objective objective, Sample<I> sample, CompactDFA<I> prefixTree) {
        this.objective = objective;
        this.sample = sample;
        this.density = new Density(sample);
        this.prefixTreeSize = prefixTree.size();
        this.prefixTreeDensity = density.of(TransitionTable.of(prefixTree, sample.getAlphabet()));
    }

    public Objective getObjective() {
        return objective;
    }

    public <I> Measures measure(Regex<I> ast, CompactDFA<I> source, Alphabet<I> alphabet) {
        return measure(ast, TransitionTable.of(source, alphabet));
    }

    public Measures measure(Regex<?> ast, TransitionTable source) {
        double generalization = (double) (prefixTreeSize - source.size()) / prefixTreeSize;
        double sourceDensity = density.of(source);
        double overgeneralization = Math.max(0.0, sourceDensity - prefixTreeDensity);
        return new Measures(ast.size(), Math.max(0.0, generalization), overgeneralization, sourceDensity);
    }

    public double score(Measures measures) {
        return objective.score(measures, sample);
    }
}
