package FAST.Score;

import FAST.Model.Measures;
import FAST.Model.Sample;

/**
 * Weights of the additive objective
 * {@code size * |AST| - generalization * g + overgeneralization * d}.
 */
public record Weights(double size, double generalization, double overgeneralization) {

    public Weights {
        if (!(size > 0) || !Double.isFinite(size)) {
            throw new IllegalArgumentException("size weight must be positive and finite: " + size);
        }
        if (!(generalization > 0) || !Double.isFinite(generalization)) {
            throw new IllegalArgumentException("generalization weight must be positive and finite: " + generalization);
        }
        if (!(overgeneralization >= 0) || !Double.isFinite(overgeneralization)) {
            throw new IllegalArgumentException(
                "overgeneralization weight must be non-negative and finite: " + overgeneralization);
        }
    }

    /**
     * Default weights: accepting every word of the example lengths costs as much as one node
     * per example symbol and per example.
     */
    public static Weights forSample(Sample<?> sample) {
        return forSample(sample, 1.0, 1.0);
    }

    public static Weights forSample(Sample<?> sample, double size, double generalization) {
        return new Weights(size, generalization, sample.totalLength() + sample.size());
    }

    public double apply(Measures measures) {
        return size * measures.size()
            - generalization * measures.generalization()
            + overgeneralization * measures.overgeneralization();
    }
}
