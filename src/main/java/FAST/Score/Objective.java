package FAST.Score;

import FAST.Model.Measures;
import FAST.Model.Sample;

/**
 * Objective function turning the measures of a candidate into a score; lower is better.
 * The same objective drives the provisional scores of the merge search and the final ranking.
 */
public interface Objective {

    String getName();

    /**
     * @param measures - raw measures of the candidate
     * @param sample - examples the candidate was inferred from
     * @return score, lower is better
     */
    double score(Measures measures, Sample<?> sample);

    /**
     * Normalization keeping the shortness of the longest example's prefix tree below 1,
     * whatever the number of examples.
     * @return 1 / (2 * length of the longest example)
     */
    static double shortnessFactor(Sample<?> sample) {
        return 1.0 / (2 * Math.max(1, sample.maxLength()));
    }

    /**
     * additive(): {@code size - generalization + (|S| + total length) * overgeneralization}.
     */
    static Objective additive() {
        return additive(1.0, 1.0);
    }

    /**
     * Additive objective whose overgeneralization weight is derived from the sample, see
     * {@link Weights#forSample(Sample, double, double)}.
     */
    static Objective additive(double sizeWeight, double generalizationWeight) {
        requirePositive("size weight", sizeWeight);
        requirePositive("generalization weight", generalizationWeight);
        return new Objective() {
            @Override
            public String getName() {
                return "additive(" + sizeWeight + ", " + generalizationWeight + ")";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                return Weights.forSample(sample, sizeWeight, generalizationWeight).apply(measures);
            }
        };
    }

    static Objective additive(Weights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        return new Objective() {
            @Override
            public String getName() {
                return "additive(" + weights.size() + ", " + weights.generalization() + ", "
                    + weights.overgeneralization() + ")";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                return weights.apply(measures);
            }
        };
    }

    /**
     * normalizedAdditive(): size factor from {@link #shortnessFactor(Sample)}, density factor its complement.
     */
    static Objective normalizedAdditive() {
        return new Objective() {
            @Override
            public String getName() {
                return "normalizedAdditive";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                double alpha = shortnessFactor(sample);
                return normalizedAdditive(measures, sample, alpha, 1.0 - alpha);
            }
        };
    }

    /**
     * {@code sizeFactor * size / (total length + |S| + 1) + densityFactor * density}.
     */
    static Objective normalizedAdditive(double sizeFactor, double densityFactor) {
        requireFactor("sizeFactor", sizeFactor);
        requireFactor("densityFactor", densityFactor);
        return new Objective() {
            @Override
            public String getName() {
                return "normalizedAdditive(" + sizeFactor + ", " + densityFactor + ")";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                return normalizedAdditive(measures, sample, sizeFactor, densityFactor);
            }
        };
    }

    private static double normalizedAdditive(Measures measures, Sample<?> sample, double sizeFactor,
                                             double densityFactor) {
        double total = sample.totalLength() + sample.size() + 1;
        return sizeFactor * (measures.size() / total) + densityFactor * measures.density();
    }

    /**
     * multiplicative(): {@code max(1e-6, size^sizeExponent) * density^densityExponent}.
     */
    static Objective multiplicative(double sizeExponent, double densityExponent) {
        requireFactor("sizeExponent", sizeExponent);
        requireFactor("densityExponent", densityExponent);
        return new Objective() {
            @Override
            public String getName() {
                return "multiplicative(" + sizeExponent + ", " + densityExponent + ")";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                return Math.max(1e-6, Math.pow(measures.size(), sizeExponent))
                    * Math.pow(measures.density(), densityExponent);
            }
        };
    }

    /**
     * lexicographic(): the smaller expression wins, density only breaks ties between equal sizes.
     * Encoded as {@code size + density / 2}, density being at most 1.
     */
    static Objective lexicographic() {
        return new Objective() {
            @Override
            public String getName() {
                return "lexicographic";
            }

            @Override
            public double score(Measures measures, Sample<?> sample) {
                return measures.size() + measures.density() / 2;
            }
        };
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be positive and finite: " + value);
        }
    }

    private static void requireFactor(String name, double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be non-negative and finite: " + value);
        }
    }
}
