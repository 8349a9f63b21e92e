package FAST.Model;

import java.util.List;

import FAST.Extract.EliminationOrder;
import FAST.Extract.RegexExtractor;
import FAST.Merge.Compatibility;
import FAST.Score.Objective;
import FAST.Score.Weights;

/**
 * Tunable knobs of one inference run. Immutable; values are checked when they are set.
 */
public final class InferenceConfig {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_BEAM_WIDTH = 5;
    public static final int DEFAULT_MAX_EXPLORED = 10_000;

    private final int maxCandidates;
    private final int beamWidth;
    private final Objective objective;
    private final Compatibility compatibility;
    private final List<EliminationOrder> eliminationOrders;
    private final boolean includeUnmerged;
    private final int maxExplored;
    private final boolean parallel;

    private InferenceConfig(Builder builder) {
        this.maxCandidates = builder.maxCandidates;
        this.beamWidth = builder.beamWidth;
        this.objective = builder.objective;
        this.compatibility = builder.compatibility;
        this.eliminationOrders = builder.eliminationOrders;
        this.includeUnmerged = builder.includeUnmerged;
        this.maxExplored = builder.maxExplored;
        this.parallel = builder.parallel;
    }

    public static InferenceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public int getBeamWidth() {
        return beamWidth;
    }

    /**
     * @return objective scoring the candidates, both during the merge search and for the final ranking
     */
    public Objective getObjective() {
        return objective;
    }

    public Compatibility getCompatibility() {
        return compatibility;
    }

    public List<EliminationOrder> getEliminationOrders() {
        return eliminationOrders;
    }

    public boolean isIncludeUnmerged() {
        return includeUnmerged;
    }

    public int getMaxExplored() {
        return maxExplored;
    }

    public boolean isParallel() {
        return parallel;
    }

    @Override
    public String toString() {
        return "InferenceConfig{maxCandidates=" + (maxCandidates == UNBOUNDED ? "unbounded" : maxCandidates)
            + ", beamWidth=" + beamWidth
            + ", objective=" + objective.getName()
            + ", compatibility=" + compatibility.getName()
            + ", eliminationOrders=" + eliminationOrders.stream().map(EliminationOrder::getName).toList()
            + ", includeUnmerged=" + includeUnmerged
            + ", maxExplored=" + maxExplored
            + ", parallel=" + parallel + "}";
    }

    public static final class Builder {
        private int maxCandidates = UNBOUNDED;
        private int beamWidth = DEFAULT_BEAM_WIDTH;
        private Objective objective = Objective.additive();
        private Compatibility compatibility = Compatibility.structural();
        private List<EliminationOrder> eliminationOrders = RegexExtractor.DEFAULT_ORDERS;
        private boolean includeUnmerged = true;
        private int maxExplored = DEFAULT_MAX_EXPLORED;
        private boolean parallel;

        private Builder() { }

        public Builder maxCandidates(int maxCandidates) {
            this.maxCandidates = requirePositive("maxCandidates", maxCandidates);
            return this;
        }

        public Builder beamWidth(int beamWidth) {
            this.beamWidth = requirePositive("beamWidth", beamWidth);
            return this;
        }

        /**
         * Additive objective with the given size and generalization weights; the overgeneralization
         * weight keeps its sample-derived default.
         */
        public Builder weights(double size, double generalization) {
            this.objective = Objective.additive(size, generalization);
            return this;
        }

        public Builder weights(Weights weights) {
            this.objective = Objective.additive(weights);
            return this;
        }

        public Builder objective(Objective objective) {
            if (objective == null) {
                throw new IllegalArgumentException("objective must not be null");
            }
            this.objective = objective;
            return this;
        }

        public Builder compatibility(Compatibility compatibility) {
            if (compatibility == null) {
                throw new IllegalArgumentException("compatibility must not be null");
            }
            this.compatibility = compatibility;
            return this;
        }

        public Builder eliminationOrders(List<EliminationOrder> eliminationOrders) {
            if (eliminationOrders == null || eliminationOrders.isEmpty()) {
                throw new IllegalArgumentException("At least one elimination order is required");
            }
            this.eliminationOrders = List.copyOf(eliminationOrders);
            return this;
        }

        public Builder includeUnmerged(boolean includeUnmerged) {
            this.includeUnmerged = includeUnmerged;
            return this;
        }

        public Builder maxExplored(int maxExplored) {
            this.maxExplored = requirePositive("maxExplored", maxExplored);
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }

        private static int requirePositive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
