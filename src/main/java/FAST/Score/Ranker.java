package FAST.Score;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import FAST.Ast.Regex;
import FAST.Model.Candidate;

/**
 * Orders candidates best-first. Candidates are only reordered and filtered, never modified.
 */
public class Ranker {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Comparator<Candidate<?>> ORDER =
        Comparator.<Candidate<?>>comparingDouble(Candidate::score)
            .thenComparingInt(c -> c.ast().size());

    /**
     * Stable sort by (score, AST size), then drop every candidate whose AST has the exact shape of a
     * better ranked one, then keep the first maxCandidates.
     * @param candidates - candidates in generation order
     * @param maxCandidates - number of candidates to keep, {@link #UNBOUNDED} for all
     * @return ranked candidates
     */
    public static <I> List<Candidate<I>> rank(List<Candidate<I>> candidates, int maxCandidates) {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be positive: " + maxCandidates);
        }
        final List<Candidate<I>> sorted = new ArrayList<>(candidates);
        sorted.sort(ORDER);

        final Set<Regex<I>> seen = new HashSet<>();
        final List<Candidate<I>> result = new ArrayList<>();
        for (Candidate<I> candidate : sorted) {
            if (result.size() >= maxCandidates) {
                break;
            }
            if (seen.add(candidate.ast())) {
                result.add(candidate);
            }
        }
        return result;
    }
}
