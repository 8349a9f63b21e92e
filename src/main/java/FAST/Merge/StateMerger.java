package FAST.Merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import FAST.MapTask;
import FAST.Model.Candidate;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Beam search over state merges of a prefix tree acceptor.
 * <p>
 * Every level applies each compatible merge to each automaton of the beam. Children identical to an
 * automaton seen before are dropped, the rest are scored and the best beamWidth of them form the next
 * beam. Each merge removes at least one state, so the search ends after at most |PTA| - 1 levels,
 * or earlier once maxExplored automata were generated.
 * @param <I> - Input symbol type, e.g., Character
 */
public class StateMerger<I> {
    private static final Logger LOGGER = Logger.getLogger(StateMerger.class.getName());

    private final Alphabet<I> alphabet;
    private final Compatibility compatibility;
    private final int beamWidth;
    private final int maxExplored;
    private final boolean parallel;

    /**
     * @param alphabet - Input symbols
     * @param compatibility - verdict on proposed merges
     * @param beamWidth - automata kept per level, and in the output
     * @param maxExplored - ceiling on the number of merges performed
     * @param parallel - score the children of a level on the fork-join pool
     */
    public StateMerger(Alphabet<I> alphabet, Compatibility compatibility, int beamWidth, int maxExplored,
                       boolean parallel) {
        if (beamWidth < 1) {
            throw new IllegalArgumentException("beamWidth must be positive: " + beamWidth);
        }
        if (maxExplored < 1) {
            throw new IllegalArgumentException("maxExplored must be positive: " + maxExplored);
        }
        this.alphabet = alphabet;
        this.compatibility = compatibility;
        this.beamWidth = beamWidth;
        this.maxExplored = maxExplored;
        this.parallel = parallel;
    }

    /**
     * A generalized automaton with the candidates extracted from it.
     * @param automaton - merged automaton
     * @param candidates - scored expressions denoting its language
     */
    public record Branch<I>(CompactDFA<I> automaton, List<Candidate<I>> candidates) {
        /**
         * @return best score among the candidates, the provisional score of the automaton
         */
        public double score() {
            double best = Double.POSITIVE_INFINITY;
            for (Candidate<I> candidate : candidates) {
                best = Math.min(best, candidate.score());
            }
            return best;
        }
    }

    private static final Comparator<Branch<?>> BY_SCORE = Comparator.<Branch<?>>comparingDouble(Branch::score);

    /**
     * Merge proposals in deterministic order: pairs p &lt; q by state number. A pair is proposed when
     * the two states have a transition on a common symbol, or when one of them is a leaf.
     * @param table - automaton
     * @param compatibility - verdict on each proposal
     * @return proposals with their verdicts
     */
    public static List<MergeCandidate> proposals(TransitionTable table, Compatibility compatibility) {
        final List<MergeCandidate> result = new ArrayList<>();
        for (int p = 0; p < table.size(); p++) {
            for (int q = p + 1; q < table.size(); q++) {
                if (table.overlaps(p, q) || table.isLeaf(p) || table.isLeaf(q)) {
                    result.add(new MergeCandidate(p, q, compatibility.test(table, p, q)));
                }
            }
        }
        return result;
    }

    /**
     * @param prefixTree - unmerged automaton, excluded from the result
     * @param evaluator - extracts and scores the candidates of an automaton; must be side-effect free
     * @return at most beamWidth distinct generalized automata, best provisional score first
     */
    public List<Branch<I>> search(CompactDFA<I> prefixTree, Function<CompactDFA<I>, List<Candidate<I>>> evaluator) {
        final Set<IntArrayList> seen = new HashSet<>();
        seen.add(Quotient.signature(TransitionTable.of(prefixTree, alphabet)));

        final List<Branch<I>> pool = new ArrayList<>();
        List<CompactDFA<I>> beam = List.of(prefixTree);
        int explored = 0;
        int level = 0;

        while (!beam.isEmpty() && explored < maxExplored) {
            level++;
            final List<CompactDFA<I>> children = new ArrayList<>();
            outer:
            for (CompactDFA<I> parent : beam) {
                final TransitionTable table = TransitionTable.of(parent, alphabet);
                for (MergeCandidate proposal : proposals(table, compatibility)) {
                    if (!proposal.compatible()) {
                        continue;
                    }
                    if (explored >= maxExplored) {
                        LOGGER.fine(() -> "Merge search stopped after " + maxExplored + " merges");
                        break outer;
                    }
                    explored++;
                    final CompactDFA<I> child = Quotient.merge(table, alphabet, proposal.first(), proposal.second());
                    if (seen.add(Quotient.signature(TransitionTable.of(child, alphabet)))) {
                        children.add(child);
                    }
                }
            }

            final List<Branch<I>> scored = MapTask.map(children, dfa -> new Branch<>(dfa, evaluator.apply(dfa)), parallel);
            // stable: ties keep the proposal order
            final List<Branch<I>> sorted = new ArrayList<>(scored);
            sorted.sort(BY_SCORE);
            final List<Branch<I>> kept = sorted.subList(0, Math.min(beamWidth, sorted.size()));
            pool.addAll(kept);

            final List<CompactDFA<I>> next = new ArrayList<>(kept.size());
            for (Branch<I> branch : kept) {
                next.add(branch.automaton());
            }
            beam = next;

            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Merge level " + level + ": " + children.size() + " new automata, beam " + describe(kept));
            }
        }

        final List<Branch<I>> result = new ArrayList<>(pool);
        result.sort(BY_SCORE);
        return new ArrayList<>(result.subList(0, Math.min(beamWidth, result.size())));
    }

    private static String describe(List<? extends Branch<?>> branches) {
        final List<String> parts = new ArrayList<>(branches.size());
        for (Branch<?> branch : branches) {
            parts.add(branch.automaton().size() + " states/" + branch.score());
        }
        return parts.toString();
    }
}
