package FAST;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import FAST.Ast.Glushkov;
import FAST.Ast.Regex;
import FAST.Extract.RegexExtractor;
import FAST.Merge.StateMerger;
import FAST.Merge.TransitionTable;
import FAST.Model.Candidate;
import FAST.Model.InferenceConfig;
import FAST.Model.Measures;
import FAST.Model.RandomWords;
import FAST.Model.Sample;
import FAST.Score.Ranker;
import FAST.Score.Scorer;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.FiniteStateAcceptor;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;

/**
 * Infers ranked regular expressions from positive examples:
 * prefix tree, beam search over state merges, state elimination under several orders, scoring.
 */
public class FASTInference {
    private static final Logger LOGGER = Logger.getLogger(FASTInference.class.getName());

    public static final double DEFAULT_STOP_PROBABILITY = 0.5;

    /**
     * @param examples - raw strings, one symbol per char
     * @return candidates, best first
     * @throws FAST.Model.InvalidInputException if there are no examples
     */
    public static List<Candidate<Character>> infer(Collection<String> examples) {
        return infer(examples, InferenceConfig.defaults());
    }

    public static List<Candidate<Character>> infer(Collection<String> examples, InferenceConfig config) {
        return infer(Sample.fromStrings(examples), config);
    }

    /**
     * @param pattern - deterministic, trim, acyclic acceptor whose language is the sample
     * @param alphabet - Input symbols
     * @param config - configuration
     * @return candidates, best first
     * @throws FAST.Model.InconsistentAutomatonException if pattern violates the acceptor contract
     */
    public static <S, I> List<Candidate<I>> infer(
        FiniteStateAcceptor<S, I> pattern, Alphabet<I> alphabet, InferenceConfig config) {
        return infer(Sample.fromAutomaton(pattern, alphabet), config);
    }

    /**
     * Infers over pattern names instead of characters, e.g., {@code uint spaces ipv4}.
     * @param examples - raw strings
     * @param catalogue - pattern name to pattern, e.g., {@link FAST.Ast.Patterns#defaults()}
     * @param config - configuration
     * @return candidates over pattern names, best first
     */
    public static List<Candidate<String>> inferFromPatterns(
        Collection<String> examples, Map<String, CompactDFA<Character>> catalogue, InferenceConfig config) {
        return infer(Sample.fromPatterns(examples, catalogue), config);
    }

    /**
     * All-or-nothing: either the full ranked list is returned or an exception is thrown.
     * @param sample - positive examples
     * @param config - configuration
     * @return candidates, best first, without two identical expressions
     */
    public static <I> List<Candidate<I>> infer(Sample<I> sample, InferenceConfig config) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Inferring from " + sample.size() + " examples with " + config);
        }
        final Alphabet<I> alphabet = sample.getAlphabet();
        final CompactDFA<I> pta = PTABuilder.build(sample);

        final Scorer scorer = new Scorer(config.getObjective(), sample, pta);
        final RegexExtractor extractor = new RegexExtractor(config.getEliminationOrders());

        final StateMerger<I> merger = new StateMerger<>(alphabet, config.getCompatibility(),
            config.getBeamWidth(), config.getMaxExplored(), config.isParallel());
        final List<StateMerger.Branch<I>> branches =
            merger.search(pta, dfa -> evaluate(dfa, alphabet, extractor, scorer));

        final List<Candidate<I>> candidates = new ArrayList<>();
        if (config.isIncludeUnmerged() || branches.isEmpty()) {
            candidates.addAll(evaluate(pta, alphabet, extractor, scorer));
        }
        for (StateMerger.Branch<I> branch : branches) {
            candidates.addAll(branch.candidates());
        }

        final List<Candidate<I>> ranked = Ranker.rank(candidates, config.getMaxCandidates());
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(ranked.size() + " candidates out of " + candidates.size()
                + (ranked.isEmpty() ? "" : ", best " + ranked.get(0)));
        }
        return ranked;
    }

    /**
     * Candidates of one automaton, one per distinct expression, in elimination order policy order.
     */
    static <I> List<Candidate<I>> evaluate(
        CompactDFA<I> dfa, Alphabet<I> alphabet, RegexExtractor extractor, Scorer scorer) {
        final TransitionTable table = TransitionTable.of(dfa, alphabet);
        final List<Candidate<I>> result = new ArrayList<>();
        for (Regex<I> ast : extractor.extract(dfa, alphabet)) {
            Measures measures = scorer.measure(ast, table);
            Candidate<I> candidate = new Candidate<>(scorer.score(measures), ast, dfa, measures);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer(candidate + " " + measures);
            }
            result.add(candidate);
        }
        return result;
    }

    /**
     * Random examples of the language of regex.
     * @param regex - expression to draw from
     * @param alphabet - Input symbols
     * @param n - number of draws; duplicates are dropped by the sample
     * @param stopProbability - probability to stop on an accepting state; lower values give longer words
     * @param random - source of randomness
     * @return sample
     */
    public static <I> Sample<I> sampleFromRegex(
        Regex<I> regex, Alphabet<I> alphabet, int n, double stopProbability, Random random) {
        final CompactDFA<I> dfa = Glushkov.toDFA(regex, alphabet);
        final List<Word<I>> words = new RandomWords<>(dfa, alphabet, stopProbability, random).next(n);
        return Sample.of(alphabet, words);
    }

    /**
     * Draws n examples from regex, then infers from them.
     */
    public static <I> List<Candidate<I>> inferFromRegex(
        Regex<I> regex, Alphabet<I> alphabet, int n, Random random, InferenceConfig config) {
        return infer(sampleFromRegex(regex, alphabet, n, DEFAULT_STOP_PROBABILITY, random), config);
    }
}
