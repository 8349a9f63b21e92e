package FAST.Model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FAST.AutomatonChecks;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.FiniteStateAcceptor;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;

/**
 * A finite, non-empty, duplicate-free set of positive examples over an alphabet.
 * Examples keep the order of their first occurrence.
 * @param <I> - Input symbol type, e.g., Character
 */
public final class Sample<I> {
    private final Alphabet<I> alphabet;
    private final List<Word<I>> examples;

    private Sample(Alphabet<I> alphabet, List<Word<I>> examples) {
        this.alphabet = alphabet;
        this.examples = Collections.unmodifiableList(examples);
    }

    /**
     * One Character symbol per char; the alphabet is made of the characters occurring in the examples.
     * @param examples - raw strings
     * @return sample
     * @throws InvalidInputException if there are no examples
     */
    public static Sample<Character> fromStrings(Collection<String> examples) {
        requireNonEmpty(examples);
        final Set<Character> symbols = new TreeSet<>();
        final List<Word<Character>> words = new ArrayList<>(examples.size());
        for (String example : examples) {
            if (example == null) {
                throw new InvalidInputException("Null example");
            }
            final List<Character> chars = new ArrayList<>(example.length());
            for (int i = 0; i < example.length(); i++) {
                chars.add(example.charAt(i));
            }
            symbols.addAll(chars);
            words.add(Word.fromList(chars));
        }
        return of(Alphabets.fromCollection(symbols), words);
    }

    /**
     * @param alphabet - declared alphabet
     * @param examples - examples over alphabet
     * @return sample
     * @throws InvalidInputException if there are no examples, or a symbol is not part of alphabet
     */
    public static <I> Sample<I> of(Alphabet<I> alphabet, Collection<? extends Word<I>> examples) {
        requireNonEmpty(examples);
        final Set<Word<I>> distinct = new LinkedHashSet<>();
        for (Word<I> example : examples) {
            if (example == null) {
                throw new InvalidInputException("Null example");
            }
            for (I symbol : example) {
                if (!alphabet.containsSymbol(symbol)) {
                    throw new InvalidInputException(
                        "Symbol '" + symbol + "' of example " + example + " is not part of the alphabet " + alphabet);
                }
            }
            distinct.add(example);
        }
        return new Sample<>(alphabet, new ArrayList<>(distinct));
    }

    /**
     * Use the (finite) language of a pattern automaton as the sample.
     * @param pattern - deterministic, trim, acyclic acceptor
     * @param alphabet - Input symbols of pattern
     * @return sample of all words accepted by pattern, in depth-first alphabet order
     * @throws InconsistentAutomatonException if pattern violates the acceptor contract
     */
    public static <S, I> Sample<I> fromAutomaton(FiniteStateAcceptor<S, I> pattern, Alphabet<I> alphabet) {
        return fromAutomaton(pattern, alphabet, List.of());
    }

    /**
     * Same as {@link #fromAutomaton(FiniteStateAcceptor, Alphabet)}, with additional examples.
     * @throws InvalidInputException if an additional example uses a symbol outside of the pattern's alphabet
     */
    public static <S, I> Sample<I> fromAutomaton(
        FiniteStateAcceptor<S, I> pattern, Alphabet<I> alphabet, Collection<? extends Word<I>> extraExamples) {
        AutomatonChecks.requireDeterministic(pattern, alphabet);
        AutomatonChecks.requireTrim(pattern, alphabet);
        AutomatonChecks.requireAcyclic(pattern, alphabet);

        final List<Word<I>> words = new ArrayList<>(enumerate(pattern, alphabet));
        words.addAll(extraExamples);
        return of(alphabet, words);
    }

    /**
     * Strings read at the pattern level: every tokenization of every string by the catalogue is an
     * example, see {@link PatternAutomaton}. The alphabet lists the catalogue names, then
     * {@link PatternAutomaton#ANY}.
     * @param examples - raw strings
     * @param catalogue - pattern name to pattern, e.g., {@link FAST.Ast.Patterns#defaults()}
     * @return sample over pattern names
     * @throws InvalidInputException if there are no examples, or the catalogue redefines {@link PatternAutomaton#ANY}
     */
    public static Sample<String> fromPatterns(Collection<String> examples,
                                              Map<String, CompactDFA<Character>> catalogue) {
        requireNonEmpty(examples);
        final List<String> names = new ArrayList<>(catalogue.keySet());
        names.add(PatternAutomaton.ANY);
        final List<PatternAutomaton> automata = new ArrayList<>(examples.size());
        for (String example : examples) {
            automata.add(PatternAutomaton.of(example, catalogue));
        }
        return fromPatterns(automata, Alphabets.fromCollection(names));
    }

    /**
     * @param examples - tokenized strings
     * @param alphabet - pattern names
     * @return sample of every tokenization, in depth-first alphabet order per string
     * @throws InvalidInputException if there are no examples, or an example uses a pattern outside of alphabet
     */
    public static Sample<String> fromPatterns(Collection<PatternAutomaton> examples, Alphabet<String> alphabet) {
        requireNonEmpty(examples);
        final List<Word<String>> words = new ArrayList<>();
        for (PatternAutomaton example : examples) {
            words.addAll(enumerate(example.toDFA(alphabet), alphabet));
        }
        return of(alphabet, words);
    }

    private static <S, I> List<Word<I>> enumerate(FiniteStateAcceptor<S, I> pattern, Alphabet<I> alphabet) {
        final List<Word<I>> result = new ArrayList<>();
        final Deque<WalkRecord<S, I>> stack = new ArrayDeque<>();
        stack.push(new WalkRecord<>(AutomatonChecks.requireSingleInitial(pattern), Word.epsilon()));
        while (!stack.isEmpty()) {
            WalkRecord<S, I> curr = stack.pop();
            if (pattern.isAccepting(curr.state())) {
                result.add(curr.prefix());
            }
            // push in reverse so that smaller symbols are popped first
            for (int a = alphabet.size() - 1; a >= 0; a--) {
                I symbol = alphabet.getSymbol(a);
                for (S succ : pattern.getTransitions(curr.state(), symbol)) {
                    stack.push(new WalkRecord<>(succ, curr.prefix().append(symbol)));
                }
            }
        }
        return result;
    }

    private static void requireNonEmpty(Collection<?> examples) {
        if (examples == null || examples.isEmpty()) {
            throw new InvalidInputException("The sample must contain at least one example");
        }
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public List<Word<I>> getExamples() {
        return examples;
    }

    public int size() {
        return examples.size();
    }

    public int maxLength() {
        int max = 0;
        for (Word<I> example : examples) {
            max = Math.max(max, example.length());
        }
        return max;
    }

    /**
     * @return sum of the example lengths
     */
    public int totalLength() {
        int total = 0;
        for (Word<I> example : examples) {
            total += example.length();
        }
        return total;
    }

    public boolean contains(Word<I> word) {
        return examples.contains(word);
    }

    @Override
    public String toString() {
        return examples.toString();
    }

    private record WalkRecord<S, I>(S state, Word<I> prefix) { }
}
