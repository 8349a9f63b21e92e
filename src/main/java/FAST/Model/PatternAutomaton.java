package FAST.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * A string read at the pattern level: vertices are string indices, an edge (j, k, name) means that
 * the infix [j, k) is matched by the pattern name. Parts of the string no pattern covers are bridged
 * by {@link #ANY} edges. Every path from 0 to the end spells one tokenization of the string.
 * <p>
 * For each pattern and start index only the largest match is kept, and among the starts sharing that
 * end only the smallest one.
 */
public final class PatternAutomaton {
    public static final String ANY = "any";

    private static final Comparator<Edge> BY_POSITION =
        Comparator.comparingInt(Edge::source).thenComparingInt(Edge::target);

    /**
     * @param source - start index of the infix, inclusive
     * @param target - end index of the infix, exclusive
     * @param pattern - name of the pattern matching the infix, or {@link #ANY}
     */
    public record Edge(int source, int target, String pattern) { }

    private final String word;
    private final int[] vertices;
    private final List<Edge> edges;

    private PatternAutomaton(String word, int[] vertices, List<Edge> edges) {
        this.word = word;
        this.vertices = vertices;
        this.edges = Collections.unmodifiableList(edges);
    }

    public static PatternAutomaton of(String word, Map<String, CompactDFA<Character>> catalogue) {
        return of(word, catalogue, Set.of());
    }

    /**
     * @param word - string to tokenize
     * @param catalogue - pattern name to pattern, iterated in map order
     * @param filtered - patterns that are matched but give no edge, e.g., to drop blanks
     * @return automaton of word
     * @throws InvalidInputException if a filtered pattern is not part of the catalogue, or the catalogue
     * redefines {@link #ANY}
     */
    public static PatternAutomaton of(String word, Map<String, CompactDFA<Character>> catalogue,
                                      Set<String> filtered) {
        if (word == null) {
            throw new InvalidInputException("Null example");
        }
        if (catalogue.containsKey(ANY)) {
            throw new InvalidInputException("'" + ANY + "' is reserved for unmatched infixes");
        }
        for (String name : filtered) {
            if (!catalogue.containsKey(name)) {
                throw new InvalidInputException("Filtered pattern '" + name + "' is not part of the catalogue "
                    + catalogue.keySet());
            }
        }

        final int n = word.length();
        final List<Edge> edges = new ArrayList<>();
        final IntSortedSet withSuccessors = new IntRBTreeSet();
        final IntSortedSet withPredecessors = new IntRBTreeSet();
        for (Map.Entry<String, CompactDFA<Character>> entry : catalogue.entrySet()) {
            if (filtered.contains(entry.getKey())) {
                continue;
            }
            for (Int2IntMap.Entry match : largestMatches(word, entry.getValue()).int2IntEntrySet()) {
                edges.add(new Edge(match.getIntKey(), match.getIntValue(), entry.getKey()));
                withSuccessors.add(match.getIntKey());
                withPredecessors.add(match.getIntValue());
            }
        }

        final IntSortedSet kept = new IntRBTreeSet();
        kept.addAll(withSuccessors);
        kept.addAll(withPredecessors);
        kept.add(0);
        kept.add(n);
        final int[] vertices = kept.toIntArray();
        for (int i = 0; i < vertices.length; i++) {
            int u = vertices[i];
            if (u != 0 && !withPredecessors.contains(u)) {
                edges.add(new Edge(vertices[i - 1], u, ANY));
                withSuccessors.add(vertices[i - 1]);
            }
            if (u != n && !withSuccessors.contains(u)) {
                edges.add(new Edge(u, vertices[i + 1], ANY));
                withPredecessors.add(vertices[i + 1]);
            }
        }
        // stable: patterns sharing an infix keep the catalogue order
        edges.sort(BY_POSITION);
        return new PatternAutomaton(word, vertices, edges);
    }

    /**
     * @return start index to end index of the kept matches of dfa in word, by start index
     */
    static Int2IntRBTreeMap largestMatches(String word, CompactDFA<Character> dfa) {
        final Alphabet<Character> alphabet = dfa.getInputAlphabet();
        final Int2IntRBTreeMap startByEnd = new Int2IntRBTreeMap();
        for (int j = 0; j < word.length(); j++) {
            int state = dfa.getIntInitialState();
            int largest = -1;
            for (int k = j; k < word.length() && state >= 0; k++) {
                char c = word.charAt(k);
                state = alphabet.containsSymbol(c) ? dfa.getSuccessor(state, alphabet.getSymbolIndex(c)) : -1;
                if (state >= 0 && dfa.isAccepting(state)) {
                    largest = k + 1;
                }
            }
            // starts are visited in increasing order: the first one wins
            if (largest > 0 && !startByEnd.containsKey(largest)) {
                startByEnd.put(largest, j);
            }
        }
        final Int2IntRBTreeMap result = new Int2IntRBTreeMap();
        for (Int2IntMap.Entry entry : startByEnd.int2IntEntrySet()) {
            result.put(entry.getIntValue(), entry.getIntKey());
        }
        return result;
    }

    public String getWord() {
        return word;
    }

    /**
     * @return kept string indices, ascending; 0 and the word length always belong to it
     */
    public int[] getVertices() {
        return vertices.clone();
    }

    /**
     * @return edges by source, then target
     */
    public List<Edge> getEdges() {
        return edges;
    }

    public String getInfix(Edge edge) {
        return word.substring(edge.source(), edge.target());
    }

    /**
     * @param alphabet - pattern names
     * @return acyclic automaton accepting the tokenizations of the word, one state per vertex
     * @throws InvalidInputException if an edge is labelled by a name outside of alphabet
     */
    public CompactDFA<String> toDFA(Alphabet<String> alphabet) {
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, vertices.length);
        final Int2IntRBTreeMap stateOf = new Int2IntRBTreeMap();
        for (int i = 0; i < vertices.length; i++) {
            boolean last = vertices[i] == word.length();
            stateOf.put(vertices[i], (int) (i == 0 ? dfa.addInitialState(last) : dfa.addState(last)));
        }
        for (Edge edge : edges) {
            if (!alphabet.containsSymbol(edge.pattern())) {
                throw new InvalidInputException("Pattern '" + edge.pattern() + "' of \"" + word
                    + "\" is not part of the alphabet " + alphabet);
            }
            dfa.setTransition(stateOf.get(edge.source()), alphabet.getSymbolIndex(edge.pattern()),
                stateOf.get(edge.target()));
        }
        return dfa;
    }

    @Override
    public String toString() {
        return "PatternAutomaton{" + word + ", " + edges + "}";
    }
}
