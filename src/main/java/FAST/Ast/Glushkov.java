package FAST.Ast;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;

/**
 * Glushkov (position automaton) construction: an epsilon-free NFA with one state per
 * literal occurrence plus an initial state.
 */
public class Glushkov {

    /**
     * Compile an AST into an NFA over the given alphabet.
     * @param regex - AST; every literal must belong to the alphabet
     * @param alphabet - Input symbols
     * @return NFA accepting exactly the language of regex
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> CompactNFA<I> toNFA(Regex<I> regex, Alphabet<I> alphabet) {
        Positions<I> positions = new Positions<>();
        Info root = positions.analyze(regex);

        CompactNFA<I> nfa = new CompactNFA<>(alphabet, positions.symbols.size() + 1);
        int init = nfa.addInitialState(root.nullable);
        for (int p = 0; p < positions.symbols.size(); p++) {
            I symbol = positions.symbols.get(p);
            if (!alphabet.containsSymbol(symbol)) {
                throw new IllegalArgumentException("Literal '" + symbol + "' is not part of the alphabet");
            }
            nfa.addState(root.last.get(p));
        }
        // position p is NFA state p + 1
        for (int p = root.first.nextSetBit(0); p >= 0; p = root.first.nextSetBit(p + 1)) {
            nfa.addTransition(init, positions.symbols.get(p), p + 1);
        }
        for (int p = 0; p < positions.follow.size(); p++) {
            BitSet follow = positions.follow.get(p);
            for (int q = follow.nextSetBit(0); q >= 0; q = follow.nextSetBit(q + 1)) {
                nfa.addTransition(p + 1, positions.symbols.get(q), q + 1);
            }
        }
        return nfa;
    }

    public static <I> CompactDFA<I> toDFA(Regex<I> regex, Alphabet<I> alphabet) {
        return NFAs.determinize(toNFA(regex, alphabet), alphabet);
    }

    /**
     * Membership test of a word in the language of an AST.
     */
    public static <I> boolean accepts(Regex<I> regex, Alphabet<I> alphabet, Iterable<? extends I> word) {
        for (I symbol : word) {
            if (!alphabet.containsSymbol(symbol)) {
                return false;
            }
        }
        return toNFA(regex, alphabet).accepts(word);
    }

    private record Info(boolean nullable, BitSet first, BitSet last) { }

    private static final class Positions<I> {
        final List<I> symbols = new ArrayList<>();
        final List<BitSet> follow = new ArrayList<>();

        Info analyze(Regex<I> regex) {
            if (regex instanceof Regex.Literal<I> l) {
                int p = symbols.size();
                symbols.add(l.symbol());
                follow.add(new BitSet());
                BitSet single = new BitSet();
                single.set(p);
                return new Info(false, single, (BitSet) single.clone());
            }
            if (regex instanceof Regex.Epsilon) {
                return new Info(true, new BitSet(), new BitSet());
            }
            if (regex instanceof Regex.EmptySet) {
                return new Info(false, new BitSet(), new BitSet());
            }
            if (regex instanceof Regex.Concat<I> c) {
                Info left = analyze(c.left());
                Info right = analyze(c.right());
                link(left.last, right.first);
                BitSet first = (BitSet) left.first.clone();
                if (left.nullable) {
                    first.or(right.first);
                }
                BitSet last = (BitSet) right.last.clone();
                if (right.nullable) {
                    last.or(left.last);
                }
                return new Info(left.nullable && right.nullable, first, last);
            }
            if (regex instanceof Regex.Union<I> u) {
                Info left = analyze(u.left());
                Info right = analyze(u.right());
                BitSet first = (BitSet) left.first.clone();
                first.or(right.first);
                BitSet last = (BitSet) left.last.clone();
                last.or(right.last);
                return new Info(left.nullable || right.nullable, first, last);
            }
            Regex.Star<I> s = (Regex.Star<I>) regex;
            Info child = analyze(s.child());
            link(child.last, child.first);
            return new Info(true, child.first, child.last);
        }

        private void link(BitSet from, BitSet to) {
            for (int p = from.nextSetBit(0); p >= 0; p = from.nextSetBit(p + 1)) {
                follow.get(p).or(to);
            }
        }
    }
}
