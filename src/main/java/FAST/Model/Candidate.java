package FAST.Model;

import FAST.Ast.Regex;
import FAST.Ast.RegexFormat;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * A scored expression together with the automaton it was extracted from. Lower scores are better.
 * @param <I> - Input symbol type, e.g., Character
 */
public record Candidate<I>(double score, Regex<I> ast, CompactDFA<I> automaton, Measures measures) {

    public String toInfix() {
        return RegexFormat.toInfix(ast);
    }

    @Override
    public String toString() {
        return score + ": " + toInfix();
    }
}
