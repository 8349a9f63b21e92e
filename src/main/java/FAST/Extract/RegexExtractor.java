package FAST.Extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FAST.Ast.Regex;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;

/**
 * Extracts syntactically different but equivalent expressions from one automaton by running the
 * state elimination once per order policy.
 */
public class RegexExtractor {
    public static final List<EliminationOrder> DEFAULT_ORDERS = List.of(
        EliminationOrder.creationOrder(),
        EliminationOrder.outDegreeAscending(),
        EliminationOrder.inDegreeAscending());

    private final List<EliminationOrder> orders;

    public RegexExtractor() {
        this(DEFAULT_ORDERS);
    }

    public RegexExtractor(List<EliminationOrder> orders) {
        if (orders.isEmpty()) {
            throw new IllegalArgumentException("At least one elimination order is required");
        }
        this.orders = List.copyOf(orders);
    }

    public List<EliminationOrder> getOrders() {
        return orders;
    }

    /**
     * @return distinct expressions, in the order of the policies that first produced them
     */
    public <S, I> List<Regex<I>> extract(DFA<S, I> dfa, Alphabet<I> alphabet) {
        final Set<Regex<I>> result = new LinkedHashSet<>();
        for (EliminationOrder order : orders) {
            result.add(StateElimination.toRegex(dfa, alphabet, order));
        }
        return new ArrayList<>(result);
    }
}
