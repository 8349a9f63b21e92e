package FAST;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FAST.Model.InconsistentAutomatonException;
import net.automatalib.automaton.fsa.FiniteStateAcceptor;

/**
 * Contract checks at the automaton boundary.
 * Supplied automata are only inspected, never repaired.
 */
public class AutomatonChecks {

    /**
     * @return the unique initial state
     * @throws InconsistentAutomatonException if there is no initial state or several
     */
    public static <S, I> S requireSingleInitial(FiniteStateAcceptor<S, I> fsa) {
        Set<S> inits = fsa.getInitialStates();
        if (inits.isEmpty()) {
            throw new InconsistentAutomatonException("Automaton has no initial state");
        }
        if (inits.size() > 1) {
            throw new InconsistentAutomatonException(
                "Automaton is non-deterministic: " + inits.size() + " initial states");
        }
        return inits.iterator().next();
    }

    public static <S, I> void requireDeterministic(FiniteStateAcceptor<S, I> fsa, Collection<? extends I> inputs) {
        requireSingleInitial(fsa);
        for (S s : fsa.getStates()) {
            for (I i : inputs) {
                if (fsa.getTransitions(s, i).size() > 1) {
                    throw new InconsistentAutomatonException(
                        "Automaton is non-deterministic in state " + s + " on symbol '" + i + "'");
                }
            }
        }
    }

    /**
     * Every state must be reachable from the initial state and must reach an accepting state.
     * @param fsa - automaton to check
     * @param inputs - Input symbols
     */
    public static <S, I> void requireTrim(FiniteStateAcceptor<S, I> fsa, Collection<? extends I> inputs) {
        final Set<S> accessible = accessibleStates(fsa, inputs);
        final Set<S> coaccessible = coaccessibleStates(fsa, inputs);
        if (coaccessible.isEmpty()) {
            throw new InconsistentAutomatonException("Automaton has no accepting state");
        }
        for (S s : fsa.getStates()) {
            if (!accessible.contains(s)) {
                throw new InconsistentAutomatonException("State " + s + " is unreachable");
            }
            if (!coaccessible.contains(s)) {
                throw new InconsistentAutomatonException("State " + s + " cannot reach an accepting state");
            }
        }
    }

    /**
     * A trim automaton has a finite language iff it has no cycle.
     */
    public static <S, I> void requireAcyclic(FiniteStateAcceptor<S, I> fsa, Collection<? extends I> inputs) {
        // iterative DFS, 1 = on stack, 2 = done
        final Map<S, Integer> color = new HashMap<>();
        for (S root : fsa.getInitialStates()) {
            if (color.containsKey(root)) {
                continue;
            }
            final Deque<DfsFrame<S>> stack = new ArrayDeque<>();
            color.put(root, 1);
            stack.push(new DfsFrame<>(root, successors(fsa, root, inputs)));
            while (!stack.isEmpty()) {
                DfsFrame<S> top = stack.peek();
                if (top.next < top.succs.size()) {
                    S t = top.succs.get(top.next++);
                    Integer c = color.get(t);
                    if (c == null) {
                        color.put(t, 1);
                        stack.push(new DfsFrame<>(t, successors(fsa, t, inputs)));
                    } else if (c == 1) {
                        throw new InconsistentAutomatonException(
                            "Automaton has a cycle through state " + t + ", its language is infinite");
                    }
                } else {
                    color.put(top.state, 2);
                    stack.pop();
                }
            }
        }
    }

    public static <S, I> Set<S> accessibleStates(FiniteStateAcceptor<S, I> fsa, Collection<? extends I> inputs) {
        final Set<S> visited = new LinkedHashSet<>(fsa.getInitialStates());
        final Deque<S> queue = new ArrayDeque<>(visited);
        while (!queue.isEmpty()) {
            S s = queue.poll();
            for (I i : inputs) {
                for (S t : fsa.getTransitions(s, i)) {
                    if (visited.add(t)) {
                        queue.add(t);
                    }
                }
            }
        }
        return visited;
    }

    public static <S, I> Set<S> coaccessibleStates(FiniteStateAcceptor<S, I> fsa, Collection<? extends I> inputs) {
        // walk the reversed transition relation from the accepting states
        final Map<S, List<S>> preds = new HashMap<>();
        final Set<S> visited = new HashSet<>();
        final Deque<S> queue = new ArrayDeque<>();
        for (S s : fsa.getStates()) {
            for (I i : inputs) {
                for (S t : fsa.getTransitions(s, i)) {
                    preds.computeIfAbsent(t, k -> new ArrayList<>()).add(s);
                }
            }
            if (fsa.isAccepting(s) && visited.add(s)) {
                queue.add(s);
            }
        }
        while (!queue.isEmpty()) {
            S t = queue.poll();
            for (S s : preds.getOrDefault(t, List.of())) {
                if (visited.add(s)) {
                    queue.add(s);
                }
            }
        }
        return visited;
    }

    private static <S, I> List<S> successors(FiniteStateAcceptor<S, I> fsa, S state, Collection<? extends I> inputs) {
        final List<S> result = new ArrayList<>();
        for (I i : inputs) {
            result.addAll(fsa.getTransitions(state, i));
        }
        return result;
    }

    private static final class DfsFrame<S> {
        final S state;
        final List<S> succs;
        int next;

        DfsFrame(S state, List<S> succs) {
            this.state = state;
            this.succs = succs;
        }
    }
}
