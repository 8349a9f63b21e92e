package FAST.Extract;

import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Policies choosing the next state to eliminate. The order changes the shape of the extracted
 * expression, never its language. Ties always go to the oldest state.
 */
public interface EliminationOrder {

    String getName();

    /**
     * @param remaining - states not eliminated yet, ascending creation order
     * @param inDegree - current number of predecessors of a state, self-loops excluded
     * @param outDegree - current number of successors of a state, self-loops excluded
     * @return state to eliminate next, taken from remaining
     */
    int select(IntSortedSet remaining, IntUnaryOperator inDegree, IntUnaryOperator outDegree);

    /**
     * creationOrder(): oldest state first.
     */
    static EliminationOrder creationOrder() {
        return new EliminationOrder() {
            @Override
            public String getName() {
                return "creation";
            }

            @Override
            public int select(IntSortedSet remaining, IntUnaryOperator inDegree, IntUnaryOperator outDegree) {
                return remaining.firstInt();
            }
        };
    }

    /**
     * outDegreeAscending(): state with the fewest successors first.
     */
    static EliminationOrder outDegreeAscending() {
        return byKey("outDegree", (in, out) -> out);
    }

    /**
     * inDegreeAscending(): state with the fewest predecessors first.
     */
    static EliminationOrder inDegreeAscending() {
        return byKey("inDegree", (in, out) -> in);
    }

    /**
     * degreeProductAscending(): fewest new edges first; eliminating a state adds in * out edges.
     */
    static EliminationOrder degreeProductAscending() {
        return byKey("degreeProduct", (in, out) -> in * out);
    }

    private static EliminationOrder byKey(String name, IntBinaryOperator key) {
        return new EliminationOrder() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public int select(IntSortedSet remaining, IntUnaryOperator inDegree, IntUnaryOperator outDegree) {
                int best = -1;
                int bestKey = Integer.MAX_VALUE;
                for (IntIterator it = remaining.iterator(); it.hasNext(); ) {
                    int s = it.nextInt();
                    int k = key.applyAsInt(inDegree.applyAsInt(s), outDegree.applyAsInt(s));
                    if (k < bestKey) {
                        best = s;
                        bestKey = k;
                    }
                }
                return best;
            }
        };
    }
}
