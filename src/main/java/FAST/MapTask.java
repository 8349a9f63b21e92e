package FAST;

import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.function.Function;

/**
 * Fork-join map over a list. Results keep the order of the inputs, so a parallel run returns
 * exactly what the sequential run returns.
 * @param <T> - input element type
 * @param <R> - result element type
 */
public final class MapTask<T, R> extends RecursiveTask<List<R>> {
    private final List<T> inputs;
    private final int lo, hi;
    private final Function<T, R> function;

    // Each element is a whole extraction and scoring run, so split down to single elements
    private static final int MIN_SUBPROBLEM_SIZE = 1;
    @Serial
    private static final long serialVersionUID = 12346L;

    private MapTask(List<T> inputs, int lo, int hi, Function<T, R> function) {
        this.inputs = inputs;
        this.lo = lo;
        this.hi = hi;
        this.function = function;
    }

    /**
     * @param inputs - elements to map
     * @param function - side-effect free function
     * @param parallel - run on the common fork-join pool instead of the calling thread
     * @return function applied to every input, in input order
     */
    public static <T, R> List<R> map(List<T> inputs, Function<T, R> function, boolean parallel) {
        if (!parallel || inputs.size() <= MIN_SUBPROBLEM_SIZE) {
            final List<R> result = new ArrayList<>(inputs.size());
            for (T input : inputs) {
                result.add(function.apply(input));
            }
            return result;
        }
        return ForkJoinPool.commonPool().invoke(new MapTask<>(inputs, 0, inputs.size(), function));
    }

    @Override
    protected List<R> compute() {
        if (hi - lo <= MIN_SUBPROBLEM_SIZE) {
            final List<R> result = new ArrayList<>(hi - lo);
            for (int i = lo; i < hi; i++) {
                result.add(function.apply(inputs.get(i)));
            }
            return result;
        }
        int mid = lo + (hi - lo) / 2;
        MapTask<T, R> right = new MapTask<>(inputs, mid, hi, function);
        right.fork();
        List<R> result = new MapTask<>(inputs, lo, mid, function).compute();
        result.addAll(right.join());
        return result;
    }
}
