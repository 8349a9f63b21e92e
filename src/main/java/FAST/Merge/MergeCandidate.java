package FAST.Merge;

/**
 * Unordered pair of states proposed for unification (stored with first &lt; second),
 * with the verdict of the compatibility test.
 */
public record MergeCandidate(int first, int second, boolean compatible) {

    public MergeCandidate {
        if (first >= second) {
            throw new IllegalArgumentException("Expected first < second, got " + first + ", " + second);
        }
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")" + (compatible ? "+" : "-");
    }
}
