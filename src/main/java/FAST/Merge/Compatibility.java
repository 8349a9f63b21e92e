package FAST.Merge;

/**
 * Compatibility test deciding whether a proposed merge may be applied.
 * Without negative examples this is what keeps the search away from the universal automaton.
 */
public interface Compatibility {

    String getName();

    /**
     * @param table - current automaton
     * @param p - first state
     * @param q - second state
     * @return verdict; true accepts the merge
     */
    boolean test(TransitionTable table, int p, int q);

    /**
     * structural(): the merge is folded first. If the folded automaton accepts a word the current
     * one rejects, the merge is only allowed when the two states share a suffix or share an identical
     * non-empty transition signature, i.e., when the sample already shows a repeated pattern.
     * Merges that leave the language unchanged are always allowed.
     */
    static Compatibility structural() {
        return new Compatibility() {
            @Override
            public String getName() {
                return "structural";
            }

            @Override
            public boolean test(TransitionTable table, int p, int q) {
                if (!Quotient.enlarges(table, p, q)) {
                    return true;
                }
                return table.sharesSuffix(p, q) || table.sameSignature(p, q);
            }
        };
    }

    /**
     * sameAcceptance(): never changes the acceptance of a merged state.
     */
    static Compatibility sameAcceptance() {
        return new Compatibility() {
            @Override
            public String getName() {
                return "sameAcceptance";
            }

            @Override
            public boolean test(TransitionTable table, int p, int q) {
                return table.isAccepting(p) == table.isAccepting(q);
            }
        };
    }

    /**
     * acceptAll(): unconstrained; the search may degenerate to the universal automaton.
     */
    static Compatibility acceptAll() {
        return new Compatibility() {
            @Override
            public String getName() {
                return "acceptAll";
            }

            @Override
            public boolean test(TransitionTable table, int p, int q) {
                return true;
            }
        };
    }
}
