package FAST.Ast;

/**
 * Immutable regular expression abstract syntax tree.
 * Two trees are equal iff they have exactly the same shape and the same literals;
 * no associativity or commutativity normalization is applied.
 * Build trees through {@link Regexes} so that the algebraic simplifications are applied.
 * @param <I> - Input symbol type, e.g., Character
 */
public interface Regex<I> {

    /**
     * @return number of nodes in this tree, a description-length proxy.
     */
    int size();

    /**
     * @return whether the empty word belongs to the denoted language.
     */
    boolean isNullable();

    record Literal<I>(I symbol) implements Regex<I> {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean isNullable() {
            return false;
        }
    }

    record Epsilon<I>() implements Regex<I> {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean isNullable() {
            return true;
        }
    }

    record EmptySet<I>() implements Regex<I> {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean isNullable() {
            return false;
        }
    }

    record Concat<I>(Regex<I> left, Regex<I> right) implements Regex<I> {
        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public boolean isNullable() {
            return left.isNullable() && right.isNullable();
        }
    }

    record Union<I>(Regex<I> left, Regex<I> right) implements Regex<I> {
        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public boolean isNullable() {
            return left.isNullable() || right.isNullable();
        }
    }

    record Star<I>(Regex<I> child) implements Regex<I> {
        @Override
        public int size() {
            return 1 + child.size();
        }

        @Override
        public boolean isNullable() {
            return true;
        }
    }
}
