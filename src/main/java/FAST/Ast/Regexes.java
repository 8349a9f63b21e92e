package FAST.Ast;

import java.util.List;

/**
 * Smart constructors for {@link Regex} trees.
 * Every constructor applies the identity and annihilator laws opportunistically:
 * <ul>
 *     <li>ε·x = x·ε = x, ∅·x = x·∅ = ∅</li>
 *     <li>∅|x = x|∅ = x, x|x = x, ε|x = x when x is nullable</li>
 *     <li>ε* = ∅* = ε, (x*)* = x*, (ε|x)* = x*</li>
 * </ul>
 * None of the rules changes the denoted language.
 */
public final class Regexes {
    private Regexes() {}

    public static <I> Regex<I> epsilon() {
        return new Regex.Epsilon<>();
    }

    public static <I> Regex<I> emptySet() {
        return new Regex.EmptySet<>();
    }

    public static <I> Regex<I> literal(I symbol) {
        return new Regex.Literal<>(symbol);
    }

    public static <I> Regex<I> concat(Regex<I> left, Regex<I> right) {
        if (left instanceof Regex.EmptySet || right instanceof Regex.EmptySet) {
            return emptySet();
        }
        if (left instanceof Regex.Epsilon) {
            return right;
        }
        if (right instanceof Regex.Epsilon) {
            return left;
        }
        return new Regex.Concat<>(left, right);
    }

    public static <I> Regex<I> union(Regex<I> left, Regex<I> right) {
        if (left instanceof Regex.EmptySet) {
            return right;
        }
        if (right instanceof Regex.EmptySet || left.equals(right)) {
            return left;
        }
        if (left instanceof Regex.Epsilon && right.isNullable()) {
            return right;
        }
        if (right instanceof Regex.Epsilon && left.isNullable()) {
            return left;
        }
        return new Regex.Union<>(left, right);
    }

    public static <I> Regex<I> star(Regex<I> child) {
        if (child instanceof Regex.Epsilon || child instanceof Regex.EmptySet) {
            return epsilon();
        }
        if (child instanceof Regex.Star) {
            return child;
        }
        if (child instanceof Regex.Union<I> u) {
            if (u.left() instanceof Regex.Epsilon) {
                return star(u.right());
            }
            if (u.right() instanceof Regex.Epsilon) {
                return star(u.left());
            }
        }
        return new Regex.Star<>(child);
    }

    /**
     * Left-nested concatenation of the given symbols, ε for an empty word.
     */
    public static <I> Regex<I> word(Iterable<? extends I> symbols) {
        Regex<I> result = epsilon();
        for (I symbol : symbols) {
            result = concat(result, literal(symbol));
        }
        return result;
    }

    /**
     * Left-nested union of the given alternatives, ∅ for an empty list.
     */
    public static <I> Regex<I> union(List<? extends Regex<I>> alternatives) {
        Regex<I> result = emptySet();
        for (Regex<I> alternative : alternatives) {
            result = union(result, alternative);
        }
        return result;
    }

    /**
     * Checks whether a Star node occurs anywhere in the tree.
     */
    public static boolean containsStar(Regex<?> regex) {
        if (regex instanceof Regex.Star) {
            return true;
        }
        if (regex instanceof Regex.Concat<?> c) {
            return containsStar(c.left()) || containsStar(c.right());
        }
        if (regex instanceof Regex.Union<?> u) {
            return containsStar(u.left()) || containsStar(u.right());
        }
        return false;
    }
}
