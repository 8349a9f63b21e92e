package FAST.Ast;

/**
 * Side-effect free renderings of a {@link Regex}.
 */
public final class RegexFormat {
    public static final String EMPTY_SET = "∅";
    public static final String EPSILON = "ε";

    private static final int UNION_PRECEDENCE = 0;
    private static final int CONCAT_PRECEDENCE = 1;
    private static final int STAR_PRECEDENCE = 2;

    private RegexFormat() {}

    /**
     * Infix notation: juxtaposition for Concat, '|' for Union, postfix '*' for Star,
     * the empty string for Epsilon and {@link #EMPTY_SET} for the empty language.
     * Parentheses are only added where precedence requires them.
     * @param regex - AST to render
     * @return infix regular expression
     */
    public static String toInfix(Regex<?> regex) {
        StringBuilder sb = new StringBuilder();
        appendInfix(sb, regex, UNION_PRECEDENCE);
        return sb.toString();
    }

    private static void appendInfix(StringBuilder sb, Regex<?> regex, int context) {
        if (regex instanceof Regex.Literal<?> l) {
            sb.append(l.symbol());
        } else if (regex instanceof Regex.EmptySet) {
            sb.append(EMPTY_SET);
        } else if (regex instanceof Regex.Epsilon) {
            if (context == STAR_PRECEDENCE) {
                sb.append("()");
            }
        } else if (regex instanceof Regex.Concat<?> c) {
            boolean parens = context > CONCAT_PRECEDENCE;
            if (parens) {
                sb.append('(');
            }
            appendInfix(sb, c.left(), CONCAT_PRECEDENCE);
            appendInfix(sb, c.right(), CONCAT_PRECEDENCE);
            if (parens) {
                sb.append(')');
            }
        } else if (regex instanceof Regex.Union<?> u) {
            boolean parens = context > UNION_PRECEDENCE;
            if (parens) {
                sb.append('(');
            }
            appendInfix(sb, u.left(), UNION_PRECEDENCE);
            sb.append('|');
            appendInfix(sb, u.right(), UNION_PRECEDENCE);
            if (parens) {
                sb.append(')');
            }
        } else if (regex instanceof Regex.Star<?> s) {
            appendInfix(sb, s.child(), STAR_PRECEDENCE);
            sb.append('*');
        }
    }

    /**
     * Prefix notation: ".(x,y)" for Concat, "|(x,y)" for Union, "*x" for Star.
     * @param regex - AST to render
     * @return prefix regular expression
     */
    public static String toPrefix(Regex<?> regex) {
        StringBuilder sb = new StringBuilder();
        appendPrefix(sb, regex);
        return sb.toString();
    }

    private static void appendPrefix(StringBuilder sb, Regex<?> regex) {
        if (regex instanceof Regex.Literal<?> l) {
            sb.append(l.symbol());
        } else if (regex instanceof Regex.EmptySet) {
            sb.append(EMPTY_SET);
        } else if (regex instanceof Regex.Epsilon) {
            sb.append(EPSILON);
        } else if (regex instanceof Regex.Concat<?> c) {
            appendBinary(sb, '.', c.left(), c.right());
        } else if (regex instanceof Regex.Union<?> u) {
            appendBinary(sb, '|', u.left(), u.right());
        } else if (regex instanceof Regex.Star<?> s) {
            sb.append('*');
            appendPrefix(sb, s.child());
        }
    }

    private static void appendBinary(StringBuilder sb, char operator, Regex<?> left, Regex<?> right) {
        sb.append(operator).append('(');
        appendPrefix(sb, left);
        sb.append(',');
        appendPrefix(sb, right);
        sb.append(')');
    }
}
