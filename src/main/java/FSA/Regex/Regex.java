package FSA.Regex;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable regular expression tree. The variant is given by {@link #kind()}; {@link #symbol()} is set for
 * {@link Kind#LITERAL}, {@link #left()} for {@link Kind#UNION}, {@link Kind#CONCAT} and {@link Kind#STAR}
 * (the operand), {@link #right()} for {@link Kind#UNION} and {@link Kind#CONCAT}.
 *
 * @param <I> symbol type
 */
public final class Regex<I> {

    public enum Kind {
        /** matches nothing */
        EMPTY,
        /** matches only the empty word */
        EPSILON,
        LITERAL,
        UNION,
        CONCAT,
        STAR
    }

    private final Kind kind;
    private final I symbol;
    private final Regex<I> left;
    private final Regex<I> right;

    private Regex(Kind kind, I symbol, Regex<I> left, Regex<I> right) {
        this.kind = kind;
        this.symbol = symbol;
        this.left = left;
        this.right = right;
    }

    public static <I> Regex<I> empty() {
        return new Regex<>(Kind.EMPTY, null, null, null);
    }

    public static <I> Regex<I> epsilon() {
        return new Regex<>(Kind.EPSILON, null, null, null);
    }

    public static <I> Regex<I> literal(I symbol) {
        return new Regex<>(Kind.LITERAL, Objects.requireNonNull(symbol, "symbol"), null, null);
    }

    public static <I> Regex<I> union(Regex<I> left, Regex<I> right) {
        return new Regex<>(Kind.UNION, null, Objects.requireNonNull(left, "left"), Objects.requireNonNull(right, "right"));
    }

    public static <I> Regex<I> concat(Regex<I> left, Regex<I> right) {
        return new Regex<>(Kind.CONCAT, null, Objects.requireNonNull(left, "left"), Objects.requireNonNull(right, "right"));
    }

    public static <I> Regex<I> star(Regex<I> inner) {
        return new Regex<>(Kind.STAR, null, Objects.requireNonNull(inner, "inner"), null);
    }

    /**
     * @return {@code r r*}
     */
    public static <I> Regex<I> plus(Regex<I> inner) {
        return concat(inner, star(inner));
    }

    /**
     * @return {@code r | ε}
     */
    public static <I> Regex<I> optional(Regex<I> inner) {
        return union(inner, epsilon());
    }

    /**
     * Left-nested union of all alternatives; {@link #empty()} for no alternative.
     */
    public static <I> Regex<I> union(List<Regex<I>> alternatives) {
        Regex<I> result = null;
        for (Regex<I> r : alternatives) {
            result = result == null ? r : union(result, r);
        }
        return result == null ? empty() : result;
    }

    /**
     * Left-nested concatenation of all parts; {@link #epsilon()} for no part.
     */
    public static <I> Regex<I> concat(List<Regex<I>> parts) {
        Regex<I> result = null;
        for (Regex<I> r : parts) {
            result = result == null ? r : concat(result, r);
        }
        return result == null ? epsilon() : result;
    }

    /**
     * Any single symbol of {@code symbols}, i.e. the "dot" of a regex over that alphabet.
     */
    public static <I> Regex<I> any(Iterable<? extends I> symbols) {
        Regex<I> result = null;
        for (I s : symbols) {
            result = result == null ? literal(s) : union(result, literal(s));
        }
        return result == null ? empty() : result;
    }

    /**
     * The given symbols in sequence.
     */
    @SafeVarargs
    public static <I> Regex<I> word(I... symbols) {
        Regex<I> result = null;
        for (I s : symbols) {
            result = result == null ? literal(s) : concat(result, literal(s));
        }
        return result == null ? epsilon() : result;
    }

    public Kind kind() {
        return kind;
    }

    public I symbol() {
        return symbol;
    }

    public Regex<I> left() {
        return left;
    }

    public Regex<I> right() {
        return right;
    }

    /**
     * Operand of a {@link Kind#STAR} node.
     */
    public Regex<I> inner() {
        return left;
    }

    /**
     * @return the symbols of all literals, in first-occurrence order
     */
    public Set<I> symbols() {
        final Set<I> result = new LinkedHashSet<>();
        collectSymbols(this, result);
        return result;
    }

    private static <I> void collectSymbols(Regex<I> regex, Set<I> result) {
        switch (regex.kind) {
            case EMPTY, EPSILON -> { }
            case LITERAL -> result.add(regex.symbol);
            case UNION, CONCAT -> {
                collectSymbols(regex.left, result);
                collectSymbols(regex.right, result);
            }
            case STAR -> collectSymbols(regex.left, result);
        }
    }

    /**
     * Rewrite bottom-up with language-preserving identities:
     * {@code ∅|r = r}, {@code r|r = r}, {@code ∅r = r∅ = ∅}, {@code εr = rε = r}, {@code (r*)* = r*},
     * {@code ∅* = ε* = ε}, {@code (ε|r)* = (r|ε)* = r*}.
     */
    public Regex<I> simplify() {
        return switch (kind) {
            case EMPTY, EPSILON, LITERAL -> this;
            case UNION -> simplifyUnion(left.simplify(), right.simplify());
            case CONCAT -> simplifyConcat(left.simplify(), right.simplify());
            case STAR -> simplifyStar(left.simplify());
        };
    }

    private static <I> Regex<I> simplifyUnion(Regex<I> l, Regex<I> r) {
        if (l.kind == Kind.EMPTY) {
            return r;
        }
        if (r.kind == Kind.EMPTY || l.equals(r)) {
            return l;
        }
        return union(l, r);
    }

    private static <I> Regex<I> simplifyConcat(Regex<I> l, Regex<I> r) {
        if (l.kind == Kind.EMPTY || r.kind == Kind.EMPTY) {
            return empty();
        }
        if (l.kind == Kind.EPSILON) {
            return r;
        }
        if (r.kind == Kind.EPSILON) {
            return l;
        }
        return concat(l, r);
    }

    private static <I> Regex<I> simplifyStar(Regex<I> inner) {
        switch (inner.kind) {
            case EMPTY:
            case EPSILON:
                return epsilon();
            case STAR:
                return inner;
            case UNION:
                if (inner.left.kind == Kind.EPSILON) {
                    return simplifyStar(inner.right);
                }
                if (inner.right.kind == Kind.EPSILON) {
                    return simplifyStar(inner.left);
                }
                return star(inner);
            default:
                return star(inner);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Regex)) {
            return false;
        }
        final Regex<?> other = (Regex<?>) o;
        return kind == other.kind && Objects.equals(symbol, other.symbol) && Objects.equals(left, other.left)
               && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, symbol, left, right);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EMPTY -> "∅";
            case EPSILON -> "ε";
            case LITERAL -> String.valueOf(symbol);
            case UNION -> "(" + left + "|" + right + ")";
            case CONCAT -> "(" + left + right + ")";
            case STAR -> "(" + left + ")*";
        };
    }
}
