package rowset.engine.exec;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import rowset.engine.numeric.NumericParser;

/**
 * Logical AND / OR over two or more predicates, or NOT over one.
 * Children are evaluated left to right and evaluation stops at the first deciding child,
 * so a later child that would fail on a bad cell is never reached.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children;

    private CompoundPredicate(Type type, List<Predicate> children) {
        int min = type == Type.NOT ? 1 : 2;
        int max = type == Type.NOT ? 1 : Integer.MAX_VALUE;
        if (children.size() < min || children.size() > max) {
            throw new IllegalArgumentException(type + " takes " + (type == Type.NOT ? "exactly one" : "at least two") + " predicates, got " + children.size());
        }
        for (Predicate p : children) if (p == null) throw new IllegalArgumentException(type + " predicate must not be null");
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static CompoundPredicate and(Predicate... predicates) { return new CompoundPredicate(Type.AND, Arrays.asList(predicates)); }
    public static CompoundPredicate or(Predicate... predicates) { return new CompoundPredicate(Type.OR, Arrays.asList(predicates)); }
    public static CompoundPredicate not(Predicate predicate) { return new CompoundPredicate(Type.NOT, Arrays.asList(predicate)); }

    public Type type() { return type; }

    @Override
    public boolean test(Row row, NumericParser numbers) {
        return switch (type) {
            case AND -> !anyChildYields(false, row, numbers);
            case OR -> anyChildYields(true, row, numbers);
            case NOT -> !children.get(0).test(row, numbers);
        };
    }

    // true as soon as one child evaluates to outcome
    private boolean anyChildYields(boolean outcome, Row row, NumericParser numbers) {
        for (Predicate p : children) {
            if (p.test(row, numbers) == outcome) return true;
        }
        return false;
    }

    @Override
    public Set<String> columns() {
        Set<String> all = new LinkedHashSet<>();
        children.forEach(p -> all.addAll(p.columns()));
        return all;
    }

    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + children.get(0) + ")";
        return children.stream().map(String::valueOf).collect(Collectors.joining(" " + type + " ", "(", ")"));
    }
}
