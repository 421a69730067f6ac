package rowset.engine.exec;

import java.util.Set;

import rowset.engine.numeric.NumericParser;

/**
 * Minimal predicate interface evaluated against a Row.
 */
public interface Predicate {
    boolean test(Row row, NumericParser numbers);

    /** Columns the predicate reads, validated before any row is processed. */
    Set<String> columns();
}
