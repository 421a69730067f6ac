package rowset.engine.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.catalog.Schema;

/**
 * Keeps the rows matching a Predicate, in input order.
 * A row whose cell cannot be evaluated fails the stage in strict mode and is dropped when errors are ignored.
 */
public class FilterStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(FilterStage.class);

    private final Predicate predicate;

    public FilterStage(Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        this.predicate = predicate;
    }

    @Override
    public String name() { return "filter"; }

    @Override
    public Schema outputSchema(Schema input) {
        input.requireAll(predicate.columns());
        return input;
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        RowSet.Builder out = RowSet.builder(input.schema());
        int dropped = 0;
        for (int i = 0; i < input.size(); i++) {
            Row r = input.row(i);
            try {
                if (predicate.test(r, ctx.numbers())) out.add(r);
            } catch (RowProcessingException e) {
                if (!ctx.ignoreErrors()) throw e.atRow(i);
                dropped++;
            }
        }
        if (dropped > 0) log.warn("filter {} dropped {} row(s) with unreadable cells", predicate, dropped);
        return out.build();
    }

    @Override
    public String toString() { return "FilterStage[" + predicate + "]"; }
}
