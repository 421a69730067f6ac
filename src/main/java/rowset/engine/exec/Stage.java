package rowset.engine.exec;

import rowset.engine.catalog.Schema;

/**
 * One queued transformation: RowSet in, new RowSet out.
 * Binary operations (joins) hold their second operand and still take the pipeline RowSet as input.
 */
public interface Stage {
    /** Operation name used in logs and error reports. */
    String name();

    /**
     * Validates column references against the input schema and returns the schema this stage produces.
     * Must not look at rows; throws SchemaException on unknown columns.
     */
    Schema outputSchema(Schema input);

    RowSet apply(RowSet input, ExecutionContext ctx);
}
