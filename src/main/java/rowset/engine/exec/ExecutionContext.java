package rowset.engine.exec;

import rowset.engine.config.EngineOptions;
import rowset.engine.numeric.NumericParser;
import rowset.engine.numeric.TimestampParser;

/**
 * Per-materialization settings handed to every stage: error policy and the parsers bound to the configured culture.
 */
public final class ExecutionContext {
    private final EngineOptions options;
    private final NumericParser numbers;
    private final TimestampParser timestamps;

    public ExecutionContext(EngineOptions options) {
        this.options = options;
        this.numbers = new NumericParser(options.numericCulture());
        this.timestamps = new TimestampParser(numbers);
    }

    public static ExecutionContext defaults() { return new ExecutionContext(EngineOptions.defaults()); }
    public static ExecutionContext tolerant() { return new ExecutionContext(EngineOptions.defaults().withIgnoreErrors(true)); }

    public EngineOptions options() { return options; }
    public NumericParser numbers() { return numbers; }
    public TimestampParser timestamps() { return timestamps; }
    public boolean ignoreErrors() { return options.ignoreErrors(); }
    public String defaultValue() { return options.defaultValue(); }
}
