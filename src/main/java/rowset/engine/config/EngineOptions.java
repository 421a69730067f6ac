package rowset.engine.config;

import rowset.engine.numeric.NumericCulture;

/**
 * Options consumed by the engine core and handed to sources / sinks.
 * Boxed components so that fields absent from a JSON options file fall back to defaults.
 */
public record EngineOptions(Boolean hasHeader,
                            Boolean ignoreErrors,
                            String defaultValue,
                            NumericCulture numericCulture,
                            String aggregateSeparator) {

    public EngineOptions {
        if (hasHeader == null) hasHeader = Boolean.TRUE;
        if (ignoreErrors == null) ignoreErrors = Boolean.FALSE;
        if (defaultValue == null) defaultValue = "";
        if (numericCulture == null) numericCulture = NumericCulture.INVARIANT;
        if (aggregateSeparator == null) aggregateSeparator = "_";
    }

    public static EngineOptions defaults() {
        return new EngineOptions(null, null, null, null, null);
    }

    public EngineOptions withHasHeader(boolean value) {
        return new EngineOptions(value, ignoreErrors, defaultValue, numericCulture, aggregateSeparator);
    }

    public EngineOptions withIgnoreErrors(boolean value) {
        return new EngineOptions(hasHeader, value, defaultValue, numericCulture, aggregateSeparator);
    }

    public EngineOptions withDefaultValue(String value) {
        return new EngineOptions(hasHeader, ignoreErrors, value, numericCulture, aggregateSeparator);
    }

    public EngineOptions withNumericCulture(NumericCulture value) {
        return new EngineOptions(hasHeader, ignoreErrors, defaultValue, value, aggregateSeparator);
    }

    public EngineOptions withAggregateSeparator(String value) {
        return new EngineOptions(hasHeader, ignoreErrors, defaultValue, numericCulture, value);
    }
}
