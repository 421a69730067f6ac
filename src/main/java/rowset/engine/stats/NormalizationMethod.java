package rowset.engine.stats;

import java.util.Locale;

public enum NormalizationMethod {
    /** (v - min) / (max - min) */
    MIN_MAX,
    /** (v - mean) / std */
    Z_SCORE,
    /** (v - median) / IQR */
    ROBUST;

    public static NormalizationMethod parse(String text) {
        if (text == null) throw new IllegalArgumentException("method must not be null");
        return switch (text.trim().toUpperCase(Locale.ROOT).replace("_", "").replace("-", "")) {
            case "MINMAX" -> MIN_MAX;
            case "ZSCORE" -> Z_SCORE;
            case "ROBUST" -> ROBUST;
            default -> throw new IllegalArgumentException("Unknown normalization method: " + text);
        };
    }
}
