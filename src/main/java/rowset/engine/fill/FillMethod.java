package rowset.engine.fill;

import java.util.Locale;

/** How a blank cell is filled. */
public enum FillMethod {
    /** mean of the column's numeric cells */
    MEAN,
    /** median of the column's numeric cells */
    MEDIAN,
    /** most frequent non-blank cell, first seen wins ties */
    MODE,
    /** nearest non-blank cell above */
    FORWARD,
    /** nearest non-blank cell below */
    BACKWARD,
    /** a fixed value */
    CONSTANT;

    public static FillMethod parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Fill method must not be empty");
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "MEAN", "AVG", "AVERAGE" -> MEAN;
            case "MEDIAN" -> MEDIAN;
            case "MODE" -> MODE;
            case "FORWARD", "FFILL" -> FORWARD;
            case "BACKWARD", "BFILL" -> BACKWARD;
            case "CONSTANT" -> CONSTANT;
            default -> throw new IllegalArgumentException("Unknown fill method: " + text);
        };
    }
}
