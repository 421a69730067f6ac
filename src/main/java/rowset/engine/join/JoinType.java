package rowset.engine.join;

import java.util.Locale;

/**
 * Which unmatched rows survive an equality join.
 */
public enum JoinType {
    /** only rows with matching keys on both sides */
    INNER,
    /** every left row, right columns empty when unmatched */
    LEFT,
    /** every right row, left columns empty when unmatched */
    RIGHT,
    /** every row from both sides */
    OUTER;

    public static JoinType parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Join type must not be empty");
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "INNER" -> INNER;
            case "LEFT" -> LEFT;
            case "RIGHT" -> RIGHT;
            case "OUTER", "FULL" -> OUTER;
            default -> throw new IllegalArgumentException("Unknown join type: " + text);
        };
    }
}
