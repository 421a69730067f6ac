package rowset.engine.asof;

import java.util.Locale;

/** Which right-side timestamp an as-of merge picks for a left timestamp t. */
public enum Direction {
    /** Greatest right time not after t. */
    BACKWARD,
    /** Smallest right time not before t. */
    FORWARD,
    /** Closer of the two; ties go backward. */
    NEAREST;

    public static Direction parse(String text) {
        if (text == null) throw new IllegalArgumentException("direction must not be null");
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "BACKWARD" -> BACKWARD;
            case "FORWARD" -> FORWARD;
            case "NEAREST" -> NEAREST;
            default -> throw new IllegalArgumentException("Unknown as-of direction: " + text);
        };
    }
}
