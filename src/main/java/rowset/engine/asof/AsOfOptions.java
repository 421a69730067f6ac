package rowset.engine.asof;

import java.time.Duration;

/**
 * Settings for an as-of merge. tolerance may be null (no limit).
 */
public record AsOfOptions(String leftOn, String rightOn, Direction direction, Duration tolerance, String suffix) {
    public static final String DEFAULT_SUFFIX = "_right";

    public AsOfOptions {
        if (leftOn == null || leftOn.isEmpty()) throw new IllegalArgumentException("Left time column must be specified");
        if (rightOn == null || rightOn.isEmpty()) throw new IllegalArgumentException("Right time column must be specified");
        if (direction == null) direction = Direction.BACKWARD;
        if (tolerance != null && tolerance.isNegative()) throw new IllegalArgumentException("Tolerance must not be negative: " + tolerance);
        if (tolerance != null) {
            try {
                tolerance.toMillis();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Tolerance too large: " + tolerance, e);
            }
        }
        if (suffix == null || suffix.isEmpty()) suffix = DEFAULT_SUFFIX;
    }

    public static AsOfOptions on(String timeColumn) {
        return new AsOfOptions(timeColumn, timeColumn, Direction.BACKWARD, null, DEFAULT_SUFFIX);
    }

    public static AsOfOptions of(String leftOn, String rightOn) {
        return new AsOfOptions(leftOn, rightOn, Direction.BACKWARD, null, DEFAULT_SUFFIX);
    }

    public AsOfOptions withDirection(Direction d) { return new AsOfOptions(leftOn, rightOn, d, tolerance, suffix); }
    public AsOfOptions withTolerance(Duration t) { return new AsOfOptions(leftOn, rightOn, direction, t, suffix); }
    public AsOfOptions withSuffix(String s) { return new AsOfOptions(leftOn, rightOn, direction, tolerance, s); }
}
