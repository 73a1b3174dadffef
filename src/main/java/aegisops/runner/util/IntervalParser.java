package aegisops.runner.util;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts interval specs like "30s", "5m", "1h" or "1d" into seconds.
 * Anything it cannot read falls back to {@link #DEFAULT_SECONDS}.
 */
public final class IntervalParser {

    public static final long DEFAULT_SECONDS = 300;

    private static final Pattern SPEC = Pattern.compile("^\\s*(\\d+)\\s*([smhd])\\s*$");

    private IntervalParser() {
    }

    public static long parseSeconds(String spec) {
        return read(spec).orElse(DEFAULT_SECONDS);
    }

    /** True if the interval is read as written rather than replaced by the default. */
    public static boolean isValid(String spec) {
        return read(spec).isPresent();
    }

    private static OptionalLong read(String spec) {
        if (spec == null) {
            return OptionalLong.empty();
        }
        Matcher m = SPEC.matcher(spec);
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        try {
            long n = Long.parseLong(m.group(1));
            return OptionalLong.of(Math.multiplyExact(n, multiplier(m.group(2).charAt(0))));
        } catch (ArithmeticException | NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static long multiplier(char unit) {
        return switch (unit) {
            case 's' -> 1L;
            case 'm' -> 60L;
            case 'h' -> 3600L;
            case 'd' -> 86400L;
            default -> throw new IllegalArgumentException("unit: " + unit);
        };
    }
}
