package aegisops.runner.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class IntervalParserTest {

    @Test
    void parsesEachUnit() {
        assertEquals(30, IntervalParser.parseSeconds("30s"));
        assertEquals(300, IntervalParser.parseSeconds("5m"));
        assertEquals(3600, IntervalParser.parseSeconds("1h"));
        assertEquals(86400, IntervalParser.parseSeconds("1d"));
    }

    @Test
    void toleratesSurroundingWhitespace() {
        assertEquals(120, IntervalParser.parseSeconds("  2 m "));
        assertEquals(45, IntervalParser.parseSeconds("\t45s\n"));
    }

    @Test
    void zeroIsAcceptedAsWritten() {
        assertEquals(0, IntervalParser.parseSeconds("0s"));
        assertTrue(IntervalParser.isValid("0s"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   ", "5", "m", "5x", "5M", "-5m", "1.5h", "5 minutes", "abc", "10s5" })
    void unreadableSpecsFallBackToDefault(String spec) {
        assertEquals(IntervalParser.DEFAULT_SECONDS, IntervalParser.parseSeconds(spec));
        assertFalse(IntervalParser.isValid(spec));
    }

    @Test
    void overflowFallsBackToDefault() {
        assertEquals(300, IntervalParser.parseSeconds("9999999999999999d"));
        assertEquals(300, IntervalParser.parseSeconds("99999999999999999999s"));
        assertFalse(IntervalParser.isValid("9999999999999999d"));
        assertFalse(IntervalParser.isValid("99999999999999999999s"));
    }

    @Test
    void defaultIsFiveMinutes() {
        assertEquals(300, IntervalParser.DEFAULT_SECONDS);
    }
}
