package aegisops.runner.parser;

import aegisops.runner.model.RunCounts;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the first "PLAY RECAP" line of human-readable output, e.g.
 * {@code web1 : ok=3 changed=1 unreachable=0 failed=0 skipped=0}.
 */
public class RecapResultParser implements ResultParser {

    // Field order is fixed by the tool; all four must sit on one line.
    private static final Pattern RECAP = Pattern.compile(
            "ok=(\\d+).*changed=(\\d+).*unreachable=(\\d+).*failed=(\\d+)");

    @Override
    public Optional<RunCounts> extract(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = RECAP.matcher(output);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new RunCounts(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
