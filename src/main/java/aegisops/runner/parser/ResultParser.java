package aegisops.runner.parser;

import aegisops.runner.model.RunCounts;

import java.util.Optional;

/**
 * Extracts aggregate host counters from the automation tool's output.
 * Implementations never throw on odd input.
 */
public interface ResultParser {

    /**
     * @param output combined stdout and stderr of one run
     * @return counters if this parser recognised a result in the output
     */
    Optional<RunCounts> extract(String output);

    /**
     * Counters from the output, or all zeros if nothing was recognised.
     */
    default RunCounts parse(String output) {
        return extract(output).orElse(RunCounts.ZERO);
    }
}
