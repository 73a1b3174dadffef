package aegisops.runner.parser;

import aegisops.runner.model.RunCounts;

import java.util.List;
import java.util.Optional;

/**
 * Tries each parser in order and returns the first result.
 */
public class ChainedResultParser implements ResultParser {

    private final List<ResultParser> parsers;

    public ChainedResultParser(List<ResultParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    /** Structured output first, recap line as fallback. */
    public static ChainedResultParser standard() {
        return new ChainedResultParser(List.of(new JsonResultParser(), new RecapResultParser()));
    }

    @Override
    public Optional<RunCounts> extract(String output) {
        for (ResultParser parser : parsers) {
            Optional<RunCounts> counts = parser.extract(output);
            if (counts.isPresent()) {
                return counts;
            }
        }
        return Optional.empty();
    }
}
