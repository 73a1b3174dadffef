package aegisops.runner.parser;

import aegisops.runner.model.RunCounts;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Sums the per-host {@code stats} block of the JSON result document.
 */
public class JsonResultParser implements ResultParser {

    @Override
    public Optional<RunCounts> extract(String output) {
        return AnsibleJsonOutput.locate(output).flatMap(JsonResultParser::fromDocument);
    }

    static Optional<RunCounts> fromDocument(JsonNode doc) {
        JsonNode stats = doc.get("stats");
        if (stats == null || !stats.isObject()) {
            return Optional.empty();
        }
        RunCounts total = RunCounts.ZERO;
        Iterator<Map.Entry<String, JsonNode>> hosts = stats.fields();
        while (hosts.hasNext()) {
            JsonNode host = hosts.next().getValue();
            if (!host.isObject()) {
                continue;
            }
            total = total.plus(new RunCounts(
                    AnsibleJsonOutput.count(host, "ok"),
                    AnsibleJsonOutput.count(host, "changed"),
                    AnsibleJsonOutput.count(host, "unreachable"),
                    AnsibleJsonOutput.count(host, "failures")));
        }
        return Optional.of(total);
    }
}
