package aegisops.runner.parser;

import aegisops.runner.model.CheckRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Harvests per-check results that a playbook publishes through
 * {@code set_stats} as {@code details: {host, checks: [{name, mode, status, detail}]}}.
 * Both per-host ({@code custom_stats}) and aggregated
 * ({@code global_custom_stats}) blocks are read.
 */
public class CheckResultExtractor {

    public List<CheckRecord> extract(String output) {
        return AnsibleJsonOutput.locate(output).map(this::fromDocument).orElse(List.of());
    }

    List<CheckRecord> fromDocument(JsonNode doc) {
        List<CheckRecord> records = new ArrayList<>();

        JsonNode perHost = doc.get("custom_stats");
        if (perHost != null && perHost.isObject()) {
            Iterator<JsonNode> hosts = perHost.elements();
            while (hosts.hasNext()) {
                collect(hosts.next().get("details"), records);
            }
        }

        JsonNode global = doc.get("global_custom_stats");
        if (global != null && global.isObject()) {
            collect(global.get("details"), records);
        }
        return records;
    }

    private void collect(JsonNode details, List<CheckRecord> into) {
        if (details == null) {
            return;
        }
        if (details.isArray()) {
            for (JsonNode d : details) {
                collect(d, into);
            }
            return;
        }
        if (!details.isObject()) {
            return;
        }
        String host = text(details, "host");
        JsonNode checks = details.get("checks");
        if (checks == null || !checks.isArray()) {
            return;
        }
        for (JsonNode check : checks) {
            if (!check.isObject()) {
                continue;
            }
            into.add(CheckRecord.of(
                    host,
                    text(check, "name"),
                    text(check, "mode"),
                    text(check, "status"),
                    text(check, "detail")));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
