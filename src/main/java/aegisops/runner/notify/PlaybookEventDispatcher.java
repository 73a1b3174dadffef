package aegisops.runner.notify;

import aegisops.runner.parser.AnsibleJsonOutput;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Replays the tool's JSON result document as callback events:
 * playbook start, then every task result per host in play order, then the
 * final stats. A callback that throws is logged and skipped; it never
 * affects the run or the other callbacks.
 */
public class PlaybookEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PlaybookEventDispatcher.class);

    /**
     * @return true if a result document was found and replayed
     */
    public boolean dispatch(String playbook, String output, List<? extends PlaybookCallback> callbacks) {
        return AnsibleJsonOutput.locate(output)
                .map(doc -> {
                    replay(playbook, doc, callbacks);
                    return true;
                })
                .orElse(false);
    }

    void replay(String playbook, JsonNode doc, List<? extends PlaybookCallback> callbacks) {
        fire(callbacks, cb -> cb.onPlaybookStart(playbook));

        JsonNode plays = doc.path("plays");
        for (JsonNode play : plays) {
            for (JsonNode task : play.path("tasks")) {
                String taskName = task.path("task").path("name").asText("");
                Iterator<Map.Entry<String, JsonNode>> hosts = task.path("hosts").fields();
                while (hosts.hasNext()) {
                    Map.Entry<String, JsonNode> entry = hosts.next();
                    String host = entry.getKey();
                    JsonNode result = entry.getValue();
                    if (result.path("unreachable").asBoolean(false)) {
                        fire(callbacks, cb -> cb.onRunnerUnreachable(host, taskName));
                    } else if (result.path("failed").asBoolean(false)) {
                        boolean ignored = result.path("_ansible_ignore_errors").asBoolean(false);
                        fire(callbacks, cb -> cb.onRunnerFailed(host, taskName, ignored));
                    } else if (result.path("skipped").asBoolean(false)) {
                        fire(callbacks, cb -> cb.onRunnerSkipped(host, taskName));
                    } else {
                        fire(callbacks, cb -> cb.onRunnerOk(host, taskName));
                    }
                }
            }
        }

        Map<String, HostStats> stats = readStats(doc.path("stats"));
        fire(callbacks, cb -> cb.onStats(stats));
    }

    private static Map<String, HostStats> readStats(JsonNode node) {
        Map<String, HostStats> stats = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> hosts = node.fields();
        while (hosts.hasNext()) {
            Map.Entry<String, JsonNode> entry = hosts.next();
            JsonNode s = entry.getValue();
            stats.put(entry.getKey(), new HostStats(
                    nonNegative(s, "ok"),
                    nonNegative(s, "changed"),
                    nonNegative(s, "unreachable"),
                    nonNegative(s, "failures"),
                    nonNegative(s, "skipped"),
                    nonNegative(s, "rescued"),
                    nonNegative(s, "ignored")));
        }
        return stats;
    }

    private static int nonNegative(JsonNode node, String field) {
        return Math.max(0, node.path(field).asInt(0));
    }

    private static void fire(List<? extends PlaybookCallback> callbacks, Consumer<PlaybookCallback> event) {
        for (PlaybookCallback cb : callbacks) {
            try {
                event.accept(cb);
            } catch (RuntimeException e) {
                log.warn("Callback {} failed: {}", cb.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
