package aegisops.runner.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Locates the result document written by the tool's {@code json} stdout
 * callback. Warnings may precede it, so the document is taken to start at
 * the first line that begins with '{'.
 */
public final class AnsibleJsonOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AnsibleJsonOutput() {
    }

    public static Optional<JsonNode> locate(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        int from = 0;
        while (from < output.length()) {
            int start = output.charAt(from) == '{' ? from : output.indexOf("\n{", from);
            if (start < 0) {
                return Optional.empty();
            }
            if (output.charAt(start) == '\n') {
                start++;
            }
            Optional<JsonNode> node = read(output.substring(start))
                    .filter(n -> n.isObject() && (n.has("stats") || n.has("plays")));
            if (node.isPresent()) {
                return node;
            }
            from = start + 1;
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> read(String text) {
        try {
            return Optional.ofNullable(MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Non-negative int field, 0 when absent or not a number.
     */
    static int count(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            return 0;
        }
        return Math.max(0, value.asInt());
    }
}
