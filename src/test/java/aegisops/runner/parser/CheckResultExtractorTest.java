package aegisops.runner.parser;

import aegisops.runner.model.CheckRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckResultExtractorTest {

    private final CheckResultExtractor extractor = new CheckResultExtractor();

    @Test
    void readsPerHostCustomStats() {
        String output = """
                {
                  "plays": [],
                  "stats": {"web1": {"ok": 2}},
                  "custom_stats": {
                    "web1": {
                      "details": {
                        "host": "web1",
                        "checks": [
                          {"name": "ping", "mode": "ping", "status": "up", "detail": "rtt 1ms"},
                          {"name": "nginx", "mode": "http", "status": "down", "detail": "HTTP 502"}
                        ]
                      }
                    }
                  }
                }
                """;

        List<CheckRecord> checks = extractor.extract(output);

        assertEquals(2, checks.size());
        assertEquals("web1", checks.get(0).host());
        assertEquals("ping", checks.get(0).checkName());
        assertEquals("up", checks.get(0).status());
        assertEquals("http", checks.get(1).mode());
        assertEquals("HTTP 502", checks.get(1).detail());
        assertNull(checks.get(0).id());
    }

    @Test
    void readsGlobalStatsAsArray() {
        String output = """
                {
                  "stats": {},
                  "global_custom_stats": {
                    "details": [
                      {"host": "a", "checks": [{"name": "ssh", "mode": "tcp", "status": "up"}]},
                      {"host": "b", "checks": [{"name": "ssh", "mode": "tcp", "status": "down", "detail": "refused"}]}
                    ]
                  }
                }
                """;

        List<CheckRecord> checks = extractor.extract(output);

        assertEquals(2, checks.size());
        assertEquals("a", checks.get(0).host());
        assertEquals("", checks.get(0).detail());
        assertEquals("b", checks.get(1).host());
        assertEquals("refused", checks.get(1).detail());
    }

    @Test
    void malformedEntriesAreSkipped() {
        String output = """
                {
                  "stats": {},
                  "global_custom_stats": {
                    "details": [
                      "not an object",
                      {"host": "a", "checks": "nope"},
                      {"host": "b", "checks": [42, {"name": "x", "mode": "ping", "status": "up"}]}
                    ]
                  }
                }
                """;

        List<CheckRecord> checks = extractor.extract(output);

        assertEquals(1, checks.size());
        assertEquals("b", checks.get(0).host());
    }

    @Test
    void noDocumentMeansNoChecks() {
        assertTrue(extractor.extract("PLAY RECAP\nweb1 : ok=1 changed=0 unreachable=0 failed=0").isEmpty());
        assertTrue(extractor.extract("{\"stats\": {}}").isEmpty());
    }
}
