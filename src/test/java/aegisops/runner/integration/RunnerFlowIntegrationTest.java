package aegisops.runner.integration;

import aegisops.runner.config.Dependencies;
import aegisops.runner.config.RunnerConfig;
import aegisops.runner.model.RunRecord;
import aegisops.runner.model.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schedules file to run history and notification, with a shell script
 * standing in for the automation tool.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class RunnerFlowIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path baseDir;

    private HttpServer intake;
    private final BlockingQueue<String> posts = new LinkedBlockingQueue<>();
    private Dependencies deps;

    @BeforeEach
    void setUp() throws Exception {
        intake = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        intake.createContext("/internal/aegisops", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                posts.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        intake.start();

        Files.createDirectories(baseDir.resolve("playbooks"));
        Files.writeString(baseDir.resolve("playbooks/ping.yml"), "- hosts: all\n");
        Files.writeString(baseDir.resolve("playbooks/broken.yml"), "- hosts: all\n");
        Files.writeString(baseDir.resolve("inventory.ini"), "[web]\nweb1\n");
        Files.writeString(baseDir.resolve("schedules.json"), """
                [
                  {"id": "ping", "playbook": "ping.yml", "every": "1h", "notify": {"target_key": "ops"}},
                  {"id": "broken", "playbook": "broken.yml", "every": "1h"},
                  {"id": "ghost", "playbook": "ghost.yml", "every": "1h"}
                ]
                """);

        Path bin = baseDir.resolve("fake-ansible.sh");
        Files.writeString(bin, """
                #!/bin/sh
                case "$*" in
                  *broken.yml*)
                    printf '{"plays": [{"tasks": [{"task": {"name": "t"}, "hosts": {"web1": {"failed": true}}}]}], "stats": {"web1": {"ok": 0, "changed": 0, "unreachable": 0, "failures": 1}}}\\n'
                    exit 2 ;;
                  *)
                    printf '{"plays": [{"tasks": [{"task": {"name": "t"}, "hosts": {"web1": {"changed": true}}}]}], "stats": {"web1": {"ok": 1, "changed": 1, "unreachable": 0, "failures": 0}}}\\n'
                    exit 0 ;;
                esac
                """);
        Files.setPosixFilePermissions(bin, PosixFilePermissions.fromString("rwxr-xr-x"));

        RunnerConfig config = RunnerConfig.defaults()
                .withBaseDir(baseDir)
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withAnsibleExecutable(bin.toString())
                .withPollQuantum(Duration.ofMillis(50))
                .withRunTimeout(Duration.ofSeconds(20))
                .withNotifyUrl("http://127.0.0.1:" + intake.getAddress().getPort() + "/internal/aegisops");

        deps = Dependencies.create(config);
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
        intake.stop(0);
    }

    @Test
    void everyJobRunsOnceAndIsRecorded() throws Exception {
        assertEquals(3, deps.jobs().size());

        deps.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (deps.runHistoryRepository().count() < 3 && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }

        List<RunRecord> runs = deps.runHistoryRepository().findRecent(10);
        assertEquals(3, runs.size());

        RunRecord ping = only(runs, "ping.yml");
        assertEquals(RunStatus.OK, ping.status());
        assertEquals(1, ping.okCount());
        assertEquals(1, ping.changedCount());
        assertEquals("ops", ping.targetKey());

        RunRecord broken = only(runs, "broken.yml");
        assertEquals(RunStatus.FAIL, broken.status());
        assertEquals(1, broken.failCount());

        RunRecord ghost = only(runs, "ghost.yml");
        assertEquals(RunStatus.FAIL, ghost.status());
        assertEquals(0, ghost.okCount());

        // one post per completed run; the missing playbook never ran
        String first = posts.poll(10, TimeUnit.SECONDS);
        String second = posts.poll(10, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertNull(posts.poll(300, TimeUnit.MILLISECONDS));

        JsonNode a = MAPPER.readTree(first);
        JsonNode b = MAPPER.readTree(second);
        JsonNode pingPost = "ping.yml".equals(a.get("playbook").asText()) ? a : b;
        JsonNode brokenPost = pingPost == a ? b : a;
        assertEquals(5, pingPost.get("priority").asInt());
        assertEquals("ops", pingPost.get("target").asText());
        assertEquals(7, brokenPost.get("priority").asInt());
        assertEquals("fail", brokenPost.get("status").asText());

        // hourly jobs do not run again within the test
        Thread.sleep(300);
        assertEquals(3, deps.runHistoryRepository().count());
    }

    private static RunRecord only(List<RunRecord> runs, String playbook) {
        List<RunRecord> matching = runs.stream().filter(r -> r.playbook().equals(playbook)).toList();
        assertEquals(1, matching.size(), "runs of " + playbook);
        return matching.get(0);
    }
}
