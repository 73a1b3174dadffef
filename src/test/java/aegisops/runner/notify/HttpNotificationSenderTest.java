package aegisops.runner.notify;

import aegisops.runner.model.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpNotificationSenderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final BlockingQueue<String> bodies = new ArrayBlockingQueue<>(10);
    private final BlockingQueue<String> contentTypes = new ArrayBlockingQueue<>(10);

    @BeforeEach
    void startIntake() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/internal/aegisops", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopIntake() {
        server.stop(0);
    }

    private URI intakeUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/internal/aegisops");
    }

    @Test
    void postsPayloadAsJson() throws Exception {
        HttpNotificationSender sender = new HttpNotificationSender(intakeUri(), Duration.ofSeconds(5));

        sender.send(NotificationPayload.of("site.yml", RunStatus.FAIL, 4, 1, 1, 0, "ops"));

        String body = bodies.poll(5, TimeUnit.SECONDS);
        assertNotNull(body);
        assertEquals("application/json", contentTypes.poll(5, TimeUnit.SECONDS));

        JsonNode json = MAPPER.readTree(body);
        assertEquals("AegisOps", json.get("title").asText());
        assertEquals("aegisops", json.get("source").asText());
        assertEquals(7, json.get("priority").asInt());
        assertEquals("site.yml", json.get("playbook").asText());
        assertEquals("fail", json.get("status").asText());
        assertEquals(4, json.get("ok").asInt());
        assertEquals(1, json.get("changed").asInt());
        assertEquals(1, json.get("failures").asInt());
        assertEquals(0, json.get("unreachable").asInt());
        assertEquals("ops", json.get("target").asText());
        assertTrue(json.get("message").asText().startsWith("Playbook: site.yml\nStatus: fail\n"));
    }

    @Test
    void callbackCompletesWhenIntakeIsDown() {
        HttpNotificationSender sender = new HttpNotificationSender(
                URI.create("http://127.0.0.1:1/internal/aegisops"), Duration.ofSeconds(2));
        NotifyCallback callback = new NotifyCallback(sender, "ops");

        callback.onPlaybookStart("site.yml");
        callback.onRunnerOk("h", "t");

        assertDoesNotThrow(() -> callback.onStats(Map.of()));
        assertFalse(Thread.currentThread().isInterrupted());
    }
}
