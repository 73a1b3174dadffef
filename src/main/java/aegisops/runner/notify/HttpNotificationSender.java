package aegisops.runner.notify;

import aegisops.runner.config.RunnerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts payloads as JSON to the internal intake endpoint. No authentication;
 * the response status and body are ignored.
 */
public class HttpNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(HttpNotificationSender.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient client;

    public HttpNotificationSender(RunnerConfig config) {
        this(URI.create(config.notifyUrl()), config.notifyTimeout());
    }

    public HttpNotificationSender(URI endpoint, Duration timeout) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void send(NotificationPayload payload) throws IOException, InterruptedException {
        byte[] body = MAPPER.writeValueAsBytes(payload);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        log.debug("Notification for {} posted to {} ({})", payload.playbook(), endpoint, response.statusCode());
    }
}
