package aegisops.runner.api.v1;

import aegisops.runner.api.Controller;
import aegisops.runner.api.v1.dto.HealthResponse;
import aegisops.runner.scheduler.JobScheduler;
import aegisops.runner.server.RouterHandler;
import aegisops.runner.service.RunHistoryService;
import aegisops.runner.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobScheduler scheduler;
    private final RunHistoryService historyService;

    public HealthController(Database database, JobScheduler scheduler, RunHistoryService historyService) {
        this.database = database;
        this.scheduler = scheduler;
        this.historyService = historyService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    scheduler.jobs().size(),
                    scheduler.activeLoops(),
                    historyService.totalRuns());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unhealthy(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private ControllerResponse unhealthy(String reason) throws Exception {
        return ControllerResponse.json(
                HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
