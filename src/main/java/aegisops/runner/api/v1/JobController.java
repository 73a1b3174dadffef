package aegisops.runner.api.v1;

import aegisops.runner.api.Controller;
import aegisops.runner.api.v1.dto.JobResponse;
import aegisops.runner.scheduler.JobScheduler;
import aegisops.runner.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Lists the jobs the scheduler was started with.
 * GET /api/v1/jobs
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobScheduler scheduler;

    public JobController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/jobs".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<JobResponse> jobs = scheduler.jobs().stream()
                    .map(JobResponse::from)
                    .toList();

            Map<String, Object> response = Map.of(
                    "running", scheduler.isRunning(),
                    "count", jobs.size(),
                    "jobs", jobs);

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
