package aegisops.runner.api.v1;

import aegisops.runner.api.Controller;
import aegisops.runner.api.v1.dto.CheckResponse;
import aegisops.runner.api.v1.dto.RunResponse;
import aegisops.runner.server.RouterHandler;
import aegisops.runner.service.RunHistoryService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Read access to run history.
 *
 * GET /api/v1/runs?limit=N&amp;playbook=P - recent playbook runs, newest first
 * GET /api/v1/checks?limit=N - recent check results, newest first
 */
public class RunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunHistoryService historyService;

    public RunController(RunHistoryService historyService) {
        this.historyService = historyService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/runs".equals(path) || "/api/v1/checks".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        try {
            Integer limit = RunHistoryService.parseLimit(param(query, "limit"));

            if ("/api/v1/checks".equals(path)) {
                List<CheckResponse> checks = historyService.recentChecks(limit).stream()
                        .map(CheckResponse::from)
                        .toList();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("count", checks.size(), "checks", checks)));
            }

            List<RunResponse> runs = historyService.recentRuns(limit, param(query, "playbook")).stream()
                    .map(RunResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("count", runs.size(), "runs", runs)));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Run controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
