package aegisops.runner.notify;

import aegisops.runner.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotifyCallbackTest {

    private final List<NotificationPayload> sent = new ArrayList<>();
    private final NotificationSender capture = sent::add;

    private static HostStats changed(int n) {
        return new HostStats(0, n, 0, 0, 0, 0, 0);
    }

    @Test
    void failedRunPostsHighPriority() {
        NotifyCallback callback = new NotifyCallback(capture, "ops");

        callback.onPlaybookStart("site.yml");
        callback.onRunnerOk("h1", "t");
        callback.onRunnerOk("h1", "t");
        callback.onRunnerFailed("h2", "t", false);
        callback.onStats(Map.of("h1", changed(1), "h2", changed(0)));

        assertEquals(1, sent.size());
        NotificationPayload p = sent.get(0);
        assertEquals("AegisOps", p.title());
        assertEquals("aegisops", p.source());
        assertEquals("site.yml", p.playbook());
        assertEquals("fail", p.status());
        assertEquals(7, p.priority());
        assertEquals(2, p.ok());
        assertEquals(1, p.changed());
        assertEquals(1, p.failures());
        assertEquals(0, p.unreachable());
        assertEquals("ops", p.target());
        assertEquals("Playbook: site.yml\nStatus: fail\nOK=2 Changed=1 Fail=1 Unreach=0", p.message());
    }

    @Test
    void cleanRunPostsNormalPriority() {
        NotifyCallback callback = new NotifyCallback(capture, null);

        callback.onPlaybookStart("ping.yml");
        callback.onRunnerOk("h1", "ping");
        callback.onStats(Map.of("h1", changed(0)));

        NotificationPayload p = sent.get(0);
        assertEquals("ok", p.status());
        assertEquals(5, p.priority());
        assertEquals("", p.target());
    }

    @Test
    void unreachableHostFailsTheRun() {
        NotifyCallback callback = new NotifyCallback(capture, "");

        callback.onPlaybookStart("ping.yml");
        callback.onRunnerUnreachable("h9", "gather");
        callback.onStats(Map.of());

        assertEquals(RunStatus.FAIL.wire(), sent.get(0).status());
        assertEquals(1, sent.get(0).unreachable());
    }

    @Test
    void senderFailureDoesNotEscape() {
        NotifyCallback callback = new NotifyCallback(payload -> {
            throw new IOException("connection refused");
        }, "ops");

        callback.onPlaybookStart("site.yml");
        callback.onRunnerFailed("h", "t", false);

        assertDoesNotThrow(() -> callback.onStats(Map.of()));
    }

    @Test
    void interruptedSendRestoresFlag() {
        NotifyCallback callback = new NotifyCallback(payload -> {
            throw new InterruptedException();
        }, "ops");

        callback.onPlaybookStart("site.yml");
        try {
            callback.onStats(Map.of());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void countersResetAfterEachRun() {
        NotifyCallback callback = new NotifyCallback(capture, "ops");

        callback.onPlaybookStart("a.yml");
        callback.onRunnerFailed("h", "t", false);
        callback.onStats(Map.of());

        assertEquals(0, callback.current().failures());

        callback.onPlaybookStart("b.yml");
        callback.onRunnerOk("h", "t");
        callback.onStats(Map.of());

        assertEquals(2, sent.size());
        assertEquals("ok", sent.get(1).status());
        assertEquals(0, sent.get(1).failures());
    }
}
