package aegisops.runner.notify;

import java.io.IOException;

/**
 * Delivers a run summary to the notification intake.
 */
public interface NotificationSender {

    void send(NotificationPayload payload) throws IOException, InterruptedException;

    /** Sender used when notifications are switched off. */
    static NotificationSender disabled() {
        return payload -> {
        };
    }
}
