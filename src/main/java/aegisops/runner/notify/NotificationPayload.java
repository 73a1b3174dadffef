package aegisops.runner.notify;

import aegisops.runner.model.RunStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body posted to the notification intake after each run.
 */
public record NotificationPayload(
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("priority") int priority,
        @JsonProperty("source") String source,
        @JsonProperty("playbook") String playbook,
        @JsonProperty("status") String status,
        @JsonProperty("ok") int ok,
        @JsonProperty("changed") int changed,
        @JsonProperty("failures") int failures,
        @JsonProperty("unreachable") int unreachable,
        @JsonProperty("target") String target) {

    public static final String TITLE = "AegisOps";
    public static final String SOURCE = "aegisops";
    public static final int PRIORITY_OK = 5;
    public static final int PRIORITY_FAIL = 7;

    public static NotificationPayload of(String playbook, RunStatus status, int ok, int changed, int failures,
            int unreachable, String target) {
        String message = "Playbook: " + playbook + "\n"
                + "Status: " + status.wire() + "\n"
                + "OK=" + ok + " Changed=" + changed + " Fail=" + failures + " Unreach=" + unreachable;
        return new NotificationPayload(
                TITLE,
                message,
                status == RunStatus.FAIL ? PRIORITY_FAIL : PRIORITY_OK,
                SOURCE,
                playbook,
                status.wire(),
                ok,
                changed,
                failures,
                unreachable,
                target != null ? target : "");
    }
}
