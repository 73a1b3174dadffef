package aegisops.runner.model;

/**
 * Per-job notification policy. The runner only forwards it to the automation
 * tool's environment; quiet hours, cooldown and state-change filtering are
 * enforced downstream.
 */
public record NotifyPolicy(
        boolean onSuccess,
        boolean onFail,
        boolean onlyOnStateChange,
        int cooldownMin,
        String quietHours,
        String targetKey) {

    public static final NotifyPolicy DEFAULT = new NotifyPolicy(false, true, true, 30, "", "");

    public NotifyPolicy {
        quietHours = quietHours == null ? "" : quietHours;
        targetKey = targetKey == null ? "" : targetKey;
        if (cooldownMin < 0) {
            cooldownMin = 0;
        }
    }
}
