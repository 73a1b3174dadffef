package aegisops.runner.model;

import java.time.Instant;

/**
 * Result of one check (ping, tcp, http) reported by a playbook for one host.
 * {@code id} and {@code timestamp} are assigned by the store.
 */
public record CheckRecord(
        Long id,
        Instant timestamp,
        String host,
        String checkName,
        String mode,
        String status,
        String detail) {

    public static CheckRecord of(String host, String checkName, String mode, String status, String detail) {
        return new CheckRecord(null, null, host, checkName, mode, status, detail);
    }
}
