package aegisops.runner.service;

import aegisops.runner.model.CheckRecord;
import aegisops.runner.model.RunRecord;
import aegisops.runner.repository.RunHistoryRepository;

import java.util.List;

/**
 * Read side of the run history used by the status API.
 * Validates paging parameters before they reach the store.
 */
public class RunHistoryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final RunHistoryRepository repository;

    public RunHistoryService(RunHistoryRepository repository) {
        this.repository = repository;
    }

    /**
     * Most recent runs, newest first.
     *
     * @param limit    requested page size, null for the default
     * @param playbook optional playbook filter, blank for all
     */
    public List<RunRecord> recentRuns(Integer limit, String playbook) {
        int n = validateLimit(limit);
        if (playbook == null || playbook.isBlank()) {
            return repository.findRecent(n);
        }
        return repository.findRecentByPlaybook(playbook.trim(), n);
    }

    public List<CheckRecord> recentChecks(Integer limit) {
        return repository.findRecentChecks(validateLimit(limit));
    }

    public long totalRuns() {
        return repository.count();
    }

    /**
     * Parse a raw {@code limit} query parameter.
     *
     * @throws IllegalArgumentException if it is not a number
     */
    public static Integer parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number: " + raw);
        }
    }

    private static int validateLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
