package aegisops.runner.repository;

import aegisops.runner.model.CheckRecord;
import aegisops.runner.model.RunRecord;
import aegisops.runner.model.RunStatus;

import java.util.List;

/**
 * Append-only persistence of playbook run outcomes.
 * There are no update or delete operations; retention is handled elsewhere.
 */
public interface RunHistoryRepository {

    /**
     * Append one run record. Each call is an independent insert, safe to call
     * from several job threads at once.
     *
     * @param playbook    playbook file name
     * @param status      run status
     * @param ok          hosts/tasks reported ok
     * @param changed     changed count
     * @param failed      failed count
     * @param unreachable unreachable host count
     * @param targetKey   notification routing label, may be empty
     */
    void record(String playbook, RunStatus status, int ok, int changed, int failed, int unreachable,
            String targetKey);

    /**
     * Append per-check results harvested from one run.
     *
     * @param checks records to insert; ids and timestamps are assigned by the store
     * @return number of rows written
     */
    int recordChecks(List<CheckRecord> checks);

    /**
     * Most recent runs first.
     *
     * @param limit maximum results
     */
    List<RunRecord> findRecent(int limit);

    /**
     * Most recent runs of one playbook, newest first.
     */
    List<RunRecord> findRecentByPlaybook(String playbook, int limit);

    /**
     * Most recent check results first.
     */
    List<CheckRecord> findRecentChecks(int limit);

    /**
     * Total number of run records.
     */
    long count();
}
