package io.memlite.sync;

import java.util.List;

/**
 * Outcome of one push cycle.
 *
 * @param success        false when the push failed or was refused; the batch stays pending
 * @param pushedCount    documents sent to the hub
 * @param syncedCount    documents flipped to synced afterwards
 * @param failedCount    documents left pending because of a failure
 * @param errors         failure messages, empty on success
 * @param durationMillis wall time of the cycle
 */
public record SyncResult(boolean success, int pushedCount, int syncedCount, int failedCount,
                         List<String> errors, long durationMillis) {

    public SyncResult {
        errors = List.copyOf(errors);
    }

    static SyncResult succeeded(int pushed, int synced, long durationMillis) {
        return new SyncResult(true, pushed, synced, 0, List.of(), durationMillis);
    }

    static SyncResult failed(int failed, String error, long durationMillis) {
        return new SyncResult(false, 0, 0, failed, List.of(error), durationMillis);
    }
}
