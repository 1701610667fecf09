package io.memlite.sync;

/** Called after every sync cycle, successful or not. */
@FunctionalInterface
public interface SyncListener {
    void onSyncComplete(SyncResult result);
}
