package io.memlite.core;

/** Local replication state of a document. Never replicated itself. */
public enum SyncStatus {
    /** Has local changes the hub has not confirmed. */
    PENDING,
    /** Hub confirmed the current revision. */
    SYNCED
}
