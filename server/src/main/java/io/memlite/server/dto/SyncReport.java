package io.memlite.server.dto;

import java.util.List;

/**
 * JSON response for POST /admin/sync.
 */
public class SyncReport {
    public boolean success;
    public int pushed;
    public int synced;
    public int failed;
    public List<String> errors;
    public long durationMillis;
    public int pending;
}
