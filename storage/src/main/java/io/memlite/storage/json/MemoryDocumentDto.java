package io.memlite.storage.json;

import java.util.List;
import java.util.Map;

/**
 * Full CRDT snapshot of a memory document as exchanged with the hub and written to disk.
 * <p>
 * {@code contentHash}, {@code tagList} and {@code updatedAt} are derived and only written
 * for readers; they are ignored on decode.
 */
public class MemoryDocumentDto {
    public String id;
    public String memoryType;
    public long createdAt;
    public String sourceInstance;

    public RegisterDto<String> content;
    public OrSetDto tags;
    public List<String> related;
    public List<String> parents;
    public List<String> evidence;
    public NumericRegisterDto importance;
    public NumericRegisterDto confidence;
    public Map<String, Long> accessCount;
    public RegisterDto<Long> lastAccessed;
    public RegisterDto<String> embeddingRef;
    public Map<String, Long> vectorClock;
    public long version;

    public String contentHash;
    public List<String> tagList;
    public long updatedAt;
}
