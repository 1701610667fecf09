package io.memlite.storage.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One WAL payload. Exactly one of the bodies is set, selected by {@code type}:
 *   "memory"    -> memory (merged document + bookkeeping)
 *   "embedding" -> embedding
 *   "synced"    -> synced (id -> revision confirmed by the hub)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WalRecordDto {
    public static final String MEMORY = "memory";
    public static final String EMBEDDING = "embedding";
    public static final String SYNCED = "synced";

    private final String type;
    private final StoredMemoryDto memory;
    private final EmbeddingDto embedding;
    private final Map<String, Long> synced;

    @JsonCreator
    public WalRecordDto(
            @JsonProperty("type") String type,
            @JsonProperty("memory") StoredMemoryDto memory,
            @JsonProperty("embedding") EmbeddingDto embedding,
            @JsonProperty("synced") Map<String, Long> synced
    ) {
        this.type = type;
        this.memory = memory;
        this.embedding = embedding;
        this.synced = synced;
    }

    public static WalRecordDto memory(StoredMemoryDto memory) { return new WalRecordDto(MEMORY, memory, null, null); }

    public static WalRecordDto embedding(EmbeddingDto embedding) { return new WalRecordDto(EMBEDDING, null, embedding, null); }

    public static WalRecordDto synced(Map<String, Long> revisions) { return new WalRecordDto(SYNCED, null, null, revisions); }

    @JsonProperty("type") public String type() { return type; }
    @JsonProperty("memory") public StoredMemoryDto memory() { return memory; }
    @JsonProperty("embedding") public EmbeddingDto embedding() { return embedding; }
    @JsonProperty("synced") public Map<String, Long> synced() { return synced; }
}
