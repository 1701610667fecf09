package io.memlite.storage.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Snapshot file body: every stored document plus every embedding. */
public final class SnapshotDto {
    private final long takenAt;
    private final List<StoredMemoryDto> memories;
    private final List<EmbeddingDto> embeddings;

    @JsonCreator
    public SnapshotDto(
            @JsonProperty("takenAt") long takenAt,
            @JsonProperty("memories") List<StoredMemoryDto> memories,
            @JsonProperty("embeddings") List<EmbeddingDto> embeddings
    ) {
        this.takenAt = takenAt;
        this.memories = memories != null ? memories : List.of();
        this.embeddings = embeddings != null ? embeddings : List.of();
    }

    @JsonProperty("takenAt") public long takenAt() { return takenAt; }
    @JsonProperty("memories") public List<StoredMemoryDto> memories() { return memories; }
    @JsonProperty("embeddings") public List<EmbeddingDto> embeddings() { return embeddings; }
}
