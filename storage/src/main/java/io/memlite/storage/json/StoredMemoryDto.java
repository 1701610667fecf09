package io.memlite.storage.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A document together with its local bookkeeping, as persisted by the store. */
public final class StoredMemoryDto {
    private final MemoryDocumentDto doc;
    private final long revision;
    private final long pendingSeq;
    private final String status;

    @JsonCreator
    public StoredMemoryDto(
            @JsonProperty("doc") MemoryDocumentDto doc,
            @JsonProperty("revision") long revision,
            @JsonProperty("pendingSeq") long pendingSeq,
            @JsonProperty("status") String status
    ) {
        this.doc = doc;
        this.revision = revision;
        this.pendingSeq = pendingSeq;
        this.status = status;
    }

    @JsonProperty("doc") public MemoryDocumentDto doc() { return doc; }
    @JsonProperty("revision") public long revision() { return revision; }
    @JsonProperty("pendingSeq") public long pendingSeq() { return pendingSeq; }
    @JsonProperty("status") public String status() { return status; }
}
