package io.memlite.storage;

import io.memlite.core.MemoryDocument;
import io.memlite.core.SyncStatus;
import io.memlite.storage.json.DocumentJson;
import io.memlite.storage.json.StoredMemoryDto;

/**
 * A document as held by the store, with its local bookkeeping.
 *
 * @param doc        merged document; never handed out directly, callers get copies
 * @param revision   local write counter, bumped whenever the document state changes
 * @param pendingSeq position in the pending queue, assigned when the entry became pending
 * @param status     whether the hub has confirmed {@code revision}
 */
public record StoredMemory(MemoryDocument doc, long revision, long pendingSeq, SyncStatus status) {

    /** Copy of the document carrying this entry's status. */
    MemoryDocument view() {
        var copy = doc.copy();
        copy.setSyncStatus(status);
        return copy;
    }

    StoredMemoryDto toDto() {
        return new StoredMemoryDto(DocumentJson.toDto(doc), revision, pendingSeq, status.name());
    }

    static StoredMemory fromDto(StoredMemoryDto dto) {
        var status = "SYNCED".equals(dto.status()) ? SyncStatus.SYNCED : SyncStatus.PENDING;
        return new StoredMemory(DocumentJson.fromDto(dto.doc()), dto.revision(), dto.pendingSeq(), status);
    }
}
