package io.memlite.server;

import io.memlite.core.ValidationException;

import java.util.List;

/**
 * Partial update of a memory. Null fields and empty lists leave the document unchanged.
 */
public record MemoryUpdate(
        String content,
        Double importance,
        Double confidence,
        List<String> addTags,
        List<String> removeTags,
        List<String> addRelated,
        List<String> addEvidence
) {
    public MemoryUpdate {
        addTags = values(addTags, "addTags");
        removeTags = values(removeTags, "removeTags");
        addRelated = values(addRelated, "addRelated");
        addEvidence = values(addEvidence, "addEvidence");
    }

    public static MemoryUpdate importance(double value) {
        return new MemoryUpdate(null, value, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return content == null && importance == null && confidence == null
                && addTags.isEmpty() && removeTags.isEmpty() && addRelated.isEmpty() && addEvidence.isEmpty();
    }

    static List<String> values(List<String> raw, String field) {
        if (raw == null) return List.of();
        for (String v : raw) {
            if (v == null || v.isBlank()) throw new ValidationException(field + " must not contain blank values");
        }
        return List.copyOf(raw);
    }
}
