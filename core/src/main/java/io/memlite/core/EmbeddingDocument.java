package io.memlite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, content-addressed embedding of a memory's content.
 * <p>
 * Identity is {@code sha256(model + ":" + contentHash)}: the same content embedded with
 * the same model always maps to the same record, so replicas never need to merge them.
 * {@code createdAt} is informational and not part of equality.
 */
public final class EmbeddingDocument {

    private final String id;
    private final String contentHash;
    private final float[] vector;
    private final String model;
    private final long createdAt;

    public EmbeddingDocument(String contentHash, float[] vector, String model, long createdAt) {
        if (contentHash == null || contentHash.isBlank()) throw new ValidationException("contentHash is blank");
        if (model == null || model.isBlank()) throw new ValidationException("model is blank");
        if (vector == null || vector.length == 0) throw new ValidationException("vector is empty");
        this.contentHash = contentHash;
        this.vector = vector.clone();
        this.model = model;
        this.createdAt = createdAt;
        this.id = idFor(contentHash, model);
    }

    /** Embed-once helper: hash {@code content} and wrap the vector. */
    public static EmbeddingDocument forContent(String content, float[] vector, String model) {
        return new EmbeddingDocument(ContentHash.sha256(content), vector, model, System.currentTimeMillis());
    }

    public static String idFor(String contentHash, String model) {
        return ContentHash.sha256(model + ":" + contentHash);
    }

    public String id() { return id; }

    public String contentHash() { return contentHash; }

    /** Copy of the vector. */
    public float[] vector() { return vector.clone(); }

    public String model() { return model; }

    public int dimensions() { return vector.length; }

    public long createdAt() { return createdAt; }

    public double cosineSimilarity(float[] other) {
        return cosineSimilarity(vector, other);
    }

    /** Cosine similarity of two vectors; 0.0 when dimensions differ or either norm is zero. */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingDocument e)) return false;
        return id.equals(e.id) && model.equals(e.model) && contentHash.equals(e.contentHash)
                && Arrays.equals(vector, e.vector);
    }

    @Override public int hashCode() { return Objects.hash(id, Arrays.hashCode(vector)); }

    @Override public String toString() {
        return "EmbeddingDocument(" + model + ", " + contentHash + ", dims=" + vector.length + ")";
    }
}
