package io.memlite.storage.json;

/** Wire form of an embedding record. {@code id} and {@code dimensions} are derived. */
public class EmbeddingDto {
    public String id;
    public String contentHash;
    public float[] vector;
    public String model;
    public int dimensions;
    public long createdAt;
}
