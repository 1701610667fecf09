package io.memlite.server;

/**
 * Source of embedding vectors for memory content.
 * Implementations may call out to a model server; failures surface as runtime exceptions.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /** Embedding of {@code content} under {@code model}. Never empty. */
    float[] embed(String content, String model);
}
