package io.memlite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingDocumentTest {

    @Test
    void identical_content_and_model_yield_identical_record() {
        var a = EmbeddingDocument.forContent("hello", new float[]{1f, 2f}, "nomic-embed-text");
        var b = new EmbeddingDocument(ContentHash.sha256("hello"), new float[]{1f, 2f}, "nomic-embed-text", 42);

        assertEquals(a, b);
        assertEquals(a.id(), EmbeddingDocument.idFor(ContentHash.sha256("hello"), "nomic-embed-text"));
        assertEquals(2, a.dimensions());
    }

    @Test
    void different_model_changes_identity() {
        var hash = ContentHash.sha256("hello");
        assertNotEquals(EmbeddingDocument.idFor(hash, "m1"), EmbeddingDocument.idFor(hash, "m2"));
    }

    @Test
    void vector_is_copied_in_and_out() {
        float[] v = {1f, 0f};
        var doc = new EmbeddingDocument("h", v, "m", 0);
        v[0] = 9f;
        doc.vector()[1] = 9f;

        assertArrayEquals(new float[]{1f, 0f}, doc.vector());
    }

    @Test
    void cosine_similarity_handles_mismatch_and_zero_norm() {
        var doc = new EmbeddingDocument("h", new float[]{1f, 0f}, "m", 0);

        assertEquals(1.0, doc.cosineSimilarity(new float[]{2f, 0f}), 1e-9);
        assertEquals(0.0, doc.cosineSimilarity(new float[]{0f, 3f}), 1e-9);
        assertEquals(0.0, doc.cosineSimilarity(new float[]{1f, 0f, 0f}));
        assertEquals(0.0, doc.cosineSimilarity(new float[]{0f, 0f}));
    }

    @Test
    void empty_vector_is_rejected() {
        assertThrows(ValidationException.class, () -> new EmbeddingDocument("h", new float[0], "m", 0));
    }

    @Test
    void sha256_is_lower_hex() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", ContentHash.sha256("hello"));
    }
}
