package io.memlite.storage.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.ValidationException;
import io.memlite.core.crdt.GCounter;
import io.memlite.core.crdt.GSet;
import io.memlite.core.crdt.LWWNumericRegister;
import io.memlite.core.crdt.LWWRegister;
import io.memlite.core.crdt.ORSet;
import io.memlite.core.crdt.OrTag;
import io.memlite.core.crdt.VectorClock;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * JSON codec for documents, embeddings and persisted store records.
 * <p>
 * Documents travel as full CRDT state (every register stamp, every OR-set tag and tombstone,
 * the vector clock), so decoding a document and merging it is equivalent to merging the
 * original. Maps and lists are written in sorted order so equal documents encode identically.
 */
public final class DocumentJson {

    private static final TypeReference<List<MemoryDocumentDto>> DOC_LIST = new TypeReference<>() {};
    private static final TypeReference<List<EmbeddingDto>> EMBEDDING_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public DocumentJson() {
        this(newMapper());
    }

    public DocumentJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Mapper used across the project: tolerant of unknown fields, omits nulls. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper mapper() { return mapper; }

    // ---------- byte level ----------

    public byte[] writeDocuments(Collection<MemoryDocument> docs) throws IOException {
        var dtos = new ArrayList<MemoryDocumentDto>(docs.size());
        for (var d : docs) dtos.add(toDto(d));
        return mapper.writeValueAsBytes(dtos);
    }

    public List<MemoryDocument> readDocuments(InputStream in) throws IOException {
        return fromDtos(mapper.readValue(in, DOC_LIST));
    }

    public List<MemoryDocument> readDocuments(byte[] bytes) throws IOException {
        return fromDtos(mapper.readValue(bytes, DOC_LIST));
    }

    public byte[] writeEmbeddings(Collection<EmbeddingDocument> embeddings) throws IOException {
        var dtos = new ArrayList<EmbeddingDto>(embeddings.size());
        for (var e : embeddings) dtos.add(toDto(e));
        return mapper.writeValueAsBytes(dtos);
    }

    public List<EmbeddingDocument> readEmbeddings(InputStream in) throws IOException {
        return embeddingsFrom(mapper.readValue(in, EMBEDDING_LIST));
    }

    public List<EmbeddingDocument> readEmbeddings(byte[] bytes) throws IOException {
        return embeddingsFrom(mapper.readValue(bytes, EMBEDDING_LIST));
    }

    public byte[] writeRecord(WalRecordDto record) throws IOException {
        return mapper.writeValueAsBytes(record);
    }

    public WalRecordDto readRecord(byte[] payload) throws IOException {
        return mapper.readValue(payload, WalRecordDto.class);
    }

    private static List<MemoryDocument> fromDtos(List<MemoryDocumentDto> dtos) {
        if (dtos == null) return List.of();
        var out = new ArrayList<MemoryDocument>(dtos.size());
        for (var dto : dtos) out.add(fromDto(dto));
        return out;
    }

    private static List<EmbeddingDocument> embeddingsFrom(List<EmbeddingDto> dtos) {
        if (dtos == null) return List.of();
        var out = new ArrayList<EmbeddingDocument>(dtos.size());
        for (var dto : dtos) out.add(fromDto(dto));
        return out;
    }

    // ---------- documents ----------

    public static MemoryDocumentDto toDto(MemoryDocument doc) {
        var snap = doc.copy();
        var dto = new MemoryDocumentDto();
        dto.id = snap.id();
        dto.memoryType = snap.memoryType().wireName();
        dto.createdAt = snap.createdAt();
        dto.sourceInstance = snap.sourceInstance();

        dto.content = register(snap.contentRegister());
        dto.tags = orSet(snap.tagSet());
        dto.related = sorted(snap.related().elements());
        dto.parents = sorted(snap.parents().elements());
        dto.evidence = sorted(snap.evidence().elements());
        dto.importance = numeric(snap.importanceRegister());
        dto.confidence = numeric(snap.confidenceRegister());
        dto.accessCount = new TreeMap<>(snap.accessCounter().counts());
        dto.lastAccessed = register(snap.lastAccessedRegister());
        dto.embeddingRef = register(snap.embeddingRefRegister());
        dto.vectorClock = new TreeMap<>(snap.vectorClock().entries());
        dto.version = snap.version();

        dto.contentHash = snap.contentHash();
        dto.tagList = sorted(snap.tags());
        dto.updatedAt = snap.updatedAt();
        return dto;
    }

    /**
     * Rebuild a document from its wire form.
     *
     * @throws ValidationException when identity fields are missing or a tag is malformed
     */
    public static MemoryDocument fromDto(MemoryDocumentDto dto) {
        if (dto == null) throw new ValidationException("document is null");
        return MemoryDocument.builder(dto.id, MemoryType.parse(dto.memoryType), dto.createdAt, dto.sourceInstance)
                .content(register(dto.content))
                .tags(orSet(dto.tags))
                .related(gset(dto.related))
                .parents(gset(dto.parents))
                .evidence(gset(dto.evidence))
                .importance(numeric(dto.importance))
                .confidence(numeric(dto.confidence))
                .accessCount(dto.accessCount == null ? GCounter.empty() : GCounter.of(dto.accessCount))
                .lastAccessed(register(dto.lastAccessed))
                .embeddingRef(register(dto.embeddingRef))
                .vectorClock(dto.vectorClock == null ? VectorClock.empty() : new VectorClock(dto.vectorClock))
                .version(dto.version)
                .build();
    }

    // ---------- embeddings ----------

    public static EmbeddingDto toDto(EmbeddingDocument e) {
        var dto = new EmbeddingDto();
        dto.id = e.id();
        dto.contentHash = e.contentHash();
        dto.vector = e.vector();
        dto.model = e.model();
        dto.dimensions = e.dimensions();
        dto.createdAt = e.createdAt();
        return dto;
    }

    public static EmbeddingDocument fromDto(EmbeddingDto dto) {
        if (dto == null) throw new ValidationException("embedding is null");
        return new EmbeddingDocument(dto.contentHash, dto.vector, dto.model, dto.createdAt);
    }

    // ---------- helpers ----------

    private static <T extends Comparable<? super T>> RegisterDto<T> register(LWWRegister<T> r) {
        return new RegisterDto<>(r.value(), r.timestamp(), r.writer());
    }

    private static <T extends Comparable<? super T>> LWWRegister<T> register(RegisterDto<T> dto) {
        if (dto == null) return LWWRegister.empty();
        return new LWWRegister<>(dto.value, dto.timestamp, dto.writer == null ? "" : dto.writer);
    }

    private static NumericRegisterDto numeric(LWWNumericRegister r) {
        return new NumericRegisterDto(r.value(), r.timestamp(), r.writer());
    }

    private static LWWNumericRegister numeric(NumericRegisterDto dto) {
        if (dto == null) return LWWNumericRegister.initial(MemoryDocument.DEFAULT_SCORE);
        return new LWWNumericRegister(dto.value, dto.timestamp, dto.writer == null ? "" : dto.writer);
    }

    private static OrSetDto orSet(ORSet<String> set) {
        var dto = new OrSetDto();
        dto.added = tagMap(set.addedTags());
        dto.removed = tagMap(set.removedTags());
        return dto;
    }

    private static ORSet<String> orSet(OrSetDto dto) {
        if (dto == null) return ORSet.empty();
        return ORSet.of(parseTags(dto.added), parseTags(dto.removed));
    }

    private static Map<String, List<String>> tagMap(Map<String, Set<OrTag>> raw) {
        var out = new TreeMap<String, List<String>>();
        raw.forEach((element, tags) -> {
            var list = new ArrayList<OrTag>(tags);
            list.sort(null);
            var text = new ArrayList<String>(list.size());
            for (var t : list) text.add(t.toString());
            out.put(element, text);
        });
        return out;
    }

    private static Map<String, List<OrTag>> parseTags(Map<String, List<String>> raw) {
        if (raw == null) return Map.of();
        var out = new HashMap<String, List<OrTag>>();
        raw.forEach((element, tags) -> {
            if (element == null || tags == null) return;
            var list = new ArrayList<OrTag>(tags.size());
            for (var t : tags) {
                if (t == null) continue;
                try {
                    list.add(OrTag.parse(t));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("malformed tag id for '" + element + "': " + t);
                }
            }
            out.put(element, list);
        });
        return out;
    }

    private static GSet<String> gset(List<String> values) {
        if (values == null || values.isEmpty()) return GSet.empty();
        var clean = new ArrayList<String>(values.size());
        for (var v : values) if (v != null) clean.add(v);
        return GSet.of(clean);
    }

    private static List<String> sorted(Set<String> values) {
        var list = new ArrayList<>(values);
        list.sort(null);
        return list;
    }
}
