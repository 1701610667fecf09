package io.memlite.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memlite.core.ValidationException;
import io.memlite.server.dto.ReplicaConfigJson;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-replica configuration.
 *
 * Supports:
 *  - instanceId:         writer identity stamped on every local mutation (required)
 *  - httpPort:           HTTP API port
 *  - dataDir:            root of the WAL and snapshot directories
 *  - batchSize:          documents per sync push
 *  - syncInterval:       pause between successful sync cycles
 *  - promotionThreshold: importance at which a memory becomes a promotion candidate
 *  - hubUrl:             sync hub; sync is disabled when absent
 *  - embeddingModel:     model name recorded on stored embeddings
 *  - snapshotEvery:      writes between snapshots
 */
public record ReplicaConfig(
        String instanceId,
        int httpPort,
        Path dataDir,
        int batchSize,
        Duration syncInterval,
        double promotionThreshold,
        URI hubUrl,
        String embeddingModel,
        int snapshotEvery
) {
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final String DEFAULT_DATA_DIR = "./data";
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final long DEFAULT_SYNC_INTERVAL_SECONDS = 60;
    public static final double DEFAULT_PROMOTION_THRESHOLD = 0.7;
    public static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    public static final int DEFAULT_SNAPSHOT_EVERY = 10_000;

    public ReplicaConfig {
        if (instanceId == null || instanceId.isBlank()) throw new ValidationException("instanceId is required");
        if (httpPort <= 0 || httpPort > 65535) throw new ValidationException("httpPort out of range");
        if (batchSize <= 0) throw new ValidationException("batchSize must be > 0");
        if (syncInterval == null || syncInterval.isZero() || syncInterval.isNegative()) {
            throw new ValidationException("syncInterval must be positive");
        }
        if (promotionThreshold < 0.0 || promotionThreshold > 1.0) {
            throw new ValidationException("promotionThreshold must be in [0, 1]");
        }
        if (snapshotEvery <= 0) throw new ValidationException("snapshotEvery must be > 0");
        if (dataDir == null) throw new ValidationException("dataDir is required");
        if (embeddingModel == null || embeddingModel.isBlank()) throw new ValidationException("embeddingModel is required");
    }

    public boolean syncEnabled() { return hubUrl != null; }

    /**
     * CLI entry: parse, and on bad input print the problem plus usage and exit.
     */
    public static ReplicaConfig fromArgs(String[] args) {
        try {
            return parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Parse CLI flags, reading {@code --config <file>} first when present so that the
     * remaining flags override the file.
     *
     * Supported flags:
     *   --instance-id,  -i   <id>
     *   --http-port,    -p   <port>
     *   --data-dir,     -d   <path>
     *   --batch-size         <n>
     *   --sync-interval-seconds <s>
     *   --promotion-threshold   <0..1>
     *   --hub-url            <url>
     *   --embedding-model    <name>
     *   --snapshot-every     <n>
     *   --config,       -c   <file>
     *   --help,         -h
     *
     * @throws IllegalArgumentException on unknown flags, missing values or invalid numbers
     */
    public static ReplicaConfig parse(String[] args) {
        ReplicaConfigJson v = new ReplicaConfigJson();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                v = readJson(Path.of(value(args, i)));
            }
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();
                case "--config", "-c" -> i++;
                case "--instance-id", "-i" -> v.instanceId = value(args, i++);
                case "--http-port", "-p" -> v.httpPort = parseInt(args, i++);
                case "--data-dir", "-d" -> v.dataDir = value(args, i++);
                case "--batch-size" -> v.batchSize = parseInt(args, i++);
                case "--sync-interval-seconds" -> v.syncIntervalSeconds = (long) parseInt(args, i++);
                case "--promotion-threshold" -> v.promotionThreshold = parseDouble(args, i++);
                case "--hub-url" -> v.hubUrl = value(args, i++);
                case "--embedding-model" -> v.embeddingModel = value(args, i++);
                case "--snapshot-every" -> v.snapshotEvery = parseInt(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return fromJson(v);
    }

    /** Load a configuration file without CLI overrides. */
    public static ReplicaConfig fromJsonFile(Path path) {
        return fromJson(readJson(path));
    }

    static ReplicaConfig fromJson(ReplicaConfigJson v) {
        URI hub = null;
        if (v.hubUrl != null && !v.hubUrl.isBlank()) {
            try {
                hub = URI.create(v.hubUrl);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("invalid hubUrl: " + v.hubUrl);
            }
            if (hub.getScheme() == null || hub.getHost() == null) throw new ValidationException("invalid hubUrl: " + v.hubUrl);
        }
        return new ReplicaConfig(
                v.instanceId,
                v.httpPort != null ? v.httpPort : DEFAULT_HTTP_PORT,
                Path.of(v.dataDir != null ? v.dataDir : DEFAULT_DATA_DIR),
                v.batchSize != null ? v.batchSize : DEFAULT_BATCH_SIZE,
                Duration.ofSeconds(v.syncIntervalSeconds != null ? v.syncIntervalSeconds : DEFAULT_SYNC_INTERVAL_SECONDS),
                v.promotionThreshold != null ? v.promotionThreshold : DEFAULT_PROMOTION_THRESHOLD,
                hub,
                v.embeddingModel != null ? v.embeddingModel : DEFAULT_EMBEDDING_MODEL,
                v.snapshotEvery != null ? v.snapshotEvery : DEFAULT_SNAPSHOT_EVERY
        );
    }

    private static ReplicaConfigJson readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return mapper.readValue(path.toFile(), ReplicaConfigJson.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load replica config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option: " + args[i]);
        return args[i + 1];
    }

    private static int parseInt(String[] args, int i) {
        String raw = value(args, i);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].replaceFirst("^-+", "") + ": " + raw);
        }
    }

    private static double parseDouble(String[] args, int i) {
        String raw = value(args, i);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].replaceFirst("^-+", "") + ": " + raw);
        }
    }

    private static void printHelpAndExit() {
        System.out.println(USAGE);
        System.exit(0);
    }

    private static final String USAGE = """
            Usage: memlite-server [options]

            Options:
              --instance-id,  -i   Replica identity (required)
              --http-port,    -p   HTTP port (default: 8080)
              --data-dir,     -d   Data directory (default: ./data)
              --batch-size         Documents per sync push (default: 100)
              --sync-interval-seconds  Seconds between sync cycles (default: 60)
              --promotion-threshold    Importance for promotion candidates (default: 0.7)
              --hub-url            Sync hub base URL (sync disabled when absent)
              --embedding-model    Embedding model name (default: nomic-embed-text)
              --snapshot-every     Writes between snapshots (default: 10000)
              --config,       -c   JSON config file; flags override its values
              --help,         -h   Show this help message
            """;
}
