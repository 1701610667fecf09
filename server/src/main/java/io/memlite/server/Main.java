package io.memlite.server;

import io.memlite.storage.DurableMemoryStore;
import io.memlite.storage.json.DocumentJson;
import io.memlite.sync.HttpSyncTransport;
import io.memlite.sync.SyncManager;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single MemLite replica.
 *
 * Responsibilities:
 *  - Parse configuration from CLI and the optional JSON file.
 *  - Open durable storage (WAL + snapshots) under the data directory.
 *  - Create MemoryService and WebServer.
 *  - Start the background sync loop when a hub is configured.
 *  - Stop everything from a shutdown hook.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ReplicaConfig.fromArgs(args);

        // ------ Storage layer ------
        var store = DurableMemoryStore.open(cfg.dataDir(), cfg.snapshotEvery());

        // ------ Service ------
        // No embedding model is wired in yet; recall falls back to text search.
        var service = new MemoryService(store, cfg.instanceId(), null,
                cfg.embeddingModel(), cfg.promotionThreshold());

        // ------ Sync ------
        SyncManager sync = null;
        if (cfg.syncEnabled()) {
            sync = new SyncManager(store, new HttpSyncTransport(cfg.hubUrl()), cfg.batchSize());
        }

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service, sync, new DocumentJson());
        web.start();
        if (sync != null) sync.start(cfg.syncInterval());

        log.info(() -> String.format("Replica %s listening on http://localhost:%d (data: %s, hub: %s)",
                cfg.instanceId(), cfg.httpPort(), cfg.dataDir(),
                cfg.syncEnabled() ? cfg.hubUrl() : "none"));

        final SyncManager syncRef = sync;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (syncRef != null) syncRef.stop();
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Error while stopping replica", e);
            } finally {
                store.close();
            }
        }, "memlite-shutdown"));
    }

    /** Use the bundled logging.properties unless one was given on the command line. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
