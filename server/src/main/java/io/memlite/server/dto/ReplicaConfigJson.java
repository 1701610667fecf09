package io.memlite.server.dto;

/**
 * JSON form of a replica configuration file. Every field is optional; unset fields
 * fall back to the defaults and CLI flags override whatever is set here.
 * Example:
 *   {
 *     "instanceId": "laptop-1",
 *     "httpPort": 8080,
 *     "dataDir": "./data",
 *     "hubUrl": "http://hub.local:8090",
 *     "syncIntervalSeconds": 60
 *   }
 */
public class ReplicaConfigJson {
    public String instanceId;
    public Integer httpPort;
    public String dataDir;
    public Integer batchSize;
    public Long syncIntervalSeconds;
    public Double promotionThreshold;
    public String hubUrl;
    public String embeddingModel;
    public Integer snapshotEvery;
}
