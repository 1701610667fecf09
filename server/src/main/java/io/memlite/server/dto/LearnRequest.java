package io.memlite.server.dto;

import java.util.List;

/**
 * JSON body for POST /memories.
 * Example:
 *   {
 *     "content": "user prefers short answers",
 *     "memoryType": "semantic",
 *     "importance": 0.8,
 *     "tags": ["preference"]
 *   }
 * Only "content" is required.
 */
public class LearnRequest {
    public String content;
    public String memoryType;   // episodic | semantic | procedural | working; default episodic
    public Double importance;   // [0, 1]
    public Double confidence;   // [0, 1]
    public List<String> tags;
    public List<String> related;
    public List<String> evidence;
}
