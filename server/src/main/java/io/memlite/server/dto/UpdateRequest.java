package io.memlite.server.dto;

import java.util.List;

/**
 * JSON body for PUT /memories/{id}. Absent fields are left unchanged.
 */
public class UpdateRequest {
    public String content;
    public Double importance;
    public Double confidence;
    public List<String> addTags;
    public List<String> removeTags;
    public List<String> addRelated;
    public List<String> addEvidence;
}
