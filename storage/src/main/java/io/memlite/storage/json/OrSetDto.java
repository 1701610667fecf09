package io.memlite.storage.json;

import java.util.List;
import java.util.Map;

/**
 * Wire form of an observed-remove set: element -> tags in "replica:counter" form.
 * Example:
 *   {
 *     "added":   { "urgent": ["agent-a:1", "agent-b:1"] },
 *     "removed": { "urgent": ["agent-a:1"] }
 *   }
 */
public class OrSetDto {
    public Map<String, List<String>> added;
    public Map<String, List<String>> removed;
}
