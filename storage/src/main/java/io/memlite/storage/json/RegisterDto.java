package io.memlite.storage.json;

/**
 * Wire form of an LWW register.
 * Example: { "value": "prefers dark mode", "timestamp": 1728000000000, "writer": "agent-a" }
 */
public class RegisterDto<T> {
    public T value;
    public long timestamp;
    public String writer;

    public RegisterDto() {}

    RegisterDto(T value, long timestamp, String writer) {
        this.value = value;
        this.timestamp = timestamp;
        this.writer = writer;
    }
}
