package io.memlite.storage.json;

/** Wire form of a numeric LWW register (importance, confidence). */
public class NumericRegisterDto {
    public double value;
    public long timestamp;
    public String writer;

    public NumericRegisterDto() {}

    NumericRegisterDto(double value, long timestamp, String writer) {
        this.value = value;
        this.timestamp = timestamp;
        this.writer = writer;
    }
}
