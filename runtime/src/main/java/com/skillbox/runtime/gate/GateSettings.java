package com.skillbox.runtime.gate;

/** Archive limits applied before anything is extracted. */
public record GateSettings(
        long maxArchiveBytes,
        int  maxEntries,
        long maxUncompressedBytes) {

    public static GateSettings defaults() {
        return new GateSettings(15L * 1024 * 1024, 60, 40L * 1024 * 1024);
    }
}
