package com.libragraph.datasink.formats.registry;

import com.libragraph.datasink.formats.api.ProbeResult;
import com.libragraph.datasink.types.DatasetFormat;

import java.util.List;

/**
 * Result of sniffing one upload.
 *
 * @param format   detected format, {@link DatasetFormat#RAW} when nothing parsed
 * @param text     the decoded text, or null when the bytes were not valid UTF-8
 * @param attempts every probe that ran, in order; empty when no probe ran
 */
public record SniffResult(DatasetFormat format, String text, List<ProbeResult> attempts) {

    public SniffResult {
        attempts = List.copyOf(attempts);
    }

    public boolean isStructured() {
        return format.isStructured();
    }
}
