package com.libragraph.datasink.formats.api;

import com.libragraph.datasink.types.DatasetFormat;

import java.util.Objects;

/**
 * Outcome of one {@link FormatProbe} attempt.
 *
 * @param format         the format that was tried
 * @param success        whether the parse completed without error and produced statements
 * @param statementCount triples or quads produced (0 on failure)
 * @param error          parser message on failure, null on success
 */
public record ProbeResult(
        DatasetFormat format,
        boolean success,
        long statementCount,
        String error
) {
    public ProbeResult {
        Objects.requireNonNull(format, "format cannot be null");
    }

    public static ProbeResult success(DatasetFormat format, long statementCount) {
        return new ProbeResult(format, true, statementCount, null);
    }

    public static ProbeResult failure(DatasetFormat format, String error) {
        return new ProbeResult(format, false, 0, error);
    }
}
