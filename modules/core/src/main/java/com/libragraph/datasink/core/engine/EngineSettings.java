package com.libragraph.datasink.core.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * @param baseIri        namespace for catalog, dataset and distribution IRIs
 * @param applicationUrl public URL prefix of dataset download links
 * @param requestTimeout overall deadline for one engine operation
 */
public record EngineSettings(String baseIri, String applicationUrl, Duration requestTimeout) {

    public EngineSettings {
        Objects.requireNonNull(baseIri, "baseIri cannot be null");
        Objects.requireNonNull(applicationUrl, "applicationUrl cannot be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
    }
}
