package com.libragraph.datasink.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialization format recorded on a dataset's distribution.
 *
 * <p>Declaration order is sniffing priority: the first structured format whose
 * parser accepts an upload wins. {@link #RAW} is the opaque fallback and is
 * never probed.
 */
public enum DatasetFormat {
    JSON_LD("json-ld", "application/ld+json"),
    TURTLE("turtle", "text/turtle"),
    // ahead of RDF_XML, whose parser also accepts a TriX document
    TRIX("trix", "application/trix+xml"),
    RDF_XML("xml", "application/rdf+xml"),
    TRIG("trig", "application/trig"),
    NQUADS("nquads", "application/n-quads"),
    RDF_JSON("rdf-json", "application/rdf+json"),
    RAW("raw", "application/octet-stream");

    private final String tag;
    private final String mediaType;

    DatasetFormat(String tag, String mediaType) {
        this.tag = tag;
        this.mediaType = mediaType;
    }

    /** Short name stored as {@code dcterms:format}. */
    public String tag() {
        return tag;
    }

    public String mediaType() {
        return mediaType;
    }

    public boolean isStructured() {
        return this != RAW;
    }

    /** Structured formats in sniffing order. */
    public static List<DatasetFormat> structured() {
        List<DatasetFormat> result = new ArrayList<>();
        for (DatasetFormat f : values()) {
            if (f.isStructured()) result.add(f);
        }
        return List.copyOf(result);
    }

    public static DatasetFormat fromTag(String tag) {
        for (DatasetFormat f : values()) {
            if (f.tag.equalsIgnoreCase(tag)) return f;
        }
        throw new IllegalArgumentException("Unknown dataset format: " + tag);
    }
}
