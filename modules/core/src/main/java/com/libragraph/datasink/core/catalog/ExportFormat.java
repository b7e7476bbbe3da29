package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.ValidationException;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Serializations offered for metadata export.
 */
public enum ExportFormat {

    JSON_LD("json-ld", "application/ld+json", RDFFormat.JSONLD),
    TURTLE("turtle", "text/turtle", RDFFormat.TURTLE_PRETTY),
    RDF_XML("xml", "application/rdf+xml", RDFFormat.RDFXML_PRETTY),
    NTRIPLES("ntriples", "application/n-triples", RDFFormat.NTRIPLES);

    private final String tag;
    private final String mediaType;
    private final RDFFormat rdfFormat;

    ExportFormat(String tag, String mediaType, RDFFormat rdfFormat) {
        this.tag = tag;
        this.mediaType = mediaType;
        this.rdfFormat = rdfFormat;
    }

    public String tag() {
        return tag;
    }

    public String mediaType() {
        return mediaType;
    }

    public String write(Graph graph) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RDFDataMgr.write(out, graph, rdfFormat);
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Resolves a request parameter. Null or blank selects JSON-LD.
     *
     * @throws ValidationException for an unknown format name
     */
    public static ExportFormat fromParam(String value) {
        if (value == null || value.isBlank()) {
            return JSON_LD;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "json-ld", "jsonld" -> { return JSON_LD; }
            case "turtle", "ttl" -> { return TURTLE; }
            case "xml", "rdf-xml", "rdfxml" -> { return RDF_XML; }
            case "ntriples", "nt" -> { return NTRIPLES; }
            default -> throw new ValidationException("Unsupported export format: " + value);
        }
    }
}
