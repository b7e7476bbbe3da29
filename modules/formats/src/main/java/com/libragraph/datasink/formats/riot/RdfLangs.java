package com.libragraph.datasink.formats.riot;

import com.libragraph.datasink.types.DatasetFormat;
import org.apache.jena.riot.Lang;

/**
 * Maps dataset formats to Jena RIOT languages.
 */
public final class RdfLangs {

    private RdfLangs() {
    }

    public static Lang langOf(DatasetFormat format) {
        return switch (format) {
            case JSON_LD -> Lang.JSONLD;
            case TURTLE -> Lang.TURTLE;
            case RDF_XML -> Lang.RDFXML;
            case TRIG -> Lang.TRIG;
            case NQUADS -> Lang.NQUADS;
            case TRIX -> Lang.TRIX;
            case RDF_JSON -> Lang.RDFJSON;
            case RAW -> throw new IllegalArgumentException("raw content has no RDF language");
        };
    }

    /** Whether the format can carry named graphs, in which case quads are flattened on load. */
    public static boolean isQuadFormat(DatasetFormat format) {
        return format == DatasetFormat.TRIG
                || format == DatasetFormat.NQUADS
                || format == DatasetFormat.TRIX
                || format == DatasetFormat.JSON_LD;
    }
}
