package com.libragraph.datasink.core.catalog;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * RDF terms used to model catalogs, datasets and distributions (DCAT + DCMI terms).
 */
public final class CatalogVocabulary {

    public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String DCAT_NS = "http://www.w3.org/ns/dcat#";
    public static final String DCTERMS_NS = "http://purl.org/dc/terms/";
    public static final String DCMITYPE_NS = "http://purl.org/dc/dcmitype/";
    /** Terms that DCAT has no property for. */
    public static final String DATASINK_NS = "http://marketplace-datasink.org/ns#";
    public static final String IANA_MEDIA_TYPES = "https://www.iana.org/assignments/media-types/";

    public static final Node TYPE = uri(RDF_NS + "type");

    public static final Node CATALOG = uri(DCAT_NS + "Catalog");
    public static final Node DATASET = uri(DCAT_NS + "Dataset");
    public static final Node DISTRIBUTION = uri(DCAT_NS + "Distribution");

    /** Catalog contains sub-catalog. */
    public static final Node HAS_CATALOG = uri(DCAT_NS + "catalog");
    /** Catalog contains dataset. */
    public static final Node HAS_DATASET = uri(DCAT_NS + "dataset");
    public static final Node HAS_DISTRIBUTION = uri(DCAT_NS + "distribution");
    public static final Node DOWNLOAD_URL = uri(DCAT_NS + "downloadURL");
    public static final Node MEDIA_TYPE = uri(DCAT_NS + "mediaType");
    public static final Node BYTE_SIZE = uri(DCAT_NS + "byteSize");

    public static final Node IDENTIFIER = uri(DCTERMS_NS + "identifier");
    public static final Node TITLE = uri(DCTERMS_NS + "title");
    public static final Node ISSUED = uri(DCTERMS_NS + "issued");
    public static final Node MODIFIED = uri(DCTERMS_NS + "modified");
    public static final Node FORMAT = uri(DCTERMS_NS + "format");
    public static final Node IS_PART_OF = uri(DCTERMS_NS + "isPartOf");
    public static final Node DC_TYPE = uri(DCTERMS_NS + "type");

    /** Marker carried by root catalogs only. */
    public static final Node COLLECTION = uri(DCMITYPE_NS + "Collection");

    /** Distribution to the named subgraph holding its parsed content. */
    public static final Node CONTENT_GRAPH = uri(DATASINK_NS + "contentGraph");

    private CatalogVocabulary() {
    }

    private static Node uri(String iri) {
        return NodeFactory.createURI(iri);
    }
}
