package com.libragraph.datasink.types;

/**
 * Kind of entity a catalog listing entry refers to, with the DCAT class that types it.
 */
public enum CatalogItemType {
    CATALOG("catalog", "http://www.w3.org/ns/dcat#Catalog"),
    DATASET("dataset", "http://www.w3.org/ns/dcat#Dataset");

    private final String label;
    private final String typeIri;

    CatalogItemType(String label, String typeIri) {
        this.label = label;
        this.typeIri = typeIri;
    }

    public String label() {
        return label;
    }

    public String typeIri() {
        return typeIri;
    }

    public static CatalogItemType fromTypeIri(String iri) {
        for (CatalogItemType t : values()) {
            if (t.typeIri.equals(iri)) return t;
        }
        throw new IllegalArgumentException("Unknown catalog item type: " + iri);
    }
}
