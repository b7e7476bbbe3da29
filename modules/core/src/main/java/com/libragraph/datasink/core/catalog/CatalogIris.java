package com.libragraph.datasink.core.catalog;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds entity IRIs under the configured base and the public download URL of a dataset.
 */
public final class CatalogIris {

    private final String baseIri;
    private final String applicationUrl;

    public CatalogIris(String baseIri, String applicationUrl) {
        this.baseIri = withTrailingSlash(Objects.requireNonNull(baseIri, "baseIri cannot be null"));
        this.applicationUrl = stripTrailingSlash(Objects.requireNonNull(applicationUrl, "applicationUrl cannot be null"));
    }

    public String baseIri() {
        return baseIri;
    }

    public String catalog(String id) {
        return baseIri + "catalogs/" + id;
    }

    public String dataset(String id) {
        return baseIri + "datasets/" + id;
    }

    public String distribution(String datasetId, String title) {
        return baseIri + "distributions/" + datasetId + "/" + encode(title);
    }

    /** {@code {applicationUrl}/data/{collection}/{dataset}} */
    public String downloadUrl(String collectionTitle, String datasetTitle) {
        return applicationUrl + "/data/" + encode(collectionTitle) + "/" + encode(datasetTitle);
    }

    /** Distribution ids are the owning dataset id plus its title. */
    public static String distributionId(String datasetId, String title) {
        return datasetId + "/" + title;
    }

    /** Name of the subgraph holding a dataset's parsed content. */
    public static String subgraphName(String collectionTitle, String datasetTitle) {
        return collectionTitle + "_" + datasetTitle;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String withTrailingSlash(String s) {
        return s.endsWith("/") || s.endsWith("#") ? s : s + "/";
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
