package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.IntegrityException;
import com.libragraph.datasink.core.error.NotFoundException;
import com.libragraph.datasink.core.graph.GraphTransaction;
import com.libragraph.datasink.core.graph.QueryResult;
import com.libragraph.datasink.core.graph.QueryTarget;
import com.libragraph.datasink.types.CatalogItemType;
import com.libragraph.datasink.types.DatasetFormat;
import com.libragraph.datasink.util.Deadline;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.ParameterizedSparqlString;
import org.apache.jena.sparql.graph.GraphFactory;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.libragraph.datasink.core.catalog.CatalogVocabulary.*;

/**
 * Typed view of catalogs, datasets and distributions over one graph transaction.
 *
 * <p>Finders return at most one entity. When the stored data holds several
 * matches for something that must be unique (an id, a root title, a dataset title
 * within a collection tree) they throw {@link IntegrityException} instead of
 * picking one. Mutations are only visible to others once the caller commits.
 */
public class CatalogGraph {

    private static final Logger log = Logger.getLogger(CatalogGraph.class);

    private static final String PREFIXES = """
            PREFIX dcat: <http://www.w3.org/ns/dcat#>
            PREFIX dct: <http://purl.org/dc/terms/>
            PREFIX dcmitype: <http://purl.org/dc/dcmitype/>
            PREFIX ds: <http://marketplace-datasink.org/ns#>
            """;

    private static final String CATALOG_QUERY = PREFIXES + """
            SELECT ?c ?id ?title ?issued ?modified ?kind ?parentId WHERE {
              ?c a dcat:Catalog ;
                 dct:identifier ?id ;
                 dct:title ?title .
              OPTIONAL { ?c dct:issued ?issued }
              OPTIONAL { ?c dct:modified ?modified }
              OPTIONAL { ?c dct:type ?kind }
              OPTIONAL { ?c dct:isPartOf ?p . ?p dct:identifier ?parentId }
              #FILTER
            }
            """;

    private static final String DATASET_QUERY = PREFIXES + """
            SELECT ?d ?id ?title ?issued ?modified ?parentId
                   ?dist ?distId ?format ?url ?size ?distModified ?graph WHERE {
              ?d a dcat:Dataset ;
                 dct:identifier ?id ;
                 dct:title ?title .
              OPTIONAL { ?d dct:issued ?issued }
              OPTIONAL { ?d dct:modified ?modified }
              OPTIONAL { ?d dct:isPartOf ?p . ?p dct:identifier ?parentId }
              OPTIONAL {
                ?d dcat:distribution ?dist .
                ?dist dct:identifier ?distId .
                OPTIONAL { ?dist dct:format ?format }
                OPTIONAL { ?dist dcat:downloadURL ?url }
                OPTIONAL { ?dist dcat:byteSize ?size }
                OPTIONAL { ?dist dct:modified ?distModified }
                OPTIONAL { ?dist ds:contentGraph ?graph }
              }
              #FILTER
            }
            """;

    private final GraphTransaction tx;
    private final CatalogIris iris;
    private final Clock clock;
    private final Deadline deadline;
    private final HierarchyIndex hierarchy;
    private final PathResolver paths;

    public CatalogGraph(GraphTransaction tx, CatalogIris iris, Clock clock, Deadline deadline) {
        this.tx = tx;
        this.iris = iris;
        this.clock = clock;
        this.deadline = deadline;
        this.hierarchy = new HierarchyIndex(tx);
        this.paths = new PathResolver(hierarchy);
    }

    public HierarchyIndex hierarchy() {
        return hierarchy;
    }

    // -- finders --

    public Optional<CatalogRecord> findCatalogById(String id) {
        List<CatalogRecord> matches = selectCatalogs("FILTER(?id = ?targetId)", Map.of("targetId", id));
        return unique(matches, "catalog id " + id);
    }

    /**
     * @param rootOnly restrict to root catalogs, whose titles are unique; nested titles
     *                 may repeat, in which case the first match is returned
     */
    public Optional<CatalogRecord> findCatalogByTitle(String title, boolean rootOnly) {
        String filter = "FILTER(?title = ?targetTitle)"
                + (rootOnly ? " FILTER(?kind = dcmitype:Collection)" : "");
        List<CatalogRecord> matches = selectCatalogs(filter, Map.of("targetTitle", title));
        if (rootOnly) {
            return unique(matches, "root catalog title '" + title + "'");
        }
        return matches.stream().findFirst();
    }

    public List<CatalogRecord> listRootCatalogs() {
        return selectCatalogs("FILTER(?kind = dcmitype:Collection)", Map.of());
    }

    public Optional<DatasetRecord> findDatasetById(String id) {
        List<DatasetRecord> matches = selectDatasets("FILTER(?id = ?targetId)", Map.of("targetId", id));
        return unique(matches, "dataset id " + id);
    }

    /**
     * Finds a dataset by title anywhere in the tree below {@code root}.
     */
    public Optional<DatasetRecord> findDatasetByTitle(CatalogRecord root, String title) {
        Node rootNode = node(root.iri());
        List<DatasetRecord> inTree = new ArrayList<>();
        for (DatasetRecord candidate : selectDatasets("FILTER(?title = ?targetTitle)", Map.of("targetTitle", title))) {
            if (hierarchy.isWithin(node(candidate.iri()), rootNode)) {
                inTree.add(candidate);
            }
        }
        return unique(inTree, "dataset title '" + title + "' under " + root.title());
    }

    /**
     * Every catalog and dataset reachable from the catalog through contains links.
     */
    public List<CatalogItem> listChildren(String catalogId) {
        CatalogRecord catalog = findCatalogById(catalogId)
                .orElseThrow(() -> NotFoundException.catalogId(catalogId));
        List<CatalogItem> items = new ArrayList<>();
        for (Node child : hierarchy.descendants(node(catalog.iri()))) {
            CatalogItemType type = hierarchy.typeOf(child)
                    .orElseThrow(() -> new IntegrityException(
                            "Contains link to " + child.getURI() + " which is neither catalog nor dataset"));
            String id = hierarchy.idOf(child)
                    .orElseThrow(() -> new IntegrityException("Entity " + child.getURI() + " has no identifier"));
            String parentId = hierarchy.parentOf(child).flatMap(hierarchy::idOf).orElse(null);
            items.add(new CatalogItem(type, id, child.getURI(),
                    hierarchy.titleOf(child).orElse(""),
                    instant(literalOf(child, MODIFIED)),
                    parentId));
        }
        return items;
    }

    /** Byte size recorded on a dataset's distribution, 0 when none is recorded. */
    public long distributionSize(String datasetIri) {
        for (Triple owned : tx.find(node(datasetIri), HAS_DISTRIBUTION, null)) {
            String size = literalOf(owned.getObject(), BYTE_SIZE);
            if (size != null) {
                try {
                    return Long.parseLong(size);
                } catch (NumberFormatException e) {
                    throw new IntegrityException("Distribution " + owned.getObject().getURI() + " has invalid byte size");
                }
            }
        }
        return 0;
    }

    /** IRIs of the distributions whose content lives in the named subgraph. */
    public List<String> distributionsUsingSubgraph(String subgraphName) {
        List<String> owners = new ArrayList<>();
        for (Triple t : tx.find(null, CONTENT_GRAPH, NodeFactory.createLiteral(subgraphName))) {
            owners.add(t.getSubject().getURI());
        }
        return owners;
    }

    /** Display path of a catalog or dataset, see {@link PathResolver}. */
    public String resolvePath(String iri) {
        return paths.resolvePath(node(iri));
    }

    /** The root catalog whose tree holds the given entity. */
    public CatalogRecord rootOf(String iri) {
        Node root = hierarchy.rootOf(node(iri));
        String id = hierarchy.idOf(root)
                .orElseThrow(() -> new IntegrityException("Root " + root.getURI() + " has no identifier"));
        return findCatalogById(id)
                .orElseThrow(() -> new IntegrityException("Root " + root.getURI() + " is not a catalog"));
    }

    // -- mutations --

    /**
     * Writes a new catalog. Without a parent it is a root catalog and carries the
     * collection marker; with one it is linked both ways to the parent.
     *
     * @throws NotFoundException if {@code parentId} does not resolve
     */
    public CatalogRecord createCatalog(String title, String parentId) {
        CatalogRecord parent = null;
        if (parentId != null) {
            parent = findCatalogById(parentId).orElseThrow(() -> NotFoundException.catalogId(parentId));
        }
        String id = UUID.randomUUID().toString();
        Node catalog = node(iris.catalog(id));
        Instant now = now();

        List<Triple> triples = new ArrayList<>();
        triples.add(Triple.create(catalog, TYPE, CATALOG));
        triples.add(Triple.create(catalog, IDENTIFIER, NodeFactory.createLiteral(id)));
        triples.add(Triple.create(catalog, TITLE, NodeFactory.createLiteral(title)));
        triples.add(Triple.create(catalog, ISSUED, dateTime(now)));
        triples.add(Triple.create(catalog, MODIFIED, dateTime(now)));
        if (parent == null) {
            triples.add(Triple.create(catalog, DC_TYPE, COLLECTION));
        } else {
            Node parentNode = node(parent.iri());
            triples.add(Triple.create(catalog, IS_PART_OF, parentNode));
            triples.add(Triple.create(parentNode, HAS_CATALOG, catalog));
            touch(parentNode, now);
        }
        tx.addTriples(null, triples);
        log.debugf("Wrote catalog %s '%s' (parent=%s)", id, title, parentId);
        return new CatalogRecord(id, catalog.getURI(), title, now, now, parent == null, parentId);
    }

    /**
     * Writes a dataset, its distribution and the contains link from its catalog. The
     * download URL is derived from the root collection's title and the dataset title.
     *
     * @throws NotFoundException if {@code catalogId} does not resolve
     */
    public DatasetRecord createDataset(String title, String catalogId, DistributionSpec spec) {
        CatalogRecord catalog = findCatalogById(catalogId)
                .orElseThrow(() -> NotFoundException.catalogId(catalogId));
        Node catalogNode = node(catalog.iri());
        String collectionTitle = hierarchy.titleOf(hierarchy.rootOf(catalogNode)).orElse(catalog.title());

        String id = UUID.randomUUID().toString();
        Node dataset = node(iris.dataset(id));
        Node distribution = node(iris.distribution(id, title));
        String distributionId = CatalogIris.distributionId(id, title);
        String downloadUrl = iris.downloadUrl(collectionTitle, title);
        Instant now = now();

        List<Triple> triples = new ArrayList<>();
        triples.add(Triple.create(dataset, TYPE, DATASET));
        triples.add(Triple.create(dataset, IDENTIFIER, NodeFactory.createLiteral(id)));
        triples.add(Triple.create(dataset, TITLE, NodeFactory.createLiteral(title)));
        triples.add(Triple.create(dataset, ISSUED, dateTime(now)));
        triples.add(Triple.create(dataset, MODIFIED, dateTime(now)));
        triples.add(Triple.create(dataset, IS_PART_OF, catalogNode));
        triples.add(Triple.create(dataset, HAS_DISTRIBUTION, distribution));
        triples.add(Triple.create(catalogNode, HAS_DATASET, dataset));

        triples.add(Triple.create(distribution, TYPE, DISTRIBUTION));
        triples.add(Triple.create(distribution, IDENTIFIER, NodeFactory.createLiteral(distributionId)));
        triples.add(Triple.create(distribution, TITLE, NodeFactory.createLiteral(title)));
        triples.add(Triple.create(distribution, DOWNLOAD_URL, node(downloadUrl)));
        triples.addAll(distributionDetails(distribution, spec, now));

        touch(catalogNode, now);
        tx.addTriples(null, triples);
        log.debugf("Wrote dataset %s '%s' in catalog %s as %s", id, title, catalogId, spec.format().tag());

        DistributionRecord dist = new DistributionRecord(distributionId, distribution.getURI(),
                spec.format(), downloadUrl, spec.byteSize(), now, spec.contentGraph());
        return new DatasetRecord(id, dataset.getURI(), title, now, now, catalogId, dist);
    }

    /**
     * Replaces the format, size and content graph of a dataset's distribution and
     * bumps both modification times. Identity, title and parent are unchanged.
     */
    public DatasetRecord updateDistribution(DatasetRecord dataset, DistributionSpec spec) {
        Node distribution = node(dataset.distribution().iri());
        Instant now = now();
        tx.removeTriples(distribution, FORMAT, null);
        tx.removeTriples(distribution, MEDIA_TYPE, null);
        tx.removeTriples(distribution, BYTE_SIZE, null);
        tx.removeTriples(distribution, MODIFIED, null);
        tx.removeTriples(distribution, CONTENT_GRAPH, null);
        tx.addTriples(null, distributionDetails(distribution, spec, now));
        touch(node(dataset.iri()), now);

        DistributionRecord old = dataset.distribution();
        DistributionRecord dist = new DistributionRecord(old.id(), old.iri(), spec.format(),
                old.downloadUrl(), spec.byteSize(), now, spec.contentGraph());
        return new DatasetRecord(dataset.id(), dataset.iri(), dataset.title(), dataset.issued(), now,
                dataset.parentId(), dist);
    }

    /**
     * Removes the contains link pointing at the entity, then every triple about the
     * entity and its distributions. Deleting an absent entity is a no-op.
     *
     * @return true if anything was removed
     */
    public boolean unlinkAndDelete(String iri) {
        Node entity = node(iri);
        int removed = 0;
        removed += tx.removeTriples(null, HAS_CATALOG, entity);
        removed += tx.removeTriples(null, HAS_DATASET, entity);
        for (Triple owned : tx.find(entity, HAS_DISTRIBUTION, null)) {
            removed += tx.removeTriples(owned.getObject(), null, null);
        }
        removed += tx.removeTriples(entity, null, null);
        if (removed == 0) {
            log.debugf("Nothing to delete for %s", iri);
        }
        return removed > 0;
    }

    /**
     * Copies every triple about {@code iri}, and optionally about everything it contains,
     * plus the distributions of the datasets involved.
     */
    public Graph exportGraph(String iri, boolean includeDescendants) {
        Node root = node(iri);
        Set<Node> subjects = new LinkedHashSet<>();
        subjects.add(root);
        if (includeDescendants) {
            subjects.addAll(hierarchy.descendants(root));
        }
        for (Node subject : List.copyOf(subjects)) {
            for (Triple owned : tx.find(subject, HAS_DISTRIBUTION, null)) {
                subjects.add(owned.getObject());
            }
        }
        Graph graph = GraphFactory.createDefaultGraph();
        graph.getPrefixMapping().setNsPrefix("dcat", DCAT_NS);
        graph.getPrefixMapping().setNsPrefix("dct", DCTERMS_NS);
        graph.getPrefixMapping().setNsPrefix("dcmitype", DCMITYPE_NS);
        graph.getPrefixMapping().setNsPrefix("ds", DATASINK_NS);
        for (Node subject : subjects) {
            tx.find(subject, null, null).forEach(graph::add);
        }
        return graph;
    }

    // -- internals --

    private List<Triple> distributionDetails(Node distribution, DistributionSpec spec, Instant now) {
        List<Triple> triples = new ArrayList<>();
        triples.add(Triple.create(distribution, FORMAT, NodeFactory.createLiteral(spec.format().tag())));
        triples.add(Triple.create(distribution, MEDIA_TYPE,
                node(CatalogVocabulary.IANA_MEDIA_TYPES + spec.format().mediaType())));
        triples.add(Triple.create(distribution, BYTE_SIZE,
                NodeFactory.createLiteral(Long.toString(spec.byteSize()), XSDDatatype.XSDnonNegativeInteger)));
        triples.add(Triple.create(distribution, MODIFIED, dateTime(now)));
        if (spec.contentGraph() != null) {
            triples.add(Triple.create(distribution, CONTENT_GRAPH, NodeFactory.createLiteral(spec.contentGraph())));
        }
        return triples;
    }

    private void touch(Node entity, Instant now) {
        tx.removeTriples(entity, MODIFIED, null);
        tx.addTriples(null, List.of(Triple.create(entity, MODIFIED, dateTime(now))));
    }

    private List<CatalogRecord> selectCatalogs(String filter, Map<String, String> literals) {
        Map<String, CatalogRecord> byIri = new LinkedHashMap<>();
        for (Map<String, String> row : select(CATALOG_QUERY, filter, literals).rows()) {
            String iri = row.get("c");
            if (byIri.containsKey(iri)) {
                continue;
            }
            byIri.put(iri, new CatalogRecord(
                    row.get("id"),
                    iri,
                    row.get("title"),
                    instant(row.get("issued")),
                    instant(row.get("modified")),
                    COLLECTION.getURI().equals(row.get("kind")),
                    row.get("parentId")));
        }
        return List.copyOf(byIri.values());
    }

    private List<DatasetRecord> selectDatasets(String filter, Map<String, String> literals) {
        Map<String, Map<String, String>> firstRow = new LinkedHashMap<>();
        Map<String, Set<String>> distributions = new LinkedHashMap<>();
        for (Map<String, String> row : select(DATASET_QUERY, filter, literals).rows()) {
            String iri = row.get("d");
            firstRow.putIfAbsent(iri, row);
            Set<String> dists = distributions.computeIfAbsent(iri, k -> new LinkedHashSet<>());
            if (row.get("dist") != null) {
                dists.add(row.get("dist"));
            }
        }
        List<DatasetRecord> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> e : firstRow.entrySet()) {
            int count = distributions.get(e.getKey()).size();
            if (count != 1) {
                throw new IntegrityException("Dataset " + e.getKey() + " has " + count + " distributions");
            }
            result.add(toDataset(e.getValue()));
        }
        return result;
    }

    private DatasetRecord toDataset(Map<String, String> row) {
        DatasetFormat format;
        try {
            format = DatasetFormat.fromTag(row.getOrDefault("format", DatasetFormat.RAW.tag()));
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Distribution " + row.get("dist") + " has unknown format " + row.get("format"));
        }
        long size = 0;
        if (row.get("size") != null) {
            try {
                size = Long.parseLong(row.get("size"));
            } catch (NumberFormatException e) {
                throw new IntegrityException("Distribution " + row.get("dist") + " has invalid byte size");
            }
        }
        DistributionRecord dist = new DistributionRecord(
                row.get("distId"),
                row.get("dist"),
                format,
                row.get("url"),
                size,
                instant(row.get("distModified")),
                row.get("graph"));
        return new DatasetRecord(
                row.get("id"),
                row.get("d"),
                row.get("title"),
                instant(row.get("issued")),
                instant(row.get("modified")),
                row.get("parentId"),
                dist);
    }

    private QueryResult select(String template, String filter, Map<String, String> literals) {
        ParameterizedSparqlString pss = new ParameterizedSparqlString(template.replace("#FILTER", filter));
        literals.forEach(pss::setLiteral);
        return tx.query(pss.toString(), QueryTarget.metadata(), deadline);
    }

    private <T> Optional<T> unique(List<T> matches, String what) {
        if (matches.size() > 1) {
            throw new IntegrityException(matches.size() + " entities match " + what);
        }
        return matches.stream().findFirst();
    }

    private String literalOf(Node subject, Node predicate) {
        List<Triple> values = tx.find(subject, predicate, null);
        return values.isEmpty() ? null : values.get(0).getObject().getLiteralLexicalForm();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Node node(String iri) {
        return NodeFactory.createURI(iri);
    }

    private static Node dateTime(Instant instant) {
        return NodeFactory.createLiteral(instant.toString(), XSDDatatype.XSDdateTime);
    }

    private static Instant instant(String lexical) {
        if (lexical == null) {
            return null;
        }
        try {
            return Instant.parse(lexical);
        } catch (DateTimeParseException e) {
            throw new IntegrityException("Invalid timestamp in metadata: " + lexical);
        }
    }
}
