package com.libragraph.datasink.core.engine;

import com.libragraph.datasink.core.catalog.CatalogGraph;
import com.libragraph.datasink.core.catalog.CatalogIris;
import com.libragraph.datasink.core.catalog.CatalogItem;
import com.libragraph.datasink.core.catalog.CatalogNames;
import com.libragraph.datasink.core.catalog.CatalogRecord;
import com.libragraph.datasink.core.catalog.DatasetRecord;
import com.libragraph.datasink.core.catalog.DistributionSpec;
import com.libragraph.datasink.core.catalog.ExportFormat;
import com.libragraph.datasink.core.error.CatalogException;
import com.libragraph.datasink.core.error.ConflictException;
import com.libragraph.datasink.core.error.IntegrityException;
import com.libragraph.datasink.core.error.NotFoundException;
import com.libragraph.datasink.core.error.StoreFailureException;
import com.libragraph.datasink.core.error.ValidationException;
import com.libragraph.datasink.core.graph.GraphStore;
import com.libragraph.datasink.core.graph.GraphTransaction;
import com.libragraph.datasink.core.graph.InvalidQueryException;
import com.libragraph.datasink.core.graph.NamedSubgraph;
import com.libragraph.datasink.core.graph.QueryResult;
import com.libragraph.datasink.core.graph.QueryTarget;
import com.libragraph.datasink.core.graph.TxnMode;
import com.libragraph.datasink.core.storage.BinaryRecord;
import com.libragraph.datasink.core.storage.BinaryStore;
import com.libragraph.datasink.core.storage.ContentNotFoundException;
import com.libragraph.datasink.formats.registry.FormatSniffer;
import com.libragraph.datasink.formats.registry.SniffResult;
import com.libragraph.datasink.types.CatalogItemType;
import com.libragraph.datasink.util.ContentHash;
import com.libragraph.datasink.util.Deadline;
import io.smallrye.mutiny.Uni;
import org.apache.jena.graph.NodeFactory;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sequences every catalog operation across the graph store and the binary store.
 *
 * <p>Each call opens one graph transaction and runs a staged workflow against it.
 * Metadata changes become visible only at the final commit, which happens after
 * the binary and subgraph writes succeeded. When a later stage fails the pending
 * transaction is discarded and any binary already written is compensated, so no
 * two-phase protocol is needed. The engine keeps no state between calls.
 *
 * <p>Errors are reported through the {@link CatalogException} hierarchy. Store
 * errors surface as {@link StoreFailureException} naming the failed stage.
 */
public class CatalogEngine {

    private static final Logger log = Logger.getLogger(CatalogEngine.class);

    static final String RAW_CONTENT_TYPE = "application/octet-stream";

    private final GraphStore graphStore;
    private final BinaryStore binaryStore;
    private final FormatSniffer sniffer;
    private final CatalogIris iris;
    private final Duration requestTimeout;
    private final Clock clock;
    private final StageListener listener;

    public CatalogEngine(GraphStore graphStore, BinaryStore binaryStore, FormatSniffer sniffer,
                         EngineSettings settings, Clock clock) {
        this(graphStore, binaryStore, sniffer, settings, clock, StageListener.NONE);
    }

    public CatalogEngine(GraphStore graphStore, BinaryStore binaryStore, FormatSniffer sniffer,
                         EngineSettings settings, Clock clock, StageListener listener) {
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore cannot be null");
        this.binaryStore = Objects.requireNonNull(binaryStore, "binaryStore cannot be null");
        this.sniffer = Objects.requireNonNull(sniffer, "sniffer cannot be null");
        this.iris = new CatalogIris(settings.baseIri(), settings.applicationUrl());
        this.requestTimeout = settings.requestTimeout();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
    }

    // -- collections --

    /**
     * Creates a root collection, or a nested one when {@code parentId} is given.
     *
     * @throws ConflictException if a root collection with the title exists
     * @throws NotFoundException if the parent does not exist
     */
    public CatalogRecord createCollection(String title, String parentId) {
        CatalogNames.requireTitle("Collection", title);
        if (parentId != null) {
            parentId = CatalogNames.requireId("Sub-collection", parentId);
        }
        Workflow w = begin("createCollection", TxnMode.WRITE);
        try {
            w.enter(CreateStage.VALIDATING);
            if (parentId == null) {
                if (w.graph.findCatalogByTitle(title, true).isPresent()) {
                    throw new ConflictException("Collection '" + title + "' already exists");
                }
            } else if (w.graph.findCatalogById(parentId).isEmpty()) {
                throw NotFoundException.catalogId(parentId);
            }

            w.enter(CreateStage.METADATA_WRITE);
            CatalogRecord record = w.graph.createCatalog(title, parentId);

            w.enter(CreateStage.COMMITTED);
            w.tx.commit();
            log.infof("Created collection '%s' (%s)%s", title, record.id(),
                    parentId == null ? "" : " under " + parentId);
            return record;
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /** Root collections with dataset counts and byte totals over their whole tree. */
    public List<CollectionSummary> listCollections() {
        Workflow w = begin("listCollections", TxnMode.READ);
        try {
            List<CollectionSummary> result = new ArrayList<>();
            for (CatalogRecord root : w.graph.listRootCatalogs()) {
                int datasets = 0;
                long bytes = 0;
                for (CatalogItem item : w.graph.listChildren(root.id())) {
                    if (item.isDataset()) {
                        datasets++;
                        bytes += w.graph.distributionSize(item.iri());
                    }
                }
                result.add(new CollectionSummary(root.id(), root.title(), root.modified(), datasets, bytes));
            }
            return result;
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /**
     * Every catalog and dataset in a collection's tree with its display path.
     *
     * @throws NotFoundException if the collection does not exist
     */
    public List<DatasetListing> listDatasets(String collection) {
        Workflow w = begin("listDatasets", TxnMode.READ);
        try {
            CatalogRecord root = requireCollection(w.graph, collection);
            List<DatasetListing> result = new ArrayList<>();
            for (CatalogItem item : w.graph.listChildren(root.id())) {
                String path = w.graph.resolvePath(item.iri());
                if (!item.isDataset()) {
                    result.add(new DatasetListing(item.id(), item.title(), item.modified(),
                            CatalogItemType.CATALOG, path, 0, null, null));
                    continue;
                }
                Optional<BinaryRecord> content = await(binaryStore.get(item.id()), w.deadline);
                if (content.isEmpty()) {
                    log.errorf("Dataset '%s' (%s) in collection '%s' has no stored content",
                            item.title(), item.id(), collection);
                }
                result.add(new DatasetListing(item.id(), item.title(), item.modified(),
                        CatalogItemType.DATASET, path,
                        content.map(BinaryRecord::size).orElse(0L),
                        content.map(c -> c.hash().toHex()).orElse(null),
                        RAW_CONTENT_TYPE));
            }
            return result;
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /**
     * Deletes a root collection and its sub-collections.
     *
     * @throws ConflictException if any dataset exists in the tree
     */
    public void deleteCollection(String title) {
        deleteCatalog(title, null);
    }

    /**
     * Deletes a catalog inside a collection's tree, or the collection itself when
     * {@code catalogId} is null. Sub-catalogs go with it.
     *
     * @throws NotFoundException if the collection does not exist or the catalog is not in its tree
     * @throws ConflictException if any dataset exists below the catalog
     */
    public void deleteCatalog(String collection, String catalogId) {
        if (catalogId != null) {
            catalogId = CatalogNames.requireId("Sub-collection", catalogId);
        }
        Workflow w = begin("deleteCollection", TxnMode.WRITE);
        try {
            w.enter(DeleteStage.LOCATE);
            CatalogRecord root = requireCollection(w.graph, collection);
            CatalogRecord target = root;
            if (catalogId != null) {
                target = requireCatalogWithin(w.graph, root, catalogId);
            }

            w.enter(DeleteStage.CHECK_EMPTY_OR_DIRECT);
            List<CatalogItem> children = w.graph.listChildren(target.id());
            long datasets = children.stream().filter(CatalogItem::isDataset).count();
            if (datasets > 0) {
                throw new ConflictException("Collection '" + target.title() + "' is not empty: "
                        + datasets + " dataset(s)");
            }

            w.enter(DeleteStage.UNLINK_METADATA);
            for (int i = children.size() - 1; i >= 0; i--) {
                w.graph.unlinkAndDelete(children.get(i).iri());
            }
            w.graph.unlinkAndDelete(target.iri());

            w.enter(DeleteStage.COMMIT_METADATA);
            w.tx.commit();
            log.infof("Deleted collection '%s' (%s) with %d sub-collection(s)",
                    target.title(), target.id(), children.size());
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    // -- datasets --

    /**
     * Creates a dataset in a collection, or in one of its sub-collections when
     * {@code subCollectionId} is given.
     *
     * @throws NotFoundException if the collection or sub-collection does not exist
     * @throws ConflictException if a dataset with the title exists in the collection's tree
     */
    public DatasetRecord createDataset(String collection, String title, String subCollectionId, byte[] content) {
        CatalogNames.requireTitle("Dataset", title);
        if (subCollectionId != null) {
            subCollectionId = CatalogNames.requireId("Sub-collection", subCollectionId);
        }
        Objects.requireNonNull(content, "content cannot be null");

        Workflow w = begin("createDataset", TxnMode.WRITE);
        DatasetRecord record = null;
        boolean binaryWritten = false;
        try {
            w.enter(CreateStage.VALIDATING);
            CatalogRecord root = requireCollection(w.graph, collection);
            CatalogRecord target = subCollectionId == null
                    ? root
                    : requireCatalogWithin(w.graph, root, subCollectionId);
            if (w.graph.findDatasetByTitle(root, title).isPresent()) {
                throw new ConflictException(
                        "Dataset '" + title + "' already exists in collection '" + collection + "'");
            }

            w.enter(CreateStage.FORMAT_SNIFFING);
            SniffResult sniff = sniffer.sniff(content);
            String subgraph = sniff.isStructured() ? CatalogIris.subgraphName(root.title(), title) : null;
            if (subgraph != null) {
                requireSubgraphFree(w.graph, subgraph, null);
            }

            w.enter(CreateStage.METADATA_WRITE);
            record = w.graph.createDataset(title, target.id(),
                    new DistributionSpec(sniff.format(), content.length, subgraph));

            w.enter(CreateStage.BINARY_WRITE);
            ContentHash hash = await(binaryStore.put(record.id(), content), w.deadline);
            binaryWritten = true;

            if (subgraph != null) {
                w.enter(CreateStage.STRUCTURED_SUBGRAPH_WRITE);
                loadSubgraph(w.tx, subgraph, sniff);
            }

            w.enter(CreateStage.COMMITTED);
            w.tx.commit();
            log.infof("Created dataset '%s' (%s) in '%s' as %s, %d bytes, hash %s",
                    title, record.id(), target.title(), sniff.format().tag(), content.length, hash);
            return record;
        } catch (RuntimeException e) {
            RuntimeException failure = w.fail(e);
            if (binaryWritten) {
                removeOrphan(record.id());
            }
            throw failure;
        } finally {
            w.close();
        }
    }

    /**
     * Reads a dataset's bytes.
     *
     * @throws NotFoundException if the collection or dataset does not exist
     * @throws IntegrityException if the metadata exists but the content is missing or disagrees
     */
    public DatasetContent getDataset(String collection, String title) {
        Workflow w = begin("getDataset", TxnMode.READ);
        try {
            CatalogRecord root = requireCollection(w.graph, collection);
            DatasetRecord dataset = requireDataset(w.graph, root, title);
            BinaryRecord content = await(binaryStore.get(dataset.id()), w.deadline)
                    .orElseThrow(() -> new IntegrityException(
                            "Dataset '" + title + "' (" + dataset.id() + ") has no stored content"));
            if (content.size() != dataset.distribution().byteSize()) {
                throw new IntegrityException("Dataset '" + title + "' (" + dataset.id() + ") has "
                        + content.size() + " stored bytes but metadata records "
                        + dataset.distribution().byteSize());
            }
            return new DatasetContent(dataset, content.data(), content.hash(), w.graph.resolvePath(dataset.iri()));
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /**
     * Replaces a dataset's content in place. The format is sniffed again and the
     * content subgraph rebuilt; identity, title and parent stay the same.
     */
    public DatasetRecord updateDataset(String collection, String title, byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        Workflow w = begin("updateDataset", TxnMode.WRITE);
        DatasetRecord existing = null;
        Optional<BinaryRecord> previous = Optional.empty();
        boolean binaryWritten = false;
        try {
            w.enter(CreateStage.VALIDATING);
            CatalogRecord root = requireCollection(w.graph, collection);
            existing = requireDataset(w.graph, root, title);

            w.enter(CreateStage.FORMAT_SNIFFING);
            SniffResult sniff = sniffer.sniff(content);
            String subgraph = sniff.isStructured() ? CatalogIris.subgraphName(root.title(), title) : null;
            if (subgraph != null) {
                requireSubgraphFree(w.graph, subgraph, existing);
            }

            w.enter(CreateStage.METADATA_WRITE);
            DatasetRecord updated = w.graph.updateDistribution(existing,
                    new DistributionSpec(sniff.format(), content.length, subgraph));

            w.enter(CreateStage.BINARY_WRITE);
            previous = await(binaryStore.get(existing.id()), w.deadline);
            ContentHash hash = await(binaryStore.put(existing.id(), content), w.deadline);
            binaryWritten = true;

            String oldSubgraph = existing.distribution().contentGraph();
            if (oldSubgraph != null || subgraph != null) {
                w.enter(CreateStage.STRUCTURED_SUBGRAPH_WRITE);
                if (oldSubgraph != null) {
                    w.tx.removeNamedSubgraph(oldSubgraph);
                }
                if (subgraph != null) {
                    loadSubgraph(w.tx, subgraph, sniff);
                }
            }

            w.enter(CreateStage.COMMITTED);
            w.tx.commit();
            log.infof("Updated dataset '%s' (%s) as %s, %d bytes, hash %s",
                    title, existing.id(), sniff.format().tag(), content.length, hash);
            return updated;
        } catch (RuntimeException e) {
            RuntimeException failure = w.fail(e);
            if (binaryWritten) {
                restoreContent(existing.id(), previous);
            }
            throw failure;
        } finally {
            w.close();
        }
    }

    /**
     * Deletes a dataset with its distribution, content subgraph and stored bytes.
     * Content that is already gone is skipped.
     *
     * @throws NotFoundException if the collection or dataset does not exist
     */
    public void deleteDataset(String collection, String title) {
        Workflow w = begin("deleteDataset", TxnMode.WRITE);
        try {
            w.enter(DeleteStage.LOCATE);
            CatalogRecord root = requireCollection(w.graph, collection);
            DatasetRecord dataset = requireDataset(w.graph, root, title);

            // datasets have no children
            w.enter(DeleteStage.CHECK_EMPTY_OR_DIRECT);

            w.enter(DeleteStage.UNLINK_METADATA);
            w.graph.unlinkAndDelete(dataset.iri());

            String subgraph = dataset.distribution().contentGraph();
            if (subgraph != null) {
                w.enter(DeleteStage.DELETE_SUBGRAPH);
                if (!w.tx.removeNamedSubgraph(subgraph)) {
                    log.warnf("Content subgraph '%s' of dataset %s was already gone", subgraph, dataset.id());
                }
            }

            w.enter(DeleteStage.DELETE_BINARY);
            try {
                await(binaryStore.delete(dataset.id()), w.deadline);
            } catch (ContentNotFoundException e) {
                log.warnf("Content of dataset %s was already gone", dataset.id());
            }

            w.enter(DeleteStage.COMMIT_METADATA);
            w.tx.commit();
            log.infof("Deleted dataset '%s' (%s) from collection '%s'", title, dataset.id(), collection);
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    // -- queries and export --

    /**
     * Runs a read query over the metadata graph, or over the union of every
     * dataset's content subgraph when {@code metadata} is false.
     *
     * @throws ValidationException if the query is blank or does not parse
     */
    public QueryResult query(String sparql, boolean metadata) {
        requireQuery(sparql);
        Workflow w = begin("query", TxnMode.READ);
        try {
            return w.tx.query(sparql, metadata ? QueryTarget.metadata() : QueryTarget.content(), w.deadline);
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /**
     * Runs a read query over one dataset's content subgraph.
     *
     * @throws ValidationException if the dataset is raw, or the query is blank or does not parse
     */
    public QueryResult queryDataset(String collection, String title, String sparql) {
        requireQuery(sparql);
        Workflow w = begin("queryDataset", TxnMode.READ);
        try {
            CatalogRecord root = requireCollection(w.graph, collection);
            DatasetRecord dataset = requireDataset(w.graph, root, title);
            if (!dataset.isStructured()) {
                throw new ValidationException("Dataset '" + title + "' is raw content and cannot be queried");
            }
            return w.tx.query(sparql, QueryTarget.subgraph(dataset.distribution().contentGraph()), w.deadline);
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /** The collection's catalog and every entity in its tree, serialized. */
    public String exportCollection(String collection, ExportFormat format) {
        Workflow w = begin("exportCollection", TxnMode.READ);
        try {
            CatalogRecord root = requireCollection(w.graph, collection);
            return format.write(w.graph.exportGraph(root.iri(), true));
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    /** One dataset and its distribution, serialized. */
    public String exportDataset(String collection, String title, ExportFormat format) {
        Workflow w = begin("exportDataset", TxnMode.READ);
        try {
            CatalogRecord root = requireCollection(w.graph, collection);
            DatasetRecord dataset = requireDataset(w.graph, root, title);
            return format.write(w.graph.exportGraph(dataset.iri(), false));
        } catch (RuntimeException e) {
            throw w.fail(e);
        } finally {
            w.close();
        }
    }

    // -- internals --

    private CatalogRecord requireCollection(CatalogGraph graph, String title) {
        return graph.findCatalogByTitle(title, true)
                .orElseThrow(() -> NotFoundException.collection(title));
    }

    private CatalogRecord requireCatalogWithin(CatalogGraph graph, CatalogRecord root, String catalogId) {
        return graph.findCatalogById(catalogId)
                .filter(c -> graph.hierarchy().isWithin(NodeFactory.createURI(c.iri()),
                        NodeFactory.createURI(root.iri())))
                .orElseThrow(() -> NotFoundException.catalogId(catalogId));
    }

    private DatasetRecord requireDataset(CatalogGraph graph, CatalogRecord root, String title) {
        return graph.findDatasetByTitle(root, title)
                .orElseThrow(() -> NotFoundException.dataset(root.title(), title));
    }

    private static void requireQuery(String sparql) {
        if (sparql == null || sparql.isBlank()) {
            throw new ValidationException("Query must not be empty");
        }
    }

    /**
     * Subgraph names join collection and dataset titles, so two different pairs can
     * meet on one name. A name already held by another dataset is a conflict.
     */
    private static void requireSubgraphFree(CatalogGraph graph, String subgraph, DatasetRecord self) {
        String ownDistribution = self == null ? null : self.distribution().iri();
        for (String owner : graph.distributionsUsingSubgraph(subgraph)) {
            if (!owner.equals(ownDistribution)) {
                throw new ConflictException("Content graph '" + subgraph
                        + "' is already used by another dataset");
            }
        }
    }

    private static void loadSubgraph(GraphTransaction tx, String name, SniffResult sniff) {
        if (tx.hasNamedSubgraph(name)) {
            log.warnf("Replacing leftover content subgraph '%s'", name);
            tx.removeNamedSubgraph(name);
        }
        NamedSubgraph subgraph = tx.openNamedSubgraph(name);
        long statements = subgraph.load(sniff.text(), sniff.format());
        log.debugf("Loaded %d statements into subgraph '%s'", statements, name);
    }

    /** Deletes content written by a workflow that did not commit. */
    private void removeOrphan(String datasetId) {
        try {
            await(binaryStore.delete(datasetId), Deadline.after(requestTimeout, clock));
            log.warnf("Removed content of uncommitted dataset %s", datasetId);
        } catch (RuntimeException e) {
            log.errorf(e, "Could not remove content of uncommitted dataset %s; it is orphaned", datasetId);
        }
    }

    /** Puts back the bytes an update replaced, or removes them when there were none. */
    private void restoreContent(String datasetId, Optional<BinaryRecord> previous) {
        Deadline deadline = Deadline.after(requestTimeout, clock);
        try {
            if (previous.isPresent()) {
                await(binaryStore.put(datasetId, previous.get().data()), deadline);
            } else {
                await(binaryStore.delete(datasetId), deadline);
            }
            log.warnf("Restored content of dataset %s after failed update", datasetId);
        } catch (RuntimeException e) {
            log.errorf(e, "Could not restore content of dataset %s after failed update", datasetId);
        }
    }

    private static <T> T await(Uni<T> uni, Deadline deadline) {
        if (deadline.isUnbounded()) {
            return uni.await().indefinitely();
        }
        deadline.check("binary store call");
        Duration remaining = deadline.remaining();
        return uni.await().atMost(remaining.isZero() ? Duration.ofMillis(1) : remaining);
    }

    private Workflow begin(String operation, TxnMode mode) {
        Deadline deadline = Deadline.after(requestTimeout, clock);
        GraphTransaction tx;
        try {
            tx = graphStore.begin(mode);
        } catch (RuntimeException e) {
            log.errorf(e, "%s: could not begin %s transaction", operation, mode);
            throw new StoreFailureException(operation, "BEGIN", e);
        }
        return new Workflow(operation, deadline, tx, new CatalogGraph(tx, iris, clock, deadline));
    }

    /** One operation's transaction, deadline and current stage. */
    private final class Workflow {

        final String operation;
        final Deadline deadline;
        final GraphTransaction tx;
        final CatalogGraph graph;
        String stage = "START";

        Workflow(String operation, Deadline deadline, GraphTransaction tx, CatalogGraph graph) {
            this.operation = operation;
            this.deadline = deadline;
            this.tx = tx;
            this.graph = graph;
        }

        void enter(Enum<?> next) {
            deadline.check(operation + " " + next);
            log.debugf("%s: %s -> %s", operation, stage, next);
            stage = next.name();
            listener.onStage(operation, next);
        }

        /** Maps a failure to the error taxonomy and logs it. */
        RuntimeException fail(RuntimeException e) {
            log.debugf("%s: %s -> FAILED (%s)", operation, stage, e.getClass().getSimpleName());
            if (e instanceof IntegrityException) {
                log.errorf("%s: inconsistent stored data at stage %s: %s", operation, stage, e.getMessage());
                return e;
            }
            if (e instanceof CatalogException) {
                return e;
            }
            if (e instanceof InvalidQueryException) {
                return new ValidationException("Invalid query: " + e.getMessage(), e);
            }
            log.errorf(e, "%s failed at stage %s", operation, stage);
            return new StoreFailureException(operation, stage, e);
        }

        void close() {
            tx.close();
        }
    }
}
