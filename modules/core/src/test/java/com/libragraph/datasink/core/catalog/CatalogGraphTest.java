package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.IntegrityException;
import com.libragraph.datasink.core.error.NotFoundException;
import com.libragraph.datasink.core.graph.GraphStore;
import com.libragraph.datasink.core.graph.GraphTransaction;
import com.libragraph.datasink.core.graph.JenaGraphStore;
import com.libragraph.datasink.core.graph.TxnMode;
import com.libragraph.datasink.types.CatalogItemType;
import com.libragraph.datasink.types.DatasetFormat;
import com.libragraph.datasink.util.Deadline;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static com.libragraph.datasink.core.catalog.CatalogVocabulary.*;
import static org.assertj.core.api.Assertions.*;

class CatalogGraphTest {

    private static final String BASE = "http://example.org/";
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

    private final GraphStore store = JenaGraphStore.inMemory(BASE);
    private final CatalogIris iris = new CatalogIris(BASE, "http://localhost:8080/");
    private GraphTransaction tx;
    private CatalogGraph graph;

    @BeforeEach
    void setUp() {
        tx = store.begin(TxnMode.WRITE);
        graph = new CatalogGraph(tx, iris, Clock.fixed(NOW, ZoneOffset.UTC), Deadline.none());
    }

    @AfterEach
    void tearDown() {
        tx.close();
        store.close();
    }

    private static DistributionSpec raw(long size) {
        return new DistributionSpec(DatasetFormat.RAW, size, null);
    }

    @Test
    void createsRootCatalog() {
        CatalogRecord created = graph.createCatalog("alpha", null);

        CatalogRecord found = graph.findCatalogById(created.id()).orElseThrow();
        assertThat(found.title()).isEqualTo("alpha");
        assertThat(found.root()).isTrue();
        assertThat(found.parentId()).isNull();
        assertThat(found.issued()).isEqualTo(NOW);
        assertThat(found.iri()).isEqualTo(BASE + "catalogs/" + created.id());
        assertThat(graph.findCatalogByTitle("alpha", true)).contains(found);
    }

    @Test
    void createsNestedCatalogLinkedBothWays() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());

        CatalogRecord found = graph.findCatalogById(beta.id()).orElseThrow();
        assertThat(found.root()).isFalse();
        assertThat(found.parentId()).isEqualTo(alpha.id());
        assertThat(graph.hierarchy().children(NodeFactory.createURI(alpha.iri())))
                .containsExactly(NodeFactory.createURI(beta.iri()));
        assertThat(graph.findCatalogByTitle("beta", true)).isEmpty();
        assertThat(graph.findCatalogByTitle("beta", false)).contains(found);
    }

    @Test
    void nestedCatalogWithUnknownParentFails() {
        String missing = UUID.randomUUID().toString();

        assertThatThrownBy(() -> graph.createCatalog("beta", missing))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining(missing);
    }

    @Test
    void createsDatasetWithDistribution() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());

        DatasetRecord created = graph.createDataset("d1", beta.id(),
                new DistributionSpec(DatasetFormat.TURTLE, 42, "alpha_d1"));

        DatasetRecord found = graph.findDatasetById(created.id()).orElseThrow();
        assertThat(found).isEqualTo(created);
        assertThat(found.parentId()).isEqualTo(beta.id());
        assertThat(found.distribution().format()).isEqualTo(DatasetFormat.TURTLE);
        assertThat(found.distribution().byteSize()).isEqualTo(42);
        assertThat(found.distribution().contentGraph()).isEqualTo("alpha_d1");
        assertThat(found.distribution().downloadUrl()).isEqualTo("http://localhost:8080/data/alpha/d1");
        assertThat(found.distribution().id()).isEqualTo(created.id() + "/d1");
        assertThat(found.isStructured()).isTrue();
    }

    @Test
    void recordsMediaTypeAndSizeOnDistribution() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(5));

        Node dist = NodeFactory.createURI(d.distribution().iri());
        assertThat(tx.find(dist, MEDIA_TYPE, null)).extracting(t -> t.getObject().getURI())
                .containsExactly(IANA_MEDIA_TYPES + "application/octet-stream");
        assertThat(graph.distributionSize(d.iri())).isEqualTo(5);
    }

    @Test
    void findsDatasetByTitleAnywhereInTheTree() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());
        CatalogRecord other = graph.createCatalog("other", null);
        DatasetRecord nested = graph.createDataset("d1", beta.id(), raw(1));
        graph.createDataset("d1", other.id(), raw(2));

        assertThat(graph.findDatasetByTitle(alpha, "d1")).contains(nested);
        assertThat(graph.findDatasetByTitle(other, "d1").orElseThrow().distribution().byteSize()).isEqualTo(2);
        assertThat(graph.findDatasetByTitle(alpha, "missing")).isEmpty();
    }

    @Test
    void duplicateRootTitlesAreAnIntegrityError() {
        graph.createCatalog("alpha", null);
        graph.createCatalog("alpha", null);

        assertThatThrownBy(() -> graph.findCatalogByTitle("alpha", true))
                .isInstanceOf(IntegrityException.class);
    }

    @Test
    void datasetWithoutDistributionIsAnIntegrityError() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(1));
        tx.removeTriples(NodeFactory.createURI(d.iri()), HAS_DISTRIBUTION, null);

        assertThatThrownBy(() -> graph.findDatasetById(d.id()))
                .isInstanceOf(IntegrityException.class);
    }

    @Test
    void listsChildrenTransitively() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());
        DatasetRecord top = graph.createDataset("top", alpha.id(), raw(1));
        DatasetRecord deep = graph.createDataset("deep", beta.id(), raw(1));

        List<CatalogItem> items = graph.listChildren(alpha.id());

        assertThat(items).extracting(CatalogItem::id)
                .containsExactlyInAnyOrder(beta.id(), top.id(), deep.id());
        assertThat(items).filteredOn(CatalogItem::isDataset).hasSize(2);
        assertThat(items).filteredOn(i -> i.type() == CatalogItemType.CATALOG)
                .extracting(CatalogItem::title).containsExactly("beta");
        assertThat(items).filteredOn(i -> i.id().equals(deep.id()))
                .extracting(CatalogItem::parentId).containsExactly(beta.id());
    }

    @Test
    void resolvesPathThroughCatalogs() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());
        DatasetRecord d = graph.createDataset("d1", beta.id(), raw(5));

        assertThat(graph.resolvePath(d.iri())).isEqualTo("./alpha/beta/");
        assertThat(graph.rootOf(d.iri()).id()).isEqualTo(alpha.id());
    }

    @Test
    void unlinkAndDeleteRemovesEntityAndDistribution() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(5));

        assertThat(graph.unlinkAndDelete(d.iri())).isTrue();

        assertThat(graph.findDatasetById(d.id())).isEmpty();
        assertThat(tx.find(NodeFactory.createURI(d.distribution().iri()), null, null)).isEmpty();
        assertThat(tx.find(null, null, NodeFactory.createURI(d.iri()))).isEmpty();
        assertThat(graph.listChildren(alpha.id())).isEmpty();
    }

    @Test
    void unlinkAndDeleteIsIdempotent() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(5));
        graph.unlinkAndDelete(d.iri());
        long size = tx.metadataSize();

        assertThat(graph.unlinkAndDelete(d.iri())).isFalse();
        assertThat(tx.metadataSize()).isEqualTo(size);
    }

    @Test
    void updateDistributionKeepsIdentity() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(5));

        DatasetRecord updated = graph.updateDistribution(d,
                new DistributionSpec(DatasetFormat.JSON_LD, 99, "alpha_d1"));

        DatasetRecord found = graph.findDatasetById(d.id()).orElseThrow();
        assertThat(found).isEqualTo(updated);
        assertThat(found.title()).isEqualTo("d1");
        assertThat(found.distribution().iri()).isEqualTo(d.distribution().iri());
        assertThat(found.distribution().format()).isEqualTo(DatasetFormat.JSON_LD);
        assertThat(found.distribution().byteSize()).isEqualTo(99);
        assertThat(tx.find(NodeFactory.createURI(d.distribution().iri()), BYTE_SIZE, null)).hasSize(1);
    }

    @Test
    void exportsCatalogTreeWithDistributions() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        CatalogRecord beta = graph.createCatalog("beta", alpha.id());
        DatasetRecord d = graph.createDataset("d1", beta.id(), raw(5));
        CatalogRecord unrelated = graph.createCatalog("unrelated", null);

        Graph export = graph.exportGraph(alpha.iri(), true);

        assertThat(export.contains(NodeFactory.createURI(beta.iri()), TITLE, Node.ANY)).isTrue();
        assertThat(export.contains(NodeFactory.createURI(d.distribution().iri()), DOWNLOAD_URL, Node.ANY)).isTrue();
        assertThat(export.contains(NodeFactory.createURI(unrelated.iri()), Node.ANY, Node.ANY)).isFalse();
        assertThat(ExportFormat.TURTLE.write(export)).contains("dcat:Catalog");
    }

    @Test
    void exportsSingleDataset() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        DatasetRecord d = graph.createDataset("d1", alpha.id(), raw(5));

        Graph export = graph.exportGraph(d.iri(), false);

        assertThat(export.contains(NodeFactory.createURI(alpha.iri()), Node.ANY, Node.ANY)).isFalse();
        assertThat(export.contains(NodeFactory.createURI(d.iri()), TYPE, DATASET)).isTrue();
        assertThat(export.contains(NodeFactory.createURI(d.distribution().iri()), TYPE, DISTRIBUTION)).isTrue();
    }

    @Test
    void creatingChildTouchesParentModified() {
        CatalogRecord alpha = graph.createCatalog("alpha", null);
        graph.createCatalog("beta", alpha.id());

        List<Triple> modified = tx.find(NodeFactory.createURI(alpha.iri()), MODIFIED, null);
        assertThat(modified).hasSize(1);
    }
}
