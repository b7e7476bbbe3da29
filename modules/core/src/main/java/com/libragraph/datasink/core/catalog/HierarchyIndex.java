package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.IntegrityException;
import com.libragraph.datasink.core.graph.GraphTransaction;
import com.libragraph.datasink.types.CatalogItemType;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The two structural relations of the catalog, read from one transaction:
 * {@code contains} (catalog to sub-catalog or dataset, via {@code dcat:catalog} and
 * {@code dcat:dataset}) and {@code partOf} (entity to enclosing catalog, via
 * {@code dcterms:isPartOf}).
 *
 * <p>Lookups are cached for the life of the index, which must not outlive its
 * transaction. Traversals carry a visited set and report a revisit as an
 * {@link IntegrityException}.
 */
public class HierarchyIndex {

    private final GraphTransaction tx;
    private final Map<Node, List<Node>> children = new HashMap<>();
    private final Map<Node, Optional<Node>> parents = new HashMap<>();
    private final Map<Node, Optional<String>> titles = new HashMap<>();

    public HierarchyIndex(GraphTransaction tx) {
        this.tx = tx;
    }

    /** Direct sub-catalogs and datasets of {@code catalog}. */
    public List<Node> children(Node catalog) {
        return children.computeIfAbsent(catalog, c -> {
            List<Node> result = new ArrayList<>();
            for (Triple t : tx.find(c, CatalogVocabulary.HAS_CATALOG, null)) {
                result.add(t.getObject());
            }
            for (Triple t : tx.find(c, CatalogVocabulary.HAS_DATASET, null)) {
                result.add(t.getObject());
            }
            return List.copyOf(result);
        });
    }

    /**
     * Every entity reachable from {@code catalog} through contains links, breadth first.
     * The catalog itself is not included.
     */
    public List<Node> descendants(Node catalog) {
        Set<Node> seen = new LinkedHashSet<>();
        Deque<Node> queue = new ArrayDeque<>();
        queue.add(catalog);
        Set<Node> expanded = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            Node current = queue.poll();
            if (!expanded.add(current)) {
                continue;
            }
            for (Node child : children(current)) {
                if (child.equals(catalog) || !seen.add(child)) {
                    throw new IntegrityException(
                            "Entity " + child.getURI() + " is contained more than once under " + catalog.getURI());
                }
                queue.add(child);
            }
        }
        return List.copyOf(seen);
    }

    /** The enclosing catalog, or empty for a root catalog. */
    public Optional<Node> parentOf(Node entity) {
        return parents.computeIfAbsent(entity, e -> {
            List<Triple> links = tx.find(e, CatalogVocabulary.IS_PART_OF, null);
            if (links.size() > 1) {
                throw new IntegrityException("Entity " + e.getURI() + " is part of " + links.size() + " catalogs");
            }
            return links.isEmpty() ? Optional.empty() : Optional.of(links.get(0).getObject());
        });
    }

    /**
     * Enclosing catalogs from the direct parent up to the root.
     *
     * @throws IntegrityException on a cyclic part-of chain
     */
    public List<Node> ancestors(Node entity) {
        List<Node> chain = new ArrayList<>();
        Set<Node> visited = new LinkedHashSet<>();
        visited.add(entity);
        Optional<Node> parent = parentOf(entity);
        while (parent.isPresent()) {
            Node p = parent.get();
            if (!visited.add(p)) {
                throw new IntegrityException("Cyclic part-of chain at " + p.getURI() + " starting from " + entity.getURI());
            }
            chain.add(p);
            parent = parentOf(p);
        }
        return chain;
    }

    /** The root catalog above {@code entity}, or the entity itself when it is a root. */
    public Node rootOf(Node entity) {
        List<Node> chain = ancestors(entity);
        return chain.isEmpty() ? entity : chain.get(chain.size() - 1);
    }

    public boolean isWithin(Node entity, Node ancestor) {
        return entity.equals(ancestor) || ancestors(entity).contains(ancestor);
    }

    public Optional<String> titleOf(Node entity) {
        return titles.computeIfAbsent(entity, e -> literal(e, CatalogVocabulary.TITLE));
    }

    public Optional<String> idOf(Node entity) {
        return literal(entity, CatalogVocabulary.IDENTIFIER);
    }

    public Optional<CatalogItemType> typeOf(Node entity) {
        for (Triple t : tx.find(entity, CatalogVocabulary.TYPE, null)) {
            if (t.getObject().equals(CatalogVocabulary.CATALOG)) {
                return Optional.of(CatalogItemType.CATALOG);
            }
            if (t.getObject().equals(CatalogVocabulary.DATASET)) {
                return Optional.of(CatalogItemType.DATASET);
            }
        }
        return Optional.empty();
    }

    private Optional<String> literal(Node subject, Node predicate) {
        List<Triple> values = tx.find(subject, predicate, null);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        Node value = values.get(0).getObject();
        return Optional.of(value.isLiteral() ? value.getLiteralLexicalForm() : value.toString());
    }
}
