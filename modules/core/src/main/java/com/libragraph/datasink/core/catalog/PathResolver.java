package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.IntegrityException;
import org.apache.jena.graph.Node;

import java.util.List;

/**
 * Builds the display path of a catalog or dataset from the titles of its
 * enclosing catalogs: {@code ./root/mid/leaf/} for a dataset in {@code leaf}.
 * A root catalog resolves to {@code ./}.
 */
public class PathResolver {

    private final HierarchyIndex index;

    public PathResolver(HierarchyIndex index) {
        this.index = index;
    }

    /**
     * @throws IntegrityException on a cyclic part-of chain, or a parent with no title
     */
    public String resolvePath(Node entity) {
        List<Node> ancestors = index.ancestors(entity);
        StringBuilder path = new StringBuilder("./");
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            Node parent = ancestors.get(i);
            String title = index.titleOf(parent)
                    .orElseThrow(() -> new IntegrityException(
                            "Catalog " + parent.getURI() + " on the path of " + entity.getURI() + " has no title"));
            path.append(title).append('/');
        }
        return path.toString();
    }
}
