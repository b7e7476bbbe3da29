package com.libragraph.datasink.core.graph;

import com.libragraph.datasink.formats.riot.RdfLangs;
import com.libragraph.datasink.formats.riot.StrictErrorHandler;
import com.libragraph.datasink.types.DatasetFormat;
import com.libragraph.datasink.util.Deadline;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryCancelledException;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionDatasetBuilder;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ReadWrite;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.system.StreamRDFBase;
import org.apache.jena.sparql.core.DatasetGraph;
import org.apache.jena.sparql.core.DatasetGraphFactory;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.tdb2.TDB2Factory;
import org.jboss.logging.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link GraphStore} over a transactional Jena dataset: the default graph holds
 * catalog metadata, each structured dataset gets a named graph under
 * {@code {baseIri}graphs/}.
 */
public class JenaGraphStore implements GraphStore {

    private static final Logger log = Logger.getLogger(JenaGraphStore.class);

    private final DatasetGraph dataset;
    private final String subgraphNamespace;
    private final String location;

    JenaGraphStore(DatasetGraph dataset, String baseIri, String location) {
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.subgraphNamespace = Objects.requireNonNull(baseIri, "baseIri cannot be null") + "graphs/";
        this.location = location;
    }

    /** Transactional in-memory store; contents are lost on shutdown. */
    public static JenaGraphStore inMemory(String baseIri) {
        return new JenaGraphStore(DatasetGraphFactory.createTxnMem(), baseIri, "memory");
    }

    /** Persistent TDB2 store in {@code directory}, created if missing. */
    public static JenaGraphStore tdb2(Path directory, String baseIri) {
        DatasetGraph dsg = TDB2Factory.connectDataset(directory.toString()).asDatasetGraph();
        return new JenaGraphStore(dsg, baseIri, "tdb2:" + directory);
    }

    @Override
    public GraphTransaction begin(TxnMode mode) {
        try {
            dataset.begin(mode == TxnMode.WRITE ? ReadWrite.WRITE : ReadWrite.READ);
        } catch (RuntimeException e) {
            throw new GraphStoreException("Failed to begin " + mode + " transaction", e);
        }
        return new JenaTransaction(mode);
    }

    @Override
    public String subgraphIri(String name) {
        return subgraphNamespace + URLEncoder.encode(name, StandardCharsets.UTF_8);
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public void close() {
        dataset.close();
    }

    private Node subgraphNode(String name) {
        return NodeFactory.createURI(subgraphIri(name));
    }

    private static Node orAny(Node node) {
        return node == null ? Node.ANY : node;
    }

    private final class JenaTransaction implements GraphTransaction {

        private final TxnMode mode;
        private boolean ended;

        JenaTransaction(TxnMode mode) {
            this.mode = mode;
        }

        @Override
        public TxnMode mode() {
            return mode;
        }

        @Override
        public List<Triple> find(Node subject, Node predicate, Node object) {
            ensureActive();
            try {
                return dataset.getDefaultGraph()
                        .find(orAny(subject), orAny(predicate), orAny(object))
                        .toList();
            } catch (RuntimeException e) {
                throw new GraphStoreException("Pattern match failed", e);
            }
        }

        @Override
        public QueryResult query(String sparql, QueryTarget target, Deadline deadline) {
            ensureActive();
            Query query;
            try {
                query = QueryFactory.create(sparql);
            } catch (QueryParseException e) {
                throw new InvalidQueryException("Query does not parse: " + e.getMessage(), e);
            }
            deadline.check("query on " + target);

            QueryExecutionDatasetBuilder builder = QueryExecution.create()
                    .query(query)
                    .dataset(DatasetFactory.wrap(view(target)));
            if (!deadline.isUnbounded()) {
                builder.timeout(Math.max(1, deadline.remaining().toMillis()), TimeUnit.MILLISECONDS);
            }
            try (QueryExecution qe = builder.build()) {
                return execute(query, qe);
            } catch (QueryCancelledException e) {
                throw new GraphStoreException("Query on " + target + " exceeded its deadline", e);
            } catch (GraphStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new GraphStoreException("Query on " + target + " failed", e);
            }
        }

        private DatasetGraph view(QueryTarget target) {
            return switch (target.kind()) {
                case METADATA -> DatasetGraphFactory.wrap(dataset.getDefaultGraph());
                case CONTENT -> DatasetGraphFactory.wrap(dataset.getUnionGraph());
                case SUBGRAPH -> DatasetGraphFactory.wrap(dataset.getGraph(subgraphNode(target.subgraphName())));
            };
        }

        private QueryResult execute(Query query, QueryExecution qe) {
            if (query.isSelectType()) {
                ResultSet rs = qe.execSelect();
                List<String> vars = rs.getResultVars();
                List<Map<String, String>> rows = new ArrayList<>();
                while (rs.hasNext()) {
                    QuerySolution solution = rs.next();
                    Map<String, String> row = new LinkedHashMap<>();
                    for (String var : vars) {
                        RDFNode value = solution.get(var);
                        if (value != null) {
                            row.put(var, render(value.asNode()));
                        }
                    }
                    rows.add(row);
                }
                return new QueryResult(QueryResult.Form.SELECT, vars, rows, null);
            }
            if (query.isAskType()) {
                return QueryResult.ask(qe.execAsk());
            }
            if (query.isConstructType()) {
                return tripleResult(QueryResult.Form.CONSTRUCT, qe.execConstructTriples());
            }
            if (query.isDescribeType()) {
                return tripleResult(QueryResult.Form.DESCRIBE, qe.execDescribeTriples());
            }
            throw new InvalidQueryException("Unsupported query form", null);
        }

        private QueryResult tripleResult(QueryResult.Form form, Iterator<Triple> triples) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (triples.hasNext()) {
                Triple t = triples.next();
                Map<String, String> row = new LinkedHashMap<>();
                row.put("subject", render(t.getSubject()));
                row.put("predicate", render(t.getPredicate()));
                row.put("object", render(t.getObject()));
                rows.add(row);
            }
            return new QueryResult(form, QueryResult.TRIPLE_VARIABLES, rows, null);
        }

        @Override
        public void addTriples(String namedGraph, Collection<Triple> triples) {
            ensureActive();
            Graph target = namedGraph == null
                    ? dataset.getDefaultGraph()
                    : dataset.getGraph(subgraphNode(namedGraph));
            try {
                triples.forEach(target::add);
            } catch (RuntimeException e) {
                throw new GraphStoreException("Failed to add triples", e);
            }
        }

        @Override
        public int removeTriples(Node subject, Node predicate, Node object) {
            List<Triple> matches = find(subject, predicate, object);
            Graph metadata = dataset.getDefaultGraph();
            try {
                matches.forEach(metadata::delete);
            } catch (RuntimeException e) {
                throw new GraphStoreException("Failed to remove triples", e);
            }
            return matches.size();
        }

        @Override
        public NamedSubgraph openNamedSubgraph(String name) {
            ensureActive();
            Node node = subgraphNode(name);
            return new JenaNamedSubgraph(name, node.getURI(), dataset.getGraph(node));
        }

        @Override
        public boolean removeNamedSubgraph(String name) {
            ensureActive();
            Node node = subgraphNode(name);
            try {
                boolean existed = dataset.containsGraph(node);
                if (existed) {
                    dataset.removeGraph(node);
                }
                return existed;
            } catch (RuntimeException e) {
                throw new GraphStoreException("Failed to remove subgraph " + name, e);
            }
        }

        @Override
        public boolean hasNamedSubgraph(String name) {
            ensureActive();
            return dataset.containsGraph(subgraphNode(name));
        }

        @Override
        public long metadataSize() {
            ensureActive();
            return dataset.getDefaultGraph().size();
        }

        @Override
        public long subgraphCount() {
            ensureActive();
            long count = 0;
            Iterator<Node> names = dataset.listGraphNodes();
            while (names.hasNext()) {
                names.next();
                count++;
            }
            return count;
        }

        @Override
        public void commit() {
            ensureActive();
            try {
                dataset.commit();
            } catch (RuntimeException e) {
                throw new GraphStoreException("Commit failed", e);
            } finally {
                end();
            }
        }

        @Override
        public void abort() {
            if (ended) {
                return;
            }
            try {
                dataset.abort();
            } catch (RuntimeException e) {
                log.warnf(e, "Abort of %s transaction failed", mode);
            } finally {
                end();
            }
        }

        @Override
        public boolean isActive() {
            return !ended;
        }

        @Override
        public void close() {
            abort();
        }

        private void end() {
            ended = true;
            try {
                dataset.end();
            } catch (RuntimeException e) {
                log.debugf("Ending %s transaction: %s", mode, e.getMessage());
            }
        }

        private void ensureActive() {
            if (ended) {
                throw new GraphStoreException(mode + " transaction already ended");
            }
        }
    }

    private static final class JenaNamedSubgraph implements NamedSubgraph {

        private final String name;
        private final String iri;
        private final Graph graph;

        JenaNamedSubgraph(String name, String iri, Graph graph) {
            this.name = name;
            this.iri = iri;
            this.graph = graph;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String iri() {
            return iri;
        }

        @Override
        public long load(String text, DatasetFormat format) {
            GraphSink sink = new GraphSink(graph);
            try {
                RDFParser.create()
                        .fromString(text)
                        .lang(RdfLangs.langOf(format))
                        .base(iri + "/")
                        .errorHandler(StrictErrorHandler.INSTANCE)
                        .parse(sink);
            } catch (RuntimeException e) {
                throw new GraphStoreException("Failed to load " + format.tag() + " into subgraph " + name, e);
            }
            return sink.count;
        }

        @Override
        public long size() {
            return graph.size();
        }
    }

    /** Adds every parsed triple, and every quad as a triple, to one graph. */
    private static final class GraphSink extends StreamRDFBase {

        private final Graph graph;
        private long count;

        GraphSink(Graph graph) {
            this.graph = graph;
        }

        @Override
        public void triple(Triple triple) {
            graph.add(triple);
            count++;
        }

        @Override
        public void quad(Quad quad) {
            graph.add(quad.asTriple());
            count++;
        }
    }

    static String render(Node node) {
        if (node.isURI()) {
            return node.getURI();
        }
        if (node.isLiteral()) {
            return node.getLiteralLexicalForm();
        }
        if (node.isBlank()) {
            return "_:" + node.getBlankNodeLabel();
        }
        return node.toString();
    }
}
