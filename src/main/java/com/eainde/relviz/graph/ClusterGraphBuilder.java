package com.eainde.relviz.graph;

import com.eainde.relviz.diagnostics.DiagnosticSink;
import com.eainde.relviz.fact.Attributes;
import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.ObjectFact;
import com.eainde.relviz.fact.RelationFact;
import com.eainde.relviz.util.Digraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns content facts into a styled {@link DiagramGraph}.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Objects of a cluster type become clusters; containment relations
 *       between two clusters become containment edges (child to parent).</li>
 *   <li>Containment must be acyclic, and after transitive reduction every
 *       cluster has at most one direct parent.</li>
 *   <li>Objects of a node type become nodes, styled by their type and then by
 *       their own attributes.</li>
 *   <li>Relations become edges when they are edge types between known
 *       vertices, or containments of a vertex in a plain node.</li>
 *   <li>Clusters are nested parents first; a cluster lists the plain nodes
 *       whose containment relation points directly at it.</li>
 * </ol>
 *
 * <p>The builder holds no per-run state; every {@link #build} call starts from
 * scratch and its output depends only on the facts and the style.</p>
 *
 * <pre>{@code
 * StyleClassification style = StyleClassification.of(styleFacts, sink);
 * DiagramGraph graph = new ClusterGraphBuilder(style, sink).build(facts);
 * }</pre>
 */
public class ClusterGraphBuilder {

    /** Prefix that turns a cluster name into its subgraph id. */
    public static final String CLUSTER_PREFIX = "cluster";

    private final StyleClassification style;
    private final DiagnosticSink diagnostics;

    public ClusterGraphBuilder(StyleClassification style) {
        this(style, DiagnosticSink.NONE);
    }

    public ClusterGraphBuilder(StyleClassification style, DiagnosticSink diagnostics) {
        this.style = style;
        this.diagnostics = diagnostics;
    }

    /**
     * @throws CyclicContainmentException if clusters contain each other in a circle
     * @throws MultipleParentException    if a cluster keeps two direct parents after reduction
     */
    public DiagramGraph build(List<? extends Fact> facts) {
        List<ObjectFact> objects = new ArrayList<>();
        List<RelationFact> relations = new ArrayList<>();
        for (Fact fact : facts) {
            if (fact instanceof ObjectFact o) {
                objects.add(o);
            } else if (fact instanceof RelationFact r) {
                relations.add(r);
            }
        }

        Map<String, ClusterObject> clusterObjects = new LinkedHashMap<>();
        for (ObjectFact o : objects) {
            if (style.clusterTypes().contains(o.type())) {
                clusterObjects.merge(o.name(), new ClusterObject(o.type(), o.attrs()), ClusterObject::mergedWith);
            }
        }
        Digraph<String> containment = containment(clusterObjects.keySet(), relations);

        Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
        for (ObjectFact o : objects) {
            if (style.nodeTypes().contains(o.type())) {
                diagnostics.graph("Adding node for %s %s", o.type(), o.name());
                nodes.merge(o.name(), Attributes.merged(style.styleOf(o.type()), o.attrs()),
                        (earlier, later) -> Attributes.merged(earlier, later));
            } else {
                diagnostics.graph("Skipping object %s %s", o.type(), o.name());
            }
        }

        List<DiagramEdge> edges = edges(relations, nodes.keySet(), containment);
        List<DiagramCluster> clusters = clusters(clusterObjects, containment, relations, nodes.keySet());

        List<DiagramNode> diagramNodes = new ArrayList<>(nodes.size());
        nodes.forEach((name, attrs) -> diagramNodes.add(new DiagramNode(name, Attributes.copyOf(attrs))));
        return new DiagramGraph(diagramNodes, edges, clusters);
    }

    // =========================================================================
    //  Containment
    // =========================================================================

    /**
     * Containment edges between clusters, reduced so that each edge links a
     * cluster to its direct parent.
     */
    Digraph<String> containment(Set<String> clusterNames, List<RelationFact> relations) {
        Digraph<String> graph = new Digraph<>();
        clusterNames.forEach(graph::addNode);
        for (RelationFact r : relations) {
            if (style.containments().contains(r.rel())
                    && graph.containsNode(r.lhs())
                    && graph.containsNode(r.rhs())) {
                graph.addEdge(r.lhs(), r.rhs());
            }
        }
        graph.findCycle().ifPresent(cycle -> {
            throw new CyclicContainmentException(cycle);
        });

        graph.transitiveReduction();

        for (String cluster : graph.nodes()) {
            if (graph.outDegree(cluster) > 1) {
                throw new MultipleParentException(cluster, graph.successors(cluster));
            }
        }
        return graph;
    }

    // =========================================================================
    //  Edges
    // =========================================================================

    private List<DiagramEdge> edges(List<RelationFact> relations, Set<String> nodes,
                                    Digraph<String> containment) {
        List<DiagramEdge> edges = new ArrayList<>();
        for (int i = 0; i < relations.size(); i++) {
            RelationFact r = relations.get(i);
            boolean lhsKnown = nodes.contains(r.lhs()) || containment.containsNode(r.lhs());
            boolean rhsKnown = nodes.contains(r.rhs()) || containment.containsNode(r.rhs());
            boolean drawn = style.edgeTypes().contains(r.rel()) && lhsKnown && rhsKnown
                    || style.containments().contains(r.rel()) && lhsKnown && nodes.contains(r.rhs());
            if (!drawn) {
                diagnostics.graph("Skipping relation %s %s %s", r.lhs(), r.rel(), r.rhs());
                continue;
            }
            diagnostics.graph("Adding edge for %s %s %s", r.lhs(), r.rel(), r.rhs());
            Map<String, String> labels = new LinkedHashMap<>();
            if (r.hasLhsLabel()) labels.put("taillabel", r.lhsLabel());
            if (r.hasRhsLabel()) labels.put("headlabel", r.rhsLabel());
            edges.add(new DiagramEdge(i,
                    vertexId(r.lhs(), containment),
                    vertexId(r.rhs(), containment),
                    Attributes.merged(style.styleOf(r.rel()), r.attrs(), labels)));
        }
        return edges;
    }

    private static String vertexId(String name, Digraph<String> containment) {
        return containment.containsNode(name) ? CLUSTER_PREFIX + name : name;
    }

    // =========================================================================
    //  Clusters
    // =========================================================================

    private List<DiagramCluster> clusters(Map<String, ClusterObject> clusterObjects,
                                          Digraph<String> containment,
                                          List<RelationFact> relations,
                                          Set<String> nodes) {
        // edges run child -> parent, so successors-first puts parents first
        List<String> parentsFirst = containment.successorsFirst();
        Map<String, List<String>> children = new LinkedHashMap<>();
        List<String> roots = new ArrayList<>();
        for (String cluster : parentsFirst) {
            List<String> parents = containment.successors(cluster);
            diagnostics.graph("Adding cluster %s in %s", cluster, parents.isEmpty() ? "root" : parents.get(0));
            if (parents.isEmpty()) {
                roots.add(cluster);
            } else {
                children.computeIfAbsent(parents.get(0), k -> new ArrayList<>()).add(cluster);
            }
        }

        Map<String, Set<String>> members = new LinkedHashMap<>();
        for (RelationFact r : relations) {
            if (style.containments().contains(r.rel())
                    && containment.containsNode(r.rhs())
                    && !containment.containsNode(r.lhs())
                    && nodes.contains(r.lhs())) {
                members.computeIfAbsent(r.rhs(), k -> new LinkedHashSet<>()).add(r.lhs());
            }
        }

        List<DiagramCluster> result = new ArrayList<>(roots.size());
        for (String root : roots) {
            result.add(cluster(root, clusterObjects, children, members));
        }
        return result;
    }

    private DiagramCluster cluster(String name, Map<String, ClusterObject> clusterObjects,
                                   Map<String, List<String>> children, Map<String, Set<String>> members) {
        ClusterObject object = clusterObjects.get(name);
        List<DiagramCluster> nested = new ArrayList<>();
        for (String child : children.getOrDefault(name, List.of())) {
            nested.add(cluster(child, clusterObjects, children, members));
        }
        return new DiagramCluster(
                CLUSTER_PREFIX + name,
                name,
                Attributes.merged(style.styleOf(object.type()), object.attrs()),
                List.copyOf(members.getOrDefault(name, Set.of())),
                List.copyOf(nested));
    }

    /** Type and accumulated own attributes of one cluster object. */
    private record ClusterObject(String type, Map<String, String> attrs) {

        ClusterObject mergedWith(ClusterObject later) {
            return new ClusterObject(later.type(), Attributes.merged(attrs, later.attrs()));
        }
    }
}
