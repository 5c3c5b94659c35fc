package com.eainde.relviz.render;

import com.eainde.relviz.graph.DiagramCluster;
import com.eainde.relviz.graph.DiagramEdge;
import com.eainde.relviz.graph.DiagramGraph;
import com.eainde.relviz.graph.DiagramNode;

import java.util.Map;

/**
 * Serializes a {@link DiagramGraph} as Graphviz DOT text.
 *
 * <p>The result is a non-strict directed graph, so parallel edges survive.
 * Nodes come first, then the cluster subgraphs (nested as in the graph),
 * then the edges in key order. Every id and value is written quoted, and the
 * same graph always produces the same text.</p>
 *
 * <pre>
 * digraph {
 *     "Car" ["shape"="box"];
 *     subgraph "clusterVehicles" {
 *         graph ["label"="Vehicles"];
 *         "Car";
 *     }
 *     "Car" -&gt; "Engine" ["key"="0", "arrowhead"="diamond"];
 * }
 * </pre>
 */
public class DotWriter {

    private static final String INDENT = "    ";

    public String write(DiagramGraph graph) {
        StringBuilder out = new StringBuilder();
        out.append("digraph {\n");
        for (DiagramNode node : graph.nodes()) {
            indent(out, 1).append(quote(node.id()));
            attributeList(out, node.attrs());
            out.append(";\n");
        }
        for (DiagramCluster cluster : graph.clusters()) {
            subgraph(out, cluster, 1);
        }
        for (DiagramEdge edge : graph.edges()) {
            indent(out, 1).append(quote(edge.tail())).append(" -> ").append(quote(edge.head()));
            out.append(" [").append(quote("key")).append('=').append(quote(String.valueOf(edge.key())));
            edge.attrs().forEach((k, v) -> out.append(", ").append(quote(k)).append('=').append(quote(v)));
            out.append("];\n");
        }
        out.append("}\n");
        return out.toString();
    }

    private void subgraph(StringBuilder out, DiagramCluster cluster, int depth) {
        indent(out, depth).append("subgraph ").append(quote(cluster.id())).append(" {\n");
        if (!cluster.attrs().isEmpty()) {
            indent(out, depth + 1).append("graph");
            attributeList(out, cluster.attrs());
            out.append(";\n");
        }
        for (String node : cluster.nodes()) {
            indent(out, depth + 1).append(quote(node)).append(";\n");
        }
        for (DiagramCluster child : cluster.clusters()) {
            subgraph(out, child, depth + 1);
        }
        indent(out, depth).append("}\n");
    }

    private static void attributeList(StringBuilder out, Map<String, String> attrs) {
        if (attrs.isEmpty()) return;
        out.append(" [");
        boolean first = true;
        for (Map.Entry<String, String> attr : attrs.entrySet()) {
            if (!first) out.append(", ");
            out.append(quote(attr.getKey())).append('=').append(quote(attr.getValue()));
            first = false;
        }
        out.append(']');
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        return out;
    }

    /** DOT double-quoted string; quotes are escaped and line breaks become {@code \n}. */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> { }
                default -> sb.append(c);
            }
        }
        // a lone trailing backslash would escape the closing quote
        int trailing = 0;
        for (int i = value.length() - 1; i >= 0 && value.charAt(i) == '\\'; i--) {
            trailing++;
        }
        if (trailing % 2 == 1) {
            sb.append('\\');
        }
        return sb.append('"').toString();
    }
}
