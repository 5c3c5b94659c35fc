package com.eainde.relviz.graph;

import com.eainde.relviz.diagnostics.DiagnosticSink;
import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.ObjectFact;
import com.eainde.relviz.model.FactModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a style sheet: which types become nodes or clusters, which relation
 * names become edges or containment, and the default attributes of every
 * type and relation name.
 *
 * <p>A style sheet is ordinary fact text. {@code node-type class} makes
 * {@code class} a node type; the effective attributes the style's fact model
 * gives {@code class} are the default attributes of every class node.</p>
 */
public class StyleClassification {

    public static final String NODE_TYPE = "node-type";
    public static final String CLUSTER_TYPE = "cluster-type";
    public static final String EDGE_TYPE = "edge-type";
    public static final String CONTAINMENT = "containment";

    private final FactModel styles;
    private final Map<String, Set<String>> membersByType;

    public StyleClassification(FactModel styles) {
        this.styles = styles;
        Map<String, Set<String>> members = new LinkedHashMap<>();
        for (ObjectFact o : styles.getObjectFacts()) {
            members.computeIfAbsent(o.type(), k -> new LinkedHashSet<>()).add(o.name());
        }
        members.replaceAll((type, names) -> Collections.unmodifiableSet(names));
        this.membersByType = Collections.unmodifiableMap(members);
    }

    public static StyleClassification of(List<? extends Fact> styleFacts, DiagnosticSink diagnostics) {
        return new StyleClassification(new FactModel(styleFacts, diagnostics));
    }

    /** Names declared with the given style type; empty if none. */
    public Set<String> membersOf(String type) {
        return membersByType.getOrDefault(type, Set.of());
    }

    public Set<String> nodeTypes() { return membersOf(NODE_TYPE); }
    public Set<String> clusterTypes() { return membersOf(CLUSTER_TYPE); }
    public Set<String> edgeTypes() { return membersOf(EDGE_TYPE); }
    public Set<String> containments() { return membersOf(CONTAINMENT); }

    /** Default attributes for a type or relation name. */
    public Map<String, String> styleOf(String name) {
        return styles.attributesOf(name);
    }

    public FactModel getStyles() {
        return styles;
    }
}
