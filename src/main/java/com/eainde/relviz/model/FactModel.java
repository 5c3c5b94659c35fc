package com.eainde.relviz.model;

import com.eainde.relviz.diagnostics.DiagnosticSink;
import com.eainde.relviz.fact.Attributes;
import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.ObjectFact;
import com.eainde.relviz.fact.RelationFact;
import com.eainde.relviz.util.Digraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic model of a fact list: which relation names mean "is a
 * specialization of", the inheritance graph they induce, and the attributes
 * every name ends up with once inherited attributes are folded in.
 *
 * <ul>
 *   <li>Generalization names are the closure of {@code generalization} under
 *       "a fact {@code X R Y} with {@code R} and {@code Y} already known adds
 *       {@code X}".</li>
 *   <li>Each generalization fact {@code X R Y} makes {@code Y} a direct base of
 *       {@code X}; bases keep declaration order.</li>
 *   <li>Entities live in an arena indexed by name, filled bases-first; every
 *       entity's ancestors are ordered by a C3 merge.</li>
 *   <li>Effective attributes fold direct attributes from the farthest ancestor
 *       to the entity itself.</li>
 * </ul>
 *
 * <p>A model is built once in the constructor and never changes afterwards.</p>
 */
public class FactModel {

    public static final String GENERALIZATION = "generalization";

    private final List<ObjectFact> objectFacts;
    private final List<RelationFact> relationFacts;
    private final Set<String> generalizations;

    private final List<Entity> arena;
    private final Map<String, Integer> index;

    public FactModel(List<? extends Fact> facts) {
        this(facts, DiagnosticSink.NONE);
    }

    /**
     * @throws CyclicInheritanceException     if generalization edges form a cycle
     * @throws InconsistentHierarchyException if some entity's ancestors cannot be linearized
     */
    public FactModel(List<? extends Fact> facts, DiagnosticSink diagnostics) {
        List<ObjectFact> objects = new ArrayList<>();
        List<RelationFact> relations = new ArrayList<>();
        for (Fact fact : facts) {
            if (fact instanceof ObjectFact o) {
                objects.add(o);
            } else if (fact instanceof RelationFact r) {
                relations.add(r);
            }
        }
        this.objectFacts = Collections.unmodifiableList(objects);
        this.relationFacts = Collections.unmodifiableList(relations);
        this.generalizations = findGeneralizations(relations);
        diagnostics.model("%d generalizations found", generalizations.size());

        Digraph<String> inheritance = new Digraph<>();
        for (RelationFact r : relations) {
            if (generalizations.contains(r.rel())) {
                inheritance.addEdge(r.lhs(), r.rhs());
            }
        }
        inheritance.findCycle().ifPresent(cycle -> {
            throw new CyclicInheritanceException(cycle);
        });

        // bases-first: every base gets its slot before anything derived from it
        List<String> names = new ArrayList<>(inheritance.successorsFirst());
        for (String name : names) {
            diagnostics.model("Creating entity for %s", name);
        }
        Set<String> known = new LinkedHashSet<>(names);
        for (ObjectFact o : objects) {
            if (known.add(o.name())) {
                names.add(o.name());
            }
        }

        Map<String, Integer> slots = new HashMap<>();
        for (String name : names) {
            slots.put(name, slots.size());
        }

        List<Map<String, String>> direct = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            direct.add(new LinkedHashMap<>());
        }
        for (ObjectFact o : objects) {
            diagnostics.model("Combining attributes for %s", o.name());
            direct.get(slots.get(o.name())).putAll(o.attrs());
        }

        List<List<Integer>> linearizations = new ArrayList<>(names.size());
        List<Entity> entities = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            List<String> baseNames = inheritance.successors(name);
            List<Integer> bases = new ArrayList<>(baseNames.size());
            List<List<Integer>> baseLinearizations = new ArrayList<>(baseNames.size());
            for (String base : baseNames) {
                int slot = slots.get(base);
                bases.add(slot);
                baseLinearizations.add(linearizations.get(slot));
            }
            List<Integer> linearization = C3Linearizer.linearize(i, bases, baseLinearizations);
            if (linearization == null) {
                throw new InconsistentHierarchyException(name, baseNames);
            }
            linearizations.add(linearization);

            List<String> order = new ArrayList<>(linearization.size());
            Map<String, String> attrs = new LinkedHashMap<>();
            for (int k = linearization.size() - 1; k >= 0; k--) {
                attrs.putAll(direct.get(linearization.get(k)));
            }
            for (Integer slot : linearization) {
                order.add(names.get(slot));
            }
            entities.add(new Entity(name, baseNames, Attributes.copyOf(direct.get(i)),
                    List.copyOf(order), Attributes.copyOf(attrs)));
        }

        this.arena = Collections.unmodifiableList(entities);
        this.index = Collections.unmodifiableMap(slots);
    }

    /**
     * Closes {@code {generalization}} under: a relation fact whose relation
     * name and right-hand side are both generalizations makes its left-hand
     * side one too. A name may also declare itself through its own relation,
     * as in {@code is-a is-a generalization}.
     */
    static Set<String> findGeneralizations(List<RelationFact> relations) {
        Set<String> result = new LinkedHashSet<>();
        result.add(GENERALIZATION);
        boolean grown = true;
        while (grown) {
            grown = false;
            for (RelationFact r : relations) {
                boolean byKnownRelation = result.contains(r.rel()) || r.rel().equals(r.lhs());
                if (!result.contains(r.lhs())
                        && byKnownRelation
                        && result.contains(r.rhs())) {
                    result.add(r.lhs());
                    grown = true;
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    // =========================================================================
    //  Lookup
    // =========================================================================

    /** Effective attributes of {@code name}; empty if the model does not know it. */
    public Map<String, String> attributesOf(String name) {
        return entity(name).map(Entity::attrs).orElse(Map.of());
    }

    public Optional<Entity> entity(String name) {
        Integer slot = index.get(name);
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    /** The entity followed by its ancestors, nearest first; empty for unknown names. */
    public List<String> linearizationOf(String name) {
        return entity(name).map(Entity::linearization).orElse(List.of());
    }

    public List<String> basesOf(String name) {
        return entity(name).map(Entity::bases).orElse(List.of());
    }

    public boolean isGeneralization(String rel) {
        return generalizations.contains(rel);
    }

    /** Entities in construction order: every base precedes everything derived from it. */
    public List<Entity> getEntities() { return arena; }
    public Set<String> getGeneralizations() { return generalizations; }
    public List<ObjectFact> getObjectFacts() { return objectFacts; }
    public List<RelationFact> getRelationFacts() { return relationFacts; }
}
