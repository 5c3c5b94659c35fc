package com.eainde.relviz.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Simple directed graph without parallel edges whose node and edge iteration
 * order is insertion order, so every traversal below is deterministic.
 *
 * <p>Not thread-safe; meant to be built and consumed within one run.</p>
 *
 * @param <V> node type
 */
public class Digraph<V> {

    private final Map<V, Set<V>> successors = new LinkedHashMap<>();

    public void addNode(V node) {
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    public void addEdge(V from, V to) {
        addNode(from);
        addNode(to);
        successors.get(from).add(to);
    }

    public boolean removeEdge(V from, V to) {
        Set<V> out = successors.get(from);
        return out != null && out.remove(to);
    }

    public boolean containsNode(V node) {
        return successors.containsKey(node);
    }

    public boolean hasEdge(V from, V to) {
        Set<V> out = successors.get(from);
        return out != null && out.contains(to);
    }

    /** Nodes in insertion order. */
    public Set<V> nodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    /** Direct successors of {@code node} in edge insertion order; empty for unknown nodes. */
    public List<V> successors(V node) {
        Set<V> out = successors.get(node);
        return out == null ? List.of() : List.copyOf(out);
    }

    public int outDegree(V node) {
        Set<V> out = successors.get(node);
        return out == null ? 0 : out.size();
    }

    public int edgeCount() {
        return successors.values().stream().mapToInt(Set::size).sum();
    }

    // =========================================================================
    //  Cycles
    // =========================================================================

    /**
     * Finds a cycle, searching depth-first from nodes in insertion order.
     *
     * @return the nodes of the first cycle found, in edge order, starting at the
     *         node where the cycle closes (the closing edge leads from the last
     *         element back to the first); empty if the graph is acyclic
     */
    public Optional<List<V>> findCycle() {
        Set<V> done = new HashSet<>();
        for (V root : successors.keySet()) {
            if (done.contains(root)) continue;
            List<V> cycle = findCycle(root, done);
            if (cycle != null) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    private List<V> findCycle(V root, Set<V> done) {
        List<V> path = new ArrayList<>();
        Set<V> onPath = new HashSet<>();
        Deque<Iterator<V>> stack = new ArrayDeque<>();
        path.add(root);
        onPath.add(root);
        stack.push(successors.get(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<V> pending = stack.peek();
            if (!pending.hasNext()) {
                stack.pop();
                V node = path.remove(path.size() - 1);
                onPath.remove(node);
                done.add(node);
                continue;
            }
            V next = pending.next();
            if (onPath.contains(next)) {
                return new ArrayList<>(path.subList(path.indexOf(next), path.size()));
            }
            if (!done.contains(next)) {
                path.add(next);
                onPath.add(next);
                stack.push(successors.get(next).iterator());
            }
        }
        return null;
    }

    // =========================================================================
    //  Ordering
    // =========================================================================

    /**
     * Orders all nodes so that every node comes after all of its successors
     * (depth-first post-order, roots taken in insertion order).
     *
     * @throws IllegalStateException if the graph has a cycle; check
     *                               {@link #findCycle()} first
     */
    public List<V> successorsFirst() {
        List<V> order = new ArrayList<>(successors.size());
        Set<V> done = new HashSet<>();
        Set<V> inProgress = new HashSet<>();
        for (V root : successors.keySet()) {
            if (!done.contains(root)) {
                visitPostOrder(root, order, done, inProgress);
            }
        }
        return order;
    }

    private void visitPostOrder(V root, List<V> order, Set<V> done, Set<V> inProgress) {
        Deque<Frame<V>> stack = new ArrayDeque<>();
        inProgress.add(root);
        stack.push(new Frame<>(root, successors.get(root).iterator()));
        while (!stack.isEmpty()) {
            Frame<V> top = stack.peek();
            if (!top.pending().hasNext()) {
                stack.pop();
                inProgress.remove(top.node());
                done.add(top.node());
                order.add(top.node());
                continue;
            }
            V next = top.pending().next();
            if (done.contains(next)) continue;
            if (!inProgress.add(next)) {
                throw new IllegalStateException("Graph has a cycle through " + next);
            }
            stack.push(new Frame<>(next, successors.get(next).iterator()));
        }
    }

    // =========================================================================
    //  Transitive reduction
    // =========================================================================

    /**
     * Removes, in place, every edge {@code u -> w} for which {@code w} is also
     * reachable from {@code u} through a longer path. Reachability is unchanged.
     *
     * <p>For each source node the walk descends depth-first from its direct
     * successors, dropping any edge from the source to a node met below; a
     * per-source visited set keeps shared descendants from being walked twice.
     * The graph must be acyclic.</p>
     */
    public void transitiveReduction() {
        for (V source : new ArrayList<>(successors.keySet())) {
            Set<V> done = new HashSet<>();
            for (V child : List.copyOf(successors.get(source))) {
                if (!done.contains(child)) {
                    dropIndirect(source, child, done);
                }
            }
        }
    }

    private void dropIndirect(V source, V child, Set<V> done) {
        Deque<Frame<V>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(child, List.copyOf(successors.get(child)).iterator()));
        while (!stack.isEmpty()) {
            Frame<V> top = stack.peek();
            if (!top.pending().hasNext()) {
                stack.pop();
                done.add(top.node());
                continue;
            }
            V below = top.pending().next();
            successors.get(source).remove(below);
            if (!done.contains(below)) {
                stack.push(new Frame<>(below, List.copyOf(successors.get(below)).iterator()));
            }
        }
    }

    /** A node on the explicit traversal stack with the successors still to visit. */
    private record Frame<N>(N node, Iterator<N> pending) {
    }
}
