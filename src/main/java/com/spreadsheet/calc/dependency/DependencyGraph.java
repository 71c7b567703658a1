package com.spreadsheet.calc.dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Directed graph of cell dependencies, edge = precedent -> dependent.
 * Two adjacency maps are kept in step:
 * - forward: precedent -> cells that read it
 * - reverse: dependent -> cells it reads
 * Cycles are allowed; {@link #hasCircularReference} reports them.
 */
public class DependencyGraph {

    private final Map<CellKey, Set<CellKey>> forward = new LinkedHashMap<>();
    private final Map<CellKey, Set<CellKey>> reverse = new LinkedHashMap<>();

    /**
     * Records that {@code dependent} reads {@code precedent}.
     */
    public void addDependency(CellKey precedent, CellKey dependent) {
        forward.computeIfAbsent(precedent, k -> new LinkedHashSet<>()).add(dependent);
        forward.putIfAbsent(dependent, new LinkedHashSet<>());

        reverse.computeIfAbsent(dependent, k -> new LinkedHashSet<>()).add(precedent);
        reverse.putIfAbsent(precedent, new LinkedHashSet<>());
    }

    /**
     * Removes every edge into {@code dependent}, leaving the cells that read it untouched.
     */
    public void clearDependencies(CellKey dependent) {
        Set<CellKey> oldPrecedents = reverse.getOrDefault(dependent, Collections.emptySet());
        for (CellKey p : oldPrecedents) {
            Set<CellKey> dependents = forward.get(p);
            if (dependents != null) {
                dependents.remove(dependent);
            }
        }
        reverse.put(dependent, new LinkedHashSet<>());
    }

    public Set<CellKey> getDependents(CellKey cell) {
        return Collections.unmodifiableSet(forward.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellKey> getPrecedents(CellKey cell) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cell, Collections.emptySet()));
    }

    public int nodeCount() {
        return forward.size();
    }

    public int edgeCount() {
        int edges = 0;
        for (Set<CellKey> dependents : forward.values()) {
            edges += dependents.size();
        }
        return edges;
    }

    /**
     * True when following dependents from {@code cell} leads back to it.
     * A cell that reads itself directly counts.
     */
    public boolean hasCircularReference(CellKey cell) {
        Set<CellKey> visited = new HashSet<>();
        Deque<CellKey> stack = new ArrayDeque<>(getDependents(cell));
        while (!stack.isEmpty()) {
            CellKey current = stack.pop();
            if (current.equals(cell)) {
                return true;
            }
            if (visited.add(current)) {
                stack.addAll(forward.getOrDefault(current, Collections.emptySet()));
            }
        }
        return false;
    }

    /**
     * Recalculation order for {@code seeds} and everything they read: every cell comes
     * after its precedents. Cells on a cycle are emitted once, in the order the walk
     * first finishes them. The result may include cells that are not in {@code seeds}.
     */
    public List<CellKey> getRecalcOrder(Collection<CellKey> seeds) {
        List<CellKey> order = new ArrayList<>();
        Set<CellKey> visited = new HashSet<>();
        // Post-order walk over precedents, iterative so long chains do not exhaust the stack
        for (CellKey seed : seeds) {
            if (!visited.add(seed)) {
                continue;
            }
            Deque<CellKey> path = new ArrayDeque<>();
            Deque<Iterator<CellKey>> pending = new ArrayDeque<>();
            path.push(seed);
            pending.push(getPrecedents(seed).iterator());
            while (!path.isEmpty()) {
                Iterator<CellKey> it = pending.peek();
                if (it.hasNext()) {
                    CellKey next = it.next();
                    if (visited.add(next)) {
                        path.push(next);
                        pending.push(getPrecedents(next).iterator());
                    }
                } else {
                    order.add(path.pop());
                    pending.pop();
                }
            }
        }
        return order;
    }

    /**
     * precedent -> dependents, keyed by {@code label}, nodes without dependents omitted.
     */
    public Map<String, Set<String>> forwardView(Function<CellKey, String> label) {
        return view(forward, label);
    }

    /**
     * dependent -> precedents, keyed by {@code label}, nodes without precedents omitted.
     */
    public Map<String, Set<String>> reverseView(Function<CellKey, String> label) {
        return view(reverse, label);
    }

    private static Map<String, Set<String>> view(Map<CellKey, Set<CellKey>> adjacency, Function<CellKey, String> label) {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (Map.Entry<CellKey, Set<CellKey>> entry : new TreeMap<>(adjacency).entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Set<String> targets = new LinkedHashSet<>();
            for (CellKey k : new TreeSet<>(entry.getValue())) {
                targets.add(label.apply(k));
            }
            out.put(label.apply(entry.getKey()), targets);
        }
        return out;
    }
}
