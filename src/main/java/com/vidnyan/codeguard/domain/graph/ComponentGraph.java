package com.vidnyan.codeguard.domain.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Component-level dependency graph.
 * Nodes and edges iterate in name order, so traversals are deterministic.
 */
public final class ComponentGraph {

    private final Map<String, ComponentNode> nodes;
    private final Map<String, Map<String, ComponentEdge>> edges; // component → callee → edge

    private ComponentGraph(Map<String, ComponentNode> nodes, Map<String, Map<String, ComponentEdge>> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableMap(edges);
    }

    public static ComponentGraph of(Collection<ComponentNode> nodes, Collection<ComponentEdge> edges) {
        Map<String, ComponentNode> byName = new TreeMap<>();
        nodes.forEach(n -> byName.put(n.name(), n));

        Map<String, Map<String, ComponentEdge>> adjacency = new TreeMap<>();
        for (ComponentEdge edge : edges) {
            if (!byName.containsKey(edge.from()) || !byName.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge between unknown components: " + edge.from() + " -> " + edge.to());
            }
            adjacency.computeIfAbsent(edge.from(), k -> new TreeMap<>()).put(edge.to(), edge);
        }
        return new ComponentGraph(byName, adjacency);
    }

    public Collection<ComponentNode> nodes() {
        return nodes.values();
    }

    public Optional<ComponentNode> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /**
     * All edges, ordered by caller then callee.
     */
    public List<ComponentEdge> edges() {
        return edges.values().stream().flatMap(m -> m.values().stream()).toList();
    }

    public Optional<ComponentEdge> edge(String from, String to) {
        return Optional.ofNullable(edges.getOrDefault(from, Map.of()).get(to));
    }

    /**
     * Get components that a component calls.
     */
    public Set<String> getDependencies(String component) {
        return edges.getOrDefault(component, Map.of()).keySet();
    }

    /**
     * Find circular dependencies with a depth-first search.
     * Each cycle is reported once, as a path that starts at its smallest component
     * name and ends where it started: {@code [a, b, a]}.
     */
    public List<List<String>> findCycles() {
        Set<List<String>> cycles = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();

        for (String component : nodes.keySet()) {
            if (!visited.contains(component)) {
                findCyclesRecursive(component, visited, new HashSet<>(), new ArrayList<>(), cycles);
            }
        }
        return new ArrayList<>(cycles);
    }

    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            Set<List<String>> cycles
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        for (String dep : getDependencies(current)) {
            if (!visited.contains(dep)) {
                findCyclesRecursive(dep, visited, inStack, path, cycles);
            } else if (inStack.contains(dep)) {
                int cycleStart = path.indexOf(dep);
                cycles.add(normalize(path.subList(cycleStart, path.size())));
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
    }

    /**
     * Rotate an open cycle so that it starts at its smallest member, then close it.
     */
    static List<String> normalize(List<String> openCycle) {
        int start = 0;
        for (int i = 1; i < openCycle.size(); i++) {
            if (openCycle.get(i).compareTo(openCycle.get(start)) < 0) {
                start = i;
            }
        }
        List<String> cycle = new ArrayList<>(openCycle.size() + 1);
        for (int i = 0; i < openCycle.size(); i++) {
            cycle.add(openCycle.get((start + i) % openCycle.size()));
        }
        cycle.add(cycle.get(0));
        return List.copyOf(cycle);
    }

    public Stats stats() {
        return new Stats(nodes.size(), edges.values().stream().mapToInt(Map::size).sum());
    }

    public record Stats(int componentCount, int edgeCount) {}
}
