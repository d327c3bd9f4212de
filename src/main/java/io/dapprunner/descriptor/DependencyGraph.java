package io.dapprunner.descriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed acyclic graph of {@code depends_on} relations. Edges point from a node to its dependencies;
 * nodes without dependencies hang off a synthetic root.
 */
public final class DependencyGraph {
    private enum Mark { VISITING, DONE }

    private final Map<String, List<String>> edges;
    private final List<String> roots;
    private final List<String> prioritized;

    private DependencyGraph(Map<String, List<String>> edges, List<String> roots, List<String> prioritized) {
        this.edges = edges;
        this.roots = roots;
        this.prioritized = prioritized;
    }

    /**
     * Builds the graph from node names to their declared dependencies, in declaration order.
     */
    public static DependencyGraph build(Map<String, ? extends Collection<String>> dependsOn) {
        var edges = new LinkedHashMap<String, List<String>>();
        var roots = new ArrayList<String>();
        dependsOn.forEach((node, dependencies) -> {
            for (var dependency : dependencies) {
                if (!dependsOn.containsKey(dependency)) {
                    throw new UnmetDependencyException(node, dependency);
                }
            }
            if (dependencies.isEmpty()) {
                roots.add(node);
            }
            edges.put(node, List.copyOf(dependencies));
        });

        var marks = new HashMap<String, Mark>();
        var order = new ArrayList<String>();
        for (var node : dependsOn.keySet()) {
            visit(node, edges, marks, new ArrayList<>(), order);
        }
        return new DependencyGraph(Collections.unmodifiableMap(edges), List.copyOf(roots), List.copyOf(order));
    }

    private static void visit(
        String node,
        Map<String, List<String>> edges,
        Map<String, Mark> marks,
        List<String> path,
        List<String> order
    ) {
        var mark = marks.get(node);
        if (mark == Mark.DONE) {
            return;
        }
        path.add(node);
        if (mark == Mark.VISITING) {
            throw new DependencyCycleException(path.subList(path.indexOf(node), path.size()));
        }
        marks.put(node, Mark.VISITING);
        for (var dependency : edges.get(node)) {
            visit(dependency, edges, marks, path, order);
        }
        marks.put(node, Mark.DONE);
        path.remove(path.size() - 1);
        order.add(node);
    }

    /**
     * Node names ordered so that every node comes after all of its dependencies.
     */
    public List<String> nodesPrioritized() {
        return prioritized;
    }

    public List<String> dependenciesOf(String node) {
        var dependencies = edges.get(node);
        if (dependencies == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return dependencies;
    }

    /**
     * Nodes without dependencies, i.e. the successors of the synthetic root.
     */
    public List<String> roots() {
        return roots;
    }

    public Map<String, List<String>> edges() {
        return edges;
    }
}
