package org.includer.merger.frontend.graph;

import org.includer.merger.api.MissingDependencyException;
import org.includer.merger.frontend.scan.ScannedFragment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Stage 2: builds forward and reverse include edges from scan results.
 */
public final class GraphBuilder {

    private GraphBuilder() {
    }

    /**
     * Builds the include graph. Every reference is validated before any edge is used,
     * so a graph is only returned when all endpoints are registered fragments.
     *
     * @param fragments Scan results keyed by fragment name, in registration order.
     * @return The complete graph.
     * @throws MissingDependencyException If a fragment includes a name that is not registered.
     */
    public static DependencyGraph build(Map<String, ScannedFragment> fragments) throws MissingDependencyException {
        Map<String, Set<String>> outEdges = new LinkedHashMap<>();
        for (ScannedFragment fragment : fragments.values()) {
            Set<String> referenced = fragment.referencedNames();
            for (String to : referenced) {
                if (!fragments.containsKey(to)) {
                    throw new MissingDependencyException(to, fragment.name());
                }
            }
            outEdges.put(fragment.name(), referenced);
        }

        Map<String, Set<String>> inEdges = new LinkedHashMap<>();
        for (String name : fragments.keySet()) {
            inEdges.put(name, new LinkedHashSet<>());
        }
        for (Map.Entry<String, Set<String>> entry : outEdges.entrySet()) {
            for (String to : entry.getValue()) {
                inEdges.get(to).add(entry.getKey());
            }
        }

        return new DependencyGraph(unmodifiable(outEdges), unmodifiable(inEdges));
    }

    private static Map<String, Set<String>> unmodifiable(Map<String, Set<String>> edges) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        edges.forEach((name, targets) -> copy.put(name, Collections.unmodifiableSet(targets)));
        return Collections.unmodifiableMap(copy);
    }
}
