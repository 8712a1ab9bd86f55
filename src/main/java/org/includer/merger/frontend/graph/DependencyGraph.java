package org.includer.merger.frontend.graph;

import java.util.Map;
import java.util.Set;

/**
 * The include graph over all registered fragments.
 * Every fragment has an entry in both maps, possibly with an empty set.
 *
 * @param outEdges Fragment name to the names it includes, in first-occurrence order.
 * @param inEdges  Fragment name to the names of fragments that include it, in registration order.
 */
public record DependencyGraph(Map<String, Set<String>> outEdges, Map<String, Set<String>> inEdges) {

    /**
     * @return The number of distinct fragments the given fragment includes.
     */
    public int outDegree(String name) {
        return outEdges.getOrDefault(name, Set.of()).size();
    }

    /**
     * @return The number of distinct fragments that include the given fragment.
     */
    public int inDegree(String name) {
        return inEdges.getOrDefault(name, Set.of()).size();
    }

    /**
     * @return All fragment names, in registration order.
     */
    public Set<String> names() {
        return outEdges.keySet();
    }
}
