package org.includer.merger.frontend.order;

import org.includer.merger.api.AmbiguousRootException;
import org.includer.merger.api.CyclicDependencyException;
import org.includer.merger.frontend.graph.DependencyGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Stage 3: orders fragments so that each one is merged after everything it includes.
 *
 * <p>Uses Kahn's algorithm starting from the root, the only fragment with in-degree zero,
 * and reverses the result. Children of a fragment are released in reverse directive order so
 * that, after the reversal, siblings released together are merged in the order their directives
 * were written. Beyond the partial order, sibling order is not part of the contract.</p>
 */
public final class TopologicalOrderer {

    private TopologicalOrderer() {
    }

    /**
     * Orders the fragments of the given graph.
     *
     * @param graph The validated include graph.
     * @return The processing order, dependencies first and the root last.
     * @throws AmbiguousRootException     If zero or more than one fragment has in-degree zero.
     * @throws CyclicDependencyException If some fragments cannot be ordered because of a cycle.
     */
    public static ProcessingOrder order(DependencyGraph graph)
            throws AmbiguousRootException, CyclicDependencyException {
        Map<String, Integer> inDegrees = new LinkedHashMap<>();
        for (String name : graph.names()) {
            inDegrees.put(name, graph.inDegree(name));
        }

        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : inDegrees.entrySet()) {
            if (entry.getValue() == 0) {
                roots.add(entry.getKey());
            }
        }
        if (roots.size() != 1) {
            throw new AmbiguousRootException(roots);
        }

        Queue<String> ready = new ArrayDeque<>(roots);
        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String from = ready.poll();
            sorted.add(from);
            List<String> children = new ArrayList<>(graph.outEdges().get(from));
            Collections.reverse(children);
            for (String to : children) {
                int remaining = inDegrees.merge(to, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(to);
                }
            }
        }

        List<String> unresolved = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : inDegrees.entrySet()) {
            if (entry.getValue() != 0) {
                unresolved.add(entry.getKey());
            }
        }
        if (!unresolved.isEmpty()) {
            throw new CyclicDependencyException(unresolved);
        }

        Collections.reverse(sorted);
        return new ProcessingOrder(roots.get(0), sorted);
    }
}
