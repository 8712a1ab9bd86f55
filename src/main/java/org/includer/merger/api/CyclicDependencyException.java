package org.includer.merger.api;

import java.util.List;

/**
 * Thrown when fragments remain unordered after topological sorting, which means they
 * take part in (or depend on) an include cycle.
 */
public class CyclicDependencyException extends MergeException {

    private final List<String> unresolved;

    public CyclicDependencyException(List<String> unresolved) {
        super(MergeErrorKind.CYCLIC_DEPENDENCY, "Cyclic dependency detected among: " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /**
     * @return The fragments that could not be ordered, in registration order.
     */
    public List<String> unresolved() {
        return unresolved;
    }
}
