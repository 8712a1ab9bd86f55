package org.includer.merger.api;

import java.util.List;

/**
 * Thrown when the number of fragments that no other fragment includes is not exactly one.
 * An empty candidate list means every fragment is included by some other fragment.
 */
public class AmbiguousRootException extends MergeException {

    private final List<String> candidates;

    public AmbiguousRootException(List<String> candidates) {
        super(MergeErrorKind.AMBIGUOUS_ROOT,
                "There must be exactly 1 file which is not included by any other file. Found: " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    /**
     * @return The fragments with no incoming include, in registration order.
     */
    public List<String> candidates() {
        return candidates;
    }
}
