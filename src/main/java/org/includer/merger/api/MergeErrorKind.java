package org.includer.merger.api;

/**
 * The kinds of structural errors a merge can fail with.
 */
public enum MergeErrorKind {
    /** A directive references a fragment that was never registered. */
    MISSING_DEPENDENCY,
    /** Zero or more than one fragment is not included by any other fragment. */
    AMBIGUOUS_ROOT,
    /** Some fragments could not be ordered because they include each other. */
    CYCLIC_DEPENDENCY
}
