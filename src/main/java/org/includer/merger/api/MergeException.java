package org.includer.merger.api;

/**
 * Base class for all errors reported by {@link IncludeMerger#merge()}.
 * <p>
 * Every subclass is terminal for the merge call that raised it: no partial output is produced,
 * and retrying without changing the registered fragments yields the same error.
 */
public abstract class MergeException extends Exception {

    private final MergeErrorKind kind;

    protected MergeException(MergeErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * @return The kind of structural error, for callers that branch on it instead of the type.
     */
    public MergeErrorKind kind() {
        return kind;
    }
}
