package org.includer.merger.api;

/**
 * Thrown when a fragment includes a name that is not registered.
 */
public class MissingDependencyException extends MergeException {

    private final String missingName;
    private final String referencedBy;

    /**
     * @param missingName  The name inside the {@code #include <...>} directive.
     * @param referencedBy The fragment containing the directive.
     */
    public MissingDependencyException(String missingName, String referencedBy) {
        super(MergeErrorKind.MISSING_DEPENDENCY, "Cannot include missing source " + missingName + ".");
        this.missingName = missingName;
        this.referencedBy = referencedBy;
    }

    public String missingName() {
        return missingName;
    }

    public String referencedBy() {
        return referencedBy;
    }
}
