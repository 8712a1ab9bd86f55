package org.includer.merger.api;

/**
 * Options controlling how fragments are scanned during a merge.
 *
 * @param commentAware If {@code true}, directive lines inside C-style block comments
 *                     are ignored. The default only recognizes directives that start
 *                     a line, which still matches such lines inside block comments.
 */
public record MergeOptions(boolean commentAware) {

    /** Line-anchored matching only. */
    public static final MergeOptions DEFAULTS = new MergeOptions(false);
}
