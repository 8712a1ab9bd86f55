package org.includer.merger.frontend.scan;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of scanning a single fragment for include and include-once directives.
 *
 * @param name             The fragment name.
 * @param lines            The fragment content split into lines, each keeping its terminator.
 * @param includes         All include directive occurrences, in textual order.
 * @param includeOnceLines Lines holding a {@code #pragma once} declaration, keyed by index. Each
 *                         value is the text of the line that survives the declaration, empty
 *                         when the declaration fills the line.
 */
public record ScannedFragment(
        String name,
        List<String> lines,
        List<IncludeDirective> includes,
        Map<Integer, String> includeOnceLines
) {

    public ScannedFragment {
        lines = List.copyOf(lines);
        includes = List.copyOf(includes);
        includeOnceLines = Map.copyOf(includeOnceLines);
    }

    /**
     * @return {@code true} if the fragment declares itself include-once.
     */
    public boolean includeOnce() {
        return !includeOnceLines.isEmpty();
    }

    /**
     * Returns the distinct names referenced by this fragment, ordered by first occurrence.
     * Repeated directives for the same name collapse into one entry.
     *
     * @return The referenced names.
     */
    public Set<String> referencedNames() {
        Set<String> names = new LinkedHashSet<>();
        for (IncludeDirective directive : includes) {
            names.add(directive.name());
        }
        return names;
    }
}
