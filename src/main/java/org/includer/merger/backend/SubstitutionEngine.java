package org.includer.merger.backend;

import org.includer.merger.frontend.order.ProcessingOrder;
import org.includer.merger.frontend.scan.IncludeDirective;
import org.includer.merger.frontend.scan.ScannedFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 4: replaces include directives with the merged text of the included fragments.
 *
 * <p>Fragments are processed in {@link ProcessingOrder}, so the merged text of every included
 * fragment is complete before it is inserted. Within one fragment, the first directive for a name
 * receives that fragment's merged text and later directives for the same name are deleted. A
 * fragment that declares {@code #pragma once} is inserted at most once per merge: once it has been
 * inserted anywhere, all further directives for it are deleted. {@code #pragma once} declarations
 * are removed from the output; text after the declaration on the same line is kept.</p>
 *
 * <p>An engine instance holds the state of exactly one merge and is discarded afterwards.</p>
 */
public final class SubstitutionEngine {

    private static final Logger log = LoggerFactory.getLogger(SubstitutionEngine.class);

    private final Map<String, ScannedFragment> fragments;
    private final Map<String, String> merged = new HashMap<>();
    private final Set<String> visited = new HashSet<>();

    /**
     * @param fragments Scan results of all registered fragments, keyed by name.
     */
    public SubstitutionEngine(Map<String, ScannedFragment> fragments) {
        this.fragments = fragments;
    }

    /**
     * Merges all fragments in the given order.
     *
     * @param order A processing order over exactly the fragments given to this engine.
     * @return The merged text of the root fragment.
     */
    public String run(ProcessingOrder order) {
        for (String name : order.order()) {
            merged.put(name, substitute(fragments.get(name)));
        }
        return merged.get(order.root());
    }

    private String substitute(ScannedFragment fragment) {
        Map<Integer, IncludeDirective> directivesByLine = new HashMap<>();
        for (IncludeDirective directive : fragment.includes()) {
            directivesByLine.put(directive.line(), directive);
        }

        Set<String> substitutedHere = new HashSet<>();
        StringBuilder out = new StringBuilder();
        List<String> lines = fragment.lines();
        for (int i = 0; i < lines.size(); i++) {
            String pragmaRemainder = fragment.includeOnceLines().get(i);
            if (pragmaRemainder != null) {
                out.append(pragmaRemainder);
                continue;
            }

            IncludeDirective directive = directivesByLine.get(i);
            if (directive == null) {
                out.append(lines.get(i));
                continue;
            }

            if (substitutedHere.add(directive.name())) {
                insert(out, fragment.name(), directive);
            }
            out.append(directive.remainder());
        }
        return out.toString();
    }

    private void insert(StringBuilder out, String into, IncludeDirective directive) {
        String name = directive.name();
        if (fragments.get(name).includeOnce() && visited.contains(name)) {
            log.trace("Skipping '{}' in '{}': include-once and already inserted", name, into);
            return;
        }
        visited.add(name);

        String text = merged.get(name);
        out.append(text);
        if (!text.isEmpty() && !text.endsWith("\n")) {
            out.append(lineBreakAfterInsertion(directive));
        }
        log.trace("Inserted '{}' into '{}'", name, into);
    }

    /**
     * The line break that separates inserted text lacking a final newline from whatever the
     * directive line leaves behind.
     */
    private static String lineBreakAfterInsertion(IncludeDirective directive) {
        if (!directive.lineBreak().isEmpty()) return directive.lineBreak();
        String remainder = directive.remainder();
        if (remainder.isEmpty()) return "";
        return remainder.endsWith("\r\n") ? "\r\n" : "\n";
    }
}
