package org.includer.merger.api;

import org.includer.merger.backend.SubstitutionEngine;
import org.includer.merger.frontend.graph.DependencyGraph;
import org.includer.merger.frontend.graph.GraphBuilder;
import org.includer.merger.frontend.order.ProcessingOrder;
import org.includer.merger.frontend.order.TopologicalOrderer;
import org.includer.merger.frontend.scan.DirectiveScanner;
import org.includer.merger.frontend.scan.ScannedFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges a set of named source fragments into one text by resolving {@code #include <NAME>}
 * directives.
 *
 * <p>Fragments are registered with {@link #add(String, String)}. A fragment includes another one
 * by a line of the form {@code #include <NAME>}, where {@code NAME} is the registered name (for
 * example {@code #include <lighting.glsl>}). A fragment that contains a {@code #pragma once} line
 * is inserted at most once in the merged output, however many fragments include it.</p>
 *
 * <p>Exactly one fragment, the root, must not be included by any other fragment; the merged
 * output is the root with all its includes resolved. Registration does no validation: all errors
 * are reported by {@link #merge()}.</p>
 *
 * <p>Instances are not thread-safe. The registry may be changed between merges, never during one.</p>
 */
public class IncludeMerger {

    private static final Logger log = LoggerFactory.getLogger(IncludeMerger.class);

    private final Map<String, String> sources = new LinkedHashMap<>();
    private final MergeOptions options;

    /**
     * Creates a merger with line-anchored directive matching.
     */
    public IncludeMerger() {
        this(MergeOptions.DEFAULTS);
    }

    /**
     * @param options Scanning options applied to every merge.
     */
    public IncludeMerger(MergeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Adds a source. Its content replaces every {@code #include <name>} directive that refers to it.
     * Adding a name that is already registered replaces the previous content.
     *
     * @param name    The name of the source.
     * @param content The content of the source.
     */
    public void add(String name, String content) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        sources.put(name, content);
    }

    /**
     * Removes a source.
     *
     * @param name The name of the source.
     * @return {@code true} if a source was registered under that name.
     */
    public boolean remove(String name) {
        return sources.remove(name) != null;
    }

    /**
     * @param name The name of the source.
     * @return The raw registered content, or empty if nothing is registered under that name.
     */
    public Optional<String> get(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public boolean contains(String name) {
        return sources.containsKey(name);
    }

    /**
     * @return The registered names, in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(sources.keySet());
    }

    /**
     * Merges all registered sources into one.
     *
     * @return The root source with every include directive resolved and {@code #pragma once} removed.
     * @throws MissingDependencyException If a source includes a name that is not registered.
     * @throws AmbiguousRootException     If not exactly one source is left un-included.
     * @throws CyclicDependencyException If sources include each other in a cycle.
     */
    public String merge() throws MergeException {
        Map<String, ScannedFragment> scanned = scanAll();
        ProcessingOrder order = orderOf(scanned);
        String result = new SubstitutionEngine(scanned).run(order);
        log.debug("Merged {} fragment(s) into '{}' ({} chars)", scanned.size(), order.root(), result.length());
        return result;
    }

    /**
     * Same as {@link #merge()}.
     *
     * @return The merged text.
     * @throws MergeException If the registered sources do not form a valid include graph.
     */
    public String build() throws MergeException {
        return merge();
    }

    /**
     * Validates the registered sources and returns the order in which they would be merged,
     * without producing output.
     *
     * @return The processing order, dependencies first and the root last.
     * @throws MergeException If the registered sources do not form a valid include graph.
     */
    public ProcessingOrder resolveOrder() throws MergeException {
        return orderOf(scanAll());
    }

    private Map<String, ScannedFragment> scanAll() {
        DirectiveScanner scanner = new DirectiveScanner(options.commentAware());
        Map<String, ScannedFragment> scanned = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : sources.entrySet()) {
            scanned.put(entry.getKey(), scanner.scan(entry.getKey(), entry.getValue()));
        }
        return scanned;
    }

    private ProcessingOrder orderOf(Map<String, ScannedFragment> scanned) throws MergeException {
        DependencyGraph graph = GraphBuilder.build(scanned);
        ProcessingOrder order = TopologicalOrderer.order(graph);
        log.debug("Processing order (root '{}'): {}", order.root(), order.order());
        return order;
    }
}
