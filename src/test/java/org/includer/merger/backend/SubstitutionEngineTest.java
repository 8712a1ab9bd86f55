package org.includer.merger.backend;

import org.includer.merger.frontend.order.ProcessingOrder;
import org.includer.merger.frontend.scan.DirectiveScanner;
import org.includer.merger.frontend.scan.ScannedFragment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests directive replacement given a fixed processing order.
 */
@Tag("unit")
public class SubstitutionEngineTest {

    private final DirectiveScanner scanner = new DirectiveScanner(false);
    private final Map<String, ScannedFragment> fragments = new LinkedHashMap<>();

    @Test
    void firstDirectiveIsReplacedAndRepeatsAreDeleted() {
        add("main", "a\n#include <lib>\nb\n  #include <lib>\nc\n");
        add("lib", "LIB\n");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("lib", "main")));

        assertThat(merged).isEqualTo("a\nLIB\nb\nc\n");
    }

    @Test
    void includeOnceIsTrackedAcrossFragments() {
        add("main", "#include <left>\n#include <right>\n#include <common>\n");
        add("left", "#include <common>\nL\n");
        add("right", "#include <common>\nR\n");
        add("common", "#pragma once\nC\n");

        String merged = new SubstitutionEngine(fragments)
                .run(new ProcessingOrder("main", List.of("common", "left", "right", "main")));

        assertThat(merged).isEqualTo("C\nL\nR\n");
    }

    @Test
    void processingOrderDecidesWhichIncluderGetsAnIncludeOnceFragment() {
        add("main", "#include <left>\n#include <right>\n");
        add("left", "#include <common>\nL\n");
        add("right", "#include <common>\nR\n");
        add("common", "#pragma once\nC\n");

        String merged = new SubstitutionEngine(fragments)
                .run(new ProcessingOrder("main", List.of("common", "right", "left", "main")));

        assertThat(merged).isEqualTo("L\nC\nR\n");
    }

    @Test
    void lineBreakIsKeptWhenInsertedTextHasNone() {
        add("main", "#include <lib>\nnext\n");
        add("lib", "no newline");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("lib", "main")));

        assertThat(merged).isEqualTo("no newline\nnext\n");
    }

    @Test
    void trailingTextAfterDirectiveIsKept() {
        add("main", "#include <lib> // shared helpers\nnext\n");
        add("lib", "LIB\n");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("lib", "main")));

        assertThat(merged).isEqualTo("LIB\n// shared helpers\nnext\n");
    }

    @Test
    void trailingTextStaysOnItsOwnLineAfterTextWithoutNewline() {
        add("main", "#include <lib> // note\r\nnext\r\n");
        add("lib", "no newline");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("lib", "main")));

        assertThat(merged).isEqualTo("no newline\r\n// note\r\nnext\r\n");
    }

    @Test
    void pragmaOnceWithTrailingCommentKeepsOnlyTheComment() {
        add("main", "#include <left>\n#include <right>\n");
        add("left", "#include <common>\nL\n");
        add("right", "#include <common>\nR\n");
        add("common", "#pragma once // guard\nC\n");

        String merged = new SubstitutionEngine(fragments)
                .run(new ProcessingOrder("main", List.of("common", "left", "right", "main")));

        assertThat(merged).isEqualTo("// guard\nC\nL\nR\n");
    }

    @Test
    void emptyDependencyRemovesTheDirectiveLine() {
        add("main", "a\n#include <empty>\nb\n");
        add("empty", "");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("empty", "main")));

        assertThat(merged).isEqualTo("a\nb\n");
    }

    @Test
    void pragmaOnceLinesAreStrippedEverywhere() {
        add("main", "#pragma once\n#include <lib>\nmain\n");
        add("lib", "  #pragma once\r\nlib\r\n");

        String merged = new SubstitutionEngine(fragments).run(new ProcessingOrder("main", List.of("lib", "main")));

        assertThat(merged).isEqualTo("lib\r\nmain\n");
    }

    private void add(String name, String content) {
        fragments.put(name, scanner.scan(name, content));
    }
}
