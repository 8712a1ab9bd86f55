package org.includer.merger.frontend.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stage 1: extracts {@code #include <NAME>} and {@code #pragma once} directives from a fragment.
 *
 * <p>This is a line-based scan. A directive is only recognized when it starts a line, after
 * optional spaces or tabs; directive text in the middle of a line (for example after
 * {@code //}) is plain content. Because matching is line-anchored, a directive standing on its
 * own line inside a block comment is still recognized unless comment-aware scanning is enabled.</p>
 */
public final class DirectiveScanner {

    private static final Logger log = LoggerFactory.getLogger(DirectiveScanner.class);

    // Horizontal whitespace: space, tab, form feed, vertical tab.
    private static final String HSPACE = "[ \\t\\f\\x0B]";

    private static final Pattern INCLUDE_PATTERN = Pattern.compile(
            "^" + HSPACE + "*#include" + HSPACE + "+<([A-Za-z0-9_.]+)>" + HSPACE + "*");
    private static final Pattern PRAGMA_ONCE_PATTERN = Pattern.compile(
            "^" + HSPACE + "*#pragma" + HSPACE + "+once\\b" + HSPACE + "*");

    private final boolean commentAware;

    /**
     * @param commentAware Whether directive lines inside block comments are skipped.
     */
    public DirectiveScanner(boolean commentAware) {
        this.commentAware = commentAware;
    }

    /**
     * Scans a fragment's raw content.
     *
     * @param name    The fragment name, carried into the result.
     * @param content The raw fragment text.
     * @return The directives found and the content split into lines.
     */
    public ScannedFragment scan(String name, String content) {
        List<String> lines = splitLines(content);
        List<IncludeDirective> includes = new ArrayList<>();
        Map<Integer, String> includeOnceLines = new LinkedHashMap<>();

        boolean inBlockComment = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String lineBreak = lineBreakOf(line);
            String body = line.substring(0, line.length() - lineBreak.length());

            boolean startsInComment = inBlockComment;
            if (commentAware) {
                inBlockComment = updateBlockCommentState(body, inBlockComment);
                if (startsInComment) continue;
            }

            Matcher includeMatcher = INCLUDE_PATTERN.matcher(body);
            if (includeMatcher.lookingAt()) {
                String tail = remainderOf(body, includeMatcher.end(), lineBreak);
                IncludeDirective directive = tail.isEmpty()
                        ? new IncludeDirective(includeMatcher.group(1), i, "", lineBreak)
                        : new IncludeDirective(includeMatcher.group(1), i, tail, "");
                includes.add(directive);
                continue;
            }

            Matcher pragmaMatcher = PRAGMA_ONCE_PATTERN.matcher(body);
            if (pragmaMatcher.lookingAt()) {
                includeOnceLines.put(i, remainderOf(body, pragmaMatcher.end(), lineBreak));
            }
        }

        log.trace("Scanned '{}': {} include directive(s), include-once={}",
                name, includes.size(), !includeOnceLines.isEmpty());
        return new ScannedFragment(name, lines, includes, includeOnceLines);
    }

    /**
     * Splits text into lines, keeping each line's {@code \n} or {@code \r\n} terminator.
     * The last line has no terminator if the text does not end with one; empty text has no lines.
     */
    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = content.indexOf('\n', start)) >= 0) {
            lines.add(content.substring(start, newline + 1));
            start = newline + 1;
        }
        if (start < content.length()) {
            lines.add(content.substring(start));
        }
        return lines;
    }

    /**
     * Text left on a line after a directive ending at {@code end}, with the line break, or an
     * empty string when nothing follows the directive.
     */
    private static String remainderOf(String body, int end, String lineBreak) {
        return end == body.length() ? "" : body.substring(end) + lineBreak;
    }

    private static String lineBreakOf(String line) {
        if (line.endsWith("\r\n")) return "\r\n";
        if (line.endsWith("\n")) return "\n";
        return "";
    }

    /**
     * Tracks whether the end of the given line lies inside a block comment.
     * Line comments ({@code //}) outside a block comment hide any {@code /*} after them.
     */
    private static boolean updateBlockCommentState(String body, boolean inBlockComment) {
        int i = 0;
        while (i < body.length()) {
            if (inBlockComment) {
                int end = body.indexOf("*/", i);
                if (end < 0) return true;
                inBlockComment = false;
                i = end + 2;
            } else {
                int start = body.indexOf("/*", i);
                int lineComment = body.indexOf("//", i);
                if (start < 0 || (lineComment >= 0 && lineComment < start)) return false;
                inBlockComment = true;
                i = start + 2;
            }
        }
        return inBlockComment;
    }
}
