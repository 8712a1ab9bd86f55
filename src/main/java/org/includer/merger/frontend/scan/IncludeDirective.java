package org.includer.merger.frontend.scan;

/**
 * One {@code #include <NAME>} occurrence found while scanning a fragment.
 *
 * @param name      The referenced fragment name, without the angle brackets.
 * @param line      Zero-based index of the line holding the directive.
 * @param remainder Text of the line that survives the directive: empty when nothing but
 *                  whitespace follows the closing bracket, otherwise the trailing text
 *                  including the line terminator.
 * @param lineBreak The line terminator consumed together with the directive, or an empty
 *                  string if the line had none or keeps it in {@code remainder}.
 */
public record IncludeDirective(String name, int line, String remainder, String lineBreak) {
}
