/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The value of a {@code transform} attribute.
 * <pre>
 * <code>&lt;g transform="translate(10, 20) rotate(45)" /></code></pre>
 * <p>
 * Only the syntax is checked: known function names with the allowed number
 * of numeric arguments.  The canonical text separates functions with a
 * single space, and arguments with a comma.</p>
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/coords.html#TransformAttribute"
 *          >SVG 1.1: The 'transform' attribute</a>
 */
public final class TransformList {

    private static final TransformList EMPTY = new TransformList(Collections.emptyList());

    private static final Pattern FUNCTION = Pattern
            .compile("\\s* ,? \\s* ([A-Za-z]+) \\s* \\( ([^)]*) \\) \\s*", Pattern.COMMENTS);

    private static final Pattern ARG_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+");

    private static final Pattern NUMBER = Pattern
            .compile("[-+]? (?:\\d+ (?:\\.\\d*)? | \\.\\d+) (?:[eE][-+]?\\d+)?",
                     Pattern.COMMENTS);

    /** Function name to allowed argument counts. */
    private static final Map<String, List<Integer>> ARITY =
            Map.of("matrix", List.of(6),
                   "translate", List.of(1, 2),
                   "scale", List.of(1, 2),
                   "rotate", List.of(1, 3),
                   "skewX", List.of(1),
                   "skewY", List.of(1));

    private final List<String> functions;

    private TransformList(List<String> functions) {
        this.functions = functions;
    }

    /** An empty (identity) transform list. */
    public static TransformList empty() {
        return EMPTY;
    }

    /**
     * @param   text  transform list text
     * @return  the parsed transform list
     * @throws  IllegalArgumentException  if the text is not a sequence of
     *          transform functions with numeric arguments
     */
    public static TransformList valueOf(String text) {
        if (text.isBlank())
            return EMPTY;

        List<String> functions = new ArrayList<>();
        Matcher m = FUNCTION.matcher(text);
        int end = 0;
        while (end < text.length()) {
            if (!m.find(end) || m.start() != end) {
                throw new IllegalArgumentException("Invalid transform list: \""
                        + text + "\" (at index " + end + ")");
            }
            functions.add(function(m.group(1), m.group(2), text));
            end = m.end();
        }
        return new TransformList(Collections.unmodifiableList(functions));
    }

    private static String function(String name, String args, String source) {
        List<Integer> arity = ARITY.get(name);
        if (arity == null) {
            throw new IllegalArgumentException("Unknown transform function \""
                    + name + "\": \"" + source + "\"");
        }

        String[] values = args.isBlank() ? new String[0]
                                         : ARG_SEPARATOR.split(args.strip());
        if (!arity.contains(values.length)) {
            throw new IllegalArgumentException(name + "() takes " + arity
                    + " arguments, got " + values.length + ": \"" + source + "\"");
        }
        for (String item : values) {
            if (!NUMBER.matcher(item).matches()) {
                throw new IllegalArgumentException("Not a number \"" + item
                        + "\" in " + name + "(): \"" + source + "\"");
            }
        }
        return name + "(" + String.join(",", values) + ")";
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    @Override
    public int hashCode() {
        return functions.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof TransformList) {
            return functions.equals(((TransformList) obj).functions);
        }
        return false;
    }

    /**
     * Returns the canonical text.
     */
    @Override
    public String toString() {
        return String.join(" ", functions);
    }

}
