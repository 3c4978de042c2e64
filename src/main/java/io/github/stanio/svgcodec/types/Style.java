/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The value of a {@code style} attribute: CSS declarations.
 * <pre>
 * <code>&lt;rect style="fill: red; stroke:blue;" /></code></pre>
 * <p>
 * The canonical text joins the declarations without extra whitespace:
 * {@code fill:red;stroke:blue}.  Later declarations of the same property
 * replace earlier ones.</p>
 */
public final class Style {

    private static final Style EMPTY = new Style(Collections.emptyMap());

    private final Map<String, String> declarations;

    private Style(Map<String, String> declarations) {
        this.declarations = declarations;
    }

    /** An empty style. */
    public static Style empty() {
        return EMPTY;
    }

    /**
     * @param   text  {@code property: value; ...}
     * @return  the parsed style
     * @throws  IllegalArgumentException  if a declaration is missing the
     *          {@code :} separator, or the property name is empty
     */
    public static Style valueOf(String text) {
        Map<String, String> declarations = new LinkedHashMap<>();
        for (String item : splitDeclarations(text)) {
            if (item.isBlank())
                continue;

            int colon = item.indexOf(':');
            String property = (colon < 0) ? "" : item.substring(0, colon).strip();
            if (property.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid style declaration: \"" + item.strip() + "\"");
            }
            declarations.put(property, item.substring(colon + 1).strip());
        }
        return declarations.isEmpty() ? EMPTY
                                      : new Style(declarations);
    }

    /**
     * Splits on {@code ;} outside quoted strings and parentheses, as in
     * {@code fill:url('data:image/png;base64,...')}.  Backslash escapes
     * inside strings are honored.
     */
    private static List<String> splitDeclarations(String text) {
        List<String> items = new ArrayList<>();
        int start = 0;
        int depth = 0;
        char quote = 0;
        for (int i = 0, len = text.length(); i < len; i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                if (depth > 0) depth--;
            } else if (ch == ';' && depth == 0) {
                items.add(text.substring(start, i));
                start = i + 1;
            }
        }
        items.add(text.substring(start));
        return items;
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }

    @Override
    public int hashCode() {
        return declarations.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Style) {
            return declarations.equals(((Style) obj).declarations);
        }
        return false;
    }

    /**
     * Returns the canonical text.
     */
    @Override
    public String toString() {
        return declarations.entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(";"));
    }

}
