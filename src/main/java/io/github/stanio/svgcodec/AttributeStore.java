/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes of a single element, in insertion order.
 * <p>
 * A value is either the raw text as read from markup, or a typed object
 * ({@code Style}, {@code TransformList}, {@code SVGPath}, ...).  Raw text is
 * coerced lazily by {@link #getTyped(String, AttributeType)}, and the typed
 * value replaces the text.  Values are written to markup using their
 * {@code toString()}.</p>
 * <p>
 * Not thread-safe.</p>
 */
public class AttributeStore {

    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * @return  the raw or typed value, or {@code null}
     */
    public Object get(String name) {
        return values.get(name);
    }

    /**
     * @return  the text form of the value, or {@code null}
     */
    public String getText(String name) {
        Object value = values.get(name);
        return (value == null) ? null : value.toString();
    }

    /**
     * Returns the named attribute as the given type.
     * <ul>
     * <li>A value already of the requested type is returned as is;</li>
     * <li>Any other non-null value is converted from its text form, and the
     *     result replaces it;</li>
     * <li>If the attribute is not set, or is {@code null}, the type's default
     *     value is stored and returned.</li>
     * </ul>
     *
     * @param   name  attribute name
     * @param   type  attribute type
     * @return  the typed value, never {@code null}
     * @throws  IllegalArgumentException  (from the type parser) if a present
     *          value cannot be converted
     */
    public <T> T getTyped(String name, AttributeType<T> type) {
        Objects.requireNonNull(name, "null name");
        Object value = values.get(name);
        if (type.isInstance(value)) {
            return type.cast(value);
        }

        T typed = (value == null) ? type.defaultValue()
                                  : type.parse(value.toString());
        values.put(name, typed);
        return typed;
    }

    /**
     * Sets an attribute.  A {@code null} value keeps the attribute position,
     * but it is not written to markup.
     *
     * @return  the previous value, or {@code null}
     */
    public Object set(String name, Object value) {
        return values.put(Objects.requireNonNull(name, "null name"), value);
    }

    /**
     * @return  the removed value, or {@code null}
     */
    public Object remove(String name) {
        return values.remove(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return  a snapshot of the attribute names, in insertion order
     */
    public List<String> names() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public String toString() {
        return "AttributeStore" + values;
    }

}
