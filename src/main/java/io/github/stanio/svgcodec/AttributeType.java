/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

import io.github.stanio.svgcodec.path.SVGPath;
import io.github.stanio.svgcodec.types.Style;
import io.github.stanio.svgcodec.types.TransformList;

/**
 * Describes how a raw attribute text is coerced into a typed value, and the
 * value to materialize when the attribute is not present.
 *
 * @param   <T>  the value type
 * @see     AttributeStore#getTyped(String, AttributeType)
 */
public final class AttributeType<T> {

    /** {@code style="..."} */
    public static final AttributeType<Style> STYLE =
            of(Style.class, Style::valueOf, Style::empty);

    /** {@code transform="..."} */
    public static final AttributeType<TransformList> TRANSFORM =
            of(TransformList.class, TransformList::valueOf, TransformList::empty);

    /** {@code d="..."} */
    public static final AttributeType<SVGPath> PATH =
            of(SVGPath.class, SVGPath::valueOf, SVGPath::new);

    private final Class<T> valueType;
    private final Function<String, ? extends T> parser;
    private final Supplier<? extends T> defaultValue;

    private AttributeType(Class<T> valueType,
                          Function<String, ? extends T> parser,
                          Supplier<? extends T> defaultValue) {
        this.valueType = Objects.requireNonNull(valueType, "null valueType");
        this.parser = Objects.requireNonNull(parser, "null parser");
        this.defaultValue = Objects.requireNonNull(defaultValue, "null defaultValue");
    }

    /**
     * @param   valueType  the typed value class
     * @param   parser  creates a value from raw attribute text
     * @param   defaultValue  creates the value to use for an absent attribute;
     *          may return a shared instance only if the value is immutable
     */
    public static <T> AttributeType<T> of(Class<T> valueType,
                                          Function<String, ? extends T> parser,
                                          Supplier<? extends T> defaultValue) {
        return new AttributeType<>(valueType, parser, defaultValue);
    }

    public Class<T> valueType() {
        return valueType;
    }

    boolean isInstance(Object value) {
        return valueType.isInstance(value);
    }

    T cast(Object value) {
        return valueType.cast(value);
    }

    T parse(String text) {
        return Objects.requireNonNull(parser.apply(text),
                () -> valueType.getSimpleName() + " parser returned null");
    }

    T defaultValue() {
        return Objects.requireNonNull(defaultValue.get(),
                () -> valueType.getSimpleName() + " default is null");
    }

    @Override
    public String toString() {
        return "AttributeType(" + valueType.getSimpleName() + ")";
    }

}
