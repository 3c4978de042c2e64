/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.path;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import io.github.stanio.svgcodec.path.PathSegment.Type;

/**
 * A path composed of segments, as described in <a
 * href="https://www.w3.org/TR/SVG11/paths.html#PathData">SVG 1.1, 8.3 Path
 * Data</a>.
 * <p>
 * The parser is a simple tokenizer splitting on whitespace and commas:</p>
 * <pre>
 * <code>M 10,20 L 30 40 h 5 Z</code></pre>
 * <p>
 * Numbers packed without a separator, as in {@code M10-20}, are not split
 * and fail to parse.  A command letter may be directly followed by its first
 * operand ({@code M10,20}).</p>
 * <p>
 * {@link #toString()} writes the <i>canonical</i> form: a command letter is
 * written only where the command changes, and coordinate pairs following a
 * move-to are left as implicit line-to:</p>
 * <pre>
 * <code>L 1 1 L 2 2   →  L 1 1 2 2
 * M 0,0 L 5,5   →  M 0 0 5 5</code></pre>
 */
public class SVGPath {

    private static final Pattern SEPARATOR = Pattern.compile("[ \t\r\n,]");

    private static final Pattern NUMBER = Pattern
            .compile("[-+]? (?:\\d+ (?:\\.\\d*)? | \\.\\d+) (?:[eE][-+]?\\d+)?",
                     Pattern.COMMENTS);

    private final List<PathSegment> segments;

    /**
     * Constructs an empty path.
     */
    public SVGPath() {
        this.segments = new ArrayList<>();
    }

    public SVGPath(Collection<PathSegment> segments) {
        this.segments = new ArrayList<>(segments);
        if (this.segments.contains(null))
            throw new NullPointerException("null segment");
    }

    /**
     * Parses the given path data.
     *
     * @param   text  the path data
     * @return  a new path with the parsed segments
     * @throws  MalformedPathException  if the text contains an unrecognized
     *          command letter, an operand appears before the first command
     *          or after a close-path, or an operand is missing or is not
     *          a number
     */
    public static SVGPath valueOf(String text) {
        String[] tokens = SEPARATOR.split(text, -1);
        List<PathSegment> parsed = new ArrayList<>();

        Type type = null;
        boolean absolute = false;
        int index = 0;
        while (index < tokens.length) {
            String token = tokens[index];
            if (token.isEmpty()) {
                index++;
                continue;
            }

            char ch = token.charAt(0);
            if (Character.isLetter(ch)) {
                type = Type.forLetter(ch);
                if (type == null) {
                    throw new MalformedPathException("Unrecognized path command '"
                                                     + ch + "'", text);
                }
                absolute = Character.isUpperCase(ch);

                token = token.substring(1);
                if (token.isEmpty()) {
                    index++;
                } else {
                    tokens[index] = token;
                }
            } else if (type == Type.MOVE_TO) {
                // SVG 1.1, 8.3.2: subsequent pairs are implicit lineto commands
                type = Type.LINE_TO;
            } else if (type == null) {
                throw new MalformedPathException("Path data doesn't begin"
                        + " with a command (token #" + (index + 1) + ")", text);
            } else if (type == Type.CLOSE_PATH) {
                throw new MalformedPathException("Unexpected operand after"
                        + " close-path (token #" + (index + 1) + ")", text);
            }

            float[] operands = new float[type.arity()];
            for (int i = 0; i < operands.length; i++) {
                index = skipEmpty(tokens, index);
                if (index >= tokens.length) {
                    throw new MalformedPathException("Missing operand #" + (i + 1)
                            + " for '" + type.letter(absolute) + "' command", text);
                }
                operands[i] = parseOperand(tokens[index], index, text);
                index++;
            }
            parsed.add(new PathSegment(type, absolute, operands));
        }
        return new SVGPath(parsed);
    }

    private static int skipEmpty(String[] tokens, int index) {
        int i = index;
        while (i < tokens.length && tokens[i].isEmpty()) {
            i++;
        }
        return i;
    }

    private static float parseOperand(String token, int index, String source) {
        if (!NUMBER.matcher(token).matches()) {
            throw new MalformedPathException("Not a number \"" + token
                    + "\" (token #" + (index + 1) + ")", source);
        }

        float value;
        try {
            value = Float.parseFloat(token);
        } catch (NumberFormatException e) {
            throw new MalformedPathException("Not a number \"" + token
                    + "\" (token #" + (index + 1) + ")", source, e);
        }
        if (Float.isInfinite(value)) {
            throw new MalformedPathException("Number out of range \"" + token
                    + "\" (token #" + (index + 1) + ")", source);
        }
        return value;
    }

    /**
     * Returns a new, independent path with the same segments.  The copy is
     * obtained by re-parsing the {@linkplain #toString() canonical text}.
     */
    public SVGPath copy() {
        return valueOf(toString());
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public PathSegment get(int index) {
        return segments.get(index);
    }

    /**
     * Replaces the segment at the given position.
     *
     * @return  the segment previously at the given position
     */
    public PathSegment set(int index, PathSegment segment) {
        return segments.set(index, Objects.requireNonNull(segment));
    }

    public SVGPath add(PathSegment segment) {
        segments.add(Objects.requireNonNull(segment));
        return this;
    }

    /**
     * @return  unmodifiable view of the segments in drawing order
     */
    public List<PathSegment> segments() {
        return Collections.unmodifiableList(segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof SVGPath) {
            return segments.equals(((SVGPath) obj).segments);
        }
        return false;
    }

    /**
     * Returns the canonical path data text.  Every command letter and operand
     * is followed by a single space.
     */
    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        PathSegment prev = null;
        for (PathSegment segment : segments) {
            if (commandChanged(prev, segment)) {
                buf.append(segment.letter()).append(' ');
            }
            for (int i = 0, len = segment.operandCount(); i < len; i++) {
                buf.append(formatNumber(segment.operand(i))).append(' ');
            }
            prev = segment;
        }
        return buf.toString();
    }

    private static boolean commandChanged(PathSegment prev, PathSegment current) {
        if (prev == null || prev.isAbsolute() != current.isAbsolute())
            return true;

        Type type = current.type();
        if (prev.type() == type) {
            // Repeated move-to would read back as line-to,
            // and close-path has no operands to continue with.
            return type == Type.MOVE_TO || type == Type.CLOSE_PATH;
        }
        return !(prev.type() == Type.MOVE_TO && type == Type.LINE_TO);
    }

    static String formatNumber(float value) {
        if (value == (int) value) {
            return Integer.toString((int) value);
        }
        return new BigDecimal(Float.toString(value))
                .stripTrailingZeros().toPlainString();
    }

}
