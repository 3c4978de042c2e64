/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.path;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * A single path-data command with its operands.
 *
 * @see  SVGPath
 * @see  <a href="https://www.w3.org/TR/SVG11/paths.html#PathData">SVG 1.1:
 *          8.3 Path Data</a>
 */
public final class PathSegment {


    public enum Type {
        MOVE_TO('M', 2),
        CLOSE_PATH('Z', 0),
        LINE_TO('L', 2),
        HORIZONTAL_LINE_TO('H', 1),
        VERTICAL_LINE_TO('V', 1),
        CURVE_TO('C', 6),
        SMOOTH_CURVE_TO('S', 4),
        QUADRATIC_BEZIER_TO('Q', 4),
        SMOOTH_QUADRATIC_BEZIER_TO('T', 2),
        ARC_TO('A', 7);

        private final char letter;
        private final int arity;

        private Type(char letter, int arity) {
            this.letter = letter;
            this.arity = arity;
        }

        /**
         * Number of operands a segment of this type takes.
         */
        public int arity() {
            return arity;
        }

        /**
         * {@code absolute ? 'M' : 'm'}, etc.
         */
        public char letter(boolean absolute) {
            return absolute ? letter : Character.toLowerCase(letter);
        }

        /**
         * @param   ch  command letter, either case
         * @return  the segment type for the given letter, or {@code null} if
         *          not a path-data command
         */
        public static Type forLetter(char ch) {
            switch (ch) {
            case 'M': case 'm': return MOVE_TO;
            case 'Z': case 'z': return CLOSE_PATH;
            case 'L': case 'l': return LINE_TO;
            case 'H': case 'h': return HORIZONTAL_LINE_TO;
            case 'V': case 'v': return VERTICAL_LINE_TO;
            case 'C': case 'c': return CURVE_TO;
            case 'S': case 's': return SMOOTH_CURVE_TO;
            case 'Q': case 'q': return QUADRATIC_BEZIER_TO;
            case 'T': case 't': return SMOOTH_QUADRATIC_BEZIER_TO;
            case 'A': case 'a': return ARC_TO;
            default: return null;
            }
        }

    } // enum Type


    private final Type type;
    private final boolean absolute;
    private final float[] operands;

    private final int hash;

    /**
     * @param   type  the segment type
     * @param   absolute  whether the operands are absolute coordinates
     * @param   operands  exactly {@code type.arity()} finite values
     * @throws  IllegalArgumentException  if the number of operands doesn't
     *          match the type arity, or an operand is not finite
     */
    public PathSegment(Type type, boolean absolute, float... operands) {
        this.type = Objects.requireNonNull(type, "null type");
        if (operands.length != type.arity()) {
            throw new IllegalArgumentException(type + " requires "
                    + type.arity() + " operands, got " + operands.length);
        }
        for (float value : operands) {
            if (!Float.isFinite(value))
                throw new IllegalArgumentException("Non-finite operand: " + value);
        }
        this.absolute = absolute;
        this.operands = operands.clone();
        this.hash = 31 * Objects.hash(type, absolute) + Arrays.hashCode(operands);
    }

    public Type type() {
        return type;
    }

    public boolean isAbsolute() {
        return absolute;
    }

    public char letter() {
        return type.letter(absolute);
    }

    public int operandCount() {
        return operands.length;
    }

    public float operand(int index) {
        return operands[index];
    }

    /**
     * @return  a copy of the operands
     */
    public float[] operands() {
        return operands.clone();
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PathSegment) {
            PathSegment other = (PathSegment) obj;
            return type == other.type
                    && absolute == other.absolute
                    && Arrays.equals(operands, other.operands);
        }
        return false;
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT)
                + (absolute ? "(abs, " : "(rel, ")
                + Arrays.toString(operands) + ")";
    }

}
