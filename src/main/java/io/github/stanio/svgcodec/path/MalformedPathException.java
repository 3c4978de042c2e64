/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.path;

/**
 * Signals path data that could not be parsed: unrecognized command letter,
 * missing operand, or an operand that is not a number.
 */
public class MalformedPathException extends IllegalArgumentException {

    private static final long serialVersionUID = 4093184729364011520L;

    private final String source;

    public MalformedPathException(String message, String source) {
        super(message + ": \"" + source + "\"");
        this.source = source;
    }

    public MalformedPathException(String message, String source, Throwable cause) {
        super(message + ": \"" + source + "\"", cause);
        this.source = source;
    }

    /**
     * @return  the complete path data text that failed to parse
     */
    public String getSource() {
        return source;
    }

}
