/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
/**
 * SVG path data parser and writer.  Notable classes include:
 * <ul>
 * <li>{@link io.github.stanio.svgcodec.path.SVGPath}
 * <li>{@link io.github.stanio.svgcodec.path.PathSegment}
 * </ul>
 * <p>Parsing is permissive about separators but doesn't split numbers
 * packed together ({@code M10-20}).  The written text is compacted to share
 * a command letter across consecutive segments of the same type.</p>
 */
package io.github.stanio.svgcodec.path;
