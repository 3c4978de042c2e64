/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec;

import static org.apache.batik.util.SVGConstants.SVG_D_ATTRIBUTE;
import static org.apache.batik.util.SVGConstants.SVG_PATH_TAG;

import io.github.stanio.svgcodec.path.SVGPath;

/**
 * {@code <path d="..." />}
 */
public class SVGPathElement extends SVGElement {

    public SVGPathElement() {
        super(SVG_PATH_TAG);
    }

    public SVGPathElement(String id) {
        super(SVG_PATH_TAG, id);
    }

    /**
     * Returns the {@code d} attribute value, parsing it if it has been read
     * as text.  If no path data has been set, an empty path is created and
     * set.
     *
     * @throws  io.github.stanio.svgcodec.path.MalformedPathException  if the
     *          attribute text is not valid path data
     */
    public SVGPath getPath() {
        return attributes().getTyped(SVG_D_ATTRIBUTE, AttributeType.PATH);
    }

    public void setPath(SVGPath path) {
        attributes().set(SVG_D_ATTRIBUTE, path);
    }

}
