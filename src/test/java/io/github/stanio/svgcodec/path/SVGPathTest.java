/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgcodec.path;

import static io.github.stanio.svgcodec.path.PathSegment.Type.ARC_TO;
import static io.github.stanio.svgcodec.path.PathSegment.Type.CLOSE_PATH;
import static io.github.stanio.svgcodec.path.PathSegment.Type.LINE_TO;
import static io.github.stanio.svgcodec.path.PathSegment.Type.MOVE_TO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Locale;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SVGPathTest {

    @Test
    void implicitLineToAfterMoveTo() {
        SVGPath path = SVGPath.valueOf("M 0,0 10,10 20,20");

        assertThat(path.segments()).as("segments")
                .containsExactly(new PathSegment(MOVE_TO, true, 0, 0),
                                 new PathSegment(LINE_TO, true, 10, 10),
                                 new PathSegment(LINE_TO, true, 20, 20));
    }

    @Test
    void implicitRelativeLineTo() {
        SVGPath path = SVGPath.valueOf("m 1 2 3 4");

        assertThat(path.segments()).as("segments")
                .containsExactly(new PathSegment(MOVE_TO, false, 1, 2),
                                 new PathSegment(LINE_TO, false, 3, 4));
    }

    @Test
    void commandLetterWithOperand() {
        SVGPath path = SVGPath.valueOf("M10,20 L30,40 Z");

        assertThat(path.segments()).as("segments")
                .containsExactly(new PathSegment(MOVE_TO, true, 10, 20),
                                 new PathSegment(LINE_TO, true, 30, 40),
                                 new PathSegment(CLOSE_PATH, true));
    }

    @Test
    void consecutiveSeparators() {
        SVGPath path = SVGPath.valueOf("\tM  1,,2\r\n  a 1 2 3 0 1 4 5 ");

        assertThat(path.segments()).as("segments")
                .containsExactly(new PathSegment(MOVE_TO, true, 1, 2),
                                 new PathSegment(ARC_TO, false, 1, 2, 3, 0, 1, 4, 5));
    }

    @Test
    void emptyPath() {
        SVGPath path = SVGPath.valueOf(" ");

        assertThat(path.isEmpty()).as("empty").isTrue();
        assertThat(path).hasToString("");
    }

    @Test
    void missingOperand() {
        assertThatThrownBy(() -> SVGPath.valueOf("C 1,2,3,4,5"))
                .isInstanceOf(MalformedPathException.class)
                .hasMessageContaining("Missing operand #6")
                .extracting(e -> ((MalformedPathException) e).getSource())
                .as("source")
                .isEqualTo("C 1,2,3,4,5");
    }

    @Test
    void unknownCommand() {
        assertThatThrownBy(() -> SVGPath.valueOf("K 1,2"))
                .isInstanceOf(MalformedPathException.class)
                .hasMessageContaining("'K'");
    }

    @Test
    void commandLetterInPlaceOfOperand() {
        assertThatThrownBy(() -> SVGPath.valueOf("M 0 0 L 5 Z"))
                .isInstanceOf(MalformedPathException.class)
                .hasMessageContaining("Not a number \"Z\"");
    }

    @Test
    void operandBeforeFirstCommand() {
        assertThatThrownBy(() -> SVGPath.valueOf("10 20"))
                .isInstanceOf(MalformedPathException.class);
    }

    @Test
    void operandAfterClosePath() {
        assertThatThrownBy(() -> SVGPath.valueOf("M 0 0 5 5 Z 10 10"))
                .isInstanceOf(MalformedPathException.class)
                .hasMessageContaining("close-path");
    }

    @ParameterizedTest
    @ValueSource(strings = { "L 1 x", "L 1 NaN", "L 0x10 1", "L 1f 2", "M10-20" })
    void nonNumericOperand(String text) {
        assertThatThrownBy(() -> SVGPath.valueOf(text))
                .isInstanceOf(MalformedPathException.class);
    }

    @Test
    void floatOverflow() {
        assertThatThrownBy(() -> SVGPath.valueOf("M 1e39 0"))
                .isInstanceOf(MalformedPathException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void compactRepeatedCommands() {
        assertThat(SVGPath.valueOf("L 1 1 L 2 2"))
                .hasToString("L 1 1 2 2 ");
    }

    @Test
    void explicitLineToAfterMoveTo() {
        assertThat(SVGPath.valueOf("M 0,0 L 5,5"))
                .hasToString("M 0 0 5 5 ");
    }

    @Test
    void absoluteRelativeSwitch() {
        assertThat(SVGPath.valueOf("L 1 1 l 2 2 L 3 3"))
                .hasToString("L 1 1 l 2 2 L 3 3 ");
    }

    @Test
    void repeatedMoveTo() {
        SVGPath path = SVGPath.valueOf("M 0 0 M 5 5");

        assertThat(path).hasToString("M 0 0 M 5 5 ");
        assertThat(path.copy()).as("copy").isEqualTo(path);
    }

    @Test
    void repeatedClosePath() {
        assertThat(SVGPath.valueOf("M 0 0 1 1 z z").size())
                .as("size after round-trip")
                .isEqualTo(SVGPath.valueOf("M 0 0 1 1 z z").copy().size())
                .isEqualTo(4);
    }

    @Test
    void numberFormat() {
        assertThat(SVGPath.valueOf("L 0.50 -0.25 1e2 .5 l +3. -0 1.5E-5 12345678"))
                .hasToString("L 0.5 -0.25 100 0.5 l 3 0 0.000015 12345678 ");
    }

    @Test
    void numberFormatLocaleIndependent() {
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            assertThat(SVGPath.valueOf("M 0.5,1.25"))
                    .hasToString("M 0.5 1.25 ");
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "M 10 20 30 40 Z ",
        "m 1.5 -2 3 4 h 5 v -6 z ",
        "M 0 0 C 1 2 3 4 5 6 S 7 8 9 10 Q 1 2 3 4 T 5 6 A 25 25 -30 0 1 50 -25 Z ",
        "M 0 0 H 10 20 V 5 L 0 0 M 2 2 l 1 1 Z M 4 4 ",
        ""
    })
    void canonicalRoundTrip(String canonical) {
        assertThat(SVGPath.valueOf(canonical)).hasToString(canonical);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "M 10,20 L 30,40 L 50 60 z",
        "M0,0 l 1,1 L 2,2 l 3 3 h1 h 2",
        "m 0 0 0.10 0.20 c 1 1 2 2 3 3 4 4 5 5 6 6",
    })
    void idempotentSerialization(String text) {
        String canonical = SVGPath.valueOf(text).toString();

        assertThat(SVGPath.valueOf(canonical)).hasToString(canonical);
    }

    @Test
    void copyIsIndependent() {
        SVGPath path = SVGPath.valueOf("M 0 0 L 10 10");
        SVGPath copy = path.copy();

        copy.set(1, new PathSegment(LINE_TO, true, 5, 5));

        assertThat(path.get(1)).as("original segment")
                .isEqualTo(new PathSegment(LINE_TO, true, 10, 10));
        assertThat(copy).as("copy").isNotEqualTo(path);
    }

    @Test
    void buildProgrammatically() {
        SVGPath path = new SVGPath()
                .add(new PathSegment(MOVE_TO, false, 1, 1))
                .add(new PathSegment(LINE_TO, false, 2, 0))
                .add(new PathSegment(CLOSE_PATH, false));

        assertThat(path).hasToString("m 1 1 2 0 z ");
    }

    @Test
    void segmentsView() {
        SVGPath path = SVGPath.valueOf("M 0 0");

        assertThatThrownBy(() -> path.segments().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

}
