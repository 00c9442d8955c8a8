package com.mainframe.dspf.parser;

import static com.mainframe.dspf.DdsSourceLine.comment;
import static com.mainframe.dspf.DdsSourceLine.constant;
import static com.mainframe.dspf.DdsSourceLine.keyword;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.dspf.DdsSourceLine;
import com.mainframe.dspf.model.core.context.DdsParserConfig;

class ContinuationResolverTest {

    private final ContinuationResolver resolver =
            new ContinuationResolver('-', new LineClassifier(DdsParserConfig.defaults()));

    @Test
    void testSingleLineText() {
        ContinuedText text = resolver.resolve(lines(constant(1, 2, "'Customer Inquiry'")), 0);

        assertThat(text.getText()).isEqualTo("'Customer Inquiry'");
        assertThat(text.getLastLineIndex()).isZero();
        assertThat(text.isUnterminated()).isFalse();
    }

    @Test
    void testConstantSplitOverTwoLines() {
        List<DdsLine> lines = lines(
                constant(6, 2, "'Opt Name of the customer that is -"),
                keyword("long'"));

        ContinuedText text = resolver.resolve(lines, 0);

        assertThat(text.getText()).isEqualTo("'Opt Name of the customer that is long'");
        assertThat(text.getLastLineIndex()).isEqualTo(1);
    }

    @Test
    void testMarkerDirectlyAfterTextJoinsWithoutBlank() {
        List<DdsLine> lines = lines(
                keyword("MSGCON(30 'Enter a valid cust-"),
                keyword("omer number')"));

        assertThat(resolver.resolve(lines, 0).getText())
                .isEqualTo("MSGCON(30 'Enter a valid customer number')");
    }

    @Test
    void testTrailingPaddingIsTrimmedPerSegment() {
        List<DdsLine> lines = lines(
                keyword("COLOR(RED) -").put(70, "   "),
                keyword("DSPATR(HI)   "));

        ContinuedText text = resolver.resolve(lines, 0);

        assertThat(text.getText()).isEqualTo("COLOR(RED) DSPATR(HI)");
    }

    @Test
    void testThreeLineContinuation() {
        List<DdsLine> lines = lines(
                constant(2, 1, "'A-"),
                keyword("B-"),
                keyword("C'"),
                keyword("INDARA"));

        ContinuedText text = resolver.resolve(lines, 0);

        assertThat(text.getText()).isEqualTo("'ABC'");
        assertThat(text.getLastLineIndex()).isEqualTo(2);
    }

    @Test
    void testCommentLinesInsideContinuationAreSkipped() {
        List<DdsLine> lines = lines(
                constant(2, 1, "'First -"),
                comment(" continued below"),
                keyword("second'"));

        ContinuedText text = resolver.resolve(lines, 0);

        assertThat(text.getText()).isEqualTo("'First second'");
        assertThat(text.getLastLineIndex()).isEqualTo(2);
    }

    @Test
    void testMarkerOnLastLineStopsAtEndOfDocument() {
        List<DdsLine> lines = lines(constant(2, 1, "'Dangling -"));

        ContinuedText text = resolver.resolve(lines, 0);

        assertThat(text.getText()).isEqualTo("'Dangling");
        assertThat(text.getLastLineIndex()).isZero();
        assertThat(text.isUnterminated()).isTrue();
    }

    @Test
    void testEmptyKeywordArea() {
        ContinuedText text = resolver.resolve(lines(DdsSourceLine.line()), 0);

        assertThat(text.isEmpty()).isTrue();
    }

    private static List<DdsLine> lines(DdsSourceLine... source) {
        List<DdsLine> lines = new ArrayList<>();
        for (int i = 0; i < source.length; i++) {
            lines.add(DdsLine.of(i, source[i].toString(), 5));
        }
        return lines;
    }
}
