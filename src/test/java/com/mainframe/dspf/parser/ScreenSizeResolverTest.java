package com.mainframe.dspf.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsFile;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.DdsSize;
import com.mainframe.dspf.model.DisplaySize;
import com.mainframe.dspf.model.FileSizeAttributes;
import com.mainframe.dspf.model.SizeSource;
import com.mainframe.dspf.model.core.context.ParseDiagnostics;

class ScreenSizeResolverTest {

    private final ScreenSizeResolver resolver = new ScreenSizeResolver(DisplaySize.DS3);
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testNoDspsizFallsBackToDefault() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("INDARA"), diagnostics);

        assertThat(sizes.isFallback()).isTrue();
        assertThat(sizes.getDisplayCount()).isEqualTo(1);
        assertThat(sizes.getPrimary()).isEqualTo(DisplaySize.DS3);
        assertThat(sizes.getSecondaryDisplay()).isEmpty();
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testPredefinedNames() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("DSPSIZ(*DS3 *DS4)"), diagnostics);

        assertThat(sizes.getDisplayCount()).isEqualTo(2);
        assertThat(sizes.getPrimary()).isEqualTo(DisplaySize.DS3);
        assertThat(sizes.getSecondary()).isEqualTo(DisplaySize.DS4);
        assertThat(sizes.getMaxRows()).isEqualTo(27);
        assertThat(sizes.getMaxColumns()).isEqualTo(132);
    }

    @Test
    void testExplicitGeometryWithNames() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("DSPSIZ(27 132 *DS4 24 80 *DS3)"), diagnostics);

        assertThat(sizes.getPrimary()).isEqualTo(new DisplaySize(27, 132, "*DS4"));
        assertThat(sizes.getSecondary()).isEqualTo(new DisplaySize(24, 80, "*DS3"));
        assertThat(sizes.isFallback()).isFalse();
    }

    @Test
    void testExplicitGeometryWithoutName() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("dspsiz(24 80)"), diagnostics);

        assertThat(sizes.getDisplayCount()).isEqualTo(1);
        assertThat(sizes.getPrimary()).isEqualTo(new DisplaySize(24, 80, ""));
    }

    @Test
    void testUnbalancedParenthesesFallBackWithWarning() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("DSPSIZ(24 80 *DS3"), diagnostics);

        assertThat(sizes.isFallback()).isTrue();
        assertThat(sizes.getPrimary()).isEqualTo(DisplaySize.DS3);
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("closing parenthesis");
    }

    @Test
    void testEmptyOrUnknownParametersFallBackWithWarning() {
        assertThat(resolver.resolveFileSize(file("DSPSIZ()"), diagnostics).isFallback()).isTrue();
        assertThat(resolver.resolveFileSize(file("DSPSIZ(*DS5)"), diagnostics).isFallback()).isTrue();
        assertThat(diagnostics.getWarnings()).hasSize(2);
    }

    @Test
    void testMoreThanTwoDisplaysKeepsFirstTwo() {
        FileSizeAttributes sizes = resolver.resolveFileSize(file("DSPSIZ(*DS3 *DS4 24 80)"), diagnostics);

        assertThat(sizes.getDisplayCount()).isEqualTo(2);
        assertThat(sizes.getSecondary()).isEqualTo(DisplaySize.DS4);
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("only the first 2");
    }

    @Test
    void testParseDisplaySizesThrowsOnMissingParenthesis() {
        DdsAttribute attribute = DdsAttribute.builder().lineIndex(4).value("DSPSIZ(24 80").build();

        assertThatThrownBy(() -> resolver.parseDisplaySizes(attribute))
                .isInstanceOf(DdsParseException.class)
                .hasFieldOrPropertyWithValue("lineIndex", 4);
    }

    @Test
    void testWindowRecordGetsWindowGeometry() {
        DdsRecord record = record("WIN1", "OVERLAY", "WINDOW(5 10 8 40)");

        DdsSize size = resolver.resolveRecordSize(record, FileSizeAttributes.fallback(DisplaySize.DS3), diagnostics);

        assertThat(size.getSource()).isEqualTo(SizeSource.WINDOW);
        assertThat(size.getRows()).isEqualTo(8);
        assertThat(size.getColumns()).isEqualTo(40);
        assertThat(size.getOriginRow()).isEqualTo(5);
        assertThat(size.getOriginColumn()).isEqualTo(10);
        assertThat(size.getName()).isEqualTo("WINDOW_5_10_8_40");
    }

    @Test
    void testPlainRecordGetsPrimaryDisplay() {
        FileSizeAttributes fileSize = FileSizeAttributes.of(DisplaySize.DS4, DisplaySize.DS3);

        DdsSize size = resolver.resolveRecordSize(record("MAIN", "OVERLAY"), fileSize, diagnostics);

        assertThat(size).isEqualTo(DdsSize.fromDisplay(DisplaySize.DS4));
        assertThat(size.getOriginRow()).isEqualTo(1);
        assertThat(size.getOriginColumn()).isEqualTo(1);
        assertThat(size.isWindow()).isFalse();
    }

    @Test
    void testWindowWithoutGeometryFallsBackWithWarning() {
        DdsRecord record = record("WIN2", "WINDOW(*DFT 5 30)");

        DdsSize size = resolver.resolveRecordSize(record, FileSizeAttributes.fallback(DisplaySize.DS3), diagnostics);

        assertThat(size.getSource()).isEqualTo(SizeSource.DEFAULT);
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("WIN2");
    }

    @Test
    void testWindowBorderKeywordIsNotAWindow() {
        DdsRecord record = record("WIN3", "WDWBORDER((*COLOR BLU))");

        DdsSize size = resolver.resolveRecordSize(record, FileSizeAttributes.fallback(DisplaySize.DS3), diagnostics);

        assertThat(size.getSource()).isEqualTo(SizeSource.DEFAULT);
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    private static DdsFile file(String... keywords) {
        DdsFile file = new DdsFile();
        for (String keyword : keywords) {
            file.addAttribute(DdsAttribute.builder().value(keyword).build());
        }
        return file;
    }

    private static DdsRecord record(String name, String... keywords) {
        DdsRecord record = DdsRecord.builder().name(name).attributes(List.of()).build();
        for (String keyword : keywords) {
            record.addAttribute(DdsAttribute.builder().value(keyword).build());
        }
        return record;
    }
}
