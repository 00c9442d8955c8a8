package com.mainframe.dspf.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsIndicator;
import com.mainframe.dspf.model.FieldUsage;

class DdsFormatUtilTest {

    @Test
    void testFormatIndicators() {
        String text = DdsFormatUtil.formatIndicators(List.of(DdsIndicator.of(5, false), DdsIndicator.of(12, true)));

        assertThat(text).isEqualTo("[N05 12]");
        assertThat(DdsFormatUtil.formatIndicators(List.of())).isEmpty();
        assertThat(DdsFormatUtil.formatIndicators(null)).isEmpty();
    }

    @Test
    void testFormatAttributes() {
        List<DdsAttribute> attributes = List.of(
                DdsAttribute.builder().value("DSPATR(HI)").indicators(List.of(DdsIndicator.of(30, true))).build(),
                DdsAttribute.builder().value("COLOR(RED)").build());

        assertThat(DdsFormatUtil.formatAttributes(attributes)).isEqualTo("[ 30] DSPATR(HI), COLOR(RED)");
    }

    @Test
    void testDescribeFieldWithDecimals() {
        DdsField field = DdsField.builder().name("AMOUNT").type('S').length(7).decimals(2).row(5).column(20).build();

        assertThat(DdsFormatUtil.describeField(field)).isEqualTo("(7:2)S [20,05]");
    }

    @Test
    void testDescribeHiddenField() {
        DdsField field = DdsField.builder().name("RRN").type('A').length(10).usage(FieldUsage.HIDDEN).build();

        assertThat(DdsFormatUtil.describeField(field)).isEqualTo("(10)A (Hidden)");
    }

    @Test
    void testDescribeReferencedField() {
        DdsField field = DdsField.builder().name("CUSTNAME").type(' ').referenced(true).row(5).column(20).build();

        assertThat(DdsFormatUtil.describeField(field)).isEqualTo("(Referenced) [20,05]");
    }

    @Test
    void testDescribeFieldWithoutPosition() {
        DdsField field = DdsField.builder().name("F1").type('A').length(3).build();

        assertThat(DdsFormatUtil.describeField(field)).isEqualTo("(3)A [--,--]");
    }

    @Test
    void testDescribeConstant() {
        DdsConstant constant = DdsConstant.builder().text("'Name'").row(5).column(20).build();

        assertThat(DdsFormatUtil.describeConstant(constant)).isEqualTo("[05,20]");
    }
}
