package com.mainframe.dspf.util;

import java.util.List;
import java.util.stream.Collectors;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsIndicator;

/**
 * Short human-readable descriptions of parsed elements, as shown next to them in
 * structure views and reports.
 */
public final class DdsFormatUtil {

    private DdsFormatUtil() {
    }

    /**
     * {@code [N05 12]}: negated indicators carry an N, active ones a blank, numbers are two digits.
     */
    public static String formatIndicators(List<DdsIndicator> indicators) {
        if (indicators == null || indicators.isEmpty()) {
            return "";
        }
        return indicators.stream()
                .map(i -> (i.isActive() ? " " : "N") + twoDigits(i.getNumber()))
                .collect(Collectors.joining("", "[", "]"));
    }

    /**
     * Attribute values separated by commas, each preceded by its indicators if it has any.
     */
    public static String formatAttributes(List<DdsAttribute> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }
        return attributes.stream()
                .map(a -> {
                    String indicators = formatIndicators(a.getIndicators());
                    return indicators.isEmpty() ? a.getValue() : indicators + " " + a.getValue();
                })
                .collect(Collectors.joining(", "));
    }

    /**
     * {@code (7:2)S [10,05]} with the column before the row, {@code (7)A (Hidden)} for hidden
     * fields and {@code (Referenced) [10,05]} for fields defined by reference.
     */
    public static String describeField(DdsField field) {
        String size = field.getDecimals() > 0
                ? "(" + field.getLength() + ":" + field.getDecimals() + ")"
                : "(" + field.getLength() + ")";
        String type = field.getType() == ' ' ? "" : String.valueOf(field.getType());

        if (field.isHidden()) {
            return size + type + " (Hidden)";
        }
        String position = "[" + twoDigits(field.getColumn()) + "," + twoDigits(field.getRow()) + "]";
        if (field.isReferenced()) {
            return "(Referenced) " + position;
        }
        return size + type + " " + position;
    }

    /**
     * {@code [05,20]}: row, then column.
     */
    public static String describeConstant(DdsConstant constant) {
        return "[" + twoDigits(constant.getRow()) + "," + twoDigits(constant.getColumn()) + "]";
    }

    private static String twoDigits(Integer value) {
        if (value == null) {
            return "--";
        }
        return value < 10 ? "0" + value : String.valueOf(value);
    }
}
