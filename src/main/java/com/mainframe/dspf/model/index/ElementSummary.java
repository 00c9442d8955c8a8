package com.mainframe.dspf.model.index;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsIndicator;
import com.mainframe.dspf.model.ElementKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flattened view of a field or constant inside its record's index entry.
 *
 * Pure structure only. Constant names are stored without their quotes,
 * and hidden fields report row and column 0.
 */
@Value
@Builder(toBuilder = true)
public class ElementSummary {

    @NonNull
    ElementKind kind;

    @NonNull
    String name;

    /**
     * Data type character for fields, null for constants.
     */
    Character type;

    int row;
    int column;
    int length;

    @Singular
    List<DdsAttribute> attributes;

    @Singular
    List<DdsIndicator> indicators;

    int lineIndex;
    int lastLineIndex;

    public List<String> getAttributeValues() {
        return attributes.stream()
                .map(DdsAttribute::getValue)
                .collect(Collectors.toList());
    }

    public boolean isField() {
        return kind == ElementKind.FIELD;
    }
}
