package com.mainframe.dspf.model.index;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsSize;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-record mirror of the element tree: the record's attributes, its field and
 * constant summaries, its inclusive line range and its resolved size.
 */
@Data
@NoArgsConstructor
public class RecordSummary {
    private String name;
    private List<DdsAttribute> attributes = new ArrayList<>();
    private List<ElementSummary> fields = new ArrayList<>();
    private List<ElementSummary> constants = new ArrayList<>();
    private int startLineIndex;
    private int endLineIndex;
    private DdsSize size;

    public RecordSummary(String name, int startLineIndex, List<DdsAttribute> attributes) {
        this.name = name;
        this.startLineIndex = startLineIndex;
        this.attributes = attributes != null ? new ArrayList<>(attributes) : new ArrayList<>();
    }

    public boolean hasField(String fieldName) {
        return fields.stream().anyMatch(f -> f.getName().equals(fieldName));
    }

    public boolean hasConstant(String text) {
        return constants.stream().anyMatch(c -> c.getName().equals(text));
    }

    public Optional<ElementSummary> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    public Optional<ElementSummary> findConstant(String text) {
        return constants.stream().filter(c -> c.getName().equals(text)).findFirst();
    }

    public boolean containsLine(int index) {
        return index >= startLineIndex && index <= endLineIndex;
    }
}
