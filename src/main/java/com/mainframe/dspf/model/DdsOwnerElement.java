package com.mainframe.dspf.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An element that attributes can be attached to: the file, a record, a field or a constant.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public abstract class DdsOwnerElement extends DdsElement {
    protected List<DdsAttribute> attributes = new ArrayList<>();

    protected DdsOwnerElement(int lineIndex, List<DdsAttribute> attributes) {
        super(lineIndex);
        this.attributes = attributes != null ? new ArrayList<>(attributes) : new ArrayList<>();
    }

    public void addAttribute(DdsAttribute attribute) {
        attributes.add(attribute);
    }

    public boolean hasKeyword(String keyword) {
        return attributes.stream().anyMatch(a -> a.hasKeyword(keyword));
    }

    /**
     * Attribute texts in attachment order, empty values dropped.
     */
    public List<String> getAttributeValues() {
        return attributes.stream()
                .map(DdsAttribute::getValue)
                .filter(v -> v != null && !v.isEmpty())
                .collect(Collectors.toList());
    }
}
