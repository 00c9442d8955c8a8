package com.mainframe.dspf.model;

import com.mainframe.dspf.model.core.context.ParseDiagnostics;
import com.mainframe.dspf.model.index.RecordSummary;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of one parse: the element tree, the per-record index and the display sizes.
 *
 * The element list starts with the file and holds records, fields and constants in
 * source order. Attribute lines are not listed; they live in their owners' attribute lists.
 */
@Value
@Builder
public class DdsDocument {
    DdsFile file;
    List<DdsElement> elements;
    List<RecordSummary> recordSummaries;
    FileSizeAttributes sizeAttributes;
    int lineCount;
    ParseDiagnostics diagnostics;

    public List<DdsRecord> getRecords() {
        return elementsOfType(DdsRecord.class);
    }

    public List<DdsField> getFields() {
        return elementsOfType(DdsField.class);
    }

    public List<DdsConstant> getConstants() {
        return elementsOfType(DdsConstant.class);
    }

    public List<String> getRecordNames() {
        return getRecords().stream().map(DdsRecord::getName).collect(Collectors.toList());
    }

    /**
     * Find a record by name (case-insensitive). The first one wins if a name repeats.
     */
    public Optional<DdsRecord> findRecord(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String needle = name.trim().toUpperCase(Locale.ROOT);
        return getRecords().stream()
                .filter(r -> r.getName() != null && r.getName().toUpperCase(Locale.ROOT).equals(needle))
                .findFirst();
    }

    public Optional<RecordSummary> findRecordSummary(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String needle = name.trim().toUpperCase(Locale.ROOT);
        return recordSummaries.stream()
                .filter(r -> r.getName() != null && r.getName().toUpperCase(Locale.ROOT).equals(needle))
                .findFirst();
    }

    public List<DdsField> getFields(String recordName) {
        return getFields().stream()
                .filter(f -> recordName != null && recordName.equals(f.getRecordName()))
                .collect(Collectors.toList());
    }

    public List<DdsConstant> getConstants(String recordName) {
        return getConstants().stream()
                .filter(c -> recordName != null && recordName.equals(c.getRecordName()))
                .collect(Collectors.toList());
    }

    private <T extends DdsElement> List<T> elementsOfType(Class<T> type) {
        return elements.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
