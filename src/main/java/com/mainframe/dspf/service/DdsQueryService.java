package com.mainframe.dspf.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

import com.mainframe.dspf.model.DdsDocument;
import com.mainframe.dspf.model.core.context.DdsParserConfig;
import com.mainframe.dspf.model.index.ElementSummary;
import com.mainframe.dspf.model.index.RecordSummary;
import com.mainframe.dspf.parser.ContinuationResolver;
import com.mainframe.dspf.parser.DdsLine;
import com.mainframe.dspf.parser.LineClassifier;

/**
 * Lookup utilities over a parsed display file.
 *
 * Stateless: callers provide the document.
 */
public class DdsQueryService {

    private final DdsParserConfig config;
    private final ContinuationResolver continuationResolver;

    public DdsQueryService() {
        this(DdsParserConfig.defaults());
    }

    public DdsQueryService(DdsParserConfig config) {
        this.config = config;
        this.continuationResolver = new ContinuationResolver(config.getContinuationMarker(), new LineClassifier(config));
    }

    /**
     * Whether a record of that name exists (case-insensitive).
     */
    public boolean recordExists(DdsDocument document, String recordName) {
        return findRecord(document, recordName).isPresent();
    }

    /**
     * Find a record's index entry by name (case-insensitive). The first one wins.
     */
    public Optional<RecordSummary> findRecord(DdsDocument document, String recordName) {
        if (document == null) {
            return Optional.empty();
        }
        return document.findRecordSummary(recordName);
    }

    /**
     * The record whose line range contains the given 0-based line.
     */
    public Optional<RecordSummary> findRecordAtLine(DdsDocument document, int lineIndex) {
        if (document == null) {
            return Optional.empty();
        }
        return document.getRecordSummaries().stream()
                .filter(r -> r.containsLine(lineIndex))
                .findFirst();
    }

    public Optional<ElementSummary> findField(DdsDocument document, String recordName, String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return Optional.empty();
        }
        String needle = fieldName.trim().toUpperCase(Locale.ROOT);
        return findRecord(document, recordName).flatMap(r -> r.getFields().stream()
                .filter(f -> f.getName().toUpperCase(Locale.ROOT).equals(needle))
                .findFirst());
    }

    /**
     * Find a constant by its text, given with or without the surrounding quotes.
     */
    public Optional<ElementSummary> findConstant(DdsDocument document, String recordName, String text) {
        if (text == null) {
            return Optional.empty();
        }
        String needle = unquote(text);
        return findRecord(document, recordName).flatMap(r -> r.findConstant(needle));
    }

    /**
     * Names of the fields and constants of a record that carry the given keyword,
     * e.g. {@code COLOR} matches {@code COLOR(RED)}.
     */
    public List<String> findElementsWithAttribute(DdsDocument document, String recordName, String keyword) {
        List<String> names = new ArrayList<>();
        Optional<RecordSummary> record = findRecord(document, recordName);
        if (record.isEmpty() || keyword == null || keyword.isBlank()) {
            return names;
        }
        Stream.concat(record.get().getFields().stream(), record.get().getConstants().stream())
                .filter(e -> e.getAttributes().stream().anyMatch(a -> a.hasKeyword(keyword)))
                .map(ElementSummary::getName)
                .forEach(names::add);
        return names;
    }

    /**
     * Largest row count across the declared displays.
     */
    public int maxRows(DdsDocument document) {
        return document.getSizeAttributes().getMaxRows();
    }

    /**
     * Largest column count across the declared displays.
     */
    public int maxColumns(DdsDocument document) {
        return document.getSizeAttributes().getMaxColumns();
    }

    /**
     * Last physical line of a constant that starts on {@code startLineIndex}, following
     * continuation markers at the end of the keyword area.
     */
    public int findEndLineIndex(List<String> lines, int startLineIndex) {
        if (lines == null || startLineIndex < 0 || startLineIndex >= lines.size()) {
            return startLineIndex;
        }
        List<DdsLine> ddsLines = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            ddsLines.add(DdsLine.of(i, lines.get(i), config.getSequenceAreaWidth()));
        }
        return continuationResolver.resolve(ddsLines, startLineIndex).getLastLineIndex();
    }

    private static String unquote(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
