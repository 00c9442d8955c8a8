package com.mainframe.dspf.parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsElement;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.ElementKind;
import com.mainframe.dspf.model.core.context.ParseDiagnostics;
import com.mainframe.dspf.model.index.ElementSummary;
import com.mainframe.dspf.model.index.RecordSummary;

/**
 * Builds the per-record mirror of the element tree.
 *
 * Entries are opened while the element builder walks the source, so a record's own
 * keywords (and with them its subfile flag) are known before its first field. Field and
 * constant summaries, end lines and sizes are filled in once the walk is over.
 */
public class RecordIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(RecordIndexBuilder.class);

    private final List<RecordSummary> summaries = new ArrayList<>();
    private final Map<DdsRecord, RecordSummary> byRecord = new IdentityHashMap<>();

    public RecordSummary openRecord(DdsRecord record) {
        RecordSummary summary = new RecordSummary(record.getName(), record.getLineIndex(), record.getAttributes());
        summaries.add(summary);
        byRecord.put(record, summary);
        return summary;
    }

    /**
     * Adds a record-level keyword line to the running attribute list of an open entry.
     */
    public void accumulate(RecordSummary summary, DdsAttribute attribute) {
        summary.getAttributes().add(attribute);
    }

    /**
     * Files every field and constant under the nearest preceding record. Within one record
     * the first element of a given name wins; later ones are reported and skipped.
     */
    public void populate(List<DdsElement> elements, ParseDiagnostics diagnostics) {
        RecordSummary current = null;

        for (DdsElement element : elements) {
            if (element instanceof DdsRecord record) {
                current = byRecord.get(record);
            } else if (element instanceof DdsField field) {
                if (current == null) {
                    continue;
                }
                if (current.hasField(field.getName())) {
                    diagnostics.warn(field.getLineIndex(), "Duplicate field " + field.getName()
                            + " in record " + current.getName() + " ignored in record index");
                    continue;
                }
                current.getFields().add(summarize(field));
            } else if (element instanceof DdsConstant constant) {
                if (current == null) {
                    continue;
                }
                String text = constant.getUnquotedText();
                if (current.hasConstant(text)) {
                    diagnostics.warn(constant.getLineIndex(), "Duplicate constant '" + text
                            + "' in record " + current.getName() + " ignored in record index");
                    continue;
                }
                current.getConstants().add(summarize(constant));
            }
        }
    }

    /**
     * A record ends on the line before the next record starts; the last one ends on the
     * last line of the document. Written to both the records and their index entries.
     */
    public void assignEndLines(List<DdsRecord> records, int lineCount) {
        List<DdsRecord> ordered = records.stream()
                .sorted((a, b) -> Integer.compare(a.getLineIndex(), b.getLineIndex()))
                .collect(Collectors.toList());

        for (int i = 0; i < ordered.size(); i++) {
            DdsRecord record = ordered.get(i);
            int end = i + 1 < ordered.size() ? ordered.get(i + 1).getLineIndex() - 1 : lineCount - 1;
            record.setEndLineIndex(end);

            RecordSummary summary = byRecord.get(record);
            if (summary != null) {
                summary.setEndLineIndex(end);
            }
            log.debug("Record {} spans lines {}-{}", record.getName(), record.getLineIndex(), end);
        }
    }

    /**
     * Replaces each entry's running attribute list with the record's linked one and copies
     * the resolved size.
     */
    public void syncRecords(List<DdsRecord> records) {
        for (DdsRecord record : records) {
            RecordSummary summary = byRecord.get(record);
            if (summary != null) {
                summary.setAttributes(new ArrayList<>(record.getAttributes()));
                summary.setSize(record.getSize());
            }
        }
    }

    public List<RecordSummary> getSummaries() {
        return summaries;
    }

    private ElementSummary summarize(DdsField field) {
        return ElementSummary.builder()
                .kind(ElementKind.FIELD)
                .name(field.getName())
                .type(field.getType())
                .row(field.getRow() != null ? field.getRow() : 0)
                .column(field.getColumn() != null ? field.getColumn() : 0)
                .length(field.getLength())
                .attributes(nonEmpty(field.getAttributes()))
                .indicators(field.getIndicators())
                .lineIndex(field.getLineIndex())
                .lastLineIndex(field.getLastLineIndex())
                .build();
    }

    private ElementSummary summarize(DdsConstant constant) {
        String text = constant.getUnquotedText();
        return ElementSummary.builder()
                .kind(ElementKind.CONSTANT)
                .name(text)
                .row(constant.getRow())
                .column(constant.getColumn())
                .length(text.length())
                .attributes(nonEmpty(constant.getAttributes()))
                .indicators(constant.getIndicators())
                .lineIndex(constant.getLineIndex())
                .lastLineIndex(constant.getLastLineIndex())
                .build();
    }

    private static List<DdsAttribute> nonEmpty(List<DdsAttribute> attributes) {
        return attributes.stream()
                .filter(a -> a.getValue() != null && !a.getValue().isEmpty())
                .collect(Collectors.toList());
    }
}
