package com.mainframe.dspf.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsElement;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsFile;
import com.mainframe.dspf.model.DdsIndicator;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.FieldUsage;
import com.mainframe.dspf.model.core.context.DdsParserConfig;
import com.mainframe.dspf.model.core.context.ParseDiagnostics;
import com.mainframe.dspf.model.index.RecordSummary;

/**
 * Turns classified lines into elements, one logical unit at a time.
 *
 * Building only:
 * - Creates the file, record, field, constant and attribute elements in source order
 * - Opens record index entries as records appear
 * - Reports diagnostics
 *
 * It does NOT attach keyword lines to their owners or compute end lines and sizes.
 */
public class DdsElementBuilder {
    private static final Logger log = LoggerFactory.getLogger(DdsElementBuilder.class);

    private final LineClassifier classifier;
    private final IndicatorDecoder indicatorDecoder;
    private final ContinuationResolver continuationResolver;
    private final SubfileCoordinateAdapter subfileAdapter;
    private final RecordIndexBuilder indexBuilder;

    private DdsRecord currentRecord;
    private RecordSummary currentSummary;
    private boolean recordHasContent;

    public DdsElementBuilder(DdsParserConfig config, RecordIndexBuilder indexBuilder) {
        this.classifier = new LineClassifier(config);
        this.indicatorDecoder = new IndicatorDecoder(config.getNegationMarker());
        this.continuationResolver = new ContinuationResolver(config.getContinuationMarker(), classifier);
        this.subfileAdapter = new SubfileCoordinateAdapter(config.getSubfileKeyword());
        this.indexBuilder = indexBuilder;
    }

    public List<DdsElement> build(List<DdsLine> lines, DdsFile file, ParseDiagnostics diagnostics) {
        List<DdsElement> elements = new ArrayList<>();
        elements.add(file);

        int index = 0;
        while (index < lines.size()) {
            DdsLine line = lines.get(index);
            LineKind kind = classifier.classify(line);

            index = switch (kind) {
                case RECORD -> buildRecord(lines, line, elements, diagnostics);
                case FIELD -> buildField(lines, line, elements, diagnostics);
                case CONSTANT -> buildConstant(lines, line, elements, diagnostics);
                case ATTRIBUTE -> buildAttribute(lines, line, elements, diagnostics);
                case COMMENT, BLANK -> index + 1;
            };
        }
        return elements;
    }

    private int buildRecord(List<DdsLine> lines, DdsLine line, List<DdsElement> elements,
                            ParseDiagnostics diagnostics) {
        String name = line.sliceTrimmed(DdsColumns.NAME_START, DdsColumns.NAME_END);
        if (name.isEmpty()) {
            diagnostics.warn(line.getIndex(), "Record header without a name");
        }

        ContinuedText keywords = resolve(lines, line, diagnostics);
        DdsRecord record = DdsRecord.builder()
                .name(name)
                .lineIndex(line.getIndex())
                .endLineIndex(line.getIndex())
                .build();
        if (!keywords.isEmpty()) {
            record.addAttribute(DdsAttribute.builder()
                    .lineIndex(line.getIndex())
                    .lastLineIndex(keywords.getLastLineIndex())
                    .value(keywords.getText())
                    .build());
        }

        elements.add(record);
        currentRecord = record;
        currentSummary = indexBuilder.openRecord(record);
        recordHasContent = false;

        log.debug("Parsed record: {} at line {}", name, line.getIndex() + 1);
        return keywords.getLastLineIndex() + 1;
    }

    private int buildField(List<DdsLine> lines, DdsLine line, List<DdsElement> elements,
                           ParseDiagnostics diagnostics) {
        String name = line.sliceTrimmed(DdsColumns.NAME_START, DdsColumns.NAME_END);
        FieldUsage usage = FieldUsage.fromCode(line.charAt(DdsColumns.USAGE));
        List<DdsIndicator> indicators = indicatorDecoder.decode(line);

        Integer row = null;
        Integer column = null;
        if (usage != FieldUsage.HIDDEN) {
            ScreenPosition position = subfileAdapter.adapt(isSubfile(),
                    line.number(DdsColumns.ROW_START, DdsColumns.ROW_END),
                    line.number(DdsColumns.COLUMN_START, DdsColumns.COLUMN_END));
            row = position.getRow();
            column = position.getColumn();
        }

        ContinuedText keywords = resolve(lines, line, diagnostics);
        DdsField field = DdsField.builder()
                .name(name)
                .type(Character.toUpperCase(line.charAt(DdsColumns.DATA_TYPE)))
                .length(numberOrZero(line, DdsColumns.LENGTH_START, DdsColumns.LENGTH_END, "length", diagnostics))
                .decimals(numberOrZero(line, DdsColumns.DECIMALS_START, DdsColumns.DECIMALS_END, "decimals", diagnostics))
                .usage(usage)
                .row(row)
                .column(column)
                .referenced(Character.toUpperCase(line.charAt(DdsColumns.REFERENCE)) == 'R')
                .recordName(owningRecordName(line, "Field " + name, diagnostics))
                .lineIndex(line.getIndex())
                .lastLineIndex(keywords.getLastLineIndex())
                .indicators(indicators)
                .build();
        if (!keywords.isEmpty()) {
            field.addAttribute(DdsAttribute.builder()
                    .lineIndex(line.getIndex())
                    .lastLineIndex(keywords.getLastLineIndex())
                    .value(keywords.getText())
                    .indicators(indicators)
                    .build());
        }

        elements.add(field);
        recordHasContent = true;

        log.debug("Parsed field: {} at line {}", name, line.getIndex() + 1);
        return keywords.getLastLineIndex() + 1;
    }

    private int buildConstant(List<DdsLine> lines, DdsLine line, List<DdsElement> elements,
                              ParseDiagnostics diagnostics) {
        ContinuedText text = resolve(lines, line, diagnostics);
        ScreenPosition position = subfileAdapter.adapt(isSubfile(),
                line.positiveNumber(DdsColumns.ROW_START, DdsColumns.ROW_END),
                line.positiveNumber(DdsColumns.COLUMN_START, DdsColumns.COLUMN_END));

        DdsConstant constant = DdsConstant.builder()
                .text(text.getText())
                .row(position.getRow())
                .column(position.getColumn())
                .recordName(owningRecordName(line, "Constant " + text.getText(), diagnostics))
                .lineIndex(line.getIndex())
                .lastLineIndex(text.getLastLineIndex())
                .indicators(indicatorDecoder.decode(line))
                .build();

        elements.add(constant);
        recordHasContent = true;

        log.debug("Parsed constant: {} at line {}", text.getText(), line.getIndex() + 1);
        return text.getLastLineIndex() + 1;
    }

    private int buildAttribute(List<DdsLine> lines, DdsLine line, List<DdsElement> elements,
                               ParseDiagnostics diagnostics) {
        ContinuedText keywords = resolve(lines, line, diagnostics);
        if (keywords.isEmpty()) {
            return keywords.getLastLineIndex() + 1;
        }

        DdsAttribute attribute = DdsAttribute.builder()
                .lineIndex(line.getIndex())
                .lastLineIndex(keywords.getLastLineIndex())
                .value(keywords.getText())
                .indicators(indicatorDecoder.decode(line))
                .build();
        elements.add(attribute);

        // Record keywords must be visible to the subfile test before the first field
        if (currentSummary != null && !recordHasContent) {
            indexBuilder.accumulate(currentSummary, attribute);
        }

        log.debug("Parsed attribute: {} at line {}", attribute.getValue(), line.getIndex() + 1);
        return keywords.getLastLineIndex() + 1;
    }

    private ContinuedText resolve(List<DdsLine> lines, DdsLine line, ParseDiagnostics diagnostics) {
        ContinuedText text = continuationResolver.resolve(lines, line.getIndex());
        if (text.isUnterminated()) {
            diagnostics.warn(text.getLastLineIndex(), "Continuation marker on the last line of the source");
        }
        return text;
    }

    private boolean isSubfile() {
        return currentSummary != null && subfileAdapter.isSubfile(currentSummary.getAttributes());
    }

    private String owningRecordName(DdsLine line, String what, ParseDiagnostics diagnostics) {
        if (currentRecord == null) {
            diagnostics.warn(line.getIndex(), what + " appears before any record");
            return null;
        }
        return currentRecord.getName();
    }

    private static int numberOrZero(DdsLine line, int start, int end, String what, ParseDiagnostics diagnostics) {
        if (line.isBlank(start, end)) {
            return 0;
        }
        Integer value = line.number(start, end);
        if (value == null) {
            diagnostics.warn(line.getIndex(), "Non-numeric " + what + " '"
                    + line.sliceTrimmed(start, end) + "' read as 0");
            return 0;
        }
        return value;
    }
}
