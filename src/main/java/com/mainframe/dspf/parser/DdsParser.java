package com.mainframe.dspf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsDocument;
import com.mainframe.dspf.model.DdsElement;
import com.mainframe.dspf.model.DdsFile;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.FileSizeAttributes;
import com.mainframe.dspf.model.core.context.DdsParserConfig;
import com.mainframe.dspf.model.core.context.ParseDiagnostics;

/**
 * Parser for DDS display file source.
 * Converts fixed-column lines into an element tree plus a per-record index.
 *
 * Every call works on fresh state and returns a new {@link DdsDocument}; the same
 * parser can be reused and shared. Nothing in the source makes a parse fail.
 */
public class DdsParser {
    private static final Logger log = LoggerFactory.getLogger(DdsParser.class);

    private final DdsParserConfig config;
    private final OwnershipLinker linker = new OwnershipLinker();
    private final ScreenSizeResolver sizeResolver;

    public DdsParser() {
        this(DdsParserConfig.defaults());
    }

    public DdsParser(DdsParserConfig config) {
        this.config = config;
        this.sizeResolver = new ScreenSizeResolver(config.getDefaultDisplaySize());
    }

    public DdsDocument parse(String text) {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        List<DdsLine> lines = splitLines(text);

        DdsFile file = new DdsFile();
        RecordIndexBuilder indexBuilder = new RecordIndexBuilder();
        DdsElementBuilder elementBuilder = new DdsElementBuilder(config, indexBuilder);

        List<DdsElement> elements = elementBuilder.build(lines, file, diagnostics);
        linker.link(file, elements);

        List<DdsElement> visible = elements.stream()
                .filter(e -> !(e instanceof DdsAttribute))
                .collect(Collectors.toList());
        List<DdsRecord> records = visible.stream()
                .filter(DdsRecord.class::isInstance)
                .map(DdsRecord.class::cast)
                .collect(Collectors.toList());

        indexBuilder.assignEndLines(records, lines.size());
        indexBuilder.populate(visible, diagnostics);

        FileSizeAttributes sizeAttributes = sizeResolver.resolveFileSize(file, diagnostics);
        for (DdsRecord record : records) {
            record.setSize(sizeResolver.resolveRecordSize(record, sizeAttributes, diagnostics));
        }
        indexBuilder.syncRecords(records);

        log.debug("Parsed {} lines into {} elements ({} records, {} warnings)",
                lines.size(), visible.size(), records.size(), diagnostics.getWarnings().size());

        return DdsDocument.builder()
                .file(file)
                .elements(visible)
                .recordSummaries(indexBuilder.getSummaries())
                .sizeAttributes(sizeAttributes)
                .lineCount(lines.size())
                .diagnostics(diagnostics)
                .build();
    }

    private List<DdsLine> splitLines(String text) {
        String source = text != null ? text : "";
        String[] raw = source.split("\\r?\\n", -1);
        List<DdsLine> lines = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            lines.add(DdsLine.of(i, raw[i], config.getSequenceAreaWidth()));
        }
        return lines;
    }
}
