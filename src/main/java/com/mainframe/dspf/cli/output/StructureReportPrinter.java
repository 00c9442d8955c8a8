package com.mainframe.dspf.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.cli.model.ValidatedInspectOptions;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsDocument;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.DdsSize;
import com.mainframe.dspf.model.DisplaySize;
import com.mainframe.dspf.model.FileSizeAttributes;
import com.mainframe.dspf.model.index.RecordSummary;
import com.mainframe.dspf.util.DdsFormatUtil;

/**
 * Responsible only for printing CLI output for the "inspect" command.
 * No validation, no parsing.
 */
public class StructureReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(StructureReportPrinter.class);

    public void printBanner(ValidatedInspectOptions v) {
        log.info("=================================================");
        log.info("DSPF Structure Inspector");
        log.info("=================================================");
        log.info("Source File: {}", v.getSourcePath());
        log.info("Record Filter: {}", v.getRecordFilter() != null ? v.getRecordFilter() : "None");
        log.info("=================================================");
    }

    public void printReport(DdsDocument document, List<DdsRecord> records, boolean verbose) {
        FileSizeAttributes sizes = document.getSizeAttributes();

        log.info("");
        log.info("Lines: {}", document.getLineCount());
        log.info("Displays: {}", sizes.getDisplayCount());
        log.info("  Primary:   {}", describe(sizes.getPrimary()));
        sizes.getSecondaryDisplay().ifPresent(s -> log.info("  Secondary: {}", describe(s)));
        if (sizes.isFallback()) {
            log.info("  (no usable DSPSIZ, default display assumed)");
        }
        if (!document.getFile().getAttributes().isEmpty()) {
            log.info("File Keywords: {}", DdsFormatUtil.formatAttributes(document.getFile().getAttributes()));
        }

        for (DdsRecord record : records) {
            printRecord(document, record, verbose);
        }

        if (document.getDiagnostics().hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            document.getDiagnostics().getWarnings().forEach(w -> log.info("  {}", w));
        }
        log.info("=================================================");
    }

    public void printRecordNotFound(String recordName, DdsDocument document) {
        log.error("Record {} not found. Records in file: {}", recordName, document.getRecordNames());
    }

    private void printRecord(DdsDocument document, DdsRecord record, boolean verbose) {
        DdsSize size = record.getSize();
        RecordSummary summary = document.findRecordSummary(record.getName()).orElse(null);

        log.info("");
        log.info("-------------------------------------------------");
        log.info("Record {} (lines {}-{})", record.getName(), record.getLineIndex() + 1, record.getEndLineIndex() + 1);
        log.info("-------------------------------------------------");
        log.info("  Size: {}x{} {} at {},{}", size.getRows(), size.getColumns(), size.getName(),
                size.getOriginRow(), size.getOriginColumn());
        if (!record.getAttributes().isEmpty()) {
            log.info("  Keywords: {}", DdsFormatUtil.formatAttributes(record.getAttributes()));
        }
        if (summary != null) {
            log.info("  Fields: {}  Constants: {}", summary.getFields().size(), summary.getConstants().size());
        }

        if (!verbose) {
            return;
        }
        for (DdsField field : document.getFields(record.getName())) {
            log.info("    {} {} {} {}", field.getName(), DdsFormatUtil.describeField(field),
                    DdsFormatUtil.formatIndicators(field.getIndicators()),
                    DdsFormatUtil.formatAttributes(field.getAttributes()));
        }
        for (DdsConstant constant : document.getConstants(record.getName())) {
            log.info("    {} {} {}", constant.getText(), DdsFormatUtil.describeConstant(constant),
                    DdsFormatUtil.formatIndicators(constant.getIndicators()));
        }
    }

    private static String describe(DisplaySize size) {
        return size.getRows() + "x" + size.getColumns() + (size.getName().isEmpty() ? "" : " " + size.getName());
    }
}
