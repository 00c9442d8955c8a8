package com.mainframe.dspf.cli;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.cli.exception.OptionsValidationException;
import com.mainframe.dspf.cli.model.InspectOptions;
import com.mainframe.dspf.cli.model.ValidatedInspectOptions;
import com.mainframe.dspf.cli.output.StructureReportPrinter;
import com.mainframe.dspf.cli.validation.InspectOptionsValidator;
import com.mainframe.dspf.model.DdsDocument;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.service.DdsParserService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that parses one display file and reports its records, sizes and elements.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        version = "dspf-structure-parser 1.0.0",
        description = "Parses a DDS display file and prints its record structure."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Mixin
    private InspectOptions options = new InspectOptions();

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final StructureReportPrinter printer = new StructureReportPrinter();

    @Override
    public Integer call() {
        ValidatedInspectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("{}", err));
            return 1;
        }

        printer.printBanner(validated);

        DdsDocument document;
        try {
            DdsParserService service = new DdsParserService(validated.getParserConfig(), null);
            document = service.parse(validated.getSourcePath());
        } catch (IOException e) {
            log.error("Could not read {}", validated.getSourcePath(), e);
            return 1;
        }

        List<DdsRecord> records = document.getRecords();
        if (validated.getRecordFilter() != null) {
            Optional<DdsRecord> record = document.findRecord(validated.getRecordFilter());
            if (record.isEmpty()) {
                printer.printRecordNotFound(validated.getRecordFilter(), document);
                return 1;
            }
            records = List.of(record.get());
        }

        printer.printReport(document, records, options.isVerbose());
        return 0;
    }
}
