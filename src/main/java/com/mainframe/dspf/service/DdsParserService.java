package com.mainframe.dspf.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsDocument;
import com.mainframe.dspf.model.core.context.DdsParserConfig;
import com.mainframe.dspf.parser.DdsParser;

/**
 * Entry point for parsing display file sources from disk or from memory.
 * When built with a {@link ParseResultStore}, every result is also published there.
 */
public class DdsParserService {
    private static final Logger log = LoggerFactory.getLogger(DdsParserService.class);

    private final DdsParserConfig config;
    private final DdsParser parser;
    private final ParseResultStore store;

    public DdsParserService() {
        this(DdsParserConfig.defaults(), null);
    }

    public DdsParserService(DdsParserConfig config, ParseResultStore store) {
        this.config = config;
        this.parser = new DdsParser(config);
        this.store = store;
    }

    public DdsDocument parse(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String content = Files.readString(path, StandardCharsets.UTF_8);

        log.info("Parsing display file: {}", fileName);
        return parse(content);
    }

    public DdsDocument parse(String content) {
        DdsDocument document = parser.parse(content);
        if (document.getDiagnostics().hasWarnings()) {
            log.debug("Parse finished with {} warning(s)", document.getDiagnostics().getWarnings().size());
        }
        if (store != null) {
            store.publish(document);
        }
        return document;
    }

    /**
     * True when the file name ends with one of the configured extensions (case-insensitive).
     */
    public boolean isDdsFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return config.getFileExtensions().stream()
                .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }
}
