package com.mainframe.dspf.cli.model;

import java.nio.file.Path;

import com.mainframe.dspf.model.core.context.DdsParserConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps InspectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    Path sourcePath;
    String recordFilter;
    DdsParserConfig parserConfig;
}
