package com.mainframe.dspf;

import com.mainframe.dspf.cli.InspectCommand;
import picocli.CommandLine;

/**
 * Main entry point of the DSPF structure inspector.
 * Parses a DDS display file and reports its records, fields, constants and screen sizes.
 */
public class DspfInspectorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new InspectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
