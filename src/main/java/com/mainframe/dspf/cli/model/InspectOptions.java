package com.mainframe.dspf.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "inspect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
@Setter
public class InspectOptions {

	@Option(names = { "--file", "-f" }, required = true, description = "DDS display file source to parse")
	private Path file;

	@Option(names = { "--record", "-r" }, description = "Only report this record format")
	private String record;

	@Option(names = { "--verbose", "-v" }, description = "List every field and constant with its description")
	private boolean verbose;

	@Option(names = {
			"--allow-any-extension" }, description = "Accept source files that do not end with .dspf")
	private boolean allowAnyExtension;
}
