package com.mainframe.dspf.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.mainframe.dspf.cli.exception.OptionsValidationException;
import com.mainframe.dspf.cli.model.InspectOptions;
import com.mainframe.dspf.cli.model.ValidatedInspectOptions;
import com.mainframe.dspf.model.core.context.DdsParserConfig;

public class InspectOptionsValidator {

	private static final int MAX_NAME_LENGTH = 10;

	public ValidatedInspectOptions validate(InspectOptions o) {
		List<String> errors = new ArrayList<>();
		DdsParserConfig config = DdsParserConfig.defaults();

		Path source = null;
		if (o.getFile() == null) {
			errors.add("Source file is required (--file / -f).");
		} else {
			source = o.getFile().toAbsolutePath().normalize();
			if (!Files.exists(source)) {
				errors.add("Source file does not exist: " + source);
			} else if (!Files.isRegularFile(source)) {
				errors.add("Source path is not a regular file: " + source);
			} else if (!Files.isReadable(source)) {
				errors.add("Source file is not readable: " + source);
			}

			if (!o.isAllowAnyExtension() && !hasExtension(source, config.getFileExtensions())) {
				errors.add("Source file must end with one of " + config.getFileExtensions()
						+ ". Use --allow-any-extension to override: " + source.getFileName());
			}
		}

		String recordFilter = null;
		if (o.getRecord() != null) {
			recordFilter = o.getRecord().trim().toUpperCase(Locale.ROOT);
			if (recordFilter.isEmpty()) {
				errors.add("Record name must not be blank (--record / -r).");
			} else if (recordFilter.length() > MAX_NAME_LENGTH) {
				errors.add("Record name can be at most " + MAX_NAME_LENGTH + " characters. Got: " + o.getRecord());
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedInspectOptions(source, recordFilter, config);
	}

	private static boolean hasExtension(Path p, List<String> extensions) {
		String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
		return extensions.stream().anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
	}
}
