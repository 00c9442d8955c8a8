package com.mainframe.dspf.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.dspf.cli.exception.OptionsValidationException;
import com.mainframe.dspf.cli.model.InspectOptions;
import com.mainframe.dspf.cli.model.ValidatedInspectOptions;
import com.mainframe.dspf.cli.validation.InspectOptionsValidator;

class InspectOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final InspectOptionsValidator validator = new InspectOptionsValidator();

    @Test
    void testValidOptions() throws IOException {
        Path file = Files.writeString(tempDir.resolve("screen.dspf"), "");
        InspectOptions options = new InspectOptions();
        options.setFile(file);
        options.setRecord(" header ");

        ValidatedInspectOptions validated = validator.validate(options);

        assertThat(validated.getSourcePath()).isEqualTo(file.toAbsolutePath().normalize());
        assertThat(validated.getRecordFilter()).isEqualTo("HEADER");
        assertThat(validated.getParserConfig()).isNotNull();
    }

    @Test
    void testMissingFile() {
        InspectOptions options = new InspectOptions();

        assertThat(catchValidation(options).getErrors())
                .containsExactly("Source file is required (--file / -f).");
    }

    @Test
    void testAllErrorsAreCollected() {
        InspectOptions options = new InspectOptions();
        options.setFile(tempDir.resolve("nothing.txt"));
        options.setRecord("   ");

        OptionsValidationException error = catchValidation(options);

        assertThat(error.getErrors()).hasSize(3);
        assertThat(error.getErrors().get(0)).startsWith("Source file does not exist");
        assertThat(error.getErrors().get(1)).startsWith("Source file must end with one of");
        assertThat(error.getErrors().get(2)).startsWith("Record name must not be blank");
    }

    @Test
    void testAnyExtensionCanBeAllowed() throws IOException {
        Path file = Files.writeString(tempDir.resolve("screen.txt"), "");
        InspectOptions options = new InspectOptions();
        options.setFile(file);
        options.setAllowAnyExtension(true);

        assertThat(validator.validate(options).getRecordFilter()).isNull();
    }

    @Test
    void testDirectoryIsRejected() {
        InspectOptions options = new InspectOptions();
        options.setFile(tempDir);
        options.setAllowAnyExtension(true);

        assertThat(catchValidation(options).getErrors())
                .singleElement().isEqualTo("Source path is not a regular file: " + tempDir.toAbsolutePath().normalize());
    }

    @Test
    void testRecordNameTooLong() throws IOException {
        Path file = Files.writeString(tempDir.resolve("screen.dspf"), "");
        InspectOptions options = new InspectOptions();
        options.setFile(file);
        options.setRecord("ABCDEFGHIJK");

        assertThat(catchValidation(options).getErrors().get(0)).startsWith("Record name can be at most 10");
    }

    private OptionsValidationException catchValidation(InspectOptions options) {
        try {
            validator.validate(options);
        } catch (OptionsValidationException e) {
            return e;
        }
        throw new AssertionError("Expected validation to fail");
    }
}
