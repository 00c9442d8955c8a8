package com.mainframe.dspf.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (warnings/info) accumulated while parsing one document.
 *
 * Pure structure only: no logging, no formatting, no IO.
 * Parsing never aborts; anything it recovers from ends up here as a warning.
 */
@Getter
public class ParseDiagnostics {
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

  public void warn(int lineIndex, String message) {
	  warnings.add("Line " + (lineIndex + 1) + ": " + message);
  }

  public void info(String message) {
	  infos.add(message);
  }
}
