package com.mainframe.dspf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsFile;
import com.mainframe.dspf.model.DdsRecord;
import com.mainframe.dspf.model.DdsSize;
import com.mainframe.dspf.model.DisplaySize;
import com.mainframe.dspf.model.FileSizeAttributes;
import com.mainframe.dspf.model.core.context.ParseDiagnostics;

/**
 * Resolves the display geometry of the file (DSPSIZ) and of each record (WINDOW).
 *
 * DSPSIZ parameters are read left to right: {@code *DS3} and {@code *DS4} stand for
 * 24 x 80 and 27 x 132, a number starts an explicit rows/columns pair that may be
 * followed by a {@code *name}. At most two geometries are kept. Anything unusable
 * falls back to the configured default display.
 */
public class ScreenSizeResolver {
    private static final Logger log = LoggerFactory.getLogger(ScreenSizeResolver.class);

    private static final Pattern DSPSIZ_KEYWORD = Pattern.compile("\\bDSPSIZ\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW_KEYWORD = Pattern.compile("\\bWINDOW\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW_SIZE = Pattern.compile(
            "\\bWINDOW\\s*\\(\\s*(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final int MAX_DISPLAYS = 2;

    private final DisplaySize defaultDisplay;

    public ScreenSizeResolver(DisplaySize defaultDisplay) {
        this.defaultDisplay = defaultDisplay;
    }

    public FileSizeAttributes resolveFileSize(DdsFile file, ParseDiagnostics diagnostics) {
        Optional<DdsAttribute> dspsiz = file.getAttributes().stream()
                .filter(a -> DSPSIZ_KEYWORD.matcher(a.getValue()).find())
                .findFirst();

        if (dspsiz.isEmpty()) {
            diagnostics.info("No DSPSIZ keyword, using " + describe(defaultDisplay));
            return FileSizeAttributes.fallback(defaultDisplay);
        }

        DdsAttribute attribute = dspsiz.get();
        List<DisplaySize> sizes;
        try {
            sizes = parseDisplaySizes(attribute);
        } catch (DdsParseException e) {
            log.debug("Unusable DSPSIZ at line {}: {}", attribute.getLineIndex() + 1, e.getMessage());
            diagnostics.warn(e.getLineIndex(), e.getMessage() + ", using " + describe(defaultDisplay));
            return FileSizeAttributes.fallback(defaultDisplay);
        }

        if (sizes.size() > MAX_DISPLAYS) {
            diagnostics.warn(attribute.getLineIndex(), "DSPSIZ declares " + sizes.size()
                    + " display sizes, only the first " + MAX_DISPLAYS + " are kept");
        }
        DisplaySize primary = sizes.get(0);
        DisplaySize secondary = sizes.size() > 1 ? sizes.get(1) : null;
        log.debug("Display sizes: primary {}, secondary {}", describe(primary),
                secondary != null ? describe(secondary) : "none");
        return FileSizeAttributes.of(primary, secondary);
    }

    /**
     * Size of one record: its WINDOW geometry when it declares a usable one, otherwise
     * the primary display of the file with origin (1, 1).
     */
    public DdsSize resolveRecordSize(DdsRecord record, FileSizeAttributes fileSize, ParseDiagnostics diagnostics) {
        for (DdsAttribute attribute : record.getAttributes()) {
            String value = attribute.getValue();
            if (!WINDOW_KEYWORD.matcher(value).find()) {
                continue;
            }
            Matcher matcher = WINDOW_SIZE.matcher(value);
            if (matcher.find()) {
                DdsSize size = DdsSize.window(
                        Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(3)),
                        Integer.parseInt(matcher.group(4)));
                log.debug("Record {} uses window {}", record.getName(), size.getName());
                return size;
            }
            diagnostics.warn(attribute.getLineIndex(), "WINDOW of record " + record.getName()
                    + " has no explicit geometry, using the display size");
            break;
        }
        return DdsSize.fromDisplay(fileSize.getPrimary());
    }

    /**
     * Reads the DSPSIZ parameters of an attribute.
     *
     * @throws DdsParseException when the parentheses are unbalanced or nothing usable is declared
     */
    List<DisplaySize> parseDisplaySizes(DdsAttribute attribute) {
        String value = attribute.getValue();
        Matcher keyword = DSPSIZ_KEYWORD.matcher(value);
        if (!keyword.find()) {
            throw new DdsParseException("No DSPSIZ keyword", attribute.getLineIndex());
        }
        int close = value.indexOf(')', keyword.end());
        if (close < 0) {
            throw new DdsParseException("DSPSIZ has no closing parenthesis", attribute.getLineIndex());
        }

        String parameters = value.substring(keyword.end(), close).trim();
        if (parameters.isEmpty()) {
            throw new DdsParseException("DSPSIZ has no parameters", attribute.getLineIndex());
        }

        List<DisplaySize> sizes = new ArrayList<>();
        String[] tokens = parameters.split("\\s+");
        int i = 0;
        while (i < tokens.length) {
            String token = tokens[i].toUpperCase(Locale.ROOT);
            if (token.startsWith("*")) {
                predefined(token).ifPresent(sizes::add);
                i++;
            } else if (isNumber(token) && i + 1 < tokens.length && isNumber(tokens[i + 1])) {
                String name = i + 2 < tokens.length && tokens[i + 2].startsWith("*")
                        ? tokens[i + 2].toUpperCase(Locale.ROOT) : "";
                sizes.add(new DisplaySize(Integer.parseInt(token), Integer.parseInt(tokens[i + 1]), name));
                i += name.isEmpty() ? 2 : 3;
            } else {
                i++;
            }
        }

        if (sizes.isEmpty()) {
            throw new DdsParseException("DSPSIZ(" + parameters + ") declares no usable display size",
                    attribute.getLineIndex());
        }
        return sizes;
    }

    private static Optional<DisplaySize> predefined(String token) {
        return switch (token) {
            case "*DS3" -> Optional.of(DisplaySize.DS3);
            case "*DS4" -> Optional.of(DisplaySize.DS4);
            default -> Optional.empty();
        };
    }

    private static boolean isNumber(String token) {
        return !token.isEmpty() && token.length() <= 4 && token.chars().allMatch(Character::isDigit);
    }

    private static String describe(DisplaySize size) {
        return size.getRows() + "x" + size.getColumns() + (size.getName().isEmpty() ? "" : " " + size.getName());
    }
}
