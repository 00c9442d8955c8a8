package com.mainframe.dspf.model.core.context;

import com.mainframe.dspf.model.DisplaySize;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Settings of the DDS display file parser.
 *
 * The column layout itself is fixed; these are the markers and fallbacks around it.
 */
@Value
@Builder(toBuilder = true)
public class DdsParserConfig {

    /**
     * Width of the leading sequence-number area (columns 1-5).
     */
    @Builder.Default
    int sequenceAreaWidth = 5;

    /**
     * Last character of a keyword or constant segment that continues on the next line.
     */
    @Builder.Default
    char continuationMarker = '-';

    /**
     * First character of an indicator slot that negates it.
     */
    @Builder.Default
    char negationMarker = 'N';

    /**
     * Column 7 character marking a comment line.
     */
    @Builder.Default
    char commentMarker = '*';

    /**
     * Column 17 character marking a record header.
     */
    @Builder.Default
    char recordMarker = 'R';

    /**
     * Record keyword whose presence transposes row and column of the record's elements.
     */
    @NonNull
    @Builder.Default
    String subfileKeyword = "SFL";

    /**
     * Display size used when DSPSIZ is missing or unusable.
     */
    @NonNull
    @Builder.Default
    DisplaySize defaultDisplaySize = DisplaySize.DS3;

    /**
     * File name suffixes recognised as display file source (compared case-insensitively).
     */
    @NonNull
    @Builder.Default
    List<String> fileExtensions = List.of(".dspf");

    public static DdsParserConfig defaults() {
        return DdsParserConfig.builder().build();
    }
}
