package com.mainframe.dspf.parser;

import com.mainframe.dspf.model.DdsIndicator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decodes the three 3-character indicator slots of columns 8-16.
 * Stateless; the result is sorted by indicator number.
 */
public class IndicatorDecoder {

    private static final int SLOTS = 3;
    private static final int SLOT_WIDTH = 3;

    private final char negationMarker;

    public IndicatorDecoder(char negationMarker) {
        this.negationMarker = negationMarker;
    }

    public List<DdsIndicator> decode(String slots) {
        List<DdsIndicator> indicators = new ArrayList<>();
        if (slots == null) {
            return indicators;
        }

        for (int i = 0; i < SLOTS; i++) {
            int start = i * SLOT_WIDTH;
            if (start >= slots.length()) {
                break;
            }
            String slot = slots.substring(start, Math.min(start + SLOT_WIDTH, slots.length()));
            char flag = slot.charAt(0);
            String digits = slot.substring(1).trim();

            // Slots without a usable 1-99 number are left out, never zero-filled
            if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                continue;
            }
            int number = Integer.parseInt(digits);
            if (number < 1 || number > 99) {
                continue;
            }
            indicators.add(DdsIndicator.of(number, Character.toUpperCase(flag) != negationMarker));
        }

        indicators.sort(Comparator.comparingInt(DdsIndicator::getNumber));
        return indicators;
    }

    public List<DdsIndicator> decode(DdsLine line) {
        return decode(line.slice(DdsColumns.INDICATORS_START, DdsColumns.INDICATORS_END));
    }
}
