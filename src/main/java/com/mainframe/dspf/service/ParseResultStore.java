package com.mainframe.dspf.service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import com.mainframe.dspf.model.DdsDocument;

/**
 * Holds the most recent parse result for collaborators that need "the current document".
 * Replacing it is a single atomic swap, so readers see either the old or the new result.
 */
public class ParseResultStore {

    private final AtomicReference<DdsDocument> current = new AtomicReference<>();

    public void publish(DdsDocument document) {
        current.set(document);
    }

    public Optional<DdsDocument> current() {
        return Optional.ofNullable(current.get());
    }

    public void clear() {
        current.set(null);
    }
}
