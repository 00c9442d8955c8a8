package com.mainframe.dspf.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.dspf.model.DdsAttribute;
import com.mainframe.dspf.model.DdsConstant;
import com.mainframe.dspf.model.DdsElement;
import com.mainframe.dspf.model.DdsField;
import com.mainframe.dspf.model.DdsFile;
import com.mainframe.dspf.model.DdsOwnerElement;
import com.mainframe.dspf.model.DdsRecord;

/**
 * Attaches every attribute element to the nearest preceding owner in a single forward pass.
 *
 * A field or constant owns the keyword lines that follow it; once a new record starts,
 * keyword lines go to that record until its first field or constant. Lines before any
 * record belong to the file.
 */
public class OwnershipLinker {
    private static final Logger log = LoggerFactory.getLogger(OwnershipLinker.class);

    public void link(DdsFile file, List<DdsElement> elements) {
        DdsOwnerElement record = null;
        DdsOwnerElement fieldOrConstant = null;

        for (DdsElement element : elements) {
            if (element instanceof DdsRecord r) {
                record = r;
                fieldOrConstant = null;
            } else if (element instanceof DdsField || element instanceof DdsConstant) {
                fieldOrConstant = (DdsOwnerElement) element;
            } else if (element instanceof DdsAttribute attribute) {
                DdsOwnerElement owner = fieldOrConstant != null ? fieldOrConstant
                        : record != null ? record : file;
                owner.addAttribute(attribute);
                log.debug("Attached {} at line {} to {}", attribute.getValue(),
                        attribute.getLineIndex() + 1, owner.getKind());
            }
        }
    }
}
