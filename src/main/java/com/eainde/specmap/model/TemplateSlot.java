package com.eainde.specmap.model;

import java.util.Objects;

/**
 * A labelled cell position in the user-supplied template awaiting a value.
 *
 * @param labelText      label as written in the template
 * @param cellCoordinate cell that receives the resolved value
 * @param expectedUnit   unit declared in the label, or null
 */
public record TemplateSlot(String labelText, CellCoordinate cellCoordinate, String expectedUnit) {

    public TemplateSlot {
        Objects.requireNonNull(labelText, "labelText");
        Objects.requireNonNull(cellCoordinate, "cellCoordinate");
    }

    public boolean hasExpectedUnit() {
        return expectedUnit != null && !expectedUnit.isBlank();
    }
}
