package com.eainde.specmap.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Position of a fragment inside its source document.
 *
 * @param label   human readable location, e.g. "Page 3", "Slide 5", "Optical / Row 12"
 * @param ordinal 1-based position used for ordering (page, slide or row number)
 */
public record FragmentLocator(String label, int ordinal) implements Comparable<FragmentLocator> {

    private static final Comparator<FragmentLocator> ORDER =
            Comparator.comparingInt(FragmentLocator::ordinal).thenComparing(FragmentLocator::label);

    public FragmentLocator {
        Objects.requireNonNull(label, "label");
        if (label.isBlank()) {
            throw new IllegalArgumentException("Fragment locator label must not be blank");
        }
    }

    public static FragmentLocator page(int pageNumber) {
        return new FragmentLocator("Page " + pageNumber, pageNumber);
    }

    public static FragmentLocator slide(int slideNumber) {
        return new FragmentLocator("Slide " + slideNumber, slideNumber);
    }

    public static FragmentLocator row(String sheetName, int rowNumber) {
        return new FragmentLocator(sheetName + " / Row " + rowNumber, rowNumber);
    }

    @Override
    public int compareTo(FragmentLocator other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label;
    }
}
