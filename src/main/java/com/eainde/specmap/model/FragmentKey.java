package com.eainde.specmap.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a {@link DocumentFragment} within a run: source file plus locator.
 * Orders by file name, then locator ordinal, then locator label.
 */
public record FragmentKey(String sourceFile, FragmentLocator locator) implements Comparable<FragmentKey> {

    private static final Comparator<FragmentKey> ORDER =
            Comparator.comparing(FragmentKey::sourceFile).thenComparing(FragmentKey::locator);

    public FragmentKey {
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(locator, "locator");
    }

    @Override
    public int compareTo(FragmentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceFile + "#" + locator.label();
    }
}
