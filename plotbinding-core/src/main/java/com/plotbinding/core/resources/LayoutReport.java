package com.plotbinding.core.resources;

import java.util.List;

/**
 * Result of checking the bundled asset layout.
 *
 * @param root resource root that was checked
 * @param expected resource paths that must exist
 * @param missing subset of {@code expected} that could not be found
 */
public record LayoutReport(
    String root,
    List<String> expected,
    List<String> missing
) {
    /**
     * Compact constructor making defensive copies.
     */
    public LayoutReport {
        expected = expected == null ? List.of() : List.copyOf(expected);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }

    public int foundCount() {
        return expected.size() - missing.size();
    }
}
