package org.broadinstitute.replicon.tools.replicon.consensus;

import java.util.Map;
import java.util.stream.Collectors;

final class CountFormatting {

    private CountFormatting() {}

    /**
     * Renders ordered counts as {@code name(count)} pairs separated by commas.
     */
    static String detail(final Map<String, Integer> counts) {
        return counts.entrySet().stream()
                .map(e -> e.getKey() + "(" + e.getValue() + ")")
                .collect(Collectors.joining(","));
    }

    static double round3(final double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
