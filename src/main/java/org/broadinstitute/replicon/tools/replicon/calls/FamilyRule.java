package org.broadinstitute.replicon.tools.replicon.calls;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Optional;
import java.util.function.Function;

/**
 * A named step of the family extraction. It either yields a family for a normalized call or passes.
 */
public final class FamilyRule {

    private final String name;
    private final Function<String, Optional<String>> extractor;

    public FamilyRule(final String name, final Function<String, Optional<String>> extractor) {
        this.name = Utils.nonEmpty(name, "the rule name cannot be null or empty");
        this.extractor = Utils.nonNull(extractor, "the extractor cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * @param normalizedCall a non-empty normalized call.
     * @return the family, or empty if this rule does not apply.
     */
    public Optional<String> apply(final String normalizedCall) {
        return Utils.nonNull(extractor.apply(normalizedCall), () -> "rule " + name + " returned null");
    }

    @Override
    public String toString() {
        return name;
    }
}
