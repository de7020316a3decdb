package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.utils.Utils;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered categorization: the category assigned when the predicate holds and how the
 * resolved call is picked.
 */
public final class ComparisonRule {

    private final ComparisonCategory category;
    private final Predicate<CallPair> predicate;
    private final Function<CallPair, String> resolver;

    public ComparisonRule(final ComparisonCategory category,
                          final Predicate<CallPair> predicate,
                          final Function<CallPair, String> resolver) {
        this.category = Utils.nonNull(category, "the category cannot be null");
        this.predicate = Utils.nonNull(predicate, "the predicate cannot be null");
        this.resolver = Utils.nonNull(resolver, "the resolver cannot be null");
    }

    public ComparisonCategory getCategory() {
        return category;
    }

    public boolean matches(final CallPair pair) {
        return predicate.test(pair);
    }

    public String resolve(final CallPair pair) {
        return resolver.apply(pair);
    }

    @Override
    public String toString() {
        return category.getLabel();
    }
}
