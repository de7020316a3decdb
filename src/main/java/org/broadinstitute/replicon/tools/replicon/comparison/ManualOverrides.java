package org.broadinstitute.replicon.tools.replicon.comparison;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentKey;
import org.broadinstitute.replicon.utils.Utils;

import java.util.Map;
import java.util.Optional;

/**
 * Curated resolved calls that take priority over every computed category except {@code exact_match}.
 */
public final class ManualOverrides {

    public static final ManualOverrides NONE = new ManualOverrides(ImmutableMap.of());

    private final Map<FragmentKey, String> overrides;

    public ManualOverrides(final Map<FragmentKey, String> overrides) {
        Utils.nonNull(overrides, "the overrides cannot be null");
        this.overrides = ImmutableMap.copyOf(overrides);
    }

    public Optional<String> get(final FragmentKey key) {
        return Optional.ofNullable(overrides.get(key));
    }

    public boolean contains(final FragmentKey key) {
        return overrides.containsKey(key);
    }

    public int size() {
        return overrides.size();
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }
}
