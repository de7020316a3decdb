package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;

import java.util.Objects;
import java.util.Set;

/**
 * The old and new raw calls of one fragment together with the derived forms the comparison rules test.
 */
public final class CallPair {

    private final String oldCall;
    private final String newCall;
    private final String oldNormalized;
    private final String newNormalized;
    private final Set<String> oldTokens;
    private final Set<String> newTokens;
    private final String oldFamily;
    private final String newFamily;

    public CallPair(final String oldCall, final String newCall) {
        this.oldCall = oldCall == null ? CallNormalizer.EMPTY_CALL : oldCall;
        this.newCall = newCall == null ? CallNormalizer.EMPTY_CALL : newCall;
        this.oldNormalized = CallNormalizer.normalize(oldCall);
        this.newNormalized = CallNormalizer.normalize(newCall);
        this.oldTokens = CallNormalizer.splitCompound(oldCall);
        this.newTokens = CallNormalizer.splitCompound(newCall);
        this.oldFamily = CallNormalizer.familyOf(oldCall);
        this.newFamily = CallNormalizer.familyOf(newCall);
    }

    public String getOldCall() {
        return oldCall;
    }

    public String getNewCall() {
        return newCall;
    }

    public String getOldNormalized() {
        return oldNormalized;
    }

    public String getNewNormalized() {
        return newNormalized;
    }

    public Set<String> getOldTokens() {
        return oldTokens;
    }

    public Set<String> getNewTokens() {
        return newTokens;
    }

    /**
     * @return {@code null} for an empty call.
     */
    public String getOldFamily() {
        return oldFamily;
    }

    /**
     * @return {@code null} for an empty call.
     */
    public String getNewFamily() {
        return newFamily;
    }

    public boolean isOldEmpty() {
        return oldNormalized.isEmpty();
    }

    public boolean isNewEmpty() {
        return newNormalized.isEmpty();
    }

    public boolean sameFamily() {
        return oldFamily != null && Objects.equals(oldFamily, newFamily);
    }

    @Override
    public String toString() {
        return String.format("'%s' -> '%s'", oldCall, newCall);
    }
}
