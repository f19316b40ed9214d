package com.underscoreresearch.keystore.store;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.underscoreresearch.keystore.encryption.Mask;

/**
 * A password change ready to be applied. The mask moves a store at the generation before
 * <code>nextGeneration</code> to the new password.
 */
@Getter
@AllArgsConstructor
public final class MaskTransition {
    private final Mask mask;
    private final GenerationCounter nextGeneration;

    @Override
    public String toString() {
        return "MaskTransition[generation " + nextGeneration + "]";
    }
}
