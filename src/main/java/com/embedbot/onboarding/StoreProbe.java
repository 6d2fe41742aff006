package com.embedbot.onboarding;

import com.embedbot.tenant.StoreParams;

/**
 * Checks that a vector store is reachable with the given credentials and supports vectors.
 */
public interface StoreProbe {

    /**
     * @throws ValidationException describing the first failed check
     */
    void probe(StoreParams store, String password);
}
