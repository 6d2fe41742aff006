package com.embedbot.embedding;

import java.util.List;

/**
 * One call to an external embedding service.
 */
public interface EmbeddingProvider {

    /**
     * @return one vector per input, in input order
     * @throws TransientProviderException when retrying the same call may succeed
     * @throws FatalProviderException when retrying cannot help
     */
    List<float[]> embed(EmbeddingRequest request, String apiKey);
}
