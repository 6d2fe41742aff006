package com.embedbot.embedding;

import java.util.List;

public record EmbeddingRequest(String model, List<String> inputs) {

    public EmbeddingRequest {
        inputs = List.copyOf(inputs);
    }
}
