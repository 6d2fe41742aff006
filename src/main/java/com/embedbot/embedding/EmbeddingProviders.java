package com.embedbot.embedding;

import java.time.Duration;

import com.embedbot.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(OkHttpClient httpClient, AppConfig.EmbeddingConfig config) {
        OkHttpClient configured = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getCallTimeoutMs()))
                .build();
        return new HttpEmbeddingProvider(configured, config.getBaseUrl());
    }
}
