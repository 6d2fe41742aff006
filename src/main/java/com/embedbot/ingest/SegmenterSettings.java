package com.embedbot.ingest;

import java.util.Locale;

import com.embedbot.runtime.AppConfig;

public record SegmenterSettings(int maxSentences, int maxCharacters, int minWords, double minAlphaRatio, Locale locale) {

    public SegmenterSettings {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be at least 1");
        }
        if (maxCharacters < 1) {
            throw new IllegalArgumentException("maxCharacters must be at least 1");
        }
        if (minWords < 0 || minAlphaRatio < 0 || minAlphaRatio > 1) {
            throw new IllegalArgumentException("minWords and minAlphaRatio must be non-negative, ratio at most 1");
        }
    }

    public static SegmenterSettings from(AppConfig.SegmenterConfig config) {
        return new SegmenterSettings(
                config.getMaxSentences(),
                config.getMaxCharacters(),
                config.getMinWords(),
                config.getMinAlphaRatio(),
                Locale.forLanguageTag(config.getLanguage()));
    }
}
