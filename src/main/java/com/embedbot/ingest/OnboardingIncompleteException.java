package com.embedbot.ingest;

public class OnboardingIncompleteException extends RuntimeException {

    public OnboardingIncompleteException(String message) {
        super(message);
    }
}
