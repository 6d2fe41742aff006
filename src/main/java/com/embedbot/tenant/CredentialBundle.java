package com.embedbot.tenant;

/**
 * Validated onboarding answers, held in memory only until they are persisted encrypted.
 */
public record CredentialBundle(String phone, StoreParams store, String storePassword, String providerApiKey) {

    @Override
    public String toString() {
        return "CredentialBundle[phone=" + phone + ", store=" + store + ", storePassword=***, providerApiKey=***]";
    }
}
