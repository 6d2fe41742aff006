package com.embedbot.tenant;

/**
 * Plaintext view of a credential. Only handed to {@link CredentialUse} callbacks and never stored.
 */
public record DecryptedCredential(
        long tenantId,
        StoreParams store,
        String storePassword,
        String providerApiKey,
        String tableName,
        boolean fallback) {

    @Override
    public String toString() {
        return "DecryptedCredential[tenantId=" + tenantId + ", store=" + store + ", tableName=" + tableName
                + ", fallback=" + fallback + ", secrets=***]";
    }
}
