package com.embedbot.tenant;

import java.time.OffsetDateTime;

public record Credential(
        long id,
        long tenantId,
        StoreParams store,
        String storePasswordCiphertext,
        String providerKeyCiphertext,
        String providerKeyFingerprint,
        String tableName,
        OffsetDateTime lastValidatedAt,
        OffsetDateTime createdAt) {
}
