package com.embedbot.tenant;

@FunctionalInterface
public interface CredentialUse<T> {
    T apply(DecryptedCredential credential);
}
