package com.embedbot.tenant;

@FunctionalInterface
public interface CredentialListener {
    void credentialReplaced(Tenant tenant);
}
