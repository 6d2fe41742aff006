package com.embedbot.tenant;

import java.util.regex.Pattern;

public final class TableNames {
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    private TableNames() {
    }

    public static String forTenant(long tenantId) {
        return "tenant_" + tenantId + "_segments";
    }

    /**
     * Rejects anything that could not be embedded as a quoted SQL identifier verbatim.
     */
    public static String requireSafe(String identifier) {
        if (identifier == null || !SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsafe table identifier: " + identifier);
        }
        return identifier;
    }
}
