package com.embedbot.tenant;

import java.time.OffsetDateTime;

public record ValidationEvent(long id, long tenantId, String fieldName, String reasonCode, OffsetDateTime createdAt) {
}
