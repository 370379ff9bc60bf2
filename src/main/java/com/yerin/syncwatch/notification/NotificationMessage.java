package com.yerin.syncwatch.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.syncwatch.domain.ChangeEvent;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationMessage(
        String type,
        String eventType,
        String errorType,
        String entityType,
        String entityId,
        String message,
        Object data,
        Instant timestamp,
        String origin
) {
    public static final String DATA_UPDATE = "data_update";
    public static final String SYSTEM_EVENT = "system_event";
    public static final String SYSTEM_ERROR = "system_error";
    public static final String SUBSCRIPTION_CONFIRMED = "subscription_confirmed";

    public static NotificationMessage dataUpdate(ChangeEvent change, String origin) {
        return new NotificationMessage(DATA_UPDATE, null, null, change.entityType(), change.entityId(),
                null, change, change.timestamp(), origin);
    }

    public static NotificationMessage systemEvent(String eventType, Object data, String origin) {
        return new NotificationMessage(SYSTEM_EVENT, eventType, null, null, null, null, data, Instant.now(), origin);
    }

    public static NotificationMessage systemError(String errorType, String message, Object details, String origin) {
        return new NotificationMessage(SYSTEM_ERROR, null, errorType, null, null, message, details, Instant.now(), origin);
    }

    public static NotificationMessage subscriptionConfirmed(Subscription subscription) {
        return new NotificationMessage(SUBSCRIPTION_CONFIRMED, null, null, subscription.scope(),
                subscription.entityId(), null, null, Instant.now(), null);
    }

    public boolean isDataUpdate() {
        return DATA_UPDATE.equals(type);
    }
}
