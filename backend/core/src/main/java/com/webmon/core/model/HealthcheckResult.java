package com.webmon.core.model;

import com.webmon.core.schema.PrimaryKey;

import java.util.Objects;

public record HealthcheckResult(
        @PrimaryKey int checkId,
        int websiteFk,
        double requestTimestamp,
        double responseTime,
        int httpStatusCode,
        MatchStatus matchStatus,
        String errorMessage
) {
    public static final int UNSAVED_ID = -1;
    public static final int MAX_ERROR_MESSAGE_LENGTH = 300;
    public static final int STATUS_TIMEOUT = 598;
    public static final int STATUS_TRANSPORT_FAILURE = 555;

    public HealthcheckResult {
        Objects.requireNonNull(matchStatus, "matchStatus is required");
        errorMessage = truncate(errorMessage);
    }

    public static HealthcheckResult unsaved(
            int websiteFk,
            double requestTimestamp,
            double responseTime,
            int httpStatusCode,
            MatchStatus matchStatus,
            String errorMessage
    ) {
        return new HealthcheckResult(
                UNSAVED_ID,
                websiteFk,
                requestTimestamp,
                responseTime,
                httpStatusCode,
                matchStatus,
                errorMessage
        );
    }

    public boolean transportFailure() {
        return httpStatusCode == STATUS_TIMEOUT || httpStatusCode == STATUS_TRANSPORT_FAILURE;
    }

    public static double toSeconds(long millis) {
        return millis / 1000.0;
    }

    static String truncate(String message) {
        if (message == null) {
            return "";
        }
        if (message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
