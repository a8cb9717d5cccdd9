package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.util.List;

public record BatchCheckinResponse(
        List<CheckinResultResponse> results,
        int successCount,
        int failureCount,
        boolean allSucceeded
) {

    public static BatchCheckinResponse of(List<CheckinResultResponse> results) {
        int successCount = (int) results.stream().filter(CheckinResultResponse::success).count();
        int failureCount = results.size() - successCount;
        return new BatchCheckinResponse(List.copyOf(results), successCount, failureCount, failureCount == 0);
    }
}
