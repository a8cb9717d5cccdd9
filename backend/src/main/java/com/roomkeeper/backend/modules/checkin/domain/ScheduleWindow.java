package com.roomkeeper.backend.modules.checkin.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.roomkeeper.backend.modules.directory.domain.CheckinSchedule;

/**
 * Check-in window of a weekly schedule: from {@code startOffset} minutes before the service time
 * until {@code endOffset} minutes after it. Schedules without a weekly time are open whenever active.
 */
public final class ScheduleWindow {

    private ScheduleWindow() {
    }

    public static boolean isOpen(CheckinSchedule schedule, LocalDateTime now) {
        if (!schedule.isActive()) {
            return false;
        }
        if (!schedule.isWeekly()) {
            return true;
        }
        // offsets may push the window across midnight, so look at the neighbouring days too
        LocalDate today = now.toLocalDate();
        for (LocalDate candidate = today.minusDays(1); !candidate.isAfter(today.plusDays(1)); candidate = candidate.plusDays(1)) {
            if (candidate.getDayOfWeek() != schedule.getWeeklyDayOfWeek()) {
                continue;
            }
            LocalDateTime serviceTime = LocalDateTime.of(candidate, schedule.getWeeklyTimeOfDay());
            LocalDateTime opensAt = serviceTime.minusMinutes(schedule.getCheckinStartOffsetMinutes());
            LocalDateTime closesAt = serviceTime.plusMinutes(schedule.getCheckinEndOffsetMinutes());
            if (!now.isBefore(opensAt) && !now.isAfter(closesAt)) {
                return true;
            }
        }
        return false;
    }
}
