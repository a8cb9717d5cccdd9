package com.roomkeeper.backend.modules.checkin.presentation.dto;

import java.time.LocalDate;
import java.time.Period;

import com.roomkeeper.backend.modules.checkin.domain.Attendance;
import com.roomkeeper.backend.modules.checkin.domain.AttendanceOccurrence;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.domain.Person;

public final class CheckinDtoMapper {

    private CheckinDtoMapper() {
    }

    public static PersonSummaryResponse toPersonSummary(Person person, LocalDate today) {
        Integer age = null;
        if (person.getBirthDate() != null && !person.getBirthDate().isAfter(today)) {
            age = Period.between(person.getBirthDate(), today).getYears();
        }
        return new PersonSummaryResponse(
                person.getId(),
                person.getFullName(),
                person.getFirstName(),
                person.getLastName(),
                age
        );
    }

    public static LocationSummaryResponse toLocationSummary(CheckinLocation location, long currentCount) {
        return new LocationSummaryResponse(
                location.getId(),
                location.getName(),
                currentCount,
                location.getSoftCapacity(),
                location.getHardCapacity()
        );
    }

    public static AttendanceSummaryResponse toAttendanceSummary(Attendance attendance, LocalDate today) {
        AttendanceOccurrence occurrence = attendance.getOccurrence();
        CheckinLocation location = occurrence.getLocation();
        return new AttendanceSummaryResponse(
                attendance.getId(),
                toPersonSummary(attendance.getPerson(), today),
                location.getId(),
                location.getName(),
                occurrence.getOccurrenceDate(),
                attendance.getStartTime(),
                attendance.getEndTime(),
                attendance.getSecurityCode() != null ? attendance.getSecurityCode().getCode() : null,
                attendance.isFirstTime(),
                attendance.getNote()
        );
    }
}
