package com.roomkeeper.backend.modules.checkin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.roomkeeper.backend.global.error.ProblemException;
import com.roomkeeper.backend.modules.checkin.domain.CapacityStatus;
import com.roomkeeper.backend.modules.checkin.infrastructure.persistence.AttendanceRepository;
import com.roomkeeper.backend.modules.checkin.presentation.dto.RoomCapacityResponse;
import com.roomkeeper.backend.modules.directory.domain.CheckinLocation;
import com.roomkeeper.backend.modules.directory.infrastructure.persistence.CheckinLocationRepository;
import com.roomkeeper.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class CapacityServiceTest {

    private static final UUID NURSERY_ID = UUID.fromString("00000000-0000-0000-0000-000000000c01");
    private static final UUID OVERFLOW_ID = UUID.fromString("00000000-0000-0000-0000-000000000c02");
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 5);

    @Mock
    private CheckinLocationRepository checkinLocationRepository;

    @Mock
    private AttendanceRepository attendanceRepository;

    private CapacityService capacityService;
    private CheckinLocation nursery;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-05T09:30:00Z").toInstant(), ZoneOffset.UTC);
        CheckinProperties properties = new CheckinProperties(Duration.ofSeconds(5), Duration.ofSeconds(2), true,
                new CheckinProperties.SecurityCodeSettings(10), new CheckinProperties.CapacitySettings(80));
        capacityService = new CapacityService(checkinLocationRepository, attendanceRepository, properties, clock);

        nursery = TestEntities.location(NURSERY_ID, "Nursery", 8, 10);
        nursery.setOverflowLocation(TestEntities.location(OVERFLOW_ID, "Nursery Overflow", null, 12));
        lenient().when(checkinLocationRepository.findById(NURSERY_ID)).thenReturn(Optional.of(nursery));
    }

    @Test
    @DisplayName("status steps through near, soft and full as occupancy grows")
    void statusThresholds() {
        assertThat(capacityService.statusOf(nursery, 0)).isEqualTo(CapacityStatus.AVAILABLE);
        assertThat(capacityService.statusOf(nursery, 6)).isEqualTo(CapacityStatus.AVAILABLE);
        assertThat(capacityService.statusOf(nursery, 7)).isEqualTo(CapacityStatus.NEAR_CAPACITY);
        assertThat(capacityService.statusOf(nursery, 8)).isEqualTo(CapacityStatus.AT_SOFT_CAPACITY);
        assertThat(capacityService.statusOf(nursery, 10)).isEqualTo(CapacityStatus.FULL);
    }

    @Test
    @DisplayName("a location without any capacity is always available")
    void unlimitedLocation() {
        CheckinLocation hall = TestEntities.location(UUID.randomUUID(), "Hall", null, null);

        assertThat(capacityService.statusOf(hall, 500)).isEqualTo(CapacityStatus.AVAILABLE);
    }

    @Test
    @DisplayName("soft capacity is the limit when no hard capacity is set")
    void softOnlyLocationFillsAtSoftCapacity() {
        CheckinLocation room = TestEntities.location(UUID.randomUUID(), "Room", 4, null);

        assertThat(capacityService.statusOf(room, 4)).isEqualTo(CapacityStatus.FULL);
    }

    @Test
    @DisplayName("capacity view reports today's count, percentage and overflow room")
    void capacityView() {
        when(attendanceRepository.countOpenByLocationAndDate(NURSERY_ID, TODAY)).thenReturn(9L);

        RoomCapacityResponse view = capacityService.getCapacity(NURSERY_ID.toString(), null);

        assertThat(view.occurrenceDate()).isEqualTo(TODAY);
        assertThat(view.currentCount()).isEqualTo(9);
        assertThat(view.status()).isEqualTo(CapacityStatus.AT_SOFT_CAPACITY);
        assertThat(view.canAcceptCheckin()).isTrue();
        assertThat(view.percentageFull()).isEqualTo(112);
        assertThat(view.overflowLocationId()).isEqualTo(OVERFLOW_ID);
        assertThat(view.overflowLocationName()).isEqualTo("Nursery Overflow");
    }

    @Test
    @DisplayName("unknown or malformed location ids are 404")
    void unknownLocation() {
        assertThatThrownBy(() -> capacityService.getCapacity("not-a-location", null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("check-ins are accepted below the hard limit only")
    void canAcceptCheckin() {
        when(attendanceRepository.countOpenByLocationAndDate(NURSERY_ID, TODAY)).thenReturn(9L, 10L);

        assertThat(capacityService.canAcceptCheckin(NURSERY_ID, TODAY)).isTrue();
        assertThat(capacityService.canAcceptCheckin(NURSERY_ID, TODAY)).isFalse();
    }

    @Test
    @DisplayName("missing and inactive locations cannot accept check-ins")
    void missingOrInactiveLocation() {
        when(checkinLocationRepository.findById(OVERFLOW_ID)).thenReturn(Optional.empty());
        nursery.setActive(false);

        assertThat(capacityService.canAcceptCheckin(OVERFLOW_ID, TODAY)).isFalse();
        assertThat(capacityService.canAcceptCheckin(NURSERY_ID, TODAY)).isFalse();
    }
}
