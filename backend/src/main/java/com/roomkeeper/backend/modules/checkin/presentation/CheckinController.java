package com.roomkeeper.backend.modules.checkin.presentation;

import java.time.LocalDate;
import java.util.List;

import com.roomkeeper.backend.modules.checkin.application.CapacityService;
import com.roomkeeper.backend.modules.checkin.application.CheckinService;
import com.roomkeeper.backend.modules.checkin.presentation.dto.AttendanceSummaryResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.BatchCheckinRequest;
import com.roomkeeper.backend.modules.checkin.presentation.dto.BatchCheckinResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinRequest;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinResultResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckinValidationResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.CheckoutResponse;
import com.roomkeeper.backend.modules.checkin.presentation.dto.RoomCapacityResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/checkin")
@Tag(name = "Check-in", description = "Attendance check-in, check-out and room occupancy")
public class CheckinController {

    private final CheckinService checkinService;
    private final CapacityService capacityService;

    public CheckinController(CheckinService checkinService, CapacityService capacityService) {
        this.checkinService = checkinService;
        this.capacityService = capacityService;
    }

    @PostMapping("/attendance")
    @Operation(summary = "Check one person in", description = "A refused check-in is returned with 200 and success=false")
    public ResponseEntity<CheckinResultResponse> checkIn(@Valid @RequestBody CheckinRequest request) {
        CheckinResultResponse result = checkinService.checkIn(request);
        return ResponseEntity.status(result.success() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @PostMapping("/attendance/batch")
    @Operation(summary = "Check several people in, each independently")
    public ResponseEntity<BatchCheckinResponse> batchCheckIn(@Valid @RequestBody BatchCheckinRequest request) {
        return ResponseEntity.ok(checkinService.batchCheckIn(request.items()));
    }

    @PostMapping("/attendance/validate")
    @Operation(summary = "Dry-run the check-in rules without checking in")
    public ResponseEntity<CheckinValidationResponse> validate(@RequestBody CheckinRequest request) {
        return ResponseEntity.ok(checkinService.validateCheckin(request.personId(), request.locationId(),
                request.scheduleId()));
    }

    @PostMapping("/checkout/{attendanceId}")
    @Operation(summary = "Close an open attendance")
    public ResponseEntity<CheckoutResponse> checkOut(@PathVariable("attendanceId") String attendanceId) {
        return ResponseEntity.ok(new CheckoutResponse(checkinService.checkOut(attendanceId)));
    }

    @GetMapping("/locations/{locationId}/attendance")
    public ResponseEntity<List<AttendanceSummaryResponse>> currentOccupants(
            @PathVariable("locationId") String locationId
    ) {
        return ResponseEntity.ok(checkinService.currentOccupants(locationId));
    }

    @GetMapping("/locations/{locationId}/capacity")
    public ResponseEntity<RoomCapacityResponse> capacity(
            @PathVariable("locationId") String locationId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(capacityService.getCapacity(locationId, date));
    }

    @GetMapping("/people/{personId}/attendance-history")
    public ResponseEntity<List<AttendanceSummaryResponse>> attendanceHistory(
            @PathVariable("personId") String personId,
            @RequestParam(name = "days", defaultValue = "30") int days
    ) {
        return ResponseEntity.ok(checkinService.personHistory(personId, days));
    }
}
