package com.roomkeeper.backend.modules.pickup.presentation;

import java.util.List;

import com.roomkeeper.backend.modules.pickup.application.AuthorizedPickupService;
import com.roomkeeper.backend.modules.pickup.presentation.dto.AuthorizedPickupResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.AutoPopulateResponse;
import com.roomkeeper.backend.modules.pickup.presentation.dto.CreateAuthorizedPickupRequest;
import com.roomkeeper.backend.modules.pickup.presentation.dto.UpdateAuthorizedPickupRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/checkin")
@Tag(name = "Authorized pickups", description = "Standing list of who may collect a child")
public class AuthorizedPickupController {

    private final AuthorizedPickupService authorizedPickupService;

    public AuthorizedPickupController(AuthorizedPickupService authorizedPickupService) {
        this.authorizedPickupService = authorizedPickupService;
    }

    @GetMapping("/people/{childId}/authorized-pickups")
    public ResponseEntity<List<AuthorizedPickupResponse>> list(@PathVariable("childId") String childId) {
        return ResponseEntity.ok(authorizedPickupService.list(childId));
    }

    @PostMapping("/people/{childId}/authorized-pickups")
    @Operation(summary = "Add or update an authorization for a child")
    public ResponseEntity<AuthorizedPickupResponse> create(
            @PathVariable("childId") String childId,
            @Valid @RequestBody CreateAuthorizedPickupRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authorizedPickupService.create(childId, request));
    }

    @PostMapping("/people/{childId}/authorized-pickups/auto-populate")
    @Operation(summary = "Authorize the adults of the child's family")
    public ResponseEntity<AutoPopulateResponse> autoPopulate(@PathVariable("childId") String childId) {
        return ResponseEntity.ok(new AutoPopulateResponse(authorizedPickupService.autoPopulate(childId)));
    }

    @PutMapping("/authorized-pickups/{pickupId}")
    public ResponseEntity<AuthorizedPickupResponse> update(
            @PathVariable("pickupId") String pickupId,
            @Valid @RequestBody UpdateAuthorizedPickupRequest request
    ) {
        return ResponseEntity.ok(authorizedPickupService.update(pickupId, request));
    }

    @DeleteMapping("/authorized-pickups/{pickupId}")
    public ResponseEntity<Void> deactivate(@PathVariable("pickupId") String pickupId) {
        authorizedPickupService.deactivate(pickupId);
        return ResponseEntity.noContent().build();
    }
}
