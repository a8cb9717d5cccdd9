package com.roomkeeper.backend.modules.pickup.presentation.dto;

import java.util.UUID;

import com.roomkeeper.backend.modules.directory.domain.Person;
import com.roomkeeper.backend.modules.pickup.domain.AuthorizedPickup;
import com.roomkeeper.backend.modules.pickup.domain.PickupLog;

public final class PickupDtoMapper {

    private PickupDtoMapper() {
    }

    public static PickupLogResponse toPickupLog(PickupLog log) {
        return new PickupLogResponse(
                log.getId(),
                log.getAttendance().getId(),
                log.getChild().getId(),
                log.getChild().getFullName(),
                idOf(log.getPickupPerson()),
                log.getPickupPersonName(),
                log.isWasAuthorized(),
                log.getAuthorizedPickup() != null ? log.getAuthorizedPickup().getId() : null,
                log.isSupervisorOverride(),
                idOf(log.getSupervisor()),
                log.getCheckoutTime(),
                log.getNotes()
        );
    }

    public static AuthorizedPickupResponse toAuthorizedPickup(AuthorizedPickup pickup) {
        return new AuthorizedPickupResponse(
                pickup.getId(),
                pickup.getChild().getId(),
                idOf(pickup.getAuthorizedPerson()),
                pickup.getDisplayName(),
                pickup.getPhoneNumber(),
                pickup.getRelationship(),
                pickup.getAuthorizationLevel(),
                pickup.getCustodyNotes(),
                pickup.isActive(),
                pickup.getUpdatedAt()
        );
    }

    private static UUID idOf(Person person) {
        return person != null ? person.getId() : null;
    }
}
