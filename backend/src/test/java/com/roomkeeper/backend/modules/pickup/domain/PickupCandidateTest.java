package com.roomkeeper.backend.modules.pickup.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PickupCandidateTest {

    @Test
    @DisplayName("a person id wins over a name")
    void personIdPreferred() {
        UUID id = UUID.randomUUID();

        assertThat(PickupCandidate.of(id, "Grandma")).isEqualTo(new PickupCandidate.KnownPerson(id));
    }

    @Test
    @DisplayName("names are trimmed and blanks rejected")
    void namedCandidate() {
        assertThat(PickupCandidate.of(null, "  Grandma ")).isEqualTo(new PickupCandidate.NamedPerson("Grandma"));
        assertThatThrownBy(() -> PickupCandidate.of(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PickupCandidate.of(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("NEVER beats EMERGENCY_ONLY beats ALWAYS")
    void mostRestrictiveLevel() {
        assertThat(AuthorizationLevel.mostRestrictive(AuthorizationLevel.ALWAYS, AuthorizationLevel.EMERGENCY_ONLY))
                .isEqualTo(AuthorizationLevel.EMERGENCY_ONLY);
        assertThat(AuthorizationLevel.mostRestrictive(AuthorizationLevel.NEVER, AuthorizationLevel.EMERGENCY_ONLY))
                .isEqualTo(AuthorizationLevel.NEVER);
        assertThat(AuthorizationLevel.mostRestrictive(AuthorizationLevel.ALWAYS, AuthorizationLevel.ALWAYS))
                .isEqualTo(AuthorizationLevel.ALWAYS);
    }
}
