package com.roomkeeper.backend.modules.pickup.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * The person presenting themselves at pickup: either a known directory record or just a name.
 */
public sealed interface PickupCandidate permits PickupCandidate.KnownPerson, PickupCandidate.NamedPerson {

    record KnownPerson(UUID personId) implements PickupCandidate {
        public KnownPerson {
            Objects.requireNonNull(personId, "personId");
        }
    }

    record NamedPerson(String name) implements PickupCandidate {
        public NamedPerson {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            name = name.trim();
        }
    }

    /**
     * Prefers the person id when both are given.
     *
     * @throws IllegalArgumentException when neither is present
     */
    static PickupCandidate of(UUID personId, String name) {
        if (personId != null) {
            return new KnownPerson(personId);
        }
        return new NamedPerson(name);
    }
}
