package com.roomkeeper.backend.modules.pickup.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.pickup.domain.AuthorizedPickup;

public interface AuthorizedPickupRepository extends JpaRepository<AuthorizedPickup, UUID> {

    @Query("""
            select ap from AuthorizedPickup ap
              left join fetch ap.authorizedPerson p
             where ap.child.id = :childId
               and ap.active = true
             order by ap.authorizationLevel asc, ap.createdAt asc
            """)
    List<AuthorizedPickup> findActiveByChildId(@Param("childId") UUID childId);

    @Query("""
            select ap from AuthorizedPickup ap
             where ap.child.id = :childId
               and ap.authorizedPerson.id = :personId
               and ap.active = true
            """)
    Optional<AuthorizedPickup> findActiveByChildAndPerson(@Param("childId") UUID childId,
                                                          @Param("personId") UUID personId);

    /**
     * Case-insensitive match on the free-text name, or on the full name of a linked person.
     */
    @Query("""
            select ap from AuthorizedPickup ap
              left join ap.authorizedPerson p
             where ap.child.id = :childId
               and ap.active = true
               and (lower(ap.name) = lower(:name) or lower(p.fullName) = lower(:name))
            """)
    List<AuthorizedPickup> findActiveByChildAndName(@Param("childId") UUID childId, @Param("name") String name);

    @Query("""
            select ap from AuthorizedPickup ap
             where ap.child.id = :childId
               and ap.authorizedPerson is null
               and lower(ap.name) = lower(:name)
               and ap.active = true
            """)
    Optional<AuthorizedPickup> findActiveNameOnlyByChild(@Param("childId") UUID childId, @Param("name") String name);

    /**
     * Inserts an active row unless one already exists for (child, person); the partial unique index decides.
     *
     * @return 1 when a row was created, 0 otherwise
     */
    @Modifying
    @Query(value = """
            INSERT INTO authorized_pickup (
                id, child_person_id, authorized_person_id, relationship, authorization_level,
                is_active, created_at, updated_at
            )
            VALUES (:id, :childId, :personId, :relationship, :level, TRUE, :now, :now)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("childId") UUID childId,
                       @Param("personId") UUID personId,
                       @Param("relationship") String relationship,
                       @Param("level") String level,
                       @Param("now") OffsetDateTime now);
}
