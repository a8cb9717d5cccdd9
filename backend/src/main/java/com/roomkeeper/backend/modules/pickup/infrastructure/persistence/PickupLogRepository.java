package com.roomkeeper.backend.modules.pickup.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.pickup.domain.PickupLog;

public interface PickupLogRepository extends JpaRepository<PickupLog, UUID> {

    @Query("""
            select pl from PickupLog pl
              join fetch pl.child c
              left join fetch pl.pickupPerson pp
              left join fetch pl.supervisor s
             where c.id = :childId
               and pl.checkoutTime >= :from
               and pl.checkoutTime < :to
             order by pl.checkoutTime desc
            """)
    List<PickupLog> findByChildBetween(@Param("childId") UUID childId,
                                       @Param("from") OffsetDateTime from,
                                       @Param("to") OffsetDateTime to);
}
