package com.roomkeeper.backend.modules.directory.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.roomkeeper.backend.modules.directory.domain.FamilyMember;
import com.roomkeeper.backend.modules.directory.domain.FamilyRole;

public interface FamilyMemberRepository extends JpaRepository<FamilyMember, UUID> {

    @Query("""
            select fm from FamilyMember fm
              join fetch fm.person p
             where fm.familyId = :familyId
               and fm.role = :role
               and fm.active = true
            """)
    List<FamilyMember> findActiveByFamilyIdAndRole(@Param("familyId") UUID familyId, @Param("role") FamilyRole role);
}
