package com.lendingmarket.backend.modules.loan.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lendingmarket.backend.modules.loan.domain.AchDetail;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AchDetailRepository extends JpaRepository<AchDetail, UUID> {

    @Query("select a from AchDetail a where a.participant.id in :participantIds")
    List<AchDetail> findByParticipantIds(@Param("participantIds") Collection<UUID> participantIds);

    @Query("select a from AchDetail a where a.participant.id = :participantId")
    Optional<AchDetail> findByParticipantId(@Param("participantId") UUID participantId);
}
