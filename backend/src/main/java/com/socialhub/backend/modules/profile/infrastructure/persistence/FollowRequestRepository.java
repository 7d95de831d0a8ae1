package com.socialhub.backend.modules.profile.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.profile.domain.FollowRequest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FollowRequestRepository extends JpaRepository<FollowRequest, UUID> {

    Optional<FollowRequest> findByRequesterIdAndTargetId(UUID requesterId, UUID targetId);

    boolean existsByRequesterIdAndTargetId(UUID requesterId, UUID targetId);

    List<FollowRequest> findAllByTargetIdOrderByCreatedAtDesc(UUID targetId);

    @Modifying
    @Query("delete from FollowRequest r where r.requesterId = :requesterId and r.targetId = :targetId")
    int deletePending(@Param("requesterId") UUID requesterId, @Param("targetId") UUID targetId);
}
