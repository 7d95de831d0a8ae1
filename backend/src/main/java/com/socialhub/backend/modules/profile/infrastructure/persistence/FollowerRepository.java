package com.socialhub.backend.modules.profile.infrastructure.persistence;

import java.util.UUID;

import com.socialhub.backend.modules.profile.domain.Follower;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FollowerRepository extends JpaRepository<Follower, UUID> {

    boolean existsByFollowerIdAndFollowingId(UUID followerId, UUID followingId);

    long countByFollowingId(UUID followingId);

    long countByFollowerId(UUID followerId);

    @Modifying
    @Query("delete from Follower f where f.followerId = :followerId and f.followingId = :followingId")
    int deleteEdge(@Param("followerId") UUID followerId, @Param("followingId") UUID followingId);
}
