package com.socialhub.backend.modules.profile.domain;

import java.util.UUID;

import com.socialhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Accepted follow edge: {@code followerId} follows {@code followingId}.
 */
@Entity
@Table(
        name = "follower",
        uniqueConstraints = @UniqueConstraint(name = "uq_follower_pair", columnNames = {"follower_id", "following_id"})
)
public class Follower extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "follower_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID followerId;

    @Column(name = "following_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID followingId;

    protected Follower() {
    }

    public Follower(UUID followerId, UUID followingId) {
        this.followerId = followerId;
        this.followingId = followingId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getFollowerId() {
        return followerId;
    }

    public UUID getFollowingId() {
        return followingId;
    }
}
