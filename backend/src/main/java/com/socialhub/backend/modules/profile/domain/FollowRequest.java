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
 * Pending request from {@code requesterId} to follow the private account {@code targetId}.
 * Accepting it turns the requester into the follower.
 */
@Entity
@Table(
        name = "follow_request",
        uniqueConstraints = @UniqueConstraint(name = "uq_follow_request_pair", columnNames = {"requester_id", "target_id"})
)
public class FollowRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "requester_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID requesterId;

    @Column(name = "target_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID targetId;

    protected FollowRequest() {
    }

    public FollowRequest(UUID requesterId, UUID targetId) {
        this.requesterId = requesterId;
        this.targetId = targetId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequesterId() {
        return requesterId;
    }

    public UUID getTargetId() {
        return targetId;
    }

    public Follower promote() {
        return new Follower(requesterId, targetId);
    }
}
