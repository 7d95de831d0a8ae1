package com.socialhub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.ResetToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResetTokenRepository extends JpaRepository<ResetToken, UUID> {

    @Query("select rt from ResetToken rt where rt.token = :token and rt.expiresAt >= :now")
    Optional<ResetToken> findValidByToken(@Param("token") String token, @Param("now") OffsetDateTime now);
}
