package com.socialhub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByUserId(UUID userId);

    @Query("""
            select rt
              from RefreshToken rt
              join fetch rt.user
             where rt.token = :token
               and rt.expiresAt >= :now
            """)
    Optional<RefreshToken> findValidByToken(@Param("token") String token, @Param("now") OffsetDateTime now);
}
