package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.VerificationToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface VerificationTokenRepository extends JpaRepository<VerificationToken, Long> {
    Optional<VerificationToken> findByToken(String token);

    // Returns 0 when another caller already consumed the token.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update VerificationToken t set t.usedAt = :usedAt where t.token = :token and t.usedAt is null")
    int markUsed(@Param("token") String token, @Param("usedAt") Instant usedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from VerificationToken t where t.expiresAt < :now or t.usedAt is not null")
    int deleteExpiredOrUsed(@Param("now") Instant now);
}
