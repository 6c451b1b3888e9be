package com.anime.tracker.catalogue.repository;

import com.anime.tracker.catalogue.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {
    Optional<UserAccount> findByEmailIgnoreCase(String email);

    Optional<UserAccount> findByGoogleId(String googleId);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByGoogleId(String googleId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserAccount u where u.id = :id")
    int deleteByIdCascading(@Param("id") Long id);
}
