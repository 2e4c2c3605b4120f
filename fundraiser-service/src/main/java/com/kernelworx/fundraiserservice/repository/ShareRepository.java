package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.model.ShareId;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ShareRepository extends JpaRepository<Share, ShareId> {

    // authorization read: goes to the database, second-level cache bypassed
    @QueryHints({
            @QueryHint(name = "jakarta.persistence.cache.retrieveMode", value = "BYPASS"),
            @QueryHint(name = "org.hibernate.cacheable", value = "false")
    })
    @Query("SELECT s FROM Share s WHERE s.profileId = :profileId AND s.targetAccountId = :targetAccountId")
    Optional<Share> findConsistent(@Param("profileId") String profileId,
                                   @Param("targetAccountId") String targetAccountId);

    List<Share> findByProfileId(String profileId);

    List<Share> findByTargetAccountId(String targetAccountId);

    @Modifying
    @Query("DELETE FROM Share s WHERE s.profileId = :profileId AND s.targetAccountId = :targetAccountId")
    int deleteShare(@Param("profileId") String profileId, @Param("targetAccountId") String targetAccountId);

    @Modifying
    @Query("DELETE FROM Share s WHERE s.profileId = :profileId")
    int deleteAllForProfile(@Param("profileId") String profileId);
}
