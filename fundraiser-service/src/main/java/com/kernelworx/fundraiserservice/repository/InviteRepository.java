package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Invite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface InviteRepository extends JpaRepository<Invite, String> {

    List<Invite> findByProfileIdOrderByCreatedAtDesc(String profileId);

    // Conditional update: only an unused invite can be consumed. 0 rows means someone else won.
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invite i SET i.used = true, i.usedBy = :usedBy, i.usedAt = :usedAt "
            + "WHERE i.inviteCode = :inviteCode AND i.used = false")
    int markUsed(@Param("inviteCode") String inviteCode,
                 @Param("usedBy") String usedBy,
                 @Param("usedAt") Instant usedAt);

    @Modifying
    @Query("DELETE FROM Invite i WHERE i.inviteCode = :inviteCode AND i.profileId = :profileId")
    int deleteInvite(@Param("inviteCode") String inviteCode, @Param("profileId") String profileId);

    @Modifying
    @Query("DELETE FROM Invite i WHERE i.profileId = :profileId")
    int deleteAllForProfile(@Param("profileId") String profileId);
}
