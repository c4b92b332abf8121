package com.example.realtime.persistence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceTokenJpaRepository extends JpaRepository<DeviceTokenEntity, String> {

    List<DeviceTokenEntity> findByProfileIdOrderByCreatedAtAsc(String profileId);

    Optional<DeviceTokenEntity> findByToken(String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DeviceTokenEntity t where t.token = :token")
    int deleteByTokenValue(@Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DeviceTokenEntity t where t.profileId = :profileId")
    int deleteByProfile(@Param("profileId") String profileId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DeviceTokenEntity t where t.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update DeviceTokenEntity t set t.lastUsedAt = :usedAt where t.id in :ids")
    int markUsed(@Param("ids") Collection<String> ids, @Param("usedAt") Instant usedAt);
}
