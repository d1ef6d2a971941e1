package com.ai.dialer.repository;

import com.ai.dialer.entity.CallerIdLockEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CallerIdLockRepository extends JpaRepository<CallerIdLockEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM CallerIdLockEntity l WHERE l.phoneNumber = :phoneNumber")
    CallerIdLockEntity findByIdForUpdate(@Param("phoneNumber") String phoneNumber);

    Optional<CallerIdLockEntity> findFirstByCallReferenceAndExpiresAtAfter(String callReference, Instant now);

    List<CallerIdLockEntity> findByHolderIdAndExpiresAtAfterOrderByAcquiredAtAsc(String holderId, Instant now);

    boolean existsByPhoneNumberAndExpiresAtAfter(String phoneNumber, Instant now);

    @Modifying
    @Query("DELETE FROM CallerIdLockEntity l WHERE l.callReference = :callReference")
    int deleteByCallReference(@Param("callReference") String callReference);

    @Modifying
    @Query("DELETE FROM CallerIdLockEntity l WHERE l.phoneNumber = :phoneNumber")
    int deleteByPhoneNumber(@Param("phoneNumber") String phoneNumber);

    @Modifying
    @Query("DELETE FROM CallerIdLockEntity l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
