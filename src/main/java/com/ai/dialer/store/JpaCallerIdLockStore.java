package com.ai.dialer.store;

import com.ai.dialer.entity.CallerIdLockEntity;
import com.ai.dialer.model.CallerIdLock;
import com.ai.dialer.repository.CallerIdLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database-backed lock table shared by every instance. Existing rows are row-locked before
 * they are overwritten; two instances inserting the same number at once collide on the
 * primary key and the loser reports the number as busy.
 */
public class JpaCallerIdLockStore implements CallerIdLockStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCallerIdLockStore.class);

    private final CallerIdLockRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaCallerIdLockStore(CallerIdLockRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public boolean acquire(CallerIdLock lock) {
        try {
            Boolean acquired = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                CallerIdLockEntity existing = repository.findByIdForUpdate(lock.phoneNumber());
                if (existing != null && existing.getExpiresAt().isAfter(now)
                        && !existing.getCallReference().equals(lock.callReference())) {
                    return false;
                }
                if (existing == null) {
                    repository.saveAndFlush(toEntity(lock));
                } else {
                    existing.setHolderId(lock.holderId());
                    existing.setCallReference(lock.callReference());
                    existing.setAcquiredAt(lock.acquiredAt());
                    existing.setExpiresAt(lock.expiresAt());
                    repository.saveAndFlush(existing);
                }
                return true;
            });
            return Boolean.TRUE.equals(acquired);
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.debug("Concurrent acquisition of caller ID {} lost the race: {}", lock.phoneNumber(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean release(String callReference) {
        Integer deleted = transactionTemplate.execute(status -> repository.deleteByCallReference(callReference));
        return deleted != null && deleted > 0;
    }

    @Override
    public boolean releaseByNumber(String phoneNumber) {
        Integer deleted = transactionTemplate.execute(status -> repository.deleteByPhoneNumber(phoneNumber));
        return deleted != null && deleted > 0;
    }

    @Override
    public boolean isAvailable(String phoneNumber) {
        return !repository.existsByPhoneNumberAndExpiresAtAfter(phoneNumber, clock.instant());
    }

    @Override
    public Optional<CallerIdLock> findByCallReference(String callReference) {
        return repository.findFirstByCallReferenceAndExpiresAtAfter(callReference, clock.instant())
                .map(JpaCallerIdLockStore::toModel);
    }

    @Override
    public List<CallerIdLock> findByHolder(String holderId) {
        return repository.findByHolderIdAndExpiresAtAfterOrderByAcquiredAtAsc(holderId, clock.instant()).stream()
                .map(JpaCallerIdLockStore::toModel)
                .toList();
    }

    @Override
    public boolean rebind(String phoneNumber, String fromCallReference, String toCallReference, Instant expiresAt) {
        Boolean rebound = transactionTemplate.execute(status -> {
            CallerIdLockEntity existing = repository.findByIdForUpdate(phoneNumber);
            if (existing == null || !existing.getExpiresAt().isAfter(clock.instant())
                    || !existing.getCallReference().equals(fromCallReference)) {
                return false;
            }
            existing.setCallReference(toCallReference);
            existing.setExpiresAt(expiresAt);
            repository.save(existing);
            return true;
        });
        return Boolean.TRUE.equals(rebound);
    }

    @Override
    public int purgeExpired() {
        Integer deleted = transactionTemplate.execute(status -> repository.deleteExpired(clock.instant()));
        return deleted == null ? 0 : deleted;
    }

    private static CallerIdLockEntity toEntity(CallerIdLock lock) {
        return CallerIdLockEntity.builder()
                .phoneNumber(lock.phoneNumber())
                .holderId(lock.holderId())
                .callReference(lock.callReference())
                .acquiredAt(lock.acquiredAt())
                .expiresAt(lock.expiresAt())
                .build();
    }

    private static CallerIdLock toModel(CallerIdLockEntity entity) {
        return new CallerIdLock(entity.getPhoneNumber(), entity.getHolderId(), entity.getCallReference(),
                entity.getAcquiredAt(), entity.getExpiresAt());
    }
}
