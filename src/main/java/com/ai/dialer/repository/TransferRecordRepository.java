package com.ai.dialer.repository;

import com.ai.dialer.entity.TransferRecordEntity;
import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface TransferRecordRepository extends JpaRepository<TransferRecordEntity, String> {

    /** Claims the record for one operation; zero rows updated means someone else holds it. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE TransferRecordEntity t SET t.pendingOperation = :operation "
            + "WHERE t.transferId = :transferId AND t.status = :expected AND t.pendingOperation IS NULL")
    int claimOperation(@Param("transferId") String transferId,
                       @Param("expected") TransferStatus expected,
                       @Param("operation") TransferOperation operation);
}
