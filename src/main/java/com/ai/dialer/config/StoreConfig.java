package com.ai.dialer.config;

import com.ai.dialer.repository.CallerIdLockRepository;
import com.ai.dialer.repository.TransferRecordRepository;
import com.ai.dialer.store.CallerIdLockStore;
import com.ai.dialer.store.InMemoryCallerIdLockStore;
import com.ai.dialer.store.InMemoryParallelGroupStore;
import com.ai.dialer.store.InMemoryTransferStore;
import com.ai.dialer.store.JpaCallerIdLockStore;
import com.ai.dialer.store.JpaTransferStore;
import com.ai.dialer.store.ParallelGroupStore;
import com.ai.dialer.store.TransferStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Chooses the store implementations. {@code dialer.store.type=jpa} shares locks and transfers
 * through the database so several instances can run side by side.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private final DialerProperties properties;

    public StoreConfig(DialerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CallerIdLockStore callerIdLockStore(CallerIdLockRepository repository,
                                               PlatformTransactionManager transactionManager,
                                               Clock clock) {
        if (properties.getStore().getType() == DialerProperties.StoreType.JPA) {
            log.info("Caller ID locks stored in database");
            return new JpaCallerIdLockStore(repository, new TransactionTemplate(transactionManager), clock);
        }
        log.info("Caller ID locks stored in memory");
        return new InMemoryCallerIdLockStore(clock);
    }

    @Bean
    public TransferStore transferStore(TransferRecordRepository repository,
                                       PlatformTransactionManager transactionManager) {
        if (properties.getStore().getType() == DialerProperties.StoreType.JPA) {
            return new JpaTransferStore(repository, new TransactionTemplate(transactionManager));
        }
        return new InMemoryTransferStore();
    }

    @Bean
    public ParallelGroupStore parallelGroupStore(Clock clock) {
        return new InMemoryParallelGroupStore(clock, properties.getParallel().getGroupTtl());
    }
}
