package com.mergeline.backend.sweep;

import com.mergeline.backend.staging.StagingEntity;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Runs the status check of every active staging, one transaction each.
 */
@Component
public class StagingChecker {

    private static final Logger log = LoggerFactory.getLogger(StagingChecker.class);

    private final StagingRepository stagings;
    private final StagingService stagingService;
    private final TransactionTemplate tx;

    public StagingChecker(StagingRepository stagings, StagingService stagingService,
                          PlatformTransactionManager transactionManager) {
        this.stagings = stagings;
        this.stagingService = stagingService;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public int sweep() {
        List<Long> ids = stagings.findByActiveTrueOrderById().stream().map(StagingEntity::getId).toList();
        int done = 0;
        for (Long id : ids) {
            try {
                tx.executeWithoutResult(status -> stagingService.checkStatus(id));
                done++;
            } catch (RuntimeException e) {
                log.error("Status check of staging {} failed", id, e);
            }
        }
        return done;
    }
}
