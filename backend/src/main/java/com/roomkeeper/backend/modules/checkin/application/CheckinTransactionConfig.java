package com.roomkeeper.backend.modules.checkin.application;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class CheckinTransactionConfig {

    /**
     * Independent transaction used for the guarded check-in section; the security code claim joins it.
     * It must commit before the location lock is released. One check-in holds one connection at a time.
     */
    @Bean
    public TransactionOperations requiresNewTransaction(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
