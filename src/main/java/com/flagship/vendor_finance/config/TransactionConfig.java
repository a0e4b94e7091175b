package com.flagship.vendor_finance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction template for wallet postings.
 *
 * Every posting attempt runs in a transaction of its own, even when the caller already
 * has one open. A lost version check then rolls back only that attempt, and the retry
 * reads the wallet through a fresh persistence context. Postings are therefore committed
 * independently of the caller's transaction and do not see its uncommitted writes.
 *
 * Declaring it replaces Spring Boot's default {@link TransactionTemplate}.
 */
@Configuration
public class TransactionConfig {

    @Bean
    public TransactionTemplate postingTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setName("ledger-posting");
        return template;
    }
}
