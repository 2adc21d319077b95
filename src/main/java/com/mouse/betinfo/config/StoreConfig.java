package com.mouse.betinfo.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class StoreConfig {

    /**
     * Every store insert commits in its own transaction before returning.
     */
    @Bean
    public TransactionTemplate ledgerTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return template;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ledgerBatchExecutor(LedgerProperties properties) {
        int threads = Math.max(1, properties.getBatch().getThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "ledger-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("⚙️ Batch executor ready | threads={}", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }
}
