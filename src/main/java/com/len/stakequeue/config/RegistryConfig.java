package com.len.stakequeue.config;

import com.len.stakequeue.domain.ledger.AccountLedger;
import com.len.stakequeue.domain.ledger.AccrualRates;
import com.len.stakequeue.domain.pricing.PricingFunction;
import com.len.stakequeue.domain.queue.StakeQueue;
import com.len.stakequeue.infra.access.RoleTableAccessGate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 도메인 객체(원장/대기열/가격 함수)는 스프링 의존 없는 순수 클래스라 여기서 빈으로 묶는다.
 */
@Configuration
public class RegistryConfig {

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccrualRates accrualRates(
            @Value("${registry.ledger.accrual-interval-ms:10000}") long intervalMs,
            @Value("${registry.ledger.regular-rate:10}") long regularRate,
            @Value("${registry.ledger.restricted-rate:5}") long restrictedRate
    ) {
        return new AccrualRates(intervalMs, regularRate, restrictedRate);
    }

    @Bean
    public AccountLedger accountLedger(AccrualRates accrualRates) {
        return new AccountLedger(accrualRates);
    }

    @Bean
    public StakeQueue stakeQueue() {
        return new StakeQueue();
    }

    @Bean
    public PricingFunction pricingFunction() {
        return new PricingFunction();
    }

    @Bean
    public RoleTableAccessGate roleTableAccessGate(
            AccountLedger accountLedger,
            @Value("${registry.access.owner:owner}") String owner,
            @Value("${registry.access.controller:controller}") String controller
    ) {
        return new RoleTableAccessGate(accountLedger, owner, controller);
    }

    // SSE 전송 전용. 스레드 하나로 알림 순서를 유지하고, 큐가 차면 hub 가 버린다.
    @Bean
    public ThreadPoolTaskExecutor sseDispatchExecutor(
            @Value("${registry.sse.dispatch-queue-capacity:10000}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sse-dispatch-");
        return executor;
    }
}
