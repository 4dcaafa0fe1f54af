package com.len.stakequeue.application.pricing;

import com.len.stakequeue.application.common.RegistryExecutor;
import com.len.stakequeue.domain.pricing.PricingFunction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 가격 함수는 순수 함수라 전역 락 없이 계산한다. 메트릭은 다른 연산과 같이 남긴다.
 */
@Service
@RequiredArgsConstructor
public class PricingService {

    private final RegistryExecutor executor;
    private final PricingFunction pricing;

    public Quote quote(long weight, long priorityValue) {
        return executor.measure("quote", () ->
                new Quote(weight, priorityValue, pricing.cost(weight, priorityValue)));
    }

    public Quote priorityFromStake(long weight, long stakedCoins) {
        return executor.measure("priorityFromStake", () ->
                new Quote(weight, pricing.priorityFromStake(weight, stakedCoins), stakedCoins));
    }

    public record Quote(long weight, long priorityValue, long stakedCoins) {}
}
