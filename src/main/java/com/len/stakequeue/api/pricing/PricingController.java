package com.len.stakequeue.api.pricing;

import com.len.stakequeue.application.pricing.PricingService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/pricing")
public class PricingController {

    private final PricingService pricingService;

    // 진입 전 예치금 견적
    @GetMapping("/quote")
    public PricingService.Quote quote(@RequestParam long weight, @RequestParam long priorityValue) {
        return pricingService.quote(weight, priorityValue);
    }

    @GetMapping("/priority")
    public PricingService.Quote priority(@RequestParam long weight, @RequestParam long stakedCoins) {
        return pricingService.priorityFromStake(weight, stakedCoins);
    }
}
