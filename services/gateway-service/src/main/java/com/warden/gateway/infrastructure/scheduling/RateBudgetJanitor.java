package com.warden.gateway.infrastructure.scheduling;

import com.warden.security.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops rate-limit budgets whose window has elapsed. */
@Component
public class RateBudgetJanitor {

    private static final Logger log = LoggerFactory.getLogger(RateBudgetJanitor.class);

    private final RateLimiter rateLimiter;

    public RateBudgetJanitor(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(
            fixedDelayString = "${warden.rate-limit.purge-interval:PT1M}",
            initialDelayString = "${warden.rate-limit.purge-interval:PT1M}")
    public void purgeExpiredBudgets() {
        int removed = rateLimiter.purgeExpired();
        if (removed > 0) {
            log.debug("Rate budget sweep removed {} client(s), {} still tracked",
                    removed, rateLimiter.trackedClients());
        }
    }
}
