package com.mouse.apex.adapter;

import com.mouse.apex.config.OddsApiConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monthly request allowance for The Odds API. Reset on the first of every month
 * and on demand.
 */
@Slf4j
@Component
public class OddsApiRequestCounter {

    private final int limit;
    private final AtomicInteger used = new AtomicInteger(0);

    @Autowired
    public OddsApiRequestCounter(OddsApiConfig oddsApiConfig) {
        this(oddsApiConfig.getMonthlyLimit());
    }

    public OddsApiRequestCounter(int limit) {
        this.limit = limit;
    }

    /** Reserves one request; false once the allowance is spent. */
    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= limit) {
                log.warn("Odds API monthly limit reached | Used: {} | Limit: {}", current, limit);
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /** Applies the provider's own count when it reports one. */
    public void syncUsed(int providerUsed) {
        used.set(providerUsed);
    }

    @Scheduled(cron = "0 0 0 1 * *")
    public void reset() {
        int previous = used.getAndSet(0);
        log.info("Odds API request counter reset | PreviouslyUsed: {} | Limit: {}", previous, limit);
    }

    public int getUsed() {
        return used.get();
    }

    public int getRemaining() {
        return Math.max(0, limit - used.get());
    }

    public int getLimit() {
        return limit;
    }
}
