package com.mouse.apex.service;

import com.mouse.apex.config.PipelineConfig;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.NoHighValueFixturesException;
import com.mouse.apex.model.DateFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pre-computes today's best pick per sport so user requests hit a warm cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheWarmupService {

    private final PredictionService predictionService;
    private final PipelineConfig pipelineConfig;

    private final AtomicBoolean warming = new AtomicBoolean(false);

    @Scheduled(cron = "${prediction.cache.warmup.cron:0 */4 * * * *}")
    public void scheduledWarmup() {
        if (!pipelineConfig.isWarmupEnabled()) {
            return;
        }
        warmup();
    }

    /**
     * @return number of sports refreshed, or -1 when a warm-up was already running
     */
    public int warmup() {
        if (!warming.compareAndSet(false, true)) {
            log.info("Cache warm-up already in progress, skipping");
            return -1;
        }
        int refreshed = 0;
        long startMs = System.currentTimeMillis();
        try {
            for (SportEnum sport : SportEnum.values()) {
                try {
                    predictionService.refresh(sport, DateFilter.parse(DateFilter.TODAY), AnalysisMode.BEST_PICK);
                    refreshed++;
                } catch (NoHighValueFixturesException e) {
                    log.info("Warm-up found nothing for {} | Reason: {}", sport, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("Warm-up failed for {} | Error: {}", sport, e.getMessage());
                }
            }
            log.info("🔥 Cache warm-up complete | Refreshed: {}/{} | Took: {}ms",
                    refreshed, SportEnum.values().length, System.currentTimeMillis() - startMs);
            return refreshed;
        } finally {
            warming.set(false);
        }
    }

    public boolean isWarming() {
        return warming.get();
    }
}
