package com.mouse.apex.service;

import com.mouse.apex.config.PipelineConfig;
import com.mouse.apex.enums.AnalysisMode;
import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.NoHighValueFixturesException;
import com.mouse.apex.exception.PredictionPipelineException;
import com.mouse.apex.model.DateFilter;
import com.mouse.apex.model.PipelineReport;
import com.mouse.apex.model.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheWarmupServiceTest {

    @Mock
    PredictionService predictionService;

    private PipelineConfig config;
    private CacheWarmupService warmupService;

    @BeforeEach
    void setup() {
        config = new PipelineConfig();
        warmupService = new CacheWarmupService(predictionService, config);
    }

    @Test
    void warmup_refreshesTodaysBestPickForEverySport() {
        when(predictionService.refresh(any(), any(), any())).thenReturn(result());

        int refreshed = warmupService.warmup();

        assertThat(refreshed).isEqualTo(SportEnum.values().length);
        verify(predictionService).refresh(SportEnum.FOOTBALL, DateFilter.parse("today"), AnalysisMode.BEST_PICK);
        assertThat(warmupService.isWarming()).isFalse();
    }

    @Test
    void warmup_failuresForOneSportDoNotStopTheOthers() {
        when(predictionService.refresh(any(), any(), any())).thenReturn(result());
        when(predictionService.refresh(eq(SportEnum.FOOTBALL), any(), any()))
                .thenThrow(new NoHighValueFixturesException("No high-value fixtures found for Football"));
        when(predictionService.refresh(eq(SportEnum.TENNIS), any(), any()))
                .thenThrow(new PredictionPipelineException("odds down"));

        assertThat(warmupService.warmup()).isEqualTo(SportEnum.values().length - 2);
        verify(predictionService, times(SportEnum.values().length)).refresh(any(), any(), any());
    }

    @Test
    void warmup_alreadyRunning_isSkipped() {
        AtomicInteger nested = new AtomicInteger();
        when(predictionService.refresh(any(), any(), any())).thenReturn(result());
        when(predictionService.refresh(eq(SportEnum.FOOTBALL), any(), any())).thenAnswer(inv -> {
            nested.set(warmupService.warmup());
            return result();
        });

        warmupService.warmup();

        assertThat(nested.get()).isEqualTo(-1);
    }

    @Test
    void scheduledWarmup_disabled_doesNothing() {
        config.setWarmupEnabled(false);

        warmupService.scheduledWarmup();

        verifyNoInteractions(predictionService);
    }

    @Test
    void scheduledWarmup_enabled_refreshes() {
        ReflectionTestUtils.setField(config, "warmupEnabled", true);
        when(predictionService.refresh(any(), any(), any())).thenReturn(result());

        warmupService.scheduledWarmup();

        verify(predictionService, times(SportEnum.values().length)).refresh(any(), any(), any());
    }

    private static PipelineResult result() {
        return new PipelineResult(List.of(), PipelineReport.builder().build());
    }
}
