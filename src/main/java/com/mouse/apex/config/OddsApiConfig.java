package com.mouse.apex.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
public class OddsApiConfig {

    @Value("${odds.api.key:}")
    private String apiKey;

    @Value("${odds.api.base-url:https://api.the-odds-api.com/v4}")
    private String baseUrl;

    @Value("${odds.api.regions:us,uk,eu}")
    private String regions;

    @Value("${odds.api.markets:h2h,spreads,totals}")
    private String markets;

    /** Free tier allowance. */
    @Value("${odds.api.monthly-limit:500}")
    private int monthlyLimit;

    @Value("${odds.api.timeout.ms:10000}")
    private long timeoutMs;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
