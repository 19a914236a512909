package com.mouse.apex.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs each outbound odds request with its timing and the provider's quota headers.
 * The api key query parameter is never written to the log.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    static final String REDACTED = "***";
    private static final String REMAINING_HEADER = "x-requests-remaining";
    private static final String USED_HEADER = "x-requests-used";

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        HttpUrl safeUrl = redact(request.url());

        log.info("→ {} {}", request.method(), safeUrl);
        long startNs = System.nanoTime();

        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long failedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.error("← FAILED after {}ms | Url: {} | Error: {}", failedMs, safeUrl, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.info("← {} {} | Total: {}ms | QuotaUsed: {} | QuotaRemaining: {}",
                response.code(),
                safeUrl.encodedPath(),
                totalMs,
                headerOrUnknown(response, USED_HEADER),
                headerOrUnknown(response, REMAINING_HEADER));
        return response;
    }

    static HttpUrl redact(HttpUrl url) {
        if (url.queryParameter("apiKey") == null) {
            return url;
        }
        return url.newBuilder().setQueryParameter("apiKey", REDACTED).build();
    }

    private static String headerOrUnknown(Response response, String name) {
        String value = response.header(name);
        return value != null ? value : "n/a";
    }
}
