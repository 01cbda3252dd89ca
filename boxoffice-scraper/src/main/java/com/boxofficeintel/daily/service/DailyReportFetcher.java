package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retrieves and parses one date page of the reporting source.
 *
 * Rate limiting: every attempt, retries included, waits for the RequestThrottle, so the source
 * never sees more than one request per configured delay. Transient failures are retried with
 * exponential backoff; once attempts run out the date comes back as a FetchError instead of
 * an exception, and the orchestrator decides what to do with it.
 */
@Service
@Slf4j
public class DailyReportFetcher {

    private final RestTemplate restTemplate;
    private final DailyReportParser parser;
    private final RequestThrottle throttle;
    private final BoxOfficeProperties properties;
    private final Retry retry;

    public DailyReportFetcher(RestTemplate sourceRestTemplate,
                              DailyReportParser parser,
                              RequestThrottle throttle,
                              BoxOfficeProperties properties) {
        this.restTemplate = sourceRestTemplate;
        this.parser = parser;
        this.throttle = throttle;
        this.properties = properties;
        this.retry = Retry.of("dailyReport", retryConfig(properties.getSource()));
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retry {} of date page after: {} (waiting {} ms)",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage(),
                        event.getWaitInterval().toMillis()));
    }

    /**
     * @return the parsed page, or the error left after the last attempt; never throws for
     *         network, status or page-shape problems
     */
    public FetchResult fetchAndParse(LocalDate date) {
        String url = urlFor(date);
        AtomicInteger attempts = new AtomicInteger();
        try {
            ParsedReport report = retry.executeSupplier(() -> {
                attempts.incrementAndGet();
                return fetchOnce(date, url);
            });
            return FetchResult.success(date, report);
        } catch (TransientFetchException e) {
            log.warn("Giving up on {} after {} attempts: {}", date, attempts.get(), e.getMessage());
            return FetchResult.failure(new FetchError(date, attempts.get(), e.getMessage()));
        }
    }

    public String urlFor(LocalDate date) {
        return properties.getSource().getDateUrlTemplate().replace("{date}", date.toString());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ParsedReport fetchOnce(LocalDate date, String url) {
        throttle.awaitTurn();
        log.debug("Fetching date page: {}", url);
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new TransientFetchException("HTTP " + response.getStatusCode().value() + " for " + url);
            }
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new TransientFetchException("Empty body for " + url);
            }
            return parser.parse(date, body, url);

        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 429) {
                log.warn("Rate limited (429) by reporting source on {}", date);
            }
            throw new TransientFetchException("HTTP " + e.getStatusCode().value() + " for " + url, e);

        } catch (ResourceAccessException e) {
            throw new TransientFetchException("I/O error for " + url + ": " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new TransientFetchException("Request failed for " + url + ": " + e.getMessage(), e);

        } catch (ReportParseException e) {
            throw new TransientFetchException("Malformed page for " + date + ": " + e.getMessage(), e);

        } finally {
            throttle.requestFinished();
        }
    }

    private static RetryConfig retryConfig(BoxOfficeProperties.Source source) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, source.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, source.getInitialBackoffMs()),
                        Math.max(1.0, source.getBackoffMultiplier())))
                .retryExceptions(TransientFetchException.class)
                .build();
    }
}
