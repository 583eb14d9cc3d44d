package com.europeanalysis.stats.service;

import com.europeanalysis.stats.SourceException;
import com.europeanalysis.stats.config.StatsCrawlerProperties;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.PayloadFormat;
import com.europeanalysis.stats.model.RawPage;
import com.europeanalysis.stats.model.RawRecord;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client over the Eurostat dissemination API (or any endpoint serving one of
 * the supported payload formats).
 *
 * Rate limiting: every attempt, retries included, first takes a permit from
 * the host's shared limiter.
 *
 * Retries: 5xx, 429 and I/O failures (timeouts, resets) are retried with
 * exponential backoff up to the configured attempt count. Any other 4xx is
 * final on the first response and surfaces as a {@link SourceException}
 * carrying the status. Eurostat answers unknown datasets and impossible
 * filters with 404; that is a failure here, not an empty result.
 *
 * Local extracts: a dataset with a resource location is read through Spring's
 * {@link ResourceLoader} as a single page, with no rate limit, retry or query
 * parameters, and parsed by the same payload parsers.
 */
@Service
@Slf4j
public class SourceClient {

    private final RestTemplate restTemplate;
    private final StatsCrawlerProperties properties;
    private final HostRateLimiters rateLimiters;
    private final ResourceLoader resourceLoader;
    private final Map<PayloadFormat, PayloadParser> parsers = new EnumMap<>(PayloadFormat.class);
    private final Retry retry;

    public SourceClient(RestTemplate restTemplate,
                        StatsCrawlerProperties properties,
                        HostRateLimiters rateLimiters,
                        ResourceLoader resourceLoader,
                        List<PayloadParser> payloadParsers) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.rateLimiters = rateLimiters;
        this.resourceLoader = resourceLoader;
        payloadParsers.forEach(p -> parsers.put(p.format(), p));

        StatsCrawlerProperties.Retry retryProps = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryProps.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1, retryProps.getInitialBackoff().toMillis()), retryProps.getMultiplier()))
                .retryOnException(SourceClient::isTransient)
                .build();
        this.retry = Retry.of("eurostat", config);
        this.retry.getEventPublisher().onRetry(event -> log.warn("Attempt {} failed ({}), retrying in {}",
                event.getNumberOfRetryAttempts(), describe(event.getLastThrowable()), event.getWaitInterval()));
    }

    /**
     * Lazy page sequence for one dataset. Nothing is fetched until a page is requested.
     *
     * @param overrides query parameters replacing the descriptor defaults; overriding
     *                  the paging parameter pins the sequence to that single value
     */
    public PageSequence fetch(DatasetDescriptor descriptor, Map<String, String> overrides) {
        Map<String, String> safeOverrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        if (descriptor.isFileBacked()) {
            if (!safeOverrides.isEmpty()) {
                log.debug("{} is read from {}; ignoring parameters {}",
                        descriptor.getId(), descriptor.getResource(), safeOverrides.keySet());
            }
            return new PageSequence(this, descriptor, Map.of(), 1);
        }
        boolean pinned = descriptor.isPaged() && safeOverrides.containsKey(descriptor.getPaging().getParam());
        int pageCount = descriptor.isPaged() && !pinned ? descriptor.getPaging().pageCount() : 1;
        return new PageSequence(this, descriptor, safeOverrides, pageCount);
    }

    /** Base dataset URL without query parameters, or the resource location of a local extract. */
    public String datasetUrl(DatasetDescriptor descriptor) {
        if (descriptor.isFileBacked()) {
            return descriptor.getResource();
        }
        return UriComponentsBuilder.fromUriString(properties.getApi().getBaseUrl())
                .pathSegment(descriptor.getPath())
                .toUriString();
    }

    // ── Page fetch ───────────────────────────────────────────────────────────

    RawPage fetchPage(DatasetDescriptor descriptor, Map<String, String> overrides, int pageIndex, int pageCount) {
        if (descriptor.isFileBacked()) {
            return readResource(descriptor);
        }
        Map<String, List<String>> params = queryParams(descriptor, overrides, pageIndex);
        URI uri = buildUri(descriptor, params);

        log.debug("Fetching {} page {}/{}: {}", descriptor.getId(), pageIndex + 1, pageCount, uri);
        ResponseEntity<byte[]> response = execute(uri);

        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        MediaType contentType = response.getHeaders().getContentType();
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;

        List<RawRecord> records = parse(descriptor, body, charset, pageIndex, uri.toString());
        log.info("{} page {}: {} records ({} bytes)", descriptor.getId(), pageIndex, records.size(), body.length);

        return page(descriptor, pageIndex, uri.toString(), params, body, charset, records)
                .lastPage(records.isEmpty() || pageIndex + 1 >= pageCount)
                .build();
    }

    private RawPage readResource(DatasetDescriptor descriptor) {
        String location = descriptor.getResource();
        Resource resource = resourceLoader.getResource(location);
        log.debug("Reading {} from {}", descriptor.getId(), location);

        byte[] body;
        try (InputStream in = resource.getInputStream()) {
            body = in.readAllBytes();
        } catch (IOException e) {
            throw new SourceException("Cannot read " + location + " for " + descriptor.getId() + ": "
                    + e.getMessage(), null, location, e);
        }
        Charset charset = descriptor.getEncoding() == null
                ? StandardCharsets.UTF_8
                : Charset.forName(descriptor.getEncoding());

        List<RawRecord> records = parse(descriptor, body, charset, 0, location);
        log.info("{} from {}: {} records ({} bytes)", descriptor.getId(), location, records.size(), body.length);

        return page(descriptor, 0, location, Map.of(), body, charset, records)
                .lastPage(true)
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Defaults, then overrides, then the page's paging value. Comma-separated
     * values become repeated parameters (geo=DE&amp;geo=FR), which is how the
     * dissemination API takes multi-value filters.
     */
    private Map<String, List<String>> queryParams(DatasetDescriptor descriptor, Map<String, String> overrides,
                                                  int pageIndex) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        descriptor.getDefaultParams().forEach((k, v) -> params.put(k, splitValues(v)));
        overrides.forEach((k, v) -> params.put(k, splitValues(v)));

        if (descriptor.isPaged() && !overrides.containsKey(descriptor.getPaging().getParam())) {
            params.put(descriptor.getPaging().getParam(),
                    List.of(descriptor.getPaging().getValues().get(pageIndex)));
        }
        return Collections.unmodifiableMap(params);
    }

    private URI buildUri(DatasetDescriptor descriptor, Map<String, List<String>> params) {
        String baseUrl = properties.getApi().getBaseUrl();
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                    .pathSegment(descriptor.getPath());
            params.forEach((k, values) -> builder.queryParam(k, values.toArray()));
            URI uri = builder.encode().build().toUri();
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new IllegalArgumentException("URI is not absolute: " + uri);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new SourceException("Malformed request URL for " + descriptor.getId() + ": " + e.getMessage(),
                    null, baseUrl, e);
        }
    }

    private ResponseEntity<byte[]> execute(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.valueOf("text/csv"), MediaType.ALL));
        HttpEntity<Void> request = new HttpEntity<>(headers);

        try {
            return Retry.decorateSupplier(retry, () -> {
                rateLimiters.acquire(uri.getHost());
                return restTemplate.exchange(uri, HttpMethod.GET, request, byte[].class);
            }).get();

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String reason = isTransient(e) ? "after " + properties.getRetry().getMaxAttempts() + " attempts" : "(not retried)";
            throw new SourceException("HTTP " + status + " from upstream " + reason, status, uri.toString(), e);

        } catch (ResourceAccessException e) {
            throw new SourceException("I/O failure after " + properties.getRetry().getMaxAttempts()
                    + " attempts: " + e.getMessage(), null, uri.toString(), e);

        } catch (RequestNotPermitted e) {
            throw new SourceException("No rate-limit permit for " + uri.getHost() + " within "
                    + properties.getRateLimit().getAcquireTimeout(), null, uri.toString(), e);
        }
    }

    private List<RawRecord> parse(DatasetDescriptor descriptor, byte[] body, Charset charset,
                                  int pageIndex, String uri) {
        try {
            return parserFor(descriptor.getFormat()).parse(body, charset);
        } catch (IOException e) {
            throw new SourceException("Malformed " + descriptor.getFormat() + " payload for "
                    + descriptor.getId() + " page " + pageIndex + ": " + e.getMessage(), null, uri, e);
        }
    }

    private static RawPage.RawPageBuilder page(DatasetDescriptor descriptor, int pageIndex, String uri,
                                               Map<String, List<String>> params, byte[] body, Charset charset,
                                               List<RawRecord> records) {
        return RawPage.builder()
                .datasetId(descriptor.getId())
                .pageIndex(pageIndex)
                .requestUri(uri)
                .queryParams(params)
                .retrievedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .payload(body)
                .charset(charset)
                .contentHash(sha256Hex(body))
                .records(records);
    }

    private PayloadParser parserFor(PayloadFormat format) {
        PayloadParser parser = parsers.get(format);
        if (parser == null) {
            throw new IllegalStateException("No parser registered for " + format);
        }
        return parser;
    }

    static boolean isTransient(Throwable t) {
        return t instanceof HttpServerErrorException
                || t instanceof HttpClientErrorException.TooManyRequests
                || t instanceof ResourceAccessException;
    }

    private static String describe(Throwable t) {
        if (t instanceof HttpStatusCodeException e) {
            return "HTTP " + e.getStatusCode().value();
        }
        return t == null ? "unknown" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    private static List<String> splitValues(String value) {
        if (value == null) {
            return List.of("");
        }
        List<String> parts = new ArrayList<>();
        Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(parts::add);
        return parts.isEmpty() ? List.of(value) : List.copyOf(parts);
    }

    static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
