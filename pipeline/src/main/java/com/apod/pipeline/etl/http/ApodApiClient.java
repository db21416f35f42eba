package com.apod.pipeline.etl.http;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.FetchClassification;
import com.apod.pipeline.etl.model.FetchResponse;
import com.apod.pipeline.etl.model.HttpFetchResult;
import com.apod.pipeline.etl.model.RawApod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.ExecutorService;

/**
 * Issues a single GET against the APOD endpoint and classifies the answer.
 * Retrying is left to {@link RetryPolicy}.
 */
@Service
public class ApodApiClient {
    private static final Logger log = LoggerFactory.getLogger(ApodApiClient.class);

    private final PipelineProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public ApodApiClient(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public FetchResponse fetch(LocalDate date) {
        HttpFetchResult result = executeOnce(buildUrl(date));
        return classify(result);
    }

    String buildUrl(LocalDate date) {
        String base = properties.getApi().getBaseUrl();
        StringBuilder url = new StringBuilder(base == null ? "" : base);
        url.append(url.indexOf("?") >= 0 ? '&' : '?');
        url.append("api_key=").append(URLEncoder.encode(properties.getApi().getApiKey(), StandardCharsets.UTF_8));
        if (date != null) {
            url.append("&date=").append(date);
        }
        return url.toString();
    }

    FetchResponse classify(HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null) {
            if (errorCode.equals("invalid_url")) {
                return new FetchResponse(result, FetchClassification.FATAL, null, errorCode);
            }
            return new FetchResponse(result, FetchClassification.RETRYABLE, null, errorCode);
        }
        int status = result.statusCode();
        if (status == 429 || status == 503) {
            return new FetchResponse(result, FetchClassification.RETRYABLE, null, "http_" + status);
        }
        if (!result.isSuccessful()) {
            return new FetchResponse(result, FetchClassification.FATAL, null, "http_" + status);
        }
        try {
            RawApod body = result.body() == null || result.body().isBlank()
                ? null
                : objectMapper.readValue(result.body(), RawApod.class);
            if (body == null) {
                return new FetchResponse(result, FetchClassification.FATAL, null, "empty_body");
            }
            return new FetchResponse(result, FetchClassification.SUCCESS, body, "ok");
        } catch (JsonProcessingException e) {
            log.warn("APOD response from {} was not parseable JSON: {}", result.requestedUrl(), e.getOriginalMessage());
            return new FetchResponse(result, FetchClassification.FATAL, null, "unparseable_body");
        }
    }

    private HttpFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getApi().getUserAgent())
                .header("Accept", "application/json")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
