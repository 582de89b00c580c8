package com.pharmanio.duty.ingestion.source;

import com.pharmanio.common.exception.IngestionFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class DefaultHttpDutySourceClient implements DutySourceClient {

    private final HttpClient httpClient;

    private final Set<String> allowedDomains;
    private final Duration requestTimeout;
    private final int maxBytes;
    private final int maxRedirects;
    private final String userAgent;

    public DefaultHttpDutySourceClient(
            @Value("${pharmanio.ingestion.allowed-domains:}") List<String> allowedDomains,
            @Value("${pharmanio.ingestion.connect-timeout:10s}") Duration connectTimeout,
            @Value("${pharmanio.ingestion.request-timeout:10s}") Duration requestTimeout,
            @Value("${pharmanio.ingestion.max-bytes:5242880}") int maxBytes,
            @Value("${pharmanio.ingestion.max-redirects:5}") int maxRedirects,
            @Value("${pharmanio.ingestion.user-agent:PharmAnio/1.0}") String userAgent
    ) {
        this.allowedDomains = normalizeDomains(allowedDomains);
        this.requestTimeout = requestTimeout;
        this.maxBytes = maxBytes;
        this.maxRedirects = maxRedirects;
        this.userAgent = userAgent;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public FetchedPage fetch(String url, Map<String, String> headers) {
        if (url == null || url.isBlank()) {
            throw IngestionFailureException.fetchFailed("url is required", Map.of());
        }

        URI current = validateUri(parseUri(url));
        for (int redirectCount = 0; redirectCount <= maxRedirects; redirectCount++) {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(current)
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .GET();

            if (headers != null) {
                for (Map.Entry<String, String> e : headers.entrySet()) {
                    if (e.getKey() != null && e.getValue() != null) {
                        req.header(e.getKey(), e.getValue());
                    }
                }
            }

            HttpResponse<byte[]> resp = exchange(req.build(), current);
            int status = resp.statusCode();

            if (isRedirect(status)) {
                String location = resp.headers().firstValue("location").orElse(null);
                if (location == null || location.isBlank()) {
                    throw IngestionFailureException.fetchFailed("Redirect response missing Location header", Map.of(
                            "statusCode", status,
                            "url", current.toString()
                    ));
                }
                URI next = validateUri(resolveRedirect(current, location));
                log.debug("Following redirect {} -> {}", current, next);
                current = next;
                continue;
            }

            if (status < 200 || status >= 300) {
                throw IngestionFailureException.fetchFailed("Download failed with status=" + status, Map.of(
                        "statusCode", status,
                        "url", current.toString()
                ));
            }

            String contentType = resp.headers().firstValue("content-type").orElse(null);
            if (contentType != null) {
                String ct = contentType.toLowerCase(Locale.ROOT);
                boolean ok = ct.contains("text/html")
                        || ct.contains("application/xhtml+xml")
                        || ct.contains("text/plain");
                if (!ok) {
                    throw IngestionFailureException.fetchFailed("Unsupported content-type: " + contentType, Map.of(
                            "contentType", contentType,
                            "url", current.toString()
                    ));
                }
            }

            return new FetchedPage(new String(resp.body(), charsetOf(contentType)), contentType, current.toString(), status);
        }

        throw IngestionFailureException.fetchFailed("Too many redirects (maxRedirects=" + maxRedirects + ")", Map.of("url", url));
    }

    /**
     * Sends one request and waits at most {@code requestTimeout} for the status line, headers and
     * body together. A stalled body is cancelled and reported as a fetch failure.
     */
    private HttpResponse<byte[]> exchange(HttpRequest request, URI uri) {
        CompletableFuture<HttpResponse<byte[]>> future = httpClient.sendAsync(request, this::cappedBody);
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw IngestionFailureException.fetchFailed("Timed out downloading " + uri + " after " + requestTimeout, Map.of(
                    "url", uri.toString(),
                    "timeout", requestTimeout.toString()
            ), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw IngestionFailureException.fetchFailed("Interrupted while downloading " + uri, Map.of("url", uri.toString()), e);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            IngestionFailureException failure = findFailure(cause);
            if (failure != null) {
                throw failure;
            }
            throw IngestionFailureException.fetchFailed("Failed to download " + uri + ": " + safeMsg(cause), Map.of(
                    "url", uri.toString()
            ), cause);
        }
    }

    private HttpResponse.BodySubscriber<byte[]> cappedBody(HttpResponse.ResponseInfo info) {
        int status = info.statusCode();
        if (status < 200 || status >= 300) {
            return HttpResponse.BodySubscribers.replacing(new byte[0]);
        }
        long declaredLength = info.headers().firstValueAsLong("content-length").orElse(-1L);
        return new CappedBodySubscriber(maxBytes, declaredLength);
    }

    private static URI parseUri(String url) {
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw IngestionFailureException.fetchFailed("Malformed URL: " + url, Map.of("url", url), e);
        }
    }

    private static URI resolveRedirect(URI current, String location) {
        try {
            return current.resolve(new URI(location.trim()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw IngestionFailureException.fetchFailed("Malformed redirect Location: " + location, Map.of(
                    "location", location,
                    "url", current.toString()
            ), e);
        }
    }

    private static IngestionFailureException findFailure(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof IngestionFailureException failure) {
                return failure;
            }
            current = current.getCause();
        }
        return null;
    }

    private URI validateUri(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null || !("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme))) {
            throw IngestionFailureException.fetchFailed("Only http(s) URLs are allowed", Map.of("url", String.valueOf(uri)));
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw IngestionFailureException.fetchFailed("URL host is missing", Map.of("url", String.valueOf(uri)));
        }

        String normalizedHost = normalizeHost(host);
        if (!allowedDomains.isEmpty()) {
            boolean ok = allowedDomains.contains(normalizedHost);
            if (!ok) {
                for (String allowed : allowedDomains) {
                    if (normalizedHost.endsWith("." + allowed)) {
                        ok = true;
                        break;
                    }
                }
            }
            if (!ok) {
                throw IngestionFailureException.fetchFailed("URL host not allowed: " + normalizedHost, Map.of(
                        "host", normalizedHost,
                        "url", String.valueOf(uri)
                ));
            }
        }
        return uri;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.debug("Unknown charset '{}', falling back to UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static Set<String> normalizeDomains(List<String> domains) {
        if (domains == null) return Set.of();
        Set<String> out = new HashSet<>();
        for (String d : domains) {
            if (d == null) continue;
            String t = d.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static String normalizeHost(String host) {
        return IDN.toASCII(host.trim().toLowerCase(Locale.ROOT));
    }

    private static String safeMsg(Throwable e) {
        if (e == null) return "unknown";
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }

    /**
     * Buffers the body up to {@code maxBytes} and cancels the exchange once the cap is exceeded.
     */
    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final int maxBytes;
        private final long declaredLength;
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private Flow.Subscription subscription;

        CappedBodySubscriber(int maxBytes, long declaredLength) {
            this.maxBytes = maxBytes;
            this.declaredLength = declaredLength;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return result;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (declaredLength > maxBytes) {
                subscription.cancel();
                result.completeExceptionally(tooLarge(Map.of(
                        "contentLength", declaredLength,
                        "maxBytes", maxBytes
                )));
                return;
            }
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) return;
            for (ByteBuffer item : items) {
                int n = item.remaining();
                if ((long) buffer.size() + n > maxBytes) {
                    subscription.cancel();
                    result.completeExceptionally(tooLarge(Map.of("maxBytes", maxBytes)));
                    return;
                }
                byte[] chunk = new byte[n];
                item.get(chunk);
                buffer.write(chunk, 0, n);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            result.complete(buffer.toByteArray());
        }

        private IngestionFailureException tooLarge(Map<String, Object> details) {
            return IngestionFailureException.fetchFailed("Downloaded content exceeds maxBytes (" + maxBytes + ")", details);
        }
    }
}
