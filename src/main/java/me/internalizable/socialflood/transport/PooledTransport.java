package me.internalizable.socialflood.transport;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientRequest;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide outbound HTTP client. Each profile owns one bounded reactor-netty connection
 * pool and one {@link WebClient} per route, created once and reused for every request. A profile
 * without proxies has a single direct route; otherwise it rotates over one route per proxy.
 *
 * Requests block the calling thread. Interrupting that thread aborts the in-flight exchange.
 */
public class PooledTransport implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PooledTransport.class);

    private final Map<String, ProfileClient> clients;
    private final Clock clock;

    public PooledTransport(TransportProperties properties, Clock clock) {
        this.clock = clock;
        Map<String, ProfileClient> created = new LinkedHashMap<>();
        properties.resolvedProfiles().forEach((name, profile) ->
                created.put(name, new ProfileClient(name, profile, parseProxies(name, properties.proxiesFor(profile)))));
        this.clients = Collections.unmodifiableMap(created);

        logger.info("PooledTransport initialized with profiles: {}", clients.keySet());
    }

    public TransportResponse get(String profile, String url, Map<String, ?> params) throws TransportException {
        return request(profile, HttpMethod.GET, url, params, Map.of(), null);
    }

    /**
     * Performs a request through the named profile's pool.
     *
     * @param url     absolute URL, or a path resolved against the profile's base URL
     * @param params  query parameters; null values are skipped
     * @param headers extra headers, overriding the profile defaults
     * @param timeout response timeout per attempt, or null for the profile's read timeout
     * @throws UpstreamRateLimitedException on 429
     * @throws TransientTransportException  when retries are exhausted on network errors or 5xx
     * @throws TransportException           on any other 4xx, or when interrupted
     */
    public TransportResponse request(
            String profile,
            HttpMethod method,
            String url,
            Map<String, ?> params,
            Map<String, String> headers,
            Duration timeout) throws TransportException {

        ProfileClient client = client(profile);
        URI uri = resolve(client.profile, url, params);
        Duration responseTimeout = timeout != null ? timeout : client.profile.getReadTimeout();
        Map<String, String> requestHeaders = headers != null ? headers : Map.of();

        client.totalRequests.incrementAndGet();
        long start = System.nanoTime();
        try {
            TransportResponse response = client.retry.executeCallable(
                    () -> exchange(client, method, uri, requestHeaders, responseTimeout));
            client.successfulRequests.incrementAndGet();
            return response;
        } catch (TransportException e) {
            client.failedRequests.incrementAndGet();
            throw e;
        } catch (Exception e) {
            client.failedRequests.incrementAndGet();
            if (Thread.currentThread().isInterrupted()) {
                throw new TransportException("Request to " + uri + " interrupted", e);
            }
            throw new TransportException("Request to " + uri + " failed: " + e.getMessage(), e);
        } finally {
            client.totalTimeNanos.addAndGet(System.nanoTime() - start);
        }
    }

    public boolean hasProfile(String profile) {
        return clients.containsKey(profile);
    }

    /**
     * Per-profile request statistics.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        clients.forEach((name, client) -> stats.put(name, client.stats()));
        return stats;
    }

    @Override
    public void close() {
        clients.values().forEach(client -> client.routes.forEach(route -> route.connectionProvider().dispose()));
        logger.info("PooledTransport closed");
    }

    private ProfileClient client(String profile) {
        ProfileClient client = clients.get(profile);
        if (client == null) {
            throw new IllegalArgumentException("Unknown transport profile: " + profile);
        }
        return client;
    }

    private TransportResponse exchange(
            ProfileClient client,
            HttpMethod method,
            URI uri,
            Map<String, String> headers,
            Duration timeout) throws TransportException {

        Route route = client.nextRoute();
        route.requests().incrementAndGet();

        TransportResponse response;
        try {
            response = route.webClient().method(method)
                    .uri(uri)
                    .headers(h -> headers.forEach(h::set))
                    .httpRequest(request -> {
                        HttpClientRequest nativeRequest = request.getNativeRequest();
                        nativeRequest.responseTimeout(timeout);
                    })
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new TransportResponse(
                                    r.statusCode().value(), r.headers().asHttpHeaders(), body)))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                throw new TransportException(method + " " + uri + " interrupted", cause);
            }
            if (cause instanceof DataBufferLimitException) {
                throw new TransportException(method + " " + uri + " response too large", cause);
            }
            throw new TransientTransportException(method + " " + uri + " failed: " + cause.getMessage(), cause);
        }

        if (response == null) {
            throw new TransientTransportException(method + " " + uri + " returned no response", TransportException.NO_STATUS);
        }
        return classify(method, uri, response);
    }

    private TransportResponse classify(HttpMethod method, URI uri, TransportResponse response) throws TransportException {
        int status = response.status();
        if (status == 429) {
            Duration retryAfter = parseRetryAfter(response.headers().getFirst(HttpHeaders.RETRY_AFTER));
            throw new UpstreamRateLimitedException(method + " " + uri + " rate limited by upstream", retryAfter);
        }
        if (status >= 500) {
            throw new TransientTransportException(method + " " + uri + " returned " + status, status);
        }
        if (status >= 400) {
            throw new TransportException(method + " " + uri + " returned " + status, status);
        }
        return response;
    }

    /**
     * Accepts both delta-seconds and HTTP-date forms; anything else yields null.
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try the date form
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(clock.instant(), at.toInstant());
            return delay.isNegative() ? Duration.ZERO : delay;
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable Retry-After header: {}", trimmed);
            return null;
        }
    }

    /**
     * Parses {@code http[s]://[user[:password]@]host[:port]}; anything else yields null.
     */
    static ProxyAddress parseProxy(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            return null;
        }

        int port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(scheme) ? 443 : 80);
        String username = null;
        String password = null;
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            username = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            password = colon >= 0 ? userInfo.substring(colon + 1) : null;
        }
        return new ProxyAddress(uri.getHost(), port, username, password);
    }

    private static List<ProxyAddress> parseProxies(String profile, List<String> urls) {
        List<ProxyAddress> proxies = new ArrayList<>();
        for (String url : urls) {
            ProxyAddress proxy = parseProxy(url);
            if (proxy == null) {
                logger.warn("[{}] Ignoring invalid proxy URL", profile);
            } else {
                proxies.add(proxy);
            }
        }
        return proxies;
    }

    static URI resolve(TransportProfile profile, String url, Map<String, ?> params) {
        String target = url;
        boolean absolute = url.startsWith("http://") || url.startsWith("https://");
        if (!absolute) {
            String base = profile.getBaseUrl();
            if (base == null || base.isBlank()) {
                throw new IllegalArgumentException("Relative URL " + url + " needs a profile base-url");
            }
            target = base.endsWith("/") || url.startsWith("/") || url.isEmpty()
                    ? base + url
                    : base + "/" + url;
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(target);
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    /**
     * HTTP proxy endpoint. Credentials never appear in {@link #label()}.
     */
    record ProxyAddress(String host, int port, String username, String password) {

        String label() {
            return host + ":" + port;
        }
    }

    private record Route(String label, ConnectionProvider connectionProvider, WebClient webClient, AtomicLong requests) {}

    private static final class ProfileClient {

        private static final String DIRECT = "direct";

        private final TransportProfile profile;
        private final List<Route> routes;
        private final AtomicInteger cursor = new AtomicInteger();
        private final Retry retry;

        private final AtomicLong totalRequests = new AtomicLong();
        private final AtomicLong successfulRequests = new AtomicLong();
        private final AtomicLong failedRequests = new AtomicLong();
        private final AtomicLong retriedRequests = new AtomicLong();
        private final AtomicLong totalTimeNanos = new AtomicLong();

        ProfileClient(String name, TransportProfile profile, List<ProxyAddress> proxies) {
            this.profile = profile;

            List<Route> created = new ArrayList<>();
            if (proxies.isEmpty()) {
                created.add(route(name, DIRECT, profile, null));
            } else {
                for (int i = 0; i < proxies.size(); i++) {
                    ProxyAddress proxy = proxies.get(i);
                    created.add(route(name + "-proxy-" + i, proxy.label(), profile, proxy));
                }
            }
            this.routes = List.copyOf(created);

            RetryConfig retryConfig = RetryConfig.custom()
                    .maxAttempts(Math.max(1, profile.getMaxAttempts()))
                    .intervalFunction(IntervalFunction.ofExponentialBackoff(
                            profile.getInitialBackoff(), profile.getBackoffMultiplier()))
                    .retryOnException(e -> e instanceof TransientTransportException)
                    .build();
            this.retry = Retry.of("transport-" + name, retryConfig);
            this.retry.getEventPublisher().onRetry(event -> {
                retriedRequests.incrementAndGet();
                logger.warn("[{}] Retrying request (attempt {}) in {}: {}",
                        name,
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            });

            logger.info("Transport profile '{}' - maxConnections: {}, readTimeout: {}, maxAttempts: {}, routes: {}",
                    name, profile.getMaxConnections(), profile.getReadTimeout(), profile.getMaxAttempts(),
                    routes.stream().map(Route::label).toList());
        }

        /**
         * Round-robin over the proxy routes; every attempt, retries included, takes the next one.
         */
        Route nextRoute() {
            return routes.get(Math.floorMod(cursor.getAndIncrement(), routes.size()));
        }

        private static Route route(String poolName, String label, TransportProfile profile, ProxyAddress proxy) {
            ConnectionProvider connectionProvider = ConnectionProvider.builder("transport-" + poolName)
                    .maxConnections(profile.getMaxConnections())
                    .maxIdleTime(profile.getMaxIdleTime())
                    .maxLifeTime(profile.getMaxLifeTime())
                    .pendingAcquireTimeout(profile.getPendingAcquireTimeout())
                    .evictInBackground(profile.getMaxIdleTime())
                    .build();

            long writeTimeoutMillis = profile.getWriteTimeout().toMillis();
            HttpClient httpClient = HttpClient.create(connectionProvider)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) profile.getConnectTimeout().toMillis())
                    .responseTimeout(profile.getReadTimeout())
                    .doOnConnected(connection -> connection.addHandlerLast(
                            new WriteTimeoutHandler(writeTimeoutMillis, TimeUnit.MILLISECONDS)))
                    .followRedirect(profile.isFollowRedirects())
                    .compress(true);

            if (proxy != null) {
                httpClient = httpClient.proxy(spec -> {
                    ProxyProvider.Builder builder = spec.type(ProxyProvider.Proxy.HTTP)
                            .host(proxy.host())
                            .port(proxy.port());
                    if (proxy.username() != null) {
                        builder.username(proxy.username()).password(user -> proxy.password() != null ? proxy.password() : "");
                    }
                });
            }

            WebClient webClient = WebClient.builder()
                    .clientConnector(new ReactorClientHttpConnector(httpClient))
                    .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) profile.getMaxInMemorySize().toBytes()))
                    .defaultHeaders(h -> profile.getDefaultHeaders().forEach(h::set))
                    .build();

            return new Route(label, connectionProvider, webClient, new AtomicLong());
        }

        Map<String, Object> stats() {
            long total = totalRequests.get();
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("base_url", profile.getBaseUrl());
            stats.put("max_connections", profile.getMaxConnections());
            stats.put("total_requests", total);
            stats.put("successful_requests", successfulRequests.get());
            stats.put("failed_requests", failedRequests.get());
            stats.put("retried_requests", retriedRequests.get());
            stats.put("average_response_time_ms",
                    total > 0 ? TimeUnit.NANOSECONDS.toMillis(totalTimeNanos.get() / total) : 0);

            Map<String, Long> routeRequests = new LinkedHashMap<>();
            routes.forEach(route -> routeRequests.merge(route.label(), route.requests().get(), Long::sum));
            stats.put("proxy_routes", DIRECT.equals(routes.get(0).label()) ? 0 : routes.size());
            stats.put("route_requests", routeRequests);
            return stats;
        }
    }
}
