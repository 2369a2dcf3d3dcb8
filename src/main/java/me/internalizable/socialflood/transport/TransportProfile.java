package me.internalizable.socialflood.transport;

import lombok.Getter;
import lombok.Setter;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection and retry settings for one upstream. Bound from {@code transport.profiles.<name>.*}.
 */
@Getter
@Setter
public class TransportProfile {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; SocialFlood/1.0)";

    /** Base URL that relative request paths are resolved against; may be empty. */
    private String baseUrl = "";

    private int maxConnections = 20;
    private Duration maxIdleTime = Duration.ofSeconds(30);
    private Duration maxLifeTime = Duration.ofMinutes(5);
    private Duration pendingAcquireTimeout = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    private Duration writeTimeout = Duration.ofSeconds(10);

    private Map<String, String> defaultHeaders = new LinkedHashMap<>(Map.of("User-Agent", DEFAULT_USER_AGENT));

    /** Total attempts including the first one. */
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;

    private DataSize maxInMemorySize = DataSize.ofMegabytes(10);
    private boolean followRedirects = true;

    /** HTTP proxy URLs this profile rotates through, each with its own pool. Empty means the shared list applies. */
    private List<String> proxies = new ArrayList<>();

    /** Whether {@code transport.proxy.urls} applies when {@link #proxies} is empty. */
    private boolean useProxy = true;
}
