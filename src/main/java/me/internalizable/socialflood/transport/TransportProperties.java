package me.internalizable.socialflood.transport;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "transport")
public class TransportProperties {

    public static final String DEFAULT_PROFILE = "default";

    private Map<String, TransportProfile> profiles = new LinkedHashMap<>();

    private Proxy proxy = new Proxy();

    /**
     * Configured profiles, always including {@value #DEFAULT_PROFILE}.
     */
    public Map<String, TransportProfile> resolvedProfiles() {
        Map<String, TransportProfile> resolved = new LinkedHashMap<>(profiles);
        resolved.putIfAbsent(DEFAULT_PROFILE, new TransportProfile());
        return resolved;
    }

    /**
     * Proxy URLs a profile routes through: its own list, else the shared list when proxying is
     * enabled and the profile opts in. Empty means direct connections.
     */
    public List<String> proxiesFor(TransportProfile profile) {
        if (!profile.getProxies().isEmpty()) {
            return List.copyOf(profile.getProxies());
        }
        if (proxy.isEnabled() && profile.isUseProxy()) {
            return List.copyOf(proxy.getUrls());
        }
        return List.of();
    }

    @Getter
    @Setter
    public static class Proxy {

        private boolean enabled = false;

        private List<String> urls = new ArrayList<>();
    }
}
