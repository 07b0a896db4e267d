package com.chainrouter.rpc.registry;

import com.chainrouter.domain.Provider;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Catalog of RPC providers keyed by id. Owned by one router instance; there is no global registry.
 */
@Slf4j
public class ProviderRegistry {

    private final Set<String> supportedChains;
    private final Map<String, Provider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry(Collection<String> supportedChains) {
        if (supportedChains == null || supportedChains.isEmpty()) {
            throw new IllegalArgumentException("At least one supported chain required");
        }
        this.supportedChains = supportedChains.stream()
                .map(ProviderRegistry::normalizeChain)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Validates the descriptor and registers it. Configuration errors are fatal and surface immediately.
     */
    public Provider register(ProviderDescriptor descriptor) {
        Provider provider = toProvider(descriptor);
        Provider previous = providers.putIfAbsent(provider.getId(), provider);
        if (previous != null) {
            throw new ProviderConfigurationException("Provider already registered: " + provider.getId());
        }
        log.info("RPC provider registered: id={} name={} chain={} tier={} priority={}",
                provider.getId(), provider.getName(), provider.getChain(), provider.getTier(), provider.getPriority());
        return provider;
    }

    public Optional<Provider> find(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(providers.get(providerId));
    }

    public Provider require(String providerId) {
        return find(providerId)
                .orElseThrow(() -> new UnknownProviderException(providerId));
    }

    public Optional<Provider> remove(String providerId) {
        Provider removed = providers.remove(providerId);
        if (removed != null) {
            log.info("RPC provider removed: id={} chain={}", removed.getId(), removed.getChain());
        }
        return Optional.ofNullable(removed);
    }

    /**
     * @return true if the flag changed
     */
    public boolean setActive(String providerId, boolean active) {
        Provider provider = require(providerId);
        if (provider.isActive() == active) {
            return false;
        }
        provider.setActive(active);
        log.info("RPC provider {} {}", providerId, active ? "activated" : "deactivated");
        return true;
    }

    public void setPriority(String providerId, int priority) {
        require(providerId).setPriority(priority);
    }

    public List<Provider> forChain(String chain) {
        String normalized = normalizeChain(chain);
        return providers.values().stream()
                .filter(p -> p.getChain().equals(normalized))
                .sorted(Comparator.comparing(Provider::getId))
                .toList();
    }

    public List<Provider> all() {
        return providers.values().stream()
                .sorted(Comparator.comparing(Provider::getId))
                .toList();
    }

    public Set<String> chains() {
        return providers.values().stream().map(Provider::getChain).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isSupportedChain(String chain) {
        return chain != null && supportedChains.contains(normalizeChain(chain));
    }

    /**
     * Normalized chain name, failing fast on chains outside the supported set.
     */
    public String requireSupportedChain(String chain) {
        if (!isSupportedChain(chain)) {
            throw new ProviderConfigurationException("Unsupported chain: " + chain);
        }
        return normalizeChain(chain);
    }

    public int size() {
        return providers.size();
    }

    private Provider toProvider(ProviderDescriptor d) {
        if (d == null) {
            throw new ProviderConfigurationException("Provider descriptor required");
        }
        if (d.getId() == null || d.getId().isBlank()) {
            throw new ProviderConfigurationException("Provider id required");
        }
        String chain = requireSupportedChain(d.getChain());
        if (d.getTier() == null) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": tier required");
        }
        validateUrl(d.getId(), "url", d.getUrl(), Set.of("http", "https"), true);
        validateUrl(d.getId(), "wsUrl", d.getWsUrl(), Set.of("ws", "wss"), false);
        if (d.getRateLimit() <= 0) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": rateLimit must be positive");
        }
        if (d.getCostPer1000() < 0) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": costPer1000 must not be negative");
        }
        if (d.getTimeoutMs() != null && d.getTimeoutMs() <= 0) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": timeoutMs must be positive");
        }
        if (d.getMaxConnections() != null && d.getMaxConnections() <= 0) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": maxConnections must be positive");
        }
        if (d.getDailyBudget() != null && d.getDailyBudget() < 0) {
            throw new ProviderConfigurationException("Provider " + d.getId() + ": dailyBudget must not be negative");
        }
        return Provider.builder()
                .id(d.getId().strip())
                .name(d.getName() != null && !d.getName().isBlank() ? d.getName() : d.getId().strip())
                .chain(chain)
                .tier(d.getTier())
                .url(d.getUrl())
                .wsUrl(d.getWsUrl())
                .apiKey(d.getApiKey())
                .rateLimit(d.getRateLimit())
                .costPer1000(d.getCostPer1000())
                .timeoutMs(d.getTimeoutMs())
                .maxConnections(d.getMaxConnections())
                .dailyBudget(d.getDailyBudget())
                .priority(d.getPriority())
                .active(d.isActive())
                .build();
    }

    private static void validateUrl(String id, String field, String value, Set<String> schemes, boolean required) {
        if (value == null || value.isBlank()) {
            if (required) {
                throw new ProviderConfigurationException("Provider " + id + ": " + field + " required");
            }
            return;
        }
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || !schemes.contains(uri.getScheme().toLowerCase(Locale.ROOT)) || uri.getHost() == null) {
                throw new ProviderConfigurationException("Provider " + id + ": invalid " + field + " " + value);
            }
        } catch (URISyntaxException e) {
            throw new ProviderConfigurationException("Provider " + id + ": malformed " + field + " " + value);
        }
    }

    static String normalizeChain(String chain) {
        return chain == null ? null : chain.strip().toLowerCase(Locale.ROOT);
    }
}
