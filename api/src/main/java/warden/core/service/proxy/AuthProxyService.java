package warden.core.service.proxy;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AuthProxyConfig;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.SignedInUser;
import warden.core.model.exception.AuthProxyException;
import warden.core.model.proxy.AuthProxyRequest;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.IdentityStore;
import warden.core.port.out.RemoteCache;
import warden.spi.ProxyLoginProvider;

/**
 * Resolves users asserted by an authenticating reverse proxy.
 *
 * <p>Resolved user ids are cached in the remote cache for the sync TTL, keyed by
 * {@link AuthProxyCacheKey}, so the identity store is only consulted again when the
 * TTL lapses or the proxy starts sending different attributes.
 */
@ApplicationScoped
public class AuthProxyService {

    private static final Logger LOG = Logger.getLogger(AuthProxyService.class);

    static final String LOGIN_FAILED = "Failed to log in as user, specified in auth proxy header";
    static final String GET_USER_FAILED = "Failed to get the user";

    private final AuthProxyConfig config;
    private final RemoteCache cache;
    private final IdentityStore identityStore;
    private final ProxyAllowList allowList;
    private final List<ProxyLoginProvider> loginProviders;
    private final AuthMetrics metrics;

    @Inject
    public AuthProxyService(
            AuthProxyConfig config,
            RemoteCache cache,
            IdentityStore identityStore,
            ProxyAllowList allowList,
            Instance<ProxyLoginProvider> loginProviders,
            AuthMetrics metrics) {
        this(
                config,
                cache,
                identityStore,
                allowList,
                StreamSupport.stream(loginProviders.spliterator(), false).toList(),
                metrics);
    }

    public AuthProxyService(
            AuthProxyConfig config,
            RemoteCache cache,
            IdentityStore identityStore,
            ProxyAllowList allowList,
            List<ProxyLoginProvider> loginProviders,
            AuthMetrics metrics) {
        this.config = config;
        this.cache = cache;
        this.identityStore = identityStore;
        this.allowList = allowList;
        this.loginProviders = List.copyOf(loginProviders);
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * @return the value of the main proxy header, if present and not blank
     */
    public Optional<String> headerValue(AuthExchange exchange) {
        return exchange.header(config.headerName()).filter(value -> !value.isBlank());
    }

    public boolean isAllowed(String remoteAddress) {
        return allowList.isAllowed(remoteAddress);
    }

    /**
     * Collect what the proxy asserted on this request.
     */
    public AuthProxyRequest newRequest(AuthExchange exchange, String headerValue, long orgId) {
        final var attributes = new LinkedHashMap<String, String>();
        for (final var attribute : AuthProxyCacheKey.SUPPORTED_ATTRIBUTES) {
            final var headerName = config.headers().get(attribute);
            if (headerName == null) {
                continue;
            }
            exchange.header(headerName)
                    .filter(value -> !value.isBlank())
                    .ifPresent(value -> attributes.put(attribute, value));
        }
        return new AuthProxyRequest(
                headerValue,
                attributes,
                orgId,
                exchange.remoteAddress(),
                AuthProxyCacheKey.of(headerValue, attributes));
    }

    /**
     * Resolve the proxy claim to a user id.
     *
     * @param request     what the proxy asserted
     * @param ignoreCache skip the cached id and always ask the login provider
     * @return Uni with the user id; fails with {@link AuthProxyException}
     */
    public Uni<Long> login(AuthProxyRequest request, boolean ignoreCache) {
        final Uni<Optional<Long>> cached =
                ignoreCache ? Uni.createFrom().item(Optional.empty()) : getUserIdViaCache(request.cacheKey());
        return cached.flatMap(userId -> {
            if (userId.isPresent()) {
                return Uni.createFrom().item(userId.get());
            }
            return loginViaProvider(request);
        });
    }

    /**
     * Load the signed-in user for a resolved id.
     *
     * @return Uni with the user; fails with {@link AuthProxyException}
     */
    public Uni<SignedInUser> getSignedInUser(long userId, long orgId) {
        return identityStore
                .getSignedInUser(userId, orgId)
                .onFailure()
                .transform(error -> new AuthProxyException(GET_USER_FAILED, error.getMessage(), error));
    }

    /**
     * Forget the cached id for a claim.
     *
     * @return Uni completing when removed; fails with
     *     {@link warden.core.model.exception.CacheItemNotFoundException} when nothing was cached
     */
    public Uni<Void> removeUserFromCache(String cacheKey) {
        LOG.debugf("Removing user from auth proxy cache: %s", cacheKey);
        return cache.delete(cacheKey);
    }

    /**
     * Cache the resolved id for the sync TTL.
     *
     * <p>An id already cached under the same key is left alone so its TTL keeps
     * counting down and the user is re-synced when it lapses.
     */
    public Uni<Void> remember(String cacheKey, long userId) {
        return getUserIdViaCache(cacheKey).flatMap(cached -> {
            if (cached.isPresent() && cached.get() == userId) {
                return Uni.createFrom().voidItem();
            }
            final var value = Long.toString(userId).getBytes(StandardCharsets.UTF_8);
            return cache.set(cacheKey, value, config.syncTtl());
        });
    }

    private Uni<Optional<Long>> getUserIdViaCache(String cacheKey) {
        return cache.get(cacheKey)
                .map(bytes -> bytes.flatMap(AuthProxyService::parseUserId))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Auth proxy cache lookup failed for %s: %s", cacheKey, error.getMessage());
                    return Optional.empty();
                })
                .invoke(userId -> {
                    metrics.recordProxyCacheLookup(userId.isPresent());
                    if (userId.isPresent()) {
                        LOG.debugf("Auth proxy cache hit for %s: user %d", cacheKey, userId.get());
                    }
                });
    }

    private Uni<Long> loginViaProvider(AuthProxyRequest request) {
        final var provider = selectProvider();
        if (provider.isEmpty()) {
            return Uni.createFrom()
                    .failure(new AuthProxyException(LOGIN_FAILED, "no proxy login provider available"));
        }
        LOG.debugf("Logging in auth proxy user %s via %s", request.headerValue(), provider.get().name());
        return Uni.createFrom()
                .deferred(() -> provider.get().login(request))
                .onFailure()
                .transform(error -> error instanceof AuthProxyException
                        ? error
                        : new AuthProxyException(LOGIN_FAILED, error.getMessage(), error));
    }

    private Optional<ProxyLoginProvider> selectProvider() {
        return loginProviders.stream()
                .filter(ProxyLoginProvider::isAvailable)
                .max(Comparator.comparingInt(ProxyLoginProvider::priority));
    }

    private static Optional<Long> parseUserId(byte[] bytes) {
        try {
            return Optional.of(Long.parseLong(new String(bytes, StandardCharsets.UTF_8)));
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed auth proxy cache entry");
            return Optional.empty();
        }
    }
}
