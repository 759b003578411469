package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.model.auth.ApiKey;
import warden.core.model.auth.ExternalUserInfo;
import warden.core.model.auth.Org;
import warden.core.model.auth.OrgRole;
import warden.core.model.auth.SignedInUser;
import warden.core.model.auth.User;
import warden.core.model.exception.ApiKeyNotFoundException;
import warden.core.model.exception.InvalidCredentialsException;
import warden.core.model.exception.OrgNotFoundException;
import warden.core.model.exception.UserNotFoundException;
import warden.core.port.out.IdentityStore;
import warden.core.util.ApiKeyCodec;
import warden.core.util.PasswordHash;

/**
 * In-memory implementation of IdentityStore.
 *
 * <p>This implementation is intended for development and testing only.
 * Users, organizations and keys are lost on restart and not shared across instances.
 *
 * <p>New users are added to the first organization created, as a viewer.
 */
@ApplicationScoped
public class InMemoryIdentityStore implements IdentityStore {

    private static final Logger LOG = Logger.getLogger(InMemoryIdentityStore.class);

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final ConcurrentMap<Long, StoredUser> users = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Org> orgs = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Map<Long, OrgRole>> memberships = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ApiKey> apiKeys = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> externalLinks = new ConcurrentHashMap<>();
    private volatile long defaultOrgId;

    private record StoredUser(
            long id,
            String login,
            String email,
            String name,
            String salt,
            String passwordHash,
            long currentOrgId,
            Instant lastSeenAt) {

        User toUser() {
            return new User(id, login, email, name);
        }

        StoredUser withProfile(String login, String email, String name) {
            return new StoredUser(id, login, email, name, salt, passwordHash, currentOrgId, lastSeenAt);
        }

        StoredUser withLastSeenAt(Instant lastSeenAt) {
            return new StoredUser(id, login, email, name, salt, passwordHash, currentOrgId, lastSeenAt);
        }
    }

    @Inject
    public InMemoryIdentityStore(Clock clock) {
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Seeding
    // -------------------------------------------------------------------------

    /**
     * Create an organization. The first one created becomes the default organization.
     */
    public synchronized Org createOrg(String name) {
        final var existing = findOrg(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        final var org = new Org(ids.incrementAndGet(), name);
        orgs.put(org.id(), org);
        if (defaultOrgId == 0) {
            defaultOrgId = org.id();
        }
        LOG.debugf("Created org %d (%s)", org.id(), name);
        return org;
    }

    /**
     * Create a user with a password, as a viewer of the default organization.
     *
     * @param password plaintext password, or null for a user that cannot log in with one
     */
    public synchronized User createUser(String login, String email, String name, String password) {
        if (findStoredUser(login).isPresent() || (email != null && findStoredUser(email).isPresent())) {
            throw new IllegalArgumentException("User already exists: " + login);
        }
        final var salt = PasswordHash.newSalt();
        final var hash = password != null ? PasswordHash.encode(password, salt) : null;
        final var user = new StoredUser(ids.incrementAndGet(), login, email, name, salt, hash, defaultOrgId, null);
        users.put(user.id(), user);
        if (defaultOrgId != 0) {
            addOrgMember(user.id(), defaultOrgId, OrgRole.VIEWER);
        }
        LOG.debugf("Created user %d (%s)", user.id(), login);
        return user.toUser();
    }

    public void addOrgMember(long userId, long orgId, OrgRole role) {
        if (!orgs.containsKey(orgId)) {
            throw new OrgNotFoundException("Organization not found: " + orgId);
        }
        memberships.computeIfAbsent(userId, id -> new ConcurrentHashMap<>()).put(orgId, role);
    }

    /**
     * Store an API key, returning the client form to hand out once.
     *
     * @param expiresAt expiry, or null for a key that never expires
     */
    public String createApiKey(String name, long orgId, OrgRole role, Instant expiresAt) {
        final var generated = ApiKeyCodec.generate(name, orgId);
        final var apiKey = new ApiKey(ids.incrementAndGet(), name, orgId, generated.hashedKey(), role, expiresAt);
        if (apiKeys.putIfAbsent(apiKeyIndex(name, orgId), apiKey) != null) {
            throw new IllegalArgumentException("API key already exists: " + name);
        }
        LOG.debugv("Created API key {0} ({1}) in org {2}", apiKey.id(), name, orgId);
        return generated.clientKey();
    }

    public Optional<Instant> lastSeenAt(long userId) {
        return Optional.ofNullable(users.get(userId)).map(StoredUser::lastSeenAt);
    }

    // -------------------------------------------------------------------------
    // IdentityStore
    // -------------------------------------------------------------------------

    @Override
    public Uni<ApiKey> lookupApiKey(String name, long orgId) {
        return Uni.createFrom().item(() -> {
            final var apiKey = apiKeys.get(apiKeyIndex(name, orgId));
            if (apiKey == null) {
                throw new ApiKeyNotFoundException();
            }
            return apiKey;
        });
    }

    @Override
    public Uni<User> login(String username, String password) {
        return Uni.createFrom().item(() -> {
            final var user = findStoredUser(username).orElseThrow(UserNotFoundException::new);
            if (!PasswordHash.matches(password, user.salt(), user.passwordHash())) {
                throw new InvalidCredentialsException();
            }
            return user.toUser();
        }).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Uni<SignedInUser> getSignedInUser(long userId, long orgId) {
        return Uni.createFrom().item(() -> {
            final var user = users.get(userId);
            if (user == null) {
                throw new UserNotFoundException();
            }
            final var effectiveOrgId = orgId > 0 ? orgId : user.currentOrgId();
            final var role = memberships.getOrDefault(userId, Map.of()).get(effectiveOrgId);
            final var org = orgs.get(effectiveOrgId);
            if (role == null || org == null) {
                throw new UserNotFoundException("User " + userId + " is not a member of org " + effectiveOrgId);
            }
            return new SignedInUser(
                    user.id(),
                    org.id(),
                    org.name(),
                    role,
                    user.login(),
                    user.email(),
                    user.name(),
                    user.lastSeenAt());
        });
    }

    @Override
    public Uni<Org> getOrgByName(String name) {
        return Uni.createFrom().item(() -> findOrg(name).orElseThrow(OrgNotFoundException::new));
    }

    @Override
    public Uni<Optional<User>> findUserByLoginOrEmail(String loginOrEmail) {
        return Uni.createFrom().item(() -> findStoredUser(loginOrEmail).map(StoredUser::toUser));
    }

    @Override
    public Uni<User> upsertExternalUser(ExternalUserInfo info, boolean signUpAllowed) {
        return Uni.createFrom().item(() -> upsert(info, signUpAllowed));
    }

    @Override
    public Uni<Void> updateLastSeenAt(long userId) {
        return Uni.createFrom().item(() -> {
            final var updated = users.computeIfPresent(userId, (id, user) -> user.withLastSeenAt(clock.instant()));
            if (updated == null) {
                throw new UserNotFoundException();
            }
            return null;
        });
    }

    private synchronized User upsert(ExternalUserInfo info, boolean signUpAllowed) {
        final var linkKey = info.authModule() + ":" + info.authId();
        var existing = Optional.ofNullable(externalLinks.get(linkKey)).map(users::get);
        if (existing.isEmpty() && info.login() != null) {
            existing = findStoredUser(info.login());
        }
        if (existing.isEmpty() && info.email() != null) {
            existing = findStoredUser(info.email());
        }

        final StoredUser user;
        if (existing.isPresent()) {
            final var current = existing.get();
            user = current.withProfile(
                    valueOr(info.login(), current.login()),
                    valueOr(info.email(), current.email()),
                    valueOr(info.name(), current.name()));
            users.put(user.id(), user);
        } else {
            if (!signUpAllowed) {
                LOG.debugf("Sign up disabled, not creating external user %s", info.login());
                throw new UserNotFoundException();
            }
            final var login = valueOr(info.login(), valueOr(info.email(), info.authId()));
            final var created = createUser(login, info.email(), info.name(), null);
            user = users.get(created.id());
        }
        externalLinks.put(linkKey, user.id());

        for (final var orgRole : info.orgRoles().entrySet()) {
            if (orgs.containsKey(orgRole.getKey())) {
                addOrgMember(user.id(), orgRole.getKey(), orgRole.getValue());
            } else {
                LOG.warnf("Ignoring role for unknown org %d on external user %s", orgRole.getKey(), user.login());
            }
        }
        return user.toUser();
    }

    private Optional<Org> findOrg(String name) {
        return orgs.values().stream().filter(org -> org.name().equals(name)).findFirst();
    }

    private Optional<StoredUser> findStoredUser(String loginOrEmail) {
        if (loginOrEmail == null) {
            return Optional.empty();
        }
        final var needle = loginOrEmail.toLowerCase(Locale.ROOT);
        return users.values().stream()
                .filter(user -> needle.equals(lower(user.login())) || needle.equals(lower(user.email())))
                .findFirst();
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }

    private static String valueOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String apiKeyIndex(String name, long orgId) {
        return orgId + ":" + name;
    }
}
