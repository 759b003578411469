package warden.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import warden.core.model.session.UserToken;

/**
 * Who is making the current request, and in which organization.
 *
 * <p>Created empty by the dispatcher, populated by the winning strategy and
 * frozen once dispatch completes. After {@link #freeze()} only
 * {@link #replaceUserToken(UserToken)} may change it; every other mutator throws
 * {@link IllegalStateException}.
 *
 * <p>Instances are confined to one request and are not thread-safe.
 */
public final class RequestContext {

    private boolean signedIn;
    private boolean allowAnonymous;
    private Identity identity;
    private SignedInUser signedInUser;
    private long orgId;
    private String orgName;
    private OrgRole orgRole;
    private Long apiKeyId;
    private boolean renderCall;
    private UserToken userToken;
    private Instant lastSeenAt;
    private boolean frozen;

    public boolean isSignedIn() {
        return signedIn;
    }

    public boolean allowAnonymous() {
        return allowAnonymous;
    }

    /**
     * @return the resolved identity, or empty if no strategy resolved one
     */
    public Optional<Identity> identity() {
        return Optional.ofNullable(identity);
    }

    public Optional<SignedInUser> signedInUser() {
        return Optional.ofNullable(signedInUser);
    }

    public long orgId() {
        return orgId;
    }

    public String orgName() {
        return orgName;
    }

    public OrgRole orgRole() {
        return orgRole;
    }

    public Optional<Long> apiKeyId() {
        return Optional.ofNullable(apiKeyId);
    }

    public boolean isRenderCall() {
        return renderCall;
    }

    public Optional<UserToken> userToken() {
        return Optional.ofNullable(userToken);
    }

    public Instant lastSeenAt() {
        return lastSeenAt;
    }

    /**
     * @return the id of the signed-in user, or 0 when the caller is not a user
     */
    public long userId() {
        return signedInUser != null ? signedInUser.userId() : 0L;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Populate the context for a signed-in user.
     *
     * @param user  the resolved user
     * @param token the session token the user was resolved from (may be null)
     */
    public void signIn(SignedInUser user, UserToken token) {
        checkMutable();
        this.signedIn = true;
        this.allowAnonymous = false;
        this.signedInUser = user;
        this.identity = new Identity.UserPrincipal(user.userId(), user.orgId(), user.orgRole());
        this.orgId = user.orgId();
        this.orgName = user.orgName();
        this.orgRole = user.orgRole();
        this.userToken = token;
        this.lastSeenAt = user.lastSeenAt();
    }

    /**
     * Populate the context for an API key caller.
     */
    public void signInWithApiKey(ApiKey apiKey) {
        checkMutable();
        this.signedIn = true;
        this.allowAnonymous = false;
        this.identity = new Identity.ApiKeyPrincipal(apiKey.id(), apiKey.name(), apiKey.orgId(), apiKey.role());
        this.apiKeyId = apiKey.id();
        this.orgId = apiKey.orgId();
        this.orgRole = apiKey.role();
    }

    /**
     * Populate the context for a render service call.
     *
     * @param renderUser the user the render key was issued for
     * @param now        current time, recorded as last seen
     */
    public void signInAsRenderer(RenderUser renderUser, Instant now) {
        checkMutable();
        this.signedIn = true;
        this.allowAnonymous = false;
        this.identity =
                new Identity.RenderPrincipal(renderUser.userId(), renderUser.orgId(), renderUser.orgRole());
        this.signedInUser = new SignedInUser(
                renderUser.userId(), renderUser.orgId(), null, renderUser.orgRole(), null, null, null, now);
        this.orgId = renderUser.orgId();
        this.orgRole = renderUser.orgRole();
        this.renderCall = true;
        this.lastSeenAt = now;
    }

    /**
     * Populate the context for anonymous access to an organization.
     */
    public void allowAnonymous(Org org, OrgRole role) {
        checkMutable();
        this.signedIn = false;
        this.allowAnonymous = true;
        this.identity = Identity.Anonymous.instance();
        this.orgId = org.id();
        this.orgName = org.name();
        this.orgRole = role;
    }

    /**
     * Replace the session token after a rotation.
     *
     * <p>Allowed after {@link #freeze()}.
     */
    public void replaceUserToken(UserToken token) {
        this.userToken = token;
    }

    /**
     * Prevent further changes except token replacement.
     */
    public void freeze() {
        this.frozen = true;
    }

    /**
     * Check whether the user's last-seen timestamp should be refreshed.
     *
     * @param now       the current time
     * @param threshold how old last seen may get before it is refreshed
     * @return true for a user caller last seen more than {@code threshold} ago (or never)
     */
    public boolean shouldUpdateLastSeenAt(Instant now, Duration threshold) {
        if (userId() <= 0) {
            return false;
        }
        return lastSeenAt == null || lastSeenAt.isBefore(now.minus(threshold));
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Request context is frozen after dispatch");
        }
    }

    @Override
    public String toString() {
        return "RequestContext[signedIn=" + signedIn + ", allowAnonymous=" + allowAnonymous + ", identity=" + identity
                + ", orgId=" + orgId + ", orgRole=" + orgRole + ", userId=" + userId() + "]";
    }
}
