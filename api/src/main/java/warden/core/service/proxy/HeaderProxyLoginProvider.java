package warden.core.service.proxy;

import java.util.HashMap;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AuthProxyConfig;
import warden.core.model.auth.ExternalUserInfo;
import warden.core.model.auth.OrgRole;
import warden.core.model.auth.User;
import warden.core.model.proxy.AuthProxyRequest;
import warden.core.port.out.IdentityStore;
import warden.spi.ProxyLoginProvider;

/**
 * Resolves proxy claims against the local identity store.
 *
 * <p>The main header is read as a login or an email depending on
 * {@code warden.auth.proxy.header-property}. Name, email, login and role attributes
 * sent by the proxy are synced onto the user, which is created when auto sign-up
 * is enabled.
 */
@ApplicationScoped
public class HeaderProxyLoginProvider implements ProxyLoginProvider {

    private static final Logger LOG = Logger.getLogger(HeaderProxyLoginProvider.class);

    static final String AUTH_MODULE = "authproxy";
    static final long DEFAULT_ORG_ID = 1L;

    private final AuthProxyConfig config;
    private final IdentityStore identityStore;

    @Inject
    public HeaderProxyLoginProvider(AuthProxyConfig config, IdentityStore identityStore) {
        this.config = config;
        this.identityStore = identityStore;
    }

    @Override
    public String name() {
        return "header";
    }

    @Override
    public Uni<Long> login(AuthProxyRequest request) {
        final var header = request.headerValue();
        String login;
        String email = null;
        switch (config.headerProperty().toLowerCase(Locale.ROOT)) {
            case "username" -> {
                login = header;
                if (looksLikeEmail(header)) {
                    email = header;
                }
            }
            case "email" -> {
                login = header;
                email = header;
            }
            default -> {
                return Uni.createFrom()
                        .failure(new IllegalStateException(
                                "auth proxy header property invalid: " + config.headerProperty()));
            }
        }

        final var name = request.attribute("Name");
        if (request.attribute("Email") != null) {
            email = request.attribute("Email");
        }
        if (request.attribute("Login") != null) {
            login = request.attribute("Login");
        }

        final var orgRoles = new HashMap<Long, OrgRole>();
        final var role = request.attribute("Role");
        if (role != null) {
            try {
                orgRoles.put(request.orgId() > 0 ? request.orgId() : DEFAULT_ORG_ID, OrgRole.fromValue(role));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Ignoring invalid role from auth proxy: %s", role);
            }
        }

        final var info = new ExternalUserInfo(AUTH_MODULE, header, login, email, name, orgRoles);
        return identityStore.upsertExternalUser(info, config.autoSignUp()).map(User::id);
    }

    private static boolean looksLikeEmail(String value) {
        final var at = value.indexOf('@');
        return at > 0 && at < value.length() - 1 && value.indexOf('@', at + 1) < 0;
    }
}
