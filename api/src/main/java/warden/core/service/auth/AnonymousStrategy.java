package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AnonymousConfig;
import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.StrategyResult;
import warden.core.port.out.IdentityStore;

/**
 * Grants anonymous access to the configured organization when nothing else matched.
 */
@ApplicationScoped
public class AnonymousStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(AnonymousStrategy.class);

    private final AnonymousConfig config;
    private final IdentityStore identityStore;

    @Inject
    public AnonymousStrategy(AnonymousConfig config, IdentityStore identityStore) {
        this.config = config;
        this.identityStore = identityStore;
    }

    @Override
    public String name() {
        return "anonymous";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        if (!config.enabled()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        return identityStore
                .getOrgByName(config.orgName())
                .map(org -> {
                    exchange.context().allowAnonymous(org, config.orgRole());
                    return StrategyResult.authenticated();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf("Anonymous access organization error: '%s': %s", config.orgName(), error.getMessage());
                    return StrategyResult.notHandled();
                });
    }
}
