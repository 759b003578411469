package warden.core.service.auth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.AuthRejection;
import warden.core.model.auth.StrategyResult;
import warden.core.port.out.RenderKeyStore;

/**
 * Authenticates the image renderer calling back with a {@code renderKey} cookie.
 */
@ApplicationScoped
public class RenderKeyStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(RenderKeyStrategy.class);

    public static final String RENDER_KEY_COOKIE = "renderKey";

    private final RenderKeyStore renderKeyStore;
    private final Clock clock;

    @Inject
    public RenderKeyStrategy(RenderKeyStore renderKeyStore, Clock clock) {
        this.renderKeyStore = renderKeyStore;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "render_key";
    }

    @Override
    public Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId) {
        final var key = exchange.cookie(RENDER_KEY_COOKIE);
        if (key.isEmpty()) {
            return Uni.createFrom().item(StrategyResult.notHandled());
        }

        final var renderUser = renderKeyStore.getRenderUser(key.get());
        if (renderUser.isEmpty()) {
            LOG.debug("Rejecting unknown or expired render key");
            return Uni.createFrom().item(StrategyResult.rejected(AuthRejection.unauthorized("Invalid Render Key")));
        }

        exchange.context().signInAsRenderer(renderUser.get(), clock.instant());
        return Uni.createFrom().item(StrategyResult.authenticated());
    }
}
