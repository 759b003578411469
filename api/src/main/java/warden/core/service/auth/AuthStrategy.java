package warden.core.service.auth;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.AuthExchange;
import warden.core.model.auth.StrategyResult;

/**
 * One way of establishing who is making a request.
 *
 * <p>A strategy that recognizes its own credential form must claim the request,
 * even when the credential turns out to be invalid; it then returns
 * {@link StrategyResult.Rejected} and no weaker strategy runs. A strategy that
 * finds no credential of its kind returns {@link StrategyResult.NotHandled}.
 */
public interface AuthStrategy {

    /**
     * Name used in logs and metrics.
     */
    String name();

    /**
     * Try to resolve the request's identity.
     *
     * @param exchange       the request, and the context to populate
     * @param requestedOrgId organization requested through the org id header, 0 if none
     * @return Uni with the outcome; never fails for credential problems
     */
    Uni<StrategyResult> tryHandle(AuthExchange exchange, long requestedOrgId);
}
