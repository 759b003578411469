package warden.core.port.out;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.UserToken;

/**
 * Storage port for session tokens.
 *
 * <p>Implementations store hashed token values only.
 */
public interface UserTokenRepository {

    /**
     * Persist a new token and assign its id.
     *
     * @param token the token to insert (its id is ignored)
     * @return Uni with the stored token carrying the assigned id
     */
    Uni<UserToken> insert(UserToken token);

    /**
     * Find the token whose current or previous hash equals the given hash.
     *
     * @param hashedToken the hashed token value
     * @return Uni with the token if found
     */
    Uni<Optional<UserToken>> findByHashedToken(String hashedToken);

    /**
     * Atomically update a token if it still satisfies a condition.
     *
     * <p>The condition and the update are evaluated against the stored record as a
     * single atomic step, so two concurrent callers cannot both apply an update
     * whose condition the first update invalidates.
     *
     * @param id        the token id
     * @param condition condition on the stored record
     * @param update    function producing the new record
     * @return Uni with the updated record, or empty if absent or the condition did not hold
     */
    Uni<Optional<UserToken>> updateIf(long id, Predicate<UserToken> condition, UnaryOperator<UserToken> update);

    /**
     * Delete a token.
     *
     * @param id the token id
     * @return Uni with true if a token was deleted
     */
    Uni<Boolean> delete(long id);
}
