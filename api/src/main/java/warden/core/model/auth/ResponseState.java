package warden.core.model.auth;

/**
 * What a finalize hook can observe about the response it runs before.
 */
public interface ResponseState {

    /**
     * @return true if the response status and headers were already sent
     */
    boolean isWritten();

    /**
     * @return true if the client went away before the response was sent
     */
    boolean isCanceled();
}
