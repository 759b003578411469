package warden.core.model.auth;

/**
 * The parts of a client-presented API key.
 *
 * @param name   the key name
 * @param orgId  the organization id
 * @param secret the plaintext secret
 */
public record DecodedApiKey(String name, long orgId, String secret) {

    @Override
    public String toString() {
        return "DecodedApiKey[name=" + name + ", orgId=" + orgId + ", secret=***]";
    }
}
