package cloud.meridian.sdk.auth;

import cloud.meridian.sdk.MeridianException;

/**
 * Contract for obtaining the bearer token attached to every request. Minting and refreshing tokens is left to the
 * implementation.
 */
public interface TokenProvider {

    String accessToken() throws MeridianException;

    /**
     * Signals that the last token was rejected by the platform.
     */
    default void invalidate() {
        // default no-op
    }
}
