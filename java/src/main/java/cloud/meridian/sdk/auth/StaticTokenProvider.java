package cloud.meridian.sdk.auth;

import cloud.meridian.sdk.MeridianException;

/**
 * TokenProvider returning a fixed, externally issued token (personal access token or secret).
 */
public final class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        this.token = token.trim();
    }

    @Override
    public String accessToken() throws MeridianException {
        return token;
    }
}
