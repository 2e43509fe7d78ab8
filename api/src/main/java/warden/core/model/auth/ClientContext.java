package warden.core.model.auth;

/**
 * Network details of the client making an authentication request.
 *
 * @param ipAddress client IP address (may be null)
 * @param userAgent client user agent (may be null)
 */
public record ClientContext(String ipAddress, String userAgent) {

    private static final ClientContext UNKNOWN = new ClientContext(null, null);

    public static ClientContext unknown() {
        return UNKNOWN;
    }
}
