package warden.core.model.token;

/**
 * Kind of bearer token, embedded in the {@code type} claim.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /**
     * Value written to the {@code type} claim.
     *
     * @return lower-case claim value
     */
    public String claimValue() {
        return claimValue;
    }

    /**
     * Resolves a {@code type} claim value.
     *
     * @param value claim value (may be null)
     * @return matching type
     * @throws IllegalArgumentException if the value is not a known token type
     */
    public static TokenType fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown token type: " + value);
    }
}
