package tollgate.core.model.auth;

/**
 * Reasons a bearer credential is rejected.
 */
public enum TokenFailure {

    /** No Authorization header, or a blank one. */
    MISSING_CREDENTIAL("missing_credential", "A bearer token is required"),

    /** Not a {@code Bearer} credential, or not a well-formed signed token. */
    MALFORMED_CREDENTIAL("malformed_credential", "The bearer token is malformed"),

    /** Wrong algorithm, signature mismatch or untrusted issuer. */
    INVALID_SIGNATURE("invalid_signature", "The bearer token could not be verified"),

    /** The token's expiry is not after the current time. */
    EXPIRED("expired", "The bearer token has expired"),

    /** Issued or valid only in the future, beyond the allowed clock skew. */
    NOT_YET_VALID("not_yet_valid", "The bearer token is not valid yet");

    private final String reason;
    private final String clientMessage;

    TokenFailure(String reason, String clientMessage) {
        this.reason = reason;
        this.clientMessage = clientMessage;
    }

    /**
     * Returns the low-cardinality reason used in logs and metric tags.
     *
     * @return the reason code
     */
    public String reason() {
        return reason;
    }

    /**
     * Returns the message shown to the client. Never includes token contents.
     *
     * @return the client-facing message
     */
    public String clientMessage() {
        return clientMessage;
    }
}
