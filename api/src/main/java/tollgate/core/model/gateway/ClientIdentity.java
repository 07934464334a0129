package tollgate.core.model.gateway;

import java.util.Objects;

/**
 * The identity a request is attributed to for rate limiting and observability.
 *
 * @param kind  where the identity came from
 * @param value the subject claim or the client address
 */
public record ClientIdentity(Kind kind, String value) {

    /**
     * Source of a client identity.
     */
    public enum Kind {
        /** The subject claim of a validated token. */
        SUBJECT("subject"),
        /** The client's network address, used before or without authentication. */
        ADDRESS("address");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public ClientIdentity {
        Objects.requireNonNull(kind, "kind must not be null");
        if (value == null || value.isBlank()) {
            value = "unknown";
        }
    }

    public static ClientIdentity subject(String subject) {
        return new ClientIdentity(Kind.SUBJECT, subject);
    }

    public static ClientIdentity address(String address) {
        return new ClientIdentity(Kind.ADDRESS, address);
    }

    /**
     * Returns the identity as {@code <kind>:<value>}, e.g. {@code subject:alice}.
     *
     * @return the identity key
     */
    public String key() {
        return kind.prefix() + ":" + value;
    }

    @Override
    public String toString() {
        return key();
    }
}
