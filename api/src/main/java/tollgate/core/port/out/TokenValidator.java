package tollgate.core.port.out;

import tollgate.core.model.auth.TokenValidationResult;

/**
 * Port interface for validating bearer credentials.
 *
 * <p>Validation is synchronous, in-memory and side-effect free.
 */
public interface TokenValidator {

    /**
     * Validate the value of an {@code Authorization} header.
     *
     * @param authorizationHeader the raw header value (may be null)
     * @return the validated claims, or the reason the credential was rejected
     */
    TokenValidationResult validate(String authorizationHeader);

    /**
     * Whether a verification key is configured and usable.
     *
     * @return true if tokens can be verified
     */
    boolean isReady();
}
