package tollgate.adapter.in.http;

import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;

/**
 * Assigns every request a correlation id and echoes it on the response.
 *
 * <p>A well-formed {@code X-Request-ID} sent by the client is kept; otherwise a new
 * id is generated. The id is stored as a request property for the gateway resource.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 200)
public class RequestIdFilter implements ContainerRequestFilter, ContainerResponseFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String PROPERTY = "tollgate.request-id";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    public void filter(ContainerRequestContext requestContext) {
        final var incoming = requestContext.getHeaderString(HEADER);
        final var requestId = incoming != null && ACCEPTED.matcher(incoming).matches() ? incoming : generate();
        requestContext.setProperty(PROPERTY, requestId);
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        final var requestId = requestContext.getProperty(PROPERTY);
        if (requestId != null) {
            responseContext.getHeaders().putSingle(HEADER, requestId);
        }
    }

    /**
     * Read the id assigned to a request, generating one if the filter did not run.
     *
     * @param requestContext the request
     * @return the request id
     */
    public static String requestId(ContainerRequestContext requestContext) {
        final var requestId = requestContext.getProperty(PROPERTY);
        if (requestId instanceof String id) {
            return id;
        }
        final var generated = generate();
        requestContext.setProperty(PROPERTY, generated);
        return generated;
    }

    static String generate() {
        return UUID.randomUUID().toString();
    }
}
