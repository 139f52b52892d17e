package warden.core.port.out;

import warden.core.model.auth.PreAuthorizationConfiguration;
import warden.core.model.transport.RetryPolicy;

/**
 * Port for obtaining transports for introspection calls.
 */
public interface IntrospectionTransportFactory {

    /**
     * Shared transport used when the authenticator does not pre-authorize.
     */
    IntrospectionTransport defaultTransport();

    /**
     * Transport that attaches a client-credentials token to every request and retries
     * with the given policy. Equal arguments yield the same transport instance.
     *
     * @param preAuthorization client-credentials settings, enabled
     * @param retryPolicy      backoff profile
     * @return the transport
     */
    IntrospectionTransport preAuthorized(PreAuthorizationConfiguration preAuthorization, RetryPolicy retryPolicy);
}
