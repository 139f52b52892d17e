package warden.adapter.out.http;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.AuthenticatorException;
import warden.core.exception.TransportException;
import warden.core.model.transport.RetryPolicy;
import warden.core.model.transport.TransportRequest;
import warden.core.model.transport.TransportResponse;
import warden.core.port.out.IntrospectionMetrics;
import warden.core.port.out.IntrospectionTransport;

/**
 * Transport decorator that retries connection-level failures with exponential backoff.
 *
 * <p>The first retry waits {@link RetryPolicy#baseDelay()}, each further one doubles the
 * delay, capped at {@link RetryPolicy#maxWait()}. No retry starts that would end after
 * {@code maxWait} has elapsed since the first attempt; a base delay longer than the maximum
 * wait therefore means a single attempt. Only {@link TransportException} is retried; any
 * HTTP response, whatever its status, is returned as is.
 */
public class ResilientTransport implements IntrospectionTransport {

    private static final Logger LOG = Logger.getLogger(ResilientTransport.class);

    private final IntrospectionTransport delegate;
    private final RetryPolicy policy;
    private final IntrospectionMetrics metrics;

    public ResilientTransport(IntrospectionTransport delegate, RetryPolicy policy, IntrospectionMetrics metrics) {
        this.delegate = delegate;
        this.policy = policy;
        this.metrics = metrics;
    }

    public RetryPolicy policy() {
        return policy;
    }

    @Override
    public Uni<TransportResponse> send(TransportRequest request) {
        if (policy.baseDelay().compareTo(policy.maxWait()) > 0) {
            return delegate.send(request);
        }

        final var attempts = new AtomicInteger();
        final var lastFailure = new AtomicReference<TransportException>();
        return Uni.createFrom()
                .deferred(() -> {
                    if (attempts.getAndIncrement() > 0) {
                        metrics.recordRetry();
                        LOG.debugf("Retrying request to %s (attempt %d)", request.uri(), attempts.get());
                    }
                    return delegate.send(request);
                })
                .onFailure(TransportException.class)
                .invoke(error -> lastFailure.set((TransportException) error))
                .onFailure(TransportException.class)
                .retry()
                .withBackOff(policy.baseDelay(), policy.maxWait())
                .withJitter(0.0)
                .expireIn(policy.maxWait().toMillis())
                .onFailure(error -> !(error instanceof AuthenticatorException) && lastFailure.get() != null)
                .transform(error -> {
                    // retry exhaustion wraps the last failure
                    LOG.warnf("Giving up on %s after %d attempts: %s",
                            request.uri(), attempts.get(), lastFailure.get().getMessage());
                    return lastFailure.get();
                });
    }
}
