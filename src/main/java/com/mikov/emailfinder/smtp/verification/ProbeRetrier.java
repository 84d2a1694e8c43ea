package com.mikov.emailfinder.smtp.verification;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.smtp.SmtpTransport;
import com.mikov.emailfinder.smtp.core.SmtpResponse;
import com.mikov.emailfinder.smtp.core.SmtpSessionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;

/**
 * Runs SMTP probes with exponential backoff and jitter. Connection failures and 4xx replies are
 * retried; permanent rejections return immediately.
 */
@Slf4j
public class ProbeRetrier {
    private final SmtpTransport transport;
    private final RetryTemplate retryTemplate;

    public ProbeRetrier(final SmtpTransport transport, final EmailFinderProperties.Retry config) {
        this.transport = transport;
        this.retryTemplate = retryTemplate(config);
    }

    static RetryTemplate retryTemplate(final EmailFinderProperties.Retry config) {
        final var backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(config.getInitialBackoff().toMillis());
        backOff.setMultiplier(config.getMultiplier());
        backOff.setMaxInterval(config.getMaxBackoff().toMillis());

        final var template = new RetryTemplate();
        template.setRetryPolicy(new TransientFailureRetryPolicy(config.getMaxAttempts()));
        template.setBackOffPolicy(backOff);
        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(final RetryContext context,
                                                         final RetryCallback<T, E> callback,
                                                         final Throwable throwable) {
                log.debug("SMTP probe attempt {}/{} failed: {}",
                        context.getRetryCount(), config.getMaxAttempts(), throwable.getMessage());
            }
        });
        return template;
    }

    static boolean isTransient(final Throwable throwable) {
        if (throwable instanceof SmtpSessionException) {
            return ((SmtpSessionException) throwable).isTemporary();
        }
        return throwable instanceof IOException;
    }

    /**
     * Returns the last reply once it is not temporary or attempts are exhausted.
     *
     * @throws IOException the last transport failure when every attempt failed at connection level
     */
    public SmtpResponse probe(final String host, final String localPart, final String domain) throws IOException {
        try {
            return retryTemplate.execute(context -> {
                final SmtpResponse response = transport.probe(host, localPart, domain);
                if (response.isTemporaryFailure()) {
                    throw new TemporaryReplyException(response);
                }
                return response;
            });
        } catch (TemporaryReplyException e) {
            return e.response;
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while probing " + host, e);
        }
    }

    /**
     * Retries only what {@link #isTransient} accepts, up to the attempt limit.
     */
    private static final class TransientFailureRetryPolicy extends SimpleRetryPolicy {

        private TransientFailureRetryPolicy(final int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(final RetryContext context) {
            final Throwable last = context.getLastThrowable();
            return (last == null || isTransient(last)) && context.getRetryCount() < getMaxAttempts();
        }
    }

    /**
     * A 4xx reply, raised inside the retry loop so that it is retried like a connection failure.
     */
    private static final class TemporaryReplyException extends IOException {
        private final transient SmtpResponse response;

        private TemporaryReplyException(final SmtpResponse response) {
            super("Temporary reply: " + response.getMessage());
            this.response = response;
        }
    }
}
