package io.tenantq.retry;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classification used when a handler does not override {@code classify}.
 *
 * <p>Payload and argument errors are permanent, I/O and timeouts are transient. Unknown errors are
 * treated as transient so that a bounded number of retries happens before dead-lettering.
 */
public final class DefaultFailureClassifier implements FailureClassifier {

    public static final DefaultFailureClassifier INSTANCE = new DefaultFailureClassifier();

    private DefaultFailureClassifier() {
    }

    @Override
    public FailureKind classify(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof PermanentTaskException
                || e instanceof JsonProcessingException
                || e instanceof IllegalArgumentException
                || e instanceof UnsupportedOperationException) {
            return FailureKind.PERMANENT;
        }
        if (e instanceof TransientTaskException
                || e instanceof TimeoutException
                || e instanceof IOException
                || e instanceof InterruptedException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.TRANSIENT;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable e = error;
        while ((e instanceof ExecutionException || e instanceof CompletionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
