package io.tenantq.retry;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultFailureClassifierTest {

    private final FailureClassifier classifier = DefaultFailureClassifier.INSTANCE;

    @Test
    void payloadAndArgumentErrorsArePermanent() {
        assertThat(classifier.classify(new PermanentTaskException("bad input"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new IllegalArgumentException("no"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new UnsupportedOperationException())).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new JsonParseException(null, "broken json"))).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void ioAndTimeoutsAreTransient() {
        assertThat(classifier.classify(new TransientTaskException("busy"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new TimeoutException())).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new SocketTimeoutException())).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new IOException("reset"))).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void unknownErrorsAreTransient() {
        assertThat(classifier.classify(new IllegalStateException("?"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new NullPointerException())).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void wrappersAreUnwrapped() {
        Throwable wrapped = new ExecutionException(new CompletionException(new IllegalArgumentException("inner")));

        assertThat(DefaultFailureClassifier.unwrap(wrapped)).isInstanceOf(IllegalArgumentException.class);
        assertThat(classifier.classify(wrapped)).isEqualTo(FailureKind.PERMANENT);
    }
}
