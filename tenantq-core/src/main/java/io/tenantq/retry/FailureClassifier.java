package io.tenantq.retry;

@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable error);
}
