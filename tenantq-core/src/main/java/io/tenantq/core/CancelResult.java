package io.tenantq.core;

/**
 * Result of a cancel request.
 *
 * <p>Cancellation is advisory: an unclaimed envelope is failed right away ({@link Effect#CANCELLED}),
 * an executing one only gets its cancel flag set and the handler is expected to check it
 * ({@link Effect#CANCELLATION_REQUESTED}). Terminal envelopes are acknowledged without effect.
 */
public record CancelResult(
        Outcome outcome,
        Effect effect
) {

    public enum Outcome {
        ACKNOWLEDGED,
        NOT_FOUND,
        FORBIDDEN
    }

    public enum Effect {
        CANCELLED,
        CANCELLATION_REQUESTED,
        NONE
    }

    public static CancelResult notFound() {
        return new CancelResult(Outcome.NOT_FOUND, Effect.NONE);
    }

    public static CancelResult forbidden() {
        return new CancelResult(Outcome.FORBIDDEN, Effect.NONE);
    }

    public static CancelResult acknowledged(Effect effect) {
        return new CancelResult(Outcome.ACKNOWLEDGED, effect);
    }

    public boolean hasEffect() {
        return effect != Effect.NONE;
    }
}
