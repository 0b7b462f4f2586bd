package com.al.clinicalsummary.model;

import com.al.clinicalsummary.model.enums.OutcomeStatus;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one extractor invocation. The payload is present if and only if the status is
 * {@link OutcomeStatus#SUCCESS}; otherwise {@code error} describes what went wrong.
 */
@Getter
@ToString(exclude = "payload")
public final class EntityOutcome {

    private final EntityKind kind;
    private final OutcomeStatus status;
    private final Object payload;
    private final String error;
    private final long elapsedMs;

    private EntityOutcome(EntityKind kind, OutcomeStatus status, Object payload, String error, long elapsedMs) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = status;
        this.payload = payload;
        this.error = error;
        this.elapsedMs = elapsedMs;
    }

    public static EntityOutcome success(EntityKind kind, Object payload, long elapsedMs) {
        Objects.requireNonNull(payload, "payload");
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload for " + kind.getWireName() + " must be "
                    + kind.getPayloadType().getSimpleName() + " but was " + payload.getClass().getSimpleName());
        }
        return new EntityOutcome(kind, OutcomeStatus.SUCCESS, payload, null, elapsedMs);
    }

    public static EntityOutcome failed(EntityKind kind, String error, long elapsedMs) {
        return new EntityOutcome(kind, OutcomeStatus.FAILED, null,
                error != null ? error : "Extraction failed", elapsedMs);
    }

    public static EntityOutcome timedOut(EntityKind kind, Duration timeout, long elapsedMs) {
        return new EntityOutcome(kind, OutcomeStatus.TIMED_OUT, null,
                "Extraction exceeded timeout of " + timeout.toMillis() + "ms", elapsedMs);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    public <T> T payloadAs(Class<T> type) {
        if (!isSuccess()) {
            throw new IllegalStateException("No payload for " + kind.getWireName() + " (status " + status + ")");
        }
        return type.cast(payload);
    }
}
