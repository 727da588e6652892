package com.vigil.decision;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * One decision: what to do, why, and with which arguments.
 *
 * <p>{@code reason} is required on every action and is only used for observability.
 */
@Value
public class Action {

    ActionType type;

    String reason;

    @Nullable
    ActionPayload payload;

    @Builder(toBuilder = true)
    public Action(ActionType type, String reason, @Nullable ActionPayload payload) {
        if (type == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        if (reason == null || reason.isEmpty()) {
            throw new IllegalArgumentException("Action reason is required");
        }
        this.type = type;
        this.reason = reason;
        this.payload = payload;
    }

    public static Action of(ActionType type, String reason) {
        return new Action(type, reason, null);
    }

    public static Action of(ActionType type, String reason, @Nullable ActionPayload payload) {
        return new Action(type, reason, payload);
    }

    public static Action waitFor(String reason) {
        return new Action(ActionType.WAIT, reason, null);
    }

    /**
     * Typed access to the payload.
     */
    public <T extends ActionPayload> Optional<T> payload(Class<T> type) {
        if (type.isInstance(payload)) {
            return Optional.of(type.cast(payload));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return type + "(" + reason + (payload != null ? ", " + payload : "") + ")";
    }
}
