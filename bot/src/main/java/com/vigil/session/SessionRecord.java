package com.vigil.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * The one durable record the runner depends on: which account plays which
 * adventurer. Rewritten whenever the identity changes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String address;

    /**
     * Signing material when the local signer needs it handed over. Never logged.
     */
    @Nullable
    private String signingKey;

    private long adventurerId;

    /**
     * Entry point for resuming this adventurer in the game client.
     */
    @Nullable
    private String playUrl;

    private Instant createdAt;

    @Nullable
    private Instant updatedAt;

    public boolean hasAdventurer() {
        return adventurerId > 0;
    }

    @Override
    public String toString() {
        return "SessionRecord(address=" + address + ", adventurerId=" + adventurerId
                + ", playUrl=" + playUrl + ", createdAt=" + createdAt + ")";
    }
}
