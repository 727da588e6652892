package com.vigil.decision;

/**
 * Marker for the typed arguments an {@link Action} carries to the writer.
 */
public interface ActionPayload {
}
