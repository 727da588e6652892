package com.vigil.decision;

import lombok.Value;

/**
 * {@code tillBeast} keeps exploring through hazards until a beast is encountered.
 */
@Value
public class ExplorePayload implements ActionPayload {
    boolean tillBeast;
}
