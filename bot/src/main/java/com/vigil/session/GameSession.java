package com.vigil.session;

import com.vigil.chain.GameReader;
import com.vigil.chain.GameWriter;
import lombok.Value;

/**
 * One identity's live handles. A rebootstrap or rotation always yields a new instance.
 */
@Value
public class GameSession {
    long adventurerId;
    String address;
    GameReader reader;
    GameWriter writer;
}
