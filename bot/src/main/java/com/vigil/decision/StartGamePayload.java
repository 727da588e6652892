package com.vigil.decision;

import lombok.Value;

@Value
public class StartGamePayload implements ActionPayload {
    int weaponId;
}
