package com.vigil.state;

import com.google.gson.annotations.SerializedName;

/**
 * Attribute names in the order the contract's stat struct lists them.
 */
public enum StatType {
    @SerializedName(value = "strength", alternate = "STRENGTH")
    STRENGTH,
    @SerializedName(value = "dexterity", alternate = "DEXTERITY")
    DEXTERITY,
    @SerializedName(value = "vitality", alternate = "VITALITY")
    VITALITY,
    @SerializedName(value = "intelligence", alternate = "INTELLIGENCE")
    INTELLIGENCE,
    @SerializedName(value = "wisdom", alternate = "WISDOM")
    WISDOM,
    @SerializedName(value = "charisma", alternate = "CHARISMA")
    CHARISMA,
    @SerializedName(value = "luck", alternate = "LUCK")
    LUCK
}
