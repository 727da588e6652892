package com.vigil.decision;

import com.vigil.state.StatType;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Points to add per stat. Every stat is present, most with zero.
 */
@Value
public class StatAllocation implements ActionPayload {

    Map<StatType, Integer> points;

    public StatAllocation(Map<StatType, Integer> points) {
        EnumMap<StatType, Integer> copy = new EnumMap<>(StatType.class);
        for (StatType stat : StatType.values()) {
            Integer value = points.get(stat);
            copy.put(stat, value == null ? 0 : value);
        }
        this.points = Collections.unmodifiableMap(copy);
    }

    public int get(StatType stat) {
        return points.get(stat);
    }

    public int total() {
        int total = 0;
        for (int value : points.values()) {
            total += value;
        }
        return total;
    }
}
