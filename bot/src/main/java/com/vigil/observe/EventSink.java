package com.vigil.observe;

import java.util.Map;

/**
 * Append-only structured event log. Fire-and-forget: implementations never throw.
 */
public interface EventSink {

    void log(EventLevel level, String event, Map<String, ?> data);

    void milestone(String name, Map<String, ?> data);
}
