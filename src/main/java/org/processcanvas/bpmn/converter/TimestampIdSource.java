package org.processcanvas.bpmn.converter;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Ids stamped with the clock reading of the first request, e.g. {@code Process_1718000000000}.
 * Repeated prefixes get a counter suffix so ids stay unique within one export.
 */
public class TimestampIdSource implements IdSource {
    private final Clock clock;
    private final Map<String, Integer> usesByPrefix = new HashMap<>();
    private Long stamp;

    public TimestampIdSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String nextId(String prefix) {
        if (stamp == null) {
            stamp = clock.millis();
        }
        int uses = usesByPrefix.merge(prefix, 1, Integer::sum);
        return uses == 1
                ? prefix + "_" + stamp
                : prefix + "_" + stamp + "_" + uses;
    }
}
