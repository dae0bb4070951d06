package metering.java.engine;

import java.util.List;

/**
 * Append-only log of meter events.
 */
public interface MeterEventLog {

    void append(MeterEvent event);

    /**
     * @return every event in append order
     */
    List<MeterEvent> readAll();
}
