package metering.java.engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryMeterEventLog implements MeterEventLog {

    private final CopyOnWriteArrayList<MeterEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void append(MeterEvent event) {
        if (event == null) throw new IllegalArgumentException("event cannot be null");
        events.add(event);
    }

    @Override
    public List<MeterEvent> readAll() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
