package photolib.ext.crop.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * EventBus
 *
 * <p>Simple message bus for decoupled communication between model, UI, and controller:
 *   - Components subscribe to typed {@link CropEvent}s.
 *   - The geometry core broadcasts state changes without knowing who listens.
 *
 * <p>A subscriber that throws is logged and skipped; the remaining subscribers still
 * receive the event and the mutation that published it is not rolled back.
 */
public class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final Map<CropEvent.Type, List<Consumer<CropEvent>>> subscribers = new EnumMap<>(CropEvent.Type.class);

    public void subscribe(CropEvent.Type type, Consumer<CropEvent> handler) {
        subscribers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Subscribes one handler to every event type.
     */
    public void subscribeAll(Consumer<CropEvent> handler) {
        for (CropEvent.Type type : CropEvent.Type.values()) {
            subscribe(type, handler);
        }
    }

    /**
     * @return {@code true} if the handler was subscribed to {@code type}
     */
    public boolean unsubscribe(CropEvent.Type type, Consumer<CropEvent> handler) {
        List<Consumer<CropEvent>> list = subscribers.get(type);
        return list != null && list.remove(handler);
    }

    public void publish(CropEvent event) {
        List<Consumer<CropEvent>> list = subscribers.get(event.type());
        if (list == null) {
            return;
        }
        for (Consumer<CropEvent> handler : list) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                logger.error("Subscriber failed while handling {}", event.type(), e);
            }
        }
    }

    public int subscriberCount(CropEvent.Type type) {
        List<Consumer<CropEvent>> list = subscribers.get(type);
        return list == null ? 0 : list.size();
    }
}
