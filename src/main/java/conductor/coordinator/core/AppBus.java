package conductor.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Change notifications for observers (persistence, UI refresh, metrics).
 * One instance is owned by the dependency container and handed to the
 * components that publish changes. A failing listener is logged and does
 * not affect the publisher or the other listeners.
 */
public final class AppBus {

    private static final Logger log = LoggerFactory.getLogger(AppBus.class);

    private final CopyOnWriteArrayList<Runnable> tasks = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Runnable> workers = new CopyOnWriteArrayList<>();

    public void onTasksChanged(Runnable r) { tasks.add(r); }
    public void onWorkersChanged(Runnable r) { workers.add(r); }

    public void fireTasksChanged() { fire("tasks", tasks); }
    public void fireWorkersChanged() { fire("workers", workers); }

    private static void fire(String channel, CopyOnWriteArrayList<Runnable> listeners) {
        for (var r : listeners) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("{} listener failed: {}", channel, e.getMessage(), e);
            }
        }
    }
}
