package io.lanmesh.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local publish/subscribe dispatch keyed by event name.
 *
 * <p>Handlers fire once per registration, in registration order. A handler that
 * throws is logged and skipped; the remaining handlers still run.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Registration>> handlers = new ConcurrentHashMap<>();
    private final Executor scheduler;
    private final AtomicLong handlerFaults = new AtomicLong();

    /**
     * @param scheduler executor used for {@link AsyncEventHandler}s, normally the node's event loop
     */
    public EventBus(Executor scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public void on(String event, EventHandler handler) {
        register(event, new Registration(Dispatch.INLINE, handler, null));
    }

    public void onAsync(String event, AsyncEventHandler handler) {
        register(event, new Registration(Dispatch.SCHEDULED, null, handler));
    }

    private void register(String event, Registration registration) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(registration.target(), "handler");
        handlers.computeIfAbsent(event, k -> new CopyOnWriteArrayList<>()).add(registration);
    }

    /**
     * Removes the first registration of {@code handler} for {@code event}.
     *
     * @return whether a registration was removed
     */
    public boolean off(String event, Object handler) {
        if (handler == null) {
            return off(event);
        }
        List<Registration> list = handlers.get(event);
        if (list == null) {
            return false;
        }
        for (Registration registration : list) {
            if (registration.target() == handler) {
                return list.remove(registration);
            }
        }
        return false;
    }

    /**
     * Removes every handler registered for {@code event}.
     */
    public boolean off(String event) {
        List<Registration> removed = handlers.remove(event);
        return removed != null && !removed.isEmpty();
    }

    public int handlerCount(String event) {
        List<Registration> list = handlers.get(event);
        return list == null ? 0 : list.size();
    }

    public long getHandlerFaults() {
        return handlerFaults.get();
    }

    /**
     * Delivers {@code event} to every handler registered under its name.
     */
    public void emitLocal(MeshEvent event) {
        List<Registration> list = handlers.get(event.name());
        if (list == null || list.isEmpty()) {
            return;
        }
        for (Registration registration : new ArrayList<>(list)) {
            switch (registration.dispatch()) {
                case INLINE -> invokeInline(registration.inline(), event);
                case SCHEDULED -> schedule(registration.scheduled(), event);
            }
        }
    }

    private void invokeInline(EventHandler handler, MeshEvent event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            handlerFaults.incrementAndGet();
            log.warn("Error in event handler for '{}'", event.name(), e);
        }
    }

    private void schedule(AsyncEventHandler handler, MeshEvent event) {
        try {
            scheduler.execute(() -> runScheduled(handler, event));
        } catch (RuntimeException e) {
            // executor already shut down
            log.debug("Dropping async handler for '{}': {}", event.name(), e.toString());
        }
    }

    private void runScheduled(AsyncEventHandler handler, MeshEvent event) {
        try {
            CompletionStage<?> stage = handler.handle(event);
            if (stage != null) {
                stage.whenComplete((result, err) -> {
                    if (err != null) {
                        handlerFaults.incrementAndGet();
                        log.warn("Async event handler for '{}' failed", event.name(), err);
                    }
                });
            }
        } catch (Exception e) {
            handlerFaults.incrementAndGet();
            log.warn("Error in async event handler for '{}'", event.name(), e);
        }
    }

    private enum Dispatch { INLINE, SCHEDULED }

    private record Registration(Dispatch dispatch, EventHandler inline, AsyncEventHandler scheduled) {
        Object target() {
            return dispatch == Dispatch.INLINE ? inline : scheduled;
        }
    }
}
