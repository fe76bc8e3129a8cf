package de.bsommerfeld.nestedsets.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers {@link TreeEvents} to listeners that subscribe with Guava's
 * {@code @Subscribe}, without the listeners depending on the trees.
 *
 * <p>
 * Delivery is synchronous on the posting thread and happens after the
 * transaction has committed. A failing listener is logged and skipped: the
 * change it was told about is already durable, so its exception never
 * reaches the caller of the tree operation, and the remaining listeners
 * still run.
 */
@Singleton
public class TreeEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(TreeEventBus.class);
    private final EventBus eventBus;

    public TreeEventBus() {
        this.eventBus = new EventBus(TreeEventBus::onListenerFailure);
    }

    public void post(TreeEvents.TreeEvent event) {
        LOG.debug("[{}] Posting {}", event.table(), event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering tree listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering tree listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        Object event = context.getEvent();
        String table = event instanceof TreeEvents.TreeEvent ? ((TreeEvents.TreeEvent) event).table() : "?";
        LOG.error("[{}] Listener {}#{} failed on {}", table, context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), event, failure);
    }
}
