package com.roundpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fan-out of round events from the source workers to feed subscribers.
 * <p>
 * Every worker publishes from its own thread and delivery runs on that thread, so a
 * subscriber must be quick. Each subscriber sees only the events its {@link FeedFilter}
 * accepts. A subscriber that throws is logged and counted; the publishing worker never sees it.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Feed> feeds = new CopyOnWriteArrayList<>();
    private final AtomicLong deliveryFailures = new AtomicLong();

    public void publish(RoundEvent event) {
        log.trace("{} from {}", event.eventType(), event.sourceId());
        for (Feed feed : feeds) {
            if (feed.filter.accepts(event)) {
                feed.deliver(event);
            }
        }
    }

    /**
     * Registers a feed.
     *
     * @return a handle that removes the feed again
     */
    public Subscription subscribe(FeedFilter filter, Consumer<RoundEvent> consumer) {
        Feed feed = new Feed(filter, consumer);
        feeds.add(feed);
        log.debug("Feed subscribed: sources {}, excluding {}",
                filter.sourceIds().isEmpty() ? "all" : filter.sourceIds(), filter.excludedTypes());
        return () -> feeds.remove(feed);
    }

    public int feedCount() {
        return feeds.size();
    }

    /** Events a subscriber failed to handle since startup. */
    public long deliveryFailures() {
        return deliveryFailures.get();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private final class Feed {

        private final FeedFilter filter;
        private final Consumer<RoundEvent> consumer;

        private Feed(FeedFilter filter, Consumer<RoundEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        private void deliver(RoundEvent event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                deliveryFailures.incrementAndGet();
                log.warn("Feed failed on {} from {}: {}", event.eventType(), event.sourceId(), e.getMessage(), e);
            }
        }
    }
}
