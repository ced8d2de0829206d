package com.koni.homeenergy.infrastructure.fanout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.homeenergy.application.port.SamplePublisher;
import com.koni.homeenergy.domain.event.SampleRecorded;
import com.koni.homeenergy.infrastructure.observability.TelemetryMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Real-time fan-out of stored samples to every connected subscriber.
 *
 * {@link #publish} serialises the event once and hands it to the fan-out executor,
 * then returns. The fan-out thread only enqueues: every subscriber has its own bounded
 * outbound queue, drained on the delivery executor, so a subscriber that stops reading
 * holds up nobody but itself. A subscriber whose queue overflows, or whose current send
 * has been blocked longer than the send-time limit, is closed and dropped.
 *
 * Delivery is best-effort: subscribers that connect later or are gone at delivery time
 * miss the event, and nothing is replayed. Delivery failures are logged and counted here
 * and never reach the publisher.
 */
@Slf4j
@Component
public class SampleBroadcaster implements SamplePublisher {

    private static final long IDLE = Long.MIN_VALUE;

    private final Map<String, SubscriberLane> lanes = new ConcurrentHashMap<>();
    private final Executor fanoutExecutor;
    private final Executor deliveryExecutor;
    private final ObjectMapper objectMapper;
    private final TelemetryMetrics telemetryMetrics;
    private final int subscriberQueueCapacity;
    private final Duration sendTimeLimit;

    public SampleBroadcaster(
            @Qualifier("fanoutExecutor") Executor fanoutExecutor,
            @Qualifier("fanoutDeliveryExecutor") Executor deliveryExecutor,
            ObjectMapper objectMapper,
            TelemetryMetrics telemetryMetrics,
            @Value("${telemetry.fanout.subscriber-queue-capacity:256}") int subscriberQueueCapacity,
            @Value("${telemetry.fanout.send-time-limit:5s}") Duration sendTimeLimit) {
        this.fanoutExecutor = fanoutExecutor;
        this.deliveryExecutor = deliveryExecutor;
        this.objectMapper = objectMapper;
        this.telemetryMetrics = telemetryMetrics;
        this.subscriberQueueCapacity = subscriberQueueCapacity;
        this.sendTimeLimit = sendTimeLimit;
        telemetryMetrics.registerSubscriberGauge(lanes::size);
    }

    public void connect(Subscriber subscriber) {
        lanes.put(subscriber.getId(), new SubscriberLane(subscriber));
        log.info("Client connected: {} ({} subscribers)", subscriber.getId(), lanes.size());
    }

    public void disconnect(String subscriberId) {
        if (lanes.remove(subscriberId) != null) {
            log.info("Client disconnected: {} ({} subscribers)", subscriberId, lanes.size());
        }
    }

    public int subscriberCount() {
        return lanes.size();
    }

    @Override
    public void publish(SampleRecorded event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (lanes.isEmpty()) {
            log.trace("No subscribers, skipping broadcast for deviceId={}", event.getDeviceId());
            return;
        }

        String message;
        try {
            message = objectMapper.writeValueAsString(envelope(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise telemetry update for deviceId={}", event.getDeviceId(), e);
            return;
        }

        try {
            fanoutExecutor.execute(() -> dispatch(message, event));
        } catch (RejectedExecutionException e) {
            telemetryMetrics.recordFanoutDropped();
            log.warn("Fan-out queue full, dropping telemetry update for deviceId={}", event.getDeviceId());
        }
    }

    private void dispatch(String message, SampleRecorded event) {
        List<SubscriberLane> snapshot = new ArrayList<>(lanes.values());
        for (SubscriberLane lane : snapshot) {
            if (!lane.subscriber.isOpen()) {
                disconnect(lane.subscriber.getId());
                continue;
            }
            lane.offer(message);
        }
        log.debug("Dispatched telemetry update for device {} to {} subscribers", event.getDeviceId(), snapshot.size());
    }

    private Map<String, Object> envelope(SampleRecorded event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", SampleRecorded.TYPE);
        envelope.put("payload", event);
        return envelope;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} real-time subscribers", lanes.size());
        lanes.values().forEach(lane -> lane.subscriber.close());
        lanes.clear();
    }

    /**
     * Outbound queue of one subscriber. At most one drain task per lane runs at a time,
     * so messages reach the subscriber in publish order.
     */
    private final class SubscriberLane {

        private final Subscriber subscriber;
        private final BlockingQueue<String> pending;
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile long sendStartedNanos = IDLE;

        private SubscriberLane(Subscriber subscriber) {
            this.subscriber = subscriber;
            this.pending = new LinkedBlockingQueue<>(subscriberQueueCapacity);
        }

        void offer(String message) {
            long started = sendStartedNanos;
            if (started != IDLE && System.nanoTime() - started > sendTimeLimit.toNanos()) {
                evict("send blocked for more than " + sendTimeLimit.toMillis() + "ms");
                return;
            }
            if (!pending.offer(message)) {
                evict("outbound queue full (" + subscriberQueueCapacity + " messages)");
                return;
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("No delivery thread available for {}, {} updates pending",
                        subscriber.getId(), pending.size());
            }
        }

        private void drain() {
            try {
                String message;
                while ((message = pending.poll()) != null) {
                    if (!send(message)) {
                        return;
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!pending.isEmpty()) {
                scheduleDrain();
            }
        }

        private boolean send(String message) {
            sendStartedNanos = System.nanoTime();
            try {
                subscriber.send(message);
                telemetryMetrics.recordFanoutDelivered();
                return true;
            } catch (Exception e) {
                telemetryMetrics.recordFanoutFailed();
                log.warn("Failed to deliver telemetry update to {}: {}", subscriber.getId(), e.getMessage());
                if (!subscriber.isOpen()) {
                    pending.clear();
                    disconnect(subscriber.getId());
                    return false;
                }
                return true;
            } finally {
                sendStartedNanos = IDLE;
            }
        }

        private void evict(String reason) {
            if (!lanes.remove(subscriber.getId(), this)) {
                return;
            }
            pending.clear();
            telemetryMetrics.recordFanoutEvicted();
            log.warn("Dropping slow subscriber {}: {} ({} subscribers)", subscriber.getId(), reason, lanes.size());
            try {
                deliveryExecutor.execute(subscriber::close);
            } catch (RejectedExecutionException e) {
                log.debug("Closing {} on the fan-out thread, no delivery thread available", subscriber.getId());
                subscriber.close();
            }
        }
    }
}
