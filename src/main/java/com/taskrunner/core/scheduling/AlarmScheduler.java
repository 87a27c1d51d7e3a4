package com.taskrunner.core.scheduling;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.store.AlarmStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Durable timer substrate: owns every continuation of every task and node.
 * <p>
 * Alarms live in the {@link AlarmStore}, so a restarted process picks up exactly where
 * the previous one stopped. A due alarm is delivered inside its owner's mailbox: it is
 * first leased (fire time pushed forward by the lease duration), then handed to the
 * registered {@link AlarmHandler}, and finally deleted unless the handler re-armed it.
 * If the process dies while the handler runs, the lease expires and the alarm fires again.
 * <p>
 * The poller only runs when {@code taskrunner.scheduler.enabled} is true (serve mode);
 * CLI invocations persist alarms and leave their delivery to the server.
 */
@Service
public class AlarmScheduler {

    private static final Logger log = LoggerFactory.getLogger(AlarmScheduler.class);

    private final AlarmStore alarmStore;
    private final KeyedSerialExecutor units;
    private final Clock clock;
    private final TaskRunnerProperties.Scheduler settings;
    private final Map<OwnerType, AlarmHandler> handlers = new ConcurrentHashMap<>();

    private ScheduledExecutorService poller;

    public AlarmScheduler(AlarmStore alarmStore, KeyedSerialExecutor units, Clock clock,
                          TaskRunnerProperties properties) {
        this.alarmStore = alarmStore;
        this.units = units;
        this.clock = clock;
        this.settings = properties.getScheduler();
    }

    public void registerHandler(OwnerType ownerType, AlarmHandler handler) {
        AlarmHandler previous = handlers.putIfAbsent(ownerType, handler);
        if (previous != null && previous != handler) {
            throw new IllegalStateException("An alarm handler is already registered for " + ownerType);
        }
    }

    @PostConstruct
    void start() {
        if (!settings.isEnabled()) {
            log.debug("Alarm poller disabled");
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alarm-poller");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = settings.getPollInterval().toMillis();
        poller.scheduleWithFixedDelay(this::pollSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Alarm poller started (interval={}ms, lease={}s)", intervalMs, settings.getLease().toSeconds());
    }

    @PreDestroy
    void stop() {
        if (poller == null) {
            return;
        }
        poller.shutdown();
        try {
            if (!poller.awaitTermination(5, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
        } catch (InterruptedException e) {
            poller.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Alarm poller stopped");
    }

    // ── Arming ───────────────────────────────────────────────────────────

    /**
     * Arms the alarm for {@code key}, replacing any earlier fire time. An alarm that is
     * already due is also delivered right away (through the owner's mailbox).
     */
    public void schedule(AlarmKey key, Instant fireAt) {
        alarmStore.set(key, fireAt);
        log.debug("Alarm {} armed for {}", key, fireAt);
        if (settings.isEnabled() && !fireAt.isAfter(clock.instant())) {
            dispatch(new Alarm(key, fireAt));
        }
    }

    public void scheduleIn(AlarmKey key, Duration delay) {
        schedule(key, clock.instant().plus(delay));
    }

    public void scheduleNow(AlarmKey key) {
        schedule(key, clock.instant());
    }

    public void cancel(AlarmKey key) {
        alarmStore.delete(key);
    }

    public void cancelAll(OwnerType ownerType, String ownerId) {
        alarmStore.deleteAll(ownerType, ownerId);
    }

    public Optional<Instant> nextFireTime(AlarmKey key) {
        return alarmStore.find(key);
    }

    // ── Delivery ─────────────────────────────────────────────────────────

    /**
     * Delivers every alarm due now. Called by the poller; also usable directly.
     *
     * @return number of alarms handed to their mailboxes
     */
    public int dispatchDueAlarms() {
        List<Alarm> due = alarmStore.findDue(clock.instant(), settings.getBatchSize());
        for (Alarm alarm : due) {
            dispatch(alarm);
        }
        return due.size();
    }

    private void pollSafely() {
        try {
            dispatchDueAlarms();
        } catch (RuntimeException e) {
            log.error("Alarm poll failed", e);
        }
    }

    private void dispatch(Alarm alarm) {
        units.execute(alarm.key().unitKey(), () -> fire(alarm));
    }

    /** Runs inside the owner's mailbox. */
    private void fire(Alarm alarm) {
        AlarmKey key = alarm.key();
        Instant leaseUntil = clock.instant().plus(settings.getLease());
        if (!alarmStore.lease(key, alarm.fireAt(), leaseUntil)) {
            log.debug("Alarm {} already re-armed or taken, skipping", key);
            return;
        }
        AlarmHandler handler = handlers.get(key.ownerType());
        if (handler == null) {
            log.warn("No handler registered for {} alarms; {} will fire again after its lease", key.ownerType(), key);
            return;
        }
        try {
            handler.onAlarm(key);
        } catch (RuntimeException e) {
            log.error("Alarm handler failed for {}; it will fire again after its lease", key, e);
            return;
        }
        alarmStore.release(key, leaseUntil);
    }
}
