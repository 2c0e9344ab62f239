package com.questrail.hil.runtime;

import com.questrail.hil.config.TransportConfig;
import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.internal.time.MonotonicScheduler;
import com.questrail.hil.internal.time.ScheduledExecutorScheduler;
import com.questrail.hil.internal.time.SystemMonotonicClock;
import com.questrail.hil.observability.LinkObservabilitySink;
import com.questrail.hil.observability.NullObservabilitySink;
import com.questrail.hil.race.RaceCoordinator;
import com.questrail.hil.transport.ConcurrentLineTransport;
import com.questrail.hil.transport.SerialDevice;
import com.questrail.hil.transport.SerialDeviceFactory;
import com.questrail.hil.transport.jserialcomm.JSerialCommDevice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * HilRuntime
 * =============================================================================
 * Composition root and lifecycle owner for serial sessions.
 *
 * <p>Owns one clock, the cooperative scheduler thread every transport and
 * driver continuation runs on, the device factory and the observability sink.
 * Transports opened here share all four, so receive timestamps and timeouts
 * from different links are comparable.</p>
 *
 * <p>A scheduler supplied through the builder (a deterministic one in tests)
 * is not owned and is left alone by {@link #stop()}.</p>
 */
public final class HilRuntime implements AutoCloseable {

    public static final String SCHEDULER_THREAD_NAME = "hil-scheduler";

    private static final Logger log = LoggerFactory.getLogger(HilRuntime.class);

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedExecutor;
    private final SerialDeviceFactory deviceFactory;
    private final LinkObservabilitySink observabilitySink;
    private final RaceCoordinator raceCoordinator;

    private HilRuntime(MonotonicClock clock,
                       MonotonicScheduler scheduler,
                       ScheduledExecutorService ownedExecutor,
                       SerialDeviceFactory deviceFactory,
                       LinkObservabilitySink observabilitySink) {
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
        this.deviceFactory = deviceFactory;
        this.observabilitySink = observabilitySink;
        this.raceCoordinator = new RaceCoordinator(scheduler, clock);
    }

    /**
     * Creates the device and starts a session on it. The caller owns the
     * returned transport and must close it.
     *
     * @throws IOException if the device cannot be opened
     */
    public ConcurrentLineTransport openTransport(TransportConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        SerialDevice device = deviceFactory.create(config.port(), config.baudRate(), config.readTimeout());
        ConcurrentLineTransport transport = new ConcurrentLineTransport(
                device,
                clock,
                scheduler,
                config.eol(),
                config.echo(),
                config.inboundCapacity(),
                config.outboundCapacity(),
                observabilitySink);
        try {
            return transport.open();
        } catch (IOException | RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    public MonotonicClock clock() {
        return clock;
    }

    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    public RaceCoordinator raceCoordinator() {
        return raceCoordinator;
    }

    public LinkObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    public void stop() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler did not stop within 5 s; forcing shutdown");
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private SerialDeviceFactory deviceFactory = JSerialCommDevice::new;
        private LinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Use an externally owned scheduler instead of a private scheduler thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withDeviceFactory(SerialDeviceFactory deviceFactory) {
            this.deviceFactory = deviceFactory;
            return this;
        }

        public Builder withObservabilitySink(LinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public HilRuntime build() {
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(deviceFactory, "deviceFactory");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            if (scheduler != null) {
                return new HilRuntime(clock, scheduler, null, deviceFactory, observabilitySink);
            }
            ScheduledExecutorService executor = ScheduledExecutorScheduler.singleThreaded(SCHEDULER_THREAD_NAME);
            return new HilRuntime(clock, new ScheduledExecutorScheduler(executor, clock), executor,
                    deviceFactory, observabilitySink);
        }
    }
}
