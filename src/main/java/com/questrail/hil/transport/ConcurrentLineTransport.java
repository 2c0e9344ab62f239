package com.questrail.hil.transport;

import com.questrail.hil.internal.time.MonotonicClock;
import com.questrail.hil.internal.time.MonotonicScheduler;
import com.questrail.hil.internal.time.PollingLoop;
import com.questrail.hil.observability.LinkErrorEvent;
import com.questrail.hil.observability.LinkObservabilitySink;
import com.questrail.hil.observability.LinkOverflowEvent;
import com.questrail.hil.observability.LinkTransportEvent;
import com.questrail.hil.observability.NullObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ConcurrentLineTransport
 * =============================================================================
 * Buffers serial input and output on two dedicated worker threads and offers
 * line-oriented access through bounded queues.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>The reader thread blocks on {@link SerialDevice#read(byte[])}, assembles
 *       lines, stamps them with the time the read returned, and offers them to
 *       the inbound queue. It never blocks on the queue: when the queue is full
 *       the new line is dropped and counted.</li>
 *   <li>The writer thread blocks on the outbound queue and writes each item.
 *       The reserved {@link #END_OF_TRANSMISSION} item makes it exit without
 *       writing.</li>
 *   <li>{@link #getLine(Duration)} and {@link #putLine(String, String, Duration)}
 *       poll the queues from the cooperative scheduler, re-arming every
 *       {@link #POLL_INTERVAL}.</li>
 * </ul>
 * The queues and the {@code running} flag are the only state shared across
 * threads.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   try (ConcurrentLineTransport t = new ConcurrentLineTransport(...).open()) {
 *       ...
 *   }
 * </pre>
 * {@link #close()} is idempotent and runs the full teardown on every exit path.
 */
public final class ConcurrentLineTransport implements LineTransport, AutoCloseable {

    public static final String DEFAULT_EOL = "\r\n";
    public static final int DEFAULT_INBOUND_CAPACITY = 4096;
    public static final int DEFAULT_OUTBOUND_CAPACITY = 256;

    /**
     * Reserved outbound item that wakes the writer for shutdown. Never written.
     */
    static final String END_OF_TRANSMISSION = "\u0004";

    static final Duration POLL_INTERVAL = Duration.ofMillis(1);

    private static final int READ_CHUNK_BYTES = 256;

    private final Logger rxLog;
    private final Logger txLog;

    private final SerialDevice device;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final LinkObservabilitySink observabilitySink;

    private final BlockingDeque<TimestampedLine> inbound;
    private final BlockingQueue<String> outbound;
    private final int outboundCapacity;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong rxBufferOverflows = new AtomicLong();

    private volatile String eol;
    private volatile boolean echo;

    private volatile Thread readerThread;
    private volatile Thread writerThread;

    public ConcurrentLineTransport(SerialDevice device,
                                   MonotonicClock clock,
                                   MonotonicScheduler scheduler,
                                   String eol,
                                   boolean echo,
                                   int inboundCapacity,
                                   int outboundCapacity,
                                   LinkObservabilitySink observabilitySink)
    {
        this.device = Objects.requireNonNull(device, "device");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.eol = requireEol(eol);
        this.echo = echo;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (inboundCapacity < 1 || outboundCapacity < 1) {
            throw new IllegalArgumentException("queue capacities must be >= 1");
        }
        this.inbound = new LinkedBlockingDeque<>(inboundCapacity);
        // One extra slot so the shutdown sentinel always fits behind a full queue.
        this.outbound = new LinkedBlockingQueue<>(outboundCapacity + 1);
        this.outboundCapacity = outboundCapacity;

        String base = ConcurrentLineTransport.class.getName();
        this.rxLog = LoggerFactory.getLogger(base + ".rx");
        this.txLog = LoggerFactory.getLogger(base + ".tx");
    }

    /**
     * Transport with default queue sizes, echo off and no observability.
     */
    public ConcurrentLineTransport(SerialDevice device,
                                   MonotonicClock clock,
                                   MonotonicScheduler scheduler,
                                   String eol)
    {
        this(device, clock, scheduler, eol, false,
                DEFAULT_INBOUND_CAPACITY, DEFAULT_OUTBOUND_CAPACITY, null);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Opens the device if needed and starts the reader and writer workers.
     *
     * @return this transport, for try-with-resources
     * @throws IllegalStateException if the transport was already opened or closed
     */
    public ConcurrentLineTransport open() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("transport " + device.name() + " is closed");
        }
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("transport " + device.name() + " is already open");
        }
        if (!device.isOpen()) {
            device.open();
        }

        readerThread = new Thread(this::readLoop, "hil-serial-rx-" + device.name());
        writerThread = new Thread(this::writeLoop, "hil-serial-tx-" + device.name());
        readerThread.setDaemon(true);
        writerThread.setDaemon(true);
        readerThread.start();
        writerThread.start();

        observabilitySink.onTransportEvent(new LinkTransportEvent(Instant.now(), device.name(), LinkTransportEvent.Kind.OPENED));
        return this;
    }

    /**
     * Stops both workers and closes the device. Idempotent; never throws.
     *
     * <p>Workers are joined for at most the device read timeout each. A worker
     * still alive after that is reported to the observability sink.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        running.set(false);

        try {
            device.flush();
        } catch (IOException | RuntimeException e) {
            reportError("flush during close failed", e);
        }
        device.cancelRead();

        if (!outbound.offer(END_OF_TRANSMISSION)) {
            outbound.clear();
            outbound.offer(END_OF_TRANSMISSION);
        }

        join(writerThread);
        join(readerThread);

        try {
            device.close();
        } catch (IOException | RuntimeException e) {
            reportError("device close failed", e);
        }

        observabilitySink.onTransportEvent(new LinkTransportEvent(Instant.now(), device.name(), LinkTransportEvent.Kind.CLOSED));
    }

    private void join(Thread worker) {
        if (worker == null) {
            return;
        }
        Duration timeout = device.readTimeout();
        try {
            if (timeout.isZero()) {
                worker.join();
            } else {
                worker.join(Math.max(1, timeout.toMillis()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            reportError(worker.getName() + " did not stop within " + timeout, null);
        }
    }

    // -------------------------------------------------------------------------
    // LineTransport
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<TimestampedLine> getLine(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long startNanos = clock.nowNanos();

        return PollingLoop.start(scheduler, clock, POLL_INTERVAL, result -> {
            TimestampedLine line = inbound.pollFirst();
            if (line != null) {
                if (!result.complete(line)) {
                    // The caller cancelled between poll and complete; keep the line.
                    requeue(line);
                }
            } else if (!running.get()) {
                result.completeExceptionally(new TransportStoppedException(
                        "transport " + device.name() + " stopped with no lines pending"));
            } else if (clock.isExpired(startNanos, timeout)) {
                result.completeExceptionally(new TimeoutException(
                        "no line received on " + device.name() + " within " + timeout));
            }
        });
    }

    @Override
    public CompletableFuture<Long> putLine(String text, String end, Duration timeout) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(timeout, "timeout");
        String payload = text + end;
        long startNanos = clock.nowNanos();

        return PollingLoop.start(scheduler, clock, POLL_INTERVAL, result -> {
            if (!running.get()) {
                result.complete(clock.nowNanos());
                return;
            }
            long putNanos = clock.nowNanos();
            if (offerOutbound(payload)) {
                result.complete(putNanos);
            } else if (clock.isExpired(startNanos, timeout)) {
                result.completeExceptionally(new TimeoutException(
                        "outbound queue of " + device.name() + " stayed full for " + timeout));
            }
        });
    }

    @Override
    public Optional<TimestampedLine> tryReadLine() {
        return Optional.ofNullable(inbound.pollFirst());
    }

    @Override
    public void unreadLine(TimestampedLine line) {
        requeue(Objects.requireNonNull(line, "line"));
    }

    @Override
    public OptionalLong tryWriteLine(String text) {
        Objects.requireNonNull(text, "text");
        long putNanos = clock.nowNanos();
        return offerOutbound(text + eol) ? OptionalLong.of(putNanos) : OptionalLong.empty();
    }

    @Override
    public long nowNanos() {
        return clock.nowNanos();
    }

    @Override
    public String eol() {
        return eol;
    }

    public void setEol(String eol) {
        this.eol = requireEol(eol);
    }

    public boolean isEcho() {
        return echo;
    }

    public void setEcho(boolean echo) {
        this.echo = echo;
    }

    @Override
    public long rxBufferOverflows() {
        return rxBufferOverflows.get();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Lines received but not yet consumed.
     */
    public int pendingLines() {
        return inbound.size();
    }

    public SerialDevice device() {
        return device;
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    @Override
    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    // -------------------------------------------------------------------------
    // Workers
    // -------------------------------------------------------------------------

    private void readLoop() {
        LineAssembler assembler = new LineAssembler();
        byte[] chunk = new byte[READ_CHUNK_BYTES];
        try {
            while (running.get()) {
                int count = device.read(chunk);
                long rxNanos = clock.nowNanos();
                if (count <= 0) {
                    continue;
                }
                for (String text : assembler.accept(chunk, count, eol)) {
                    TimestampedLine line = new TimestampedLine(text, rxNanos);
                    if (inbound.offerLast(line)) {
                        rxLog.debug("{}", printable(text));
                    } else {
                        recordOverflow(text);
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            if (running.get()) {
                reportError("read failed", e);
            }
        } finally {
            if (running.getAndSet(false)) {
                observabilitySink.onTransportEvent(new LinkTransportEvent(
                        Instant.now(), device.name(), LinkTransportEvent.Kind.READER_EXITED));
            }
        }
    }

    private void writeLoop() {
        try {
            while (running.get()) {
                String text = outbound.take();
                if (END_OF_TRANSMISSION.equals(text)) {
                    continue;
                }
                device.write(text.getBytes(StandardCharsets.UTF_8));
                if (echo) {
                    txLog.debug("{}", printable(text));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            if (running.get()) {
                reportError("write failed", e);
            }
        } finally {
            if (running.getAndSet(false)) {
                observabilitySink.onTransportEvent(new LinkTransportEvent(
                        Instant.now(), device.name(), LinkTransportEvent.Kind.WRITER_EXITED));
            }
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private boolean offerOutbound(String payload) {
        // The last slot is reserved for the shutdown sentinel.
        synchronized (outbound) {
            return outbound.size() < outboundCapacity && outbound.offer(payload);
        }
    }

    private void requeue(TimestampedLine line) {
        if (!inbound.offerFirst(line)) {
            recordOverflow(line.text());
        }
    }

    private void recordOverflow(String droppedText) {
        long total = rxBufferOverflows.incrementAndGet();
        observabilitySink.onOverflow(new LinkOverflowEvent(Instant.now(), device.name(), total, droppedText));
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new LinkErrorEvent(Instant.now(), device.name(), message, cause));
    }

    private static String printable(String text) {
        return text.replace("\r", "<cr>");
    }

    private static String requireEol(String eol) {
        Objects.requireNonNull(eol, "eol");
        if (eol.isEmpty()) {
            throw new IllegalArgumentException("eol must not be empty");
        }
        return eol;
    }
}
