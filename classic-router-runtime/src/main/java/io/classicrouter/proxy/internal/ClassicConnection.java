/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import io.netty.util.Timeout;

import io.classicrouter.proxy.internal.processor.Processor;
import io.classicrouter.proxy.protocol.ClientSideProtocolState;
import io.classicrouter.proxy.protocol.ServerMode;
import io.classicrouter.proxy.protocol.ServerSideProtocolState;
import io.classicrouter.proxy.service.PooledConnection;
import io.classicrouter.proxy.service.ServerChannel;
import io.classicrouter.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A client connection and the server connection it is currently attached to.
 *
 * <p>Work on the connection is done by {@link Processor}s kept on a stack. {@link #resume()}
 * runs the processor on top of the stack until it suspends or the stack is empty:</p>
 * <ul>
 *   <li>{@code AGAIN}: run the top of the stack again, which may be a processor that was just pushed</li>
 *   <li>{@code SEND_TO_CLIENT}: flush the client channel, then continue</li>
 *   <li>{@code DONE}: pop the processor, which resumes the one below it</li>
 *   <li>{@code SUSPEND}: return, something will call {@link #resume()} once the processor can continue</li>
 * </ul>
 *
 * <p>All methods must be called from the client channel's event loop.</p>
 */
public class ClassicConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClassicConnection.class);

    private final String connectionId;
    private final RouteContext context;
    private final Channel clientChannel;
    private final ClientSideProtocolState clientProtocol = new ClientSideProtocolState();
    private final ExecutionContext executionContext = new ExecutionContext();

    private ServerSideProtocolState serverProtocol = new ServerSideProtocolState();
    private @Nullable ServerChannel serverChannel;

    // Processor stack and its driver
    private final Deque<Processor> processors = new ArrayDeque<>();
    private boolean running;
    private boolean resumeRequested;
    private @Nullable Timeout pendingResume;

    // Session flags
    private boolean authenticated;
    private boolean clientGreetingSent;
    private boolean greetingFromRouter;
    private boolean someStateChanged;
    private @Nullable TrxCharacteristics trxCharacteristics;

    // Routing
    private ServerMode expectedServerMode = ServerMode.READ_WRITE;
    private boolean waitForMyWrites;
    private Duration waitForMyWritesTimeout;
    private String gtidAtLeastExecuted = "";

    public ClassicConnection(RouteContext context, Channel clientChannel) {
        this.connectionId = UUID.randomUUID().toString();
        this.context = Objects.requireNonNull(context);
        this.clientChannel = Objects.requireNonNull(clientChannel);
        this.waitForMyWrites = context.config().waitForMyWrites();
        this.waitForMyWritesTimeout = context.config().waitForMyWritesTimeout();
    }

    // ==================== Accessors ====================

    public String connectionId() {
        return connectionId;
    }

    public RouteContext context() {
        return context;
    }

    public Channel clientChannel() {
        return clientChannel;
    }

    public ClientSideProtocolState clientProtocol() {
        return clientProtocol;
    }

    public ServerSideProtocolState serverProtocol() {
        return serverProtocol;
    }

    public ExecutionContext executionContext() {
        return executionContext;
    }

    @Nullable
    public ServerChannel serverChannel() {
        return serverChannel;
    }

    public boolean isServerOpen() {
        return serverChannel != null && serverChannel.isOpen();
    }

    // ==================== Processor Stack ====================

    /**
     * Pushes a processor which will run before the current one continues.
     */
    public void pushProcessor(Processor processor) {
        LOGGER.trace("{}: push {}", connectionId, processor.getClass().getSimpleName());
        processors.push(Objects.requireNonNull(processor));
    }

    public boolean hasProcessors() {
        return !processors.isEmpty();
    }

    @VisibleForTesting
    int processorCount() {
        return processors.size();
    }

    /**
     * Runs the processors on the stack until one suspends or all are done.
     * <p>
     * A call while the processors are already running, for example from a future that
     * completes synchronously, makes the next suspending processor run again instead.
     * </p>
     */
    public void resume() {
        if (running) {
            resumeRequested = true;
            return;
        }

        running = true;
        try {
            while (!processors.isEmpty()) {
                resumeRequested = false;

                Processor processor = processors.peek();
                Processor.Result result = processor.process();
                switch (result) {
                    case AGAIN -> {
                        // run whatever is on top now
                    }
                    case SEND_TO_CLIENT -> clientChannel.flush();
                    case DONE -> {
                        LOGGER.trace("{}: pop {}", connectionId, processor.getClass().getSimpleName());
                        processors.remove(processor);
                    }
                    case SUSPEND -> {
                        if (!resumeRequested) {
                            return;
                        }
                    }
                }
            }
        }
        finally {
            running = false;
        }
    }

    /**
     * Calls {@link #resume()} on the client's event loop once {@code delay} has passed.
     */
    public void resumeAfter(Duration delay) {
        pendingResume = context.timer().newTimeout(timeout -> {
            EventLoop eventLoop = clientChannel.eventLoop();
            if (eventLoop.inEventLoop()) {
                resumeExpired(timeout);
            }
            else {
                eventLoop.execute(() -> resumeExpired(timeout));
            }
        }, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void resumeExpired(Timeout timeout) {
        if (pendingResume != timeout) {
            // cancelled by close(), or replaced by a later resumeAfter()
            return;
        }
        pendingResume = null;
        resume();
    }

    @VisibleForTesting
    boolean hasPendingResume() {
        return pendingResume != null;
    }

    // ==================== Server Connection ====================

    /**
     * Attaches a server connection to this client connection.
     */
    public void attachServer(ServerChannel channel, ServerSideProtocolState protocol) {
        if (serverChannel != null) {
            throw new IllegalStateException("A server connection is already attached to " + connectionId);
        }
        this.serverChannel = Objects.requireNonNull(channel);
        this.serverProtocol = Objects.requireNonNull(protocol);
    }

    /**
     * The attached server connection in the shape the connection pool takes it.
     */
    public Optional<PooledConnection> poolableServer() {
        if (!isServerOpen()) {
            return Optional.empty();
        }
        return Optional.of(new PooledConnection(Objects.requireNonNull(serverChannel), serverProtocol, expectedServerMode));
    }

    /**
     * Forgets the server connection without closing it, as its ownership moved elsewhere.
     */
    public void detachServer() {
        this.serverChannel = null;
        this.serverProtocol = new ServerSideProtocolState();
    }

    /**
     * Closes the transport of the server connection and forgets it.
     */
    public void closeServer() {
        ServerChannel channel = serverChannel;
        if (channel != null) {
            LOGGER.debug("{}: closing server connection", connectionId);
            channel.close();
        }
        detachServer();
    }

    /**
     * Tears down the connection: pending processors and timers are dropped.
     */
    public void close() {
        Timeout timeout = pendingResume;
        if (timeout != null) {
            timeout.cancel();
            pendingResume = null;
        }
        processors.clear();
        closeServer();
    }

    // ==================== Session Flags ====================

    public boolean isAuthenticated() {
        return authenticated;
    }

    public void setAuthenticated(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public boolean isClientGreetingSent() {
        return clientGreetingSent;
    }

    public void setClientGreetingSent(boolean clientGreetingSent) {
        this.clientGreetingSent = clientGreetingSent;
    }

    /**
     * @return true if the client was greeted by the router rather than by a server
     */
    public boolean isGreetingFromRouter() {
        return greetingFromRouter;
    }

    public void setGreetingFromRouter(boolean greetingFromRouter) {
        this.greetingFromRouter = greetingFromRouter;
    }

    /**
     * Marks that the session changed in a way the router can't track, or stops doing so.
     * A connection with such changes can't be shared.
     */
    public void someStateChanged(boolean changed) {
        this.someStateChanged = changed;
    }

    /**
     * @return true if the server connection could be shared with other clients
     */
    public boolean isConnectionSharingPossible() {
        return context.config().connectionSharing()
                && greetingFromRouter
                && !someStateChanged;
    }

    public Optional<TrxCharacteristics> trxCharacteristics() {
        return Optional.ofNullable(trxCharacteristics);
    }

    public void setTrxCharacteristics(@Nullable TrxCharacteristics trxCharacteristics) {
        this.trxCharacteristics = trxCharacteristics;
    }

    // ==================== Routing ====================

    public ServerMode expectedServerMode() {
        return expectedServerMode;
    }

    public void setExpectedServerMode(ServerMode expectedServerMode) {
        this.expectedServerMode = Objects.requireNonNull(expectedServerMode);
    }

    public boolean waitForMyWrites() {
        return waitForMyWrites;
    }

    public void setWaitForMyWrites(boolean waitForMyWrites) {
        this.waitForMyWrites = waitForMyWrites;
    }

    public Duration waitForMyWritesTimeout() {
        return waitForMyWritesTimeout;
    }

    public void setWaitForMyWritesTimeout(Duration waitForMyWritesTimeout) {
        this.waitForMyWritesTimeout = Objects.requireNonNull(waitForMyWritesTimeout);
    }

    /**
     * GTID set the server must have executed before it may serve this client's reads.
     */
    public String gtidAtLeastExecuted() {
        return gtidAtLeastExecuted;
    }

    public void setGtidAtLeastExecuted(String gtidAtLeastExecuted) {
        this.gtidAtLeastExecuted = Objects.requireNonNull(gtidAtLeastExecuted);
    }

    @Override
    public String toString() {
        return "ClassicConnection{" +
                "connectionId='" + connectionId + '\'' +
                ", authenticated=" + authenticated +
                ", expectedServerMode=" + expectedServerMode +
                ", serverOpen=" + isServerOpen() +
                ", processors=" + processors.size() +
                '}';
    }
}
