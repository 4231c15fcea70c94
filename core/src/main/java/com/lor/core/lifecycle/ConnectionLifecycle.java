/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lor.core.lifecycle;

import com.lor.core.client.BrokerClient;
import com.lor.core.client.BrokerConnection;
import com.lor.meta.Binding;
import com.lor.meta.ExchangeTopology;
import com.lor.meta.connection.ConnectionDescriptor;
import com.lor.meta.connection.ConnectionSettings;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.ErrorHandler;
import org.apache.logging.log4j.status.StatusLogger;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns the broker connection of one appender.
 * <p>
 * {@link #activate} hands the connect and topology declaration to a startup
 * executor and returns at once. Publishes read the connection under the read
 * lock; every state transition takes the write lock, so shutdown cannot
 * interleave with the first assignment. A publish still holding the read lock
 * after {@link #DEFAULT_SHUTDOWN_WAIT_MILLIS} is unblocked by closing its
 * connection before shutdown takes the write lock.
 */
public class ConnectionLifecycle {

    public static final String CONNECT_FAILED = "could not create the bus instance";

    public static final String DECLARE_FAILED = "could not declare the exchange";

    public static final String DISPOSE_FAILED = "could not dispose bus";

    public static final long DEFAULT_SHUTDOWN_WAIT_MILLIS = 5000;

    private static final Logger LOGGER = StatusLogger.getLogger();

    private final BrokerClient brokerClient;

    private final Executor startupExecutor;

    private final Supplier<ErrorHandler> errorHandler;

    private final long shutdownWaitMillis;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicBoolean shutdownStarted = new AtomicBoolean();

    private ConnectionState state = ConnectionState.NONE;

    private volatile BrokerConnection connection;

    /**
     * @param brokerClient opens the connection
     * @param startupExecutor runs the startup task, must not run it on the caller's thread in production
     * @param errorHandler the appender's current error handler
     */
    public ConnectionLifecycle(BrokerClient brokerClient, Executor startupExecutor, Supplier<ErrorHandler> errorHandler) {
        this(brokerClient, startupExecutor, errorHandler, DEFAULT_SHUTDOWN_WAIT_MILLIS);
    }

    ConnectionLifecycle(BrokerClient brokerClient, Executor startupExecutor, Supplier<ErrorHandler> errorHandler,
                        long shutdownWaitMillis) {
        this.brokerClient = brokerClient;
        this.startupExecutor = startupExecutor;
        this.errorHandler = errorHandler;
        this.shutdownWaitMillis = shutdownWaitMillis;
    }

    /**
     * Executor starting one daemon thread per task.
     */
    public static Executor daemonThreadExecutor(String threadName) {
        return task -> {
            Thread thread = new Thread(task, threadName);
            thread.setDaemon(true);
            thread.start();
        };
    }

    /**
     * Starts connecting in the background. Only the first call has an effect.
     *
     * @param settings connection settings, resolved and validated by the startup task
     * @param topology supplies the exchange and bindings to declare once connected
     */
    public void activate(ConnectionSettings settings, Supplier<ExchangeTopology> topology) {
        lock.writeLock().lock();
        try {
            if (state != ConnectionState.NONE) {
                LOGGER.debug("amqp connection already activated, state {}", state);
                return;
            }
            state = ConnectionState.CONNECTING;
        } finally {
            lock.writeLock().unlock();
        }
        startupExecutor.execute(() -> startConnection(settings, topology));
    }

    private void startConnection(ConnectionSettings settings, Supplier<ExchangeTopology> topology) {
        BrokerConnection opened;
        try {
            ConnectionDescriptor descriptor = settings.resolve();
            opened = brokerClient.connect(descriptor);
        } catch (Exception e) {
            markFailed();
            errorHandler.get().error(CONNECT_FAILED, e);
            return;
        }
        if (!assign(opened)) {
            LOGGER.debug("amqp appender shut down while connecting, closing the new connection");
            dispose(opened);
            return;
        }
        try {
            declareTopology(opened, topology.get());
        } catch (Exception e) {
            errorHandler.get().error(DECLARE_FAILED, e);
        }
    }

    private void declareTopology(BrokerConnection opened, ExchangeTopology topology) throws IOException {
        topology.validate();
        opened.declareExchange(topology.getExchange());
        boolean bound = true;
        for (Binding binding : topology.getBindings()) {
            try {
                opened.bind(binding.getSource(), binding.getDestination(), binding.getRoutingKey());
            } catch (IOException e) {
                bound = false;
                errorHandler.get().error(DECLARE_FAILED, e);
            }
        }
        if (bound) {
            LOGGER.debug("amqp connection opened");
        }
    }

    private void markFailed() {
        lock.writeLock().lock();
        try {
            if (state == ConnectionState.CONNECTING) {
                state = ConnectionState.FAILED;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean assign(BrokerConnection opened) {
        lock.writeLock().lock();
        try {
            if (state != ConnectionState.CONNECTING) {
                return false;
            }
            connection = opened;
            state = ConnectionState.CONNECTED;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs the action against the connection unless it is missing or not connected.
     *
     * @return whether the action ran
     * @throws IOException whatever the action throws
     */
    public boolean withConnection(ConnectionAction action) throws IOException {
        lock.readLock().lock();
        try {
            BrokerConnection current = connection;
            if (current == null || !current.isConnected()) {
                return false;
            }
            action.run(current);
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes the connection if one is held. Safe to call more than once, never throws.
     * <p>
     * Waits up to the shutdown wait for publishes in progress; past that the
     * connection is closed first so a publish blocked on the socket fails and
     * releases the lock.
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            return;
        }
        BrokerConnection forced = null;
        if (!tryWriteLock()) {
            forced = connection;
            if (forced != null) {
                LOGGER.debug("publish still running after {} ms, closing the amqp connection", shutdownWaitMillis);
                dispose(forced);
            }
            lock.writeLock().lock();
        }
        BrokerConnection toDispose;
        try {
            state = ConnectionState.DISPOSED;
            toDispose = connection;
            connection = null;
        } finally {
            lock.writeLock().unlock();
        }
        if (toDispose != null && toDispose != forced) {
            dispose(toDispose);
        }
    }

    private boolean tryWriteLock() {
        try {
            return lock.writeLock().tryLock(shutdownWaitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void dispose(BrokerConnection toDispose) {
        try {
            toDispose.dispose();
        } catch (Exception e) {
            errorHandler.get().error(DISPOSE_FAILED, e);
        }
    }

    public ConnectionState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isConnected() {
        lock.readLock().lock();
        try {
            return connection != null && connection.isConnected();
        } finally {
            lock.readLock().unlock();
        }
    }

    @FunctionalInterface
    public interface ConnectionAction {

        void run(BrokerConnection connection) throws IOException;
    }
}
