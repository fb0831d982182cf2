package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.PoolClosedException;
import com.streamfirst.dbsync.domain.PoolExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed-size pool of pre-opened connections. {@link #acquire()} blocks while every connection is
 * leased; {@link #close()} wakes all waiters, which then fail with {@link PoolClosedException}.
 *
 * @param <C> connection type
 */
@Slf4j
public final class ConnectionPool<C extends AutoCloseable> implements AutoCloseable {

    private final String name;
    private final int size;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition available = lock.newCondition();
    private final Deque<C> idle = new ArrayDeque<>();
    private final Set<C> leased = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean closed;

    /**
     * Opens {@code size} connections up front.
     *
     * @param name used in log and error messages
     * @param size number of connections, at least 1
     * @param opener creates one connection
     */
    public ConnectionPool(String name, int size, Supplier<C> opener) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + size);
        }
        this.name = name;
        this.size = size;
        try {
            for (int i = 0; i < size; i++) {
                idle.add(opener.get());
            }
        } catch (RuntimeException e) {
            idle.forEach(this::closeQuietly);
            idle.clear();
            throw e;
        }
        log.info("Initialized connection pool {} with {} connections", name, size);
    }

    /**
     * Takes a connection, waiting as long as it takes for one to be released.
     *
     * @throws PoolClosedException if the pool is or becomes closed while waiting
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public C acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && idle.isEmpty()) {
                available.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a connection, waiting at most {@code timeout}.
     *
     * @throws PoolExhaustedException if no connection was released in time
     * @throws PoolClosedException if the pool is or becomes closed while waiting
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public C acquire(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && idle.isEmpty()) {
                if (remaining <= 0) {
                    throw new PoolExhaustedException(
                            "No connection in pool " + name + " became available within " + timeout);
                }
                remaining = available.awaitNanos(remaining);
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a leased connection and wakes one waiter. Connections returned after the pool closed
     * are closed instead.
     *
     * @throws IllegalArgumentException if the connection is not leased from this pool
     */
    public void release(C connection) {
        lock.lock();
        try {
            if (!leased.remove(connection)) {
                throw new IllegalArgumentException("Connection was not leased from pool " + name);
            }
            if (closed) {
                closeQuietly(connection);
                return;
            }
            idle.push(connection);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return size;
    }

    public int available() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int leased() {
        lock.lock();
        try {
            return leased.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes idle connections and fails every current and future {@code acquire}. Leased
     * connections are closed when they are released.
     */
    @Override
    public void close() {
        List<C> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = List.copyOf(idle);
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        toClose.forEach(this::closeQuietly);
        log.info("Closed connection pool {} ({} connections still leased)", name, leased());
    }

    private C take() {
        if (closed) {
            throw new PoolClosedException("Connection pool " + name + " is closed");
        }
        C connection = idle.pop();
        leased.add(connection);
        return connection;
    }

    private void closeQuietly(C connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Failed to close a connection of pool {}", name, e);
        }
    }
}
