package org.iceforge.sluice.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker slots; the only path through which the engine is touched.
 * <p>
 * Every slot is a dedicated thread that owns one connection per database for its whole
 * lifetime, so connection-local engine state never leaks between slots. When all slots
 * are busy, work queues in FIFO order without a depth limit.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    /** Work that runs on a slot with that slot's connection to the requested database. */
    @FunctionalInterface
    public interface SlotTask<T> {
        T run(Connection conn) throws Exception;
    }

    /** Opens the connection a slot keeps for a database. */
    @FunctionalInterface
    public interface ConnectionOpener {
        Connection open(String database) throws Exception;
    }

    private final int size;
    private final ConnectionOpener opener;
    private final ThreadPoolExecutor executor;
    private final List<WorkerSlot> slots = new CopyOnWriteArrayList<>();

    public WorkerPool(int size, ConnectionOpener opener) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0: " + size);
        this.size = size;
        this.opener = Objects.requireNonNull(opener, "opener");

        AtomicInteger ids = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    WorkerSlot slot = new WorkerSlot(ids.incrementAndGet());
                    slots.add(slot);
                    SlotThread t = new SlotThread(r, slot);
                    t.setDaemon(true);
                    return t;
                });
        log.info("Started worker pool with {} slot(s)", size);
    }

    public <T> Future<T> submit(String database, SlotTask<T> task) {
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(task, "task");
        return executor.submit(() -> {
            WorkerSlot slot = currentSlot();
            return task.run(slot.connection(database, opener));
        });
    }

    /** Withdraw a task that has not started yet; a running task is left alone. */
    public void withdraw(Future<?> future) {
        future.cancel(false);
        if (future instanceof Runnable r) {
            executor.remove(r);
        }
    }

    public int size() {
        return size;
    }

    /** Tasks waiting for a free slot. */
    public int queued() {
        return executor.getQueue().size();
    }

    public int active() {
        return executor.getActiveCount();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (WorkerSlot slot : slots) {
            slot.close();
        }
        log.info("Worker pool closed");
    }

    private static WorkerSlot currentSlot() {
        if (Thread.currentThread() instanceof SlotThread t) {
            return t.slot;
        }
        throw new IllegalStateException("not running on a worker slot");
    }

    private static final class SlotThread extends Thread {
        private final WorkerSlot slot;

        SlotThread(Runnable r, WorkerSlot slot) {
            super(r, "sluice-sql-" + slot.id);
            this.slot = slot;
        }
    }

    /** Connections owned by one slot; only its own thread opens them. */
    static final class WorkerSlot {
        private final int id;
        private final Map<String, Connection> connections = new ConcurrentHashMap<>();

        WorkerSlot(int id) {
            this.id = id;
        }

        Connection connection(String database, ConnectionOpener opener) throws Exception {
            Connection conn = connections.get(database);
            if (conn != null && !conn.isClosed()) {
                return conn;
            }
            conn = opener.open(database);
            connections.put(database, conn);
            log.debug("Slot {} opened connection to database={}", id, database);
            return conn;
        }

        void close() {
            connections.forEach((database, conn) -> {
                try {
                    conn.close();
                } catch (SQLException e) {
                    log.warn("Slot {} failed to close connection to {}: {}", id, database, e.toString());
                }
            });
            connections.clear();
        }
    }
}
