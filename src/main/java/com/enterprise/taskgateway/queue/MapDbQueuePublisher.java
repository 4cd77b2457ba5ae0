package com.enterprise.taskgateway.queue;

import com.enterprise.taskgateway.collaborator.PublishAck;
import com.enterprise.taskgateway.collaborator.PublishException;
import com.enterprise.taskgateway.collaborator.QueuePublisher;
import org.mapdb.Atomic;
import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable local outbox backed by MapDB. Messages are committed in sequence
 * order and drained by a relay with {@link #poll(String, int)}.
 * Disk writes run on a dedicated thread, never on the caller's.
 */
public class MapDbQueuePublisher implements QueuePublisher {

    private static final Logger logger = LoggerFactory.getLogger(MapDbQueuePublisher.class);

    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 1024 * 1024;

    private final DB db;
    private final BTreeMap<Long, byte[]> messages;
    private final BTreeMap<Long, String> subjects;
    private final Atomic.Long sequence;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService writer;
    private final Duration publishTimeout;
    private final int maxPayloadBytes;
    private volatile boolean closed;

    /**
     * @param dbPath outbox file, or null to keep messages in memory
     */
    public MapDbQueuePublisher(String dbPath, Duration publishTimeout) {
        this(dbPath, publishTimeout, DEFAULT_MAX_PAYLOAD_BYTES);
    }

    public MapDbQueuePublisher(String dbPath, Duration publishTimeout, int maxPayloadBytes) {
        if (dbPath == null) {
            this.db = DBMaker.memoryDB()
                .transactionEnable()
                .make();
        } else {
            this.db = DBMaker.fileDB(new File(dbPath))
                .fileMmapEnableIfSupported()
                .transactionEnable()
                .closeOnJvmShutdown()
                .make();
        }

        this.messages = db.treeMap("messages", Serializer.LONG, Serializer.BYTE_ARRAY).createOrOpen();
        this.subjects = db.treeMap("subjects", Serializer.LONG, Serializer.STRING).createOrOpen();
        this.sequence = db.atomicLong("sequence").createOrOpen();
        this.publishTimeout = publishTimeout;
        this.maxPayloadBytes = maxPayloadBytes;
        this.writer = Executors.newSingleThreadExecutor(new OutboxThreadFactory());

        logger.info("MapDbQueuePublisher initialized at {} with {} pending message(s)",
                   dbPath != null ? dbPath : "memory", messages.size());
    }

    @Override
    public CompletableFuture<PublishAck> publish(String subject, byte[] payload) {
        if (subject == null || subject.trim().isEmpty()) {
            return CompletableFuture.failedFuture(
                new PublishException(subject, "Subject is required", true));
        }
        if (payload == null || payload.length > maxPayloadBytes) {
            return CompletableFuture.failedFuture(new PublishException(subject,
                "Payload must be present and at most " + maxPayloadBytes + " bytes", true));
        }
        if (closed) {
            return CompletableFuture.failedFuture(new PublishException(subject, "Publisher is closed", true));
        }

        try {
            return CompletableFuture.supplyAsync(() -> append(subject, payload), writer)
                .orTimeout(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new PublishException(subject, "Publisher is closed", true, e));
        }
    }

    private PublishAck append(String subject, byte[] payload) {
        lock.writeLock().lock();
        try {
            long seq = sequence.incrementAndGet();
            messages.put(seq, payload);
            subjects.put(seq, subject);
            db.commit();
            logger.debug("Published {} byte(s) to {} as #{}", payload.length, subject, seq);
            return new PublishAck(subject, seq);
        } catch (RuntimeException e) {
            db.rollback();
            logger.error("Failed to append message to {}", subject, e);
            throw new CompletionException(new PublishException(subject, "Outbox write failed", false, e));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove and return up to {@code max} of the oldest messages for the subject
     */
    public List<QueuedMessage> poll(String subject, int max) {
        lock.writeLock().lock();
        try {
            List<QueuedMessage> drained = new ArrayList<>();
            Iterator<Map.Entry<Long, String>> it = subjects.entrySet().iterator();
            while (it.hasNext() && drained.size() < max) {
                Map.Entry<Long, String> entry = it.next();
                if (entry.getValue().equals(subject)) {
                    Long seq = entry.getKey();
                    drained.add(new QueuedMessage(seq, subject, messages.get(seq)));
                }
            }
            for (QueuedMessage message : drained) {
                subjects.remove(message.getSequence());
                messages.remove(message.getSequence());
            }
            db.commit();
            return drained;
        } catch (RuntimeException e) {
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Messages waiting across all subjects
     */
    public int pending() {
        lock.readLock().lock();
        try {
            return messages.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        lock.writeLock().lock();
        try {
            db.close();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("MapDbQueuePublisher closed");
    }

    private static class OutboxThreadFactory implements ThreadFactory {
        private static final AtomicLong threadNumber = new AtomicLong(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "queue-outbox-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
