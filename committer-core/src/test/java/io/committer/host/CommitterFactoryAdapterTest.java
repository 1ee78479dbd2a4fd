package io.committer.host;

import io.committer.AsyncCommitterFactory;
import io.committer.Committer;
import io.committer.CommitterFactory;
import io.committer.CommitterKey;
import io.committer.TopicFilter;
import io.committer.UnrecoverableCommitterFactoryException;
import io.committer.retry.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommitterFactoryAdapterTest {

    private final Executor direct = Runnable::run;
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentCreatesNeverOverlap() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CommitterFactory factory = (topic, partition, id) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return new RecordingCommitter();
        };
        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter(factory);
        pool = Executors.newFixedThreadPool(8);

        List<CompletableFuture<Attempt<Committer>>> creations = new ArrayList<>();
        for (int id = 0; id < 8; id++) {
            creations.add(adapter.createAsync(new CommitterKey("orders", 0, id), pool));
        }
        for (CompletableFuture<Attempt<Committer>> creation : creations) {
            assertInstanceOf(Attempt.Succeeded.class, creation.get(5, TimeUnit.SECONDS));
        }

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void suppliedLockGuardsSynchronousCreates() {
        CountingLock lock = new CountingLock();
        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter(
                (topic, partition, id) -> new RecordingCommitter(), lock);

        adapter.createAsync(new CommitterKey("orders", 0, 0), direct).join();
        adapter.createAsync(new CommitterKey("orders", 0, 1), direct).join();

        assertEquals(2, lock.acquired.get());
        assertFalse(lock.delegate.isLocked());
    }

    @Test
    void lockIsReleasedWhenCreateThrows() {
        CountingLock lock = new CountingLock();
        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter((topic, partition, id) -> {
            throw new IOException("unreachable");
        }, lock);

        adapter.createAsync(new CommitterKey("orders", 0, 0), direct).join();

        assertEquals(1, lock.acquired.get());
        assertFalse(lock.delegate.isLocked());
    }

    @Test
    void asyncFactoryBypassesTheLock() {
        CountingLock lock = new CountingLock();
        AsyncCommitterFactory factory = new AsyncCommitterFactory() {
            @Override
            public CompletionStage<Committer> createAsync(String topic, int partition, int id, Executor executor) {
                return CompletableFuture.completedFuture(new RecordingCommitter());
            }

            @Override
            public Committer create(String topic, int partition, int id) {
                throw new AssertionError("synchronous path must not be used");
            }
        };
        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter(factory, lock);

        Attempt<Committer> attempt = adapter.createAsync(new CommitterKey("orders", 0, 0), direct).join();

        assertInstanceOf(Attempt.Succeeded.class, attempt);
        assertTrue(adapter.isAsync());
        assertEquals(0, lock.acquired.get());
    }

    @Test
    void failuresAreClassified() {
        IOException recoverable = new IOException("unreachable");
        UnrecoverableCommitterFactoryException unrecoverable = new UnrecoverableCommitterFactoryException("bad config");

        Attempt.Failed<Committer> first = assertInstanceOf(Attempt.Failed.class,
                new CommitterFactoryAdapter((topic, partition, id) -> {
                    throw recoverable;
                }).createAsync(new CommitterKey("t", 0, 0), direct).join());
        Attempt.Failed<Committer> second = assertInstanceOf(Attempt.Failed.class,
                new CommitterFactoryAdapter((topic, partition, id) -> {
                    throw unrecoverable;
                }).createAsync(new CommitterKey("t", 0, 0), direct).join());

        assertSame(recoverable, first.cause());
        assertFalse(first.isUnrecoverable());
        assertSame(unrecoverable, second.cause());
        assertTrue(second.isUnrecoverable());
    }

    @Test
    void nullCommitterIsAFailure() {
        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter((topic, partition, id) -> null);

        Attempt<Committer> attempt = adapter.createAsync(new CommitterKey("t", 0, 0), direct).join();

        Attempt.Failed<Committer> failed = assertInstanceOf(Attempt.Failed.class, attempt);
        assertInstanceOf(IllegalStateException.class, failed.cause());
    }

    @Test
    void strategiesAndFilterAreReadOnce() {
        AtomicInteger reads = new AtomicInteger();
        RetryStrategy fixed = attempts -> 42L;
        CommitterFactory factory = new CommitterFactory() {
            @Override
            public Committer create(String topic, int partition, int id) {
                return new RecordingCommitter();
            }

            @Override
            public RetryStrategy recoverableExceptionRetryStrategy() {
                reads.incrementAndGet();
                return fixed;
            }

            @Override
            public TopicFilter createTopicFilter() {
                return topic -> topic.startsWith("orders");
            }
        };

        CommitterFactoryAdapter adapter = new CommitterFactoryAdapter(factory);
        adapter.recoverableExceptionRetryStrategy();
        adapter.recoverableExceptionRetryStrategy();

        assertEquals(1, reads.get());
        assertSame(fixed, adapter.recoverableExceptionRetryStrategy());
        assertSame(CommitterFactory.DEFAULT_NO_DATA_BACKOFF_STRATEGY, adapter.noDataBackoffStrategy());
        assertTrue(adapter.topicFilter().accepts("orders.eu"));
        assertFalse(adapter.topicFilter().accepts("payments"));
    }

    @Test
    void nullStrategyIsRejected() {
        CommitterFactory factory = new CommitterFactory() {
            @Override
            public Committer create(String topic, int partition, int id) {
                return new RecordingCommitter();
            }

            @Override
            public RetryStrategy noDataBackoffStrategy() {
                return null;
            }
        };

        assertThrows(NullPointerException.class, () -> new CommitterFactoryAdapter(factory));
    }

    @Test
    void closeClosesTheFactory() {
        AtomicInteger closed = new AtomicInteger();
        CommitterFactory factory = new CommitterFactory() {
            @Override
            public Committer create(String topic, int partition, int id) {
                return new RecordingCommitter();
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };

        new CommitterFactoryAdapter(factory).close();

        assertEquals(1, closed.get());
    }

    private static final class CountingLock implements Lock {
        final ReentrantLock delegate = new ReentrantLock();
        final AtomicInteger acquired = new AtomicInteger();

        @Override
        public void lock() {
            delegate.lock();
            acquired.incrementAndGet();
        }

        @Override
        public void lockInterruptibly() throws InterruptedException {
            delegate.lockInterruptibly();
            acquired.incrementAndGet();
        }

        @Override
        public boolean tryLock() {
            boolean locked = delegate.tryLock();
            if (locked) {
                acquired.incrementAndGet();
            }
            return locked;
        }

        @Override
        public boolean tryLock(long time, TimeUnit unit) throws InterruptedException {
            boolean locked = delegate.tryLock(time, unit);
            if (locked) {
                acquired.incrementAndGet();
            }
            return locked;
        }

        @Override
        public void unlock() {
            delegate.unlock();
        }

        @Override
        public Condition newCondition() {
            return delegate.newCondition();
        }
    }
}
