package io.committer.host;

import io.committer.CommitResult;
import io.committer.Committer;
import io.committer.CommitterFactory;
import io.committer.CommitterKey;
import io.committer.Message;
import io.committer.MutableClock;
import io.committer.TopicFilter;
import io.committer.UnrecoverableCommitterException;
import io.committer.UnrecoverableCommitterFactoryException;
import io.committer.retry.RetryStrategy;
import io.committer.retry.TruncatedBinaryExponentialBackoffStrategy;
import io.committer.spi.InMemoryMetadataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommitterHostTest {

    private static final List<Message> BATCH = List.of(Message.ofString(0, "a"), Message.ofString(1, "b"));

    private ManualTaskScheduler scheduler;
    private MutableClock clock;
    private StubMetrics metrics;
    private InMemoryMetadataStore store;
    private ScriptedFactory factory;
    private CommitterHost host;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        clock = new MutableClock();
        metrics = new StubMetrics();
        store = new InMemoryMetadataStore();
        factory = new ScriptedFactory();
    }

    @AfterEach
    void tearDown() {
        if (host != null) {
            host.close();
        }
    }

    private CommitterHost host(CommitterHostConfig config) {
        host = CommitterHost.builder()
                .factory(factory)
                .config(config)
                .metadataStore(store)
                .metrics(metrics)
                .scheduler(scheduler)
                .executor(Runnable::run)
                .clock(clock)
                .build();
        return host;
    }

    private CommitterHost host() {
        return host(new CommitterHostConfig());
    }

    @Test
    void attachedUnitCommitsBatches() {
        CommitterHost host = host();

        CommitterUnit unit = host.attach("orders", 0, 0).join().orElseThrow();
        unit.commit(BATCH).join();

        assertEquals(new CommitterKey("orders", 0, 0), unit.key());
        assertEquals(1, factory.created.size());
        assertEquals(BATCH, factory.created.get(0).batch(0));
        assertEquals(Optional.of(unit), host.unit(unit.key()));
        assertEquals(1, metrics.activeUnits.get());
    }

    @Test
    void rejectedTopicIsNotAttached() {
        factory.filter = TopicFilter.allowing(List.of("orders"));
        CommitterHost host = host();

        Optional<CommitterUnit> unit = host.attach("payments", 0, 0).join();

        assertFalse(unit.isPresent());
        assertEquals(0, factory.createCalls.get());
        assertTrue(host.units().isEmpty());
    }

    @Test
    void attachingTwiceReturnsTheSameUnit() {
        CommitterHost host = host();

        CommitterUnit first = host.attach("orders", 0, 0).join().orElseThrow();
        CommitterUnit second = host.attach("orders", 0, 0).join().orElseThrow();

        assertSame(first, second);
        assertEquals(1, factory.createCalls.get());
    }

    @Test
    void failedCreatesAreRetriedWithCreateStrategy() {
        factory.createStrategy = attempts -> attempts * 100L;
        factory.failures.add(new IOException("unreachable"));
        factory.failures.add(new IOException("unreachable"));
        CommitterHost host = host();

        CompletableFuture<Optional<CommitterUnit>> attached = host.attach("orders", 0, 0);

        assertFalse(attached.isDone());
        assertEquals(100L, scheduler.runNext());
        assertFalse(attached.isDone());
        assertEquals(200L, scheduler.runNext());
        assertTrue(attached.join().isPresent());
        assertEquals(3, factory.createCalls.get());
        assertEquals(2, metrics.createFailure.get());
    }

    @Test
    void unrecoverableCreateFailureFailsTheAttachment() {
        UnrecoverableCommitterFactoryException failure = new UnrecoverableCommitterFactoryException("bad config");
        factory.failures.add(failure);
        CommitterHost host = host();

        CompletableFuture<Optional<CommitterUnit>> attached = host.attach("orders", 0, 0);

        assertSame(failure, assertThrows(CompletionException.class, attached::join).getCause());
        assertTrue(scheduler.pending().isEmpty());
        assertEquals(1, metrics.unrecoverable.get());

        assertTrue(host.attach("orders", 0, 0).join().isPresent());
        assertEquals(2, factory.createCalls.get());
    }

    @Test
    void exhaustedCreateStrategyWrapsLastCause() {
        IOException cause = new IOException("unreachable");
        factory.createStrategy = new TruncatedBinaryExponentialBackoffStrategy(10, 10, 0);
        factory.failures.add(cause);
        CommitterHost host = host();

        Throwable failure = assertThrows(CompletionException.class, host.attach("orders", 0, 0)::join).getCause();

        assertInstanceOf(UnrecoverableCommitterFactoryException.class, failure);
        assertSame(cause, failure.getCause());
    }

    @Test
    void attachAllAttachesEveryIdOfThePartition() {
        CommitterHost host = host(new CommitterHostConfig().setParallelism(3));

        List<CommitterUnit> units = host.attachAll("orders", 2).join();

        assertEquals(3, units.size());
        for (int id = 0; id < 3; id++) {
            assertEquals(new CommitterKey("orders", 2, id), units.get(id).key());
        }
        assertEquals(3, host.units().size());
    }

    @Test
    void unitStoppedByUnrecoverableFailureIsDetached() throws Exception {
        CommitterHost host = host();
        CommitterUnit unit = host.attach("orders", 0, 0).join().orElseThrow();
        RecordingCommitter committer = factory.created.get(0);
        committer.thenThrow(new UnrecoverableCommitterException("revoked"));

        assertThrows(CompletionException.class, unit.commit(BATCH)::join);

        assertTrue(committer.closed.await(5, TimeUnit.SECONDS));
        assertFalse(host.unit(unit.key()).isPresent());
        assertEquals(CommitterUnit.State.CLOSED, unit.state());
    }

    @Test
    void detachClosesTheCommitter() {
        CommitterHost host = host();
        CommitterUnit unit = host.attach("orders", 0, 0).join().orElseThrow();

        assertTrue(host.detach(unit.key()));

        assertEquals(1, factory.created.get(0).closeCalls.get());
        assertFalse(host.detach(unit.key()));
        assertEquals(0, metrics.activeUnits.get());
    }

    @Test
    void heartbeatTickDeliversDueHeartbeats() {
        CommitterHost host = host(new CommitterHostConfig().setHeartbeatCadenceMs(1_000));
        host.attach("orders", 0, 0).join().orElseThrow();
        RecordingCommitter committer = factory.created.get(0);

        clock.advanceMillis(1_000);
        assertEquals(500L, scheduler.runNext());

        assertEquals(1, committer.heartbeatCalls());
        assertEquals(1, scheduler.pending().size());
        assertEquals(0, host.heartbeatAll());
    }

    @Test
    void closeClosesUnitsAndFactory() {
        CommitterHost host = host(new CommitterHostConfig().setParallelism(2));
        host.attachAll("orders", 0).join();

        host.close();

        assertTrue(host.isClosed());
        for (RecordingCommitter committer : factory.created) {
            assertEquals(1, committer.closeCalls.get());
        }
        assertEquals(1, factory.closeCalls.get());
        assertTrue(host.units().isEmpty());
        assertEquals(0, metrics.activeUnits.get());
        assertInstanceOf(IllegalStateException.class,
                assertThrows(CompletionException.class, host.attach("orders", 0, 0)::join).getCause());

        host.close();
        assertEquals(1, factory.closeCalls.get());
    }

    @Test
    void closeCancelsPendingAttachments() {
        factory.createStrategy = attempts -> 100L;
        factory.failures.add(new IOException("unreachable"));
        CommitterHost host = host();
        CompletableFuture<Optional<CommitterUnit>> attached = host.attach("orders", 0, 0);

        host.close();
        scheduler.runNext();

        assertTrue(attached.isCompletedExceptionally());
        assertEquals(1, factory.createCalls.get());
    }

    @Test
    void closeGivesUpOnACommitThatOutlivesTheTimeout() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        factory.next = new RecordingCommitter() {
            @Override
            public CommitResult commit(List<Message> batch, String metadata) throws Exception {
                started.countDown();
                release.await(10, TimeUnit.SECONDS);
                return CommitResult.committed();
            }
        };
        host = CommitterHost.builder()
                .factory(factory)
                .config(new CommitterHostConfig().setGracefulShutdownTimeoutMs(100))
                .build();
        CommitterUnit unit = host.attach("orders", 0, 0).get(5, TimeUnit.SECONDS).orElseThrow();
        unit.commit(BATCH);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        long startedAt = System.nanoTime();
        host.close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        release.countDown();
        assertTrue(elapsedMs < 5_000, "close took " + elapsedMs + "ms");
    }

    @Test
    void fromPropertiesLoadsFactoryAndConfig() {
        CommitterHost.Builder builder = CommitterHost.fromProperties(Map.of(
                "factoryClassName", MapConfiguredCommitterFactory.class.getName(),
                "factory.sink", "memory",
                "parallelismFactor", "2"));
        host = builder.scheduler(scheduler).executor(Runnable::run).build();

        assertEquals(2, host.config().getParallelism());
        MapConfiguredCommitterFactory loaded =
                assertInstanceOf(MapConfiguredCommitterFactory.class, host.factory().factory());
        assertEquals("memory", loaded.config.get("sink"));
        assertEquals(2, host.attachAll("orders", 0).join().size());
    }

    @Test
    void factoryIsRequired() {
        assertThrows(NullPointerException.class, () -> CommitterHost.builder().build());
    }

    private static final class ScriptedFactory implements CommitterFactory {
        final List<RecordingCommitter> created = new ArrayList<>();
        final Deque<Exception> failures = new ArrayDeque<>();
        final AtomicInteger createCalls = new AtomicInteger();
        final AtomicInteger closeCalls = new AtomicInteger();
        volatile TopicFilter filter = TopicFilter.ACCEPT_ALL;
        volatile RetryStrategy createStrategy = attempts -> 10L;
        volatile RecordingCommitter next;

        @Override
        public synchronized Committer create(String topic, int partition, int id) throws Exception {
            createCalls.incrementAndGet();
            Exception failure = failures.poll();
            if (failure != null) {
                throw failure;
            }
            RecordingCommitter committer = next != null ? next : new RecordingCommitter();
            next = null;
            created.add(committer);
            return committer;
        }

        @Override
        public RetryStrategy createCommitterExceptionRetryStrategy() {
            return createStrategy;
        }

        @Override
        public TopicFilter createTopicFilter() {
            return filter;
        }

        @Override
        public void close() {
            closeCalls.incrementAndGet();
        }
    }
}
