package io.committer.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("committer-worker-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertTrue(thread.getName().startsWith("committer-worker-"));
        assertNotNull(thread.getUncaughtExceptionHandler());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertEquals("test-1", t1.getName());
        assertEquals("test-2", t2.getName());
    }

    @Test
    void uncaughtExceptionIsLoggedWithTheThreadName() throws Exception {
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        boolean useParentHandlers = logger.getUseParentHandlers();
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
        try {
            IllegalStateException failure = new IllegalStateException("commit loop crashed");
            Thread thread = new DaemonThreadFactory("committer-retry-").newThread(() -> {
                throw failure;
            });

            thread.start();
            thread.join(5_000);

            assertFalse(thread.isAlive());
            assertEquals(1, records.size());
            LogRecord record = records.get(0);
            assertEquals(Level.SEVERE, record.getLevel());
            assertSame(failure, record.getThrown());
            assertTrue(record.getMessage().contains("committer-retry-1"));
        } finally {
            logger.removeHandler(handler);
            logger.setUseParentHandlers(useParentHandlers);
        }
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () ->
                new DaemonThreadFactory(null));
    }
}
