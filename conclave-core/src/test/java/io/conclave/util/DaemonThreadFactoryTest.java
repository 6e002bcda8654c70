package io.conclave.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("conclave-consumer-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("conclave-consumer-1", thread.getName());
    }

    @Test
    void numbersThreadsSequentially() {
        DaemonThreadFactory factory = new DaemonThreadFactory("t-");

        factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("t-2", second.getName());
    }

    @Test
    void uncaughtExceptionsAreLogged() throws Exception {
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                synchronized (records) {
                    records.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        logger.addHandler(capture);
        try {
            Thread thread = new DaemonThreadFactory("failing-").newThread(() -> {
                throw new IllegalStateException("handler blew up");
            });
            thread.start();
            thread.join(5000);
        } finally {
            logger.removeHandler(capture);
        }

        synchronized (records) {
            assertEquals(1, records.size());
            assertEquals(Level.SEVERE, records.get(0).getLevel());
            assertEquals("handler blew up", records.get(0).getThrown().getMessage());
        }
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
