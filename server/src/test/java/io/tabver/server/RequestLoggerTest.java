// file: src/test/java/io/tabver/server/RequestLoggerTest.java
package io.tabver.server;

import io.tabver.core.VersionNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggerTest {

    private final Logger logger = Logger.getLogger(RequestLogger.class.getName());
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler capture = new Handler() {
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

    @BeforeEach
    void attach() {
        logger.addHandler(capture);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(capture);
    }

    @Test
    void merge_line_names_the_versions_and_the_outcome() {
        var entry = new RequestLogger.Entry("POST", "/diff/merge", 200, 12, 9,
                "base=v1 left=v2 right=v3 actor=ana", "outcome=partial merged=v4 unresolved=2", null);

        assertEquals("HTTP POST /diff/merge -> 200 [base=v1 left=v2 right=v3 actor=ana]"
                + " outcome=partial merged=v4 unresolved=2 (total=12ms, engine=9ms)", entry.format());
    }

    @Test
    void router_responses_have_no_subject_or_engine_time() {
        RequestLogger.logRequest("GET", "/nope", 404);

        assertEquals(1, records.size());
        assertEquals(Level.INFO, records.get(0).getLevel());
        assertEquals("HTTP GET /nope -> 404 (total=0ms)", records.get(0).getMessage());
    }

    @Test
    void rejected_request_carries_the_reason() {
        var entry = new RequestLogger.Entry("GET", "/versions/v9", 404, 1, 0,
                "version=v9", null, new VersionNotFoundException("v9"));

        RequestLogger.log(entry);

        assertEquals(Level.INFO, records.get(0).getLevel());
        assertTrue(records.get(0).getMessage().contains("[version=v9]"));
        assertTrue(records.get(0).getMessage().contains(" error="));
        assertNull(records.get(0).getThrown());
    }

    @Test
    void server_error_goes_to_warning_with_the_stack_trace() {
        var boom = new IllegalStateException("disk gone");
        var entry = new RequestLogger.Entry("POST", "/versions", 500, 3, -1, "doc=budget actor=ana", null, boom);

        RequestLogger.log(entry);

        LogRecord r = records.get(0);
        assertEquals(Level.WARNING, r.getLevel());
        assertSame(boom, r.getThrown());
        assertFalse(r.getMessage().contains("disk gone"));
        assertFalse(r.getMessage().contains("engine="));
    }
}
