package io.litebridge.micrometer;

import io.litebridge.Client;
import io.litebridge.ExecutionFailedException;
import io.litebridge.jdbc.JdbcTemplate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void jobCounters() {
        exporter.incrementSubmitted();
        exporter.incrementSubmitted();
        exporter.incrementCompleted();
        exporter.incrementFailed();
        exporter.incrementPanicked();
        exporter.incrementRejected();
        exporter.incrementRejected();
        exporter.incrementRejected();

        assertEquals(2.0, counter("litebridge.jobs.submitted").count());
        assertEquals(1.0, counter("litebridge.jobs.completed").count());
        assertEquals(1.0, counter("litebridge.jobs.failed").count());
        assertEquals(1.0, counter("litebridge.jobs.panicked").count());
        assertEquals(3.0, counter("litebridge.jobs.rejected").count());
    }

    @Test
    void queueDepthIsTrackedPerActor() {
        exporter.recordQueueDepth("litebridge-pool-1", 4);
        exporter.recordQueueDepth("litebridge-pool-2", 9);
        exporter.recordQueueDepth("litebridge-pool-1", 2);

        assertEquals(2.0, depth("litebridge-pool-1").value());
        assertEquals(9.0, depth("litebridge-pool-2").value());
        assertEquals(2, registry.find("litebridge.queue.depth").gauges().size());
    }

    @Test
    void executionTimeRecordedInMillis() {
        exporter.recordExecutionNanos(3_000_000L);
        exporter.recordExecutionNanos(1_000_000L);

        DistributionSummary summary = registry.find("litebridge.job.execution.ms").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount(), 0.001);
    }

    @Test
    void customPrefix() {
        SimpleMeterRegistry reg = new SimpleMeterRegistry();
        MicrometerMetricsExporter custom = new MicrometerMetricsExporter(reg, "orders.db");

        custom.incrementSubmitted();
        custom.recordQueueDepth("w", 1);

        assertEquals(1.0, reg.find("orders.db.jobs.submitted").counter().count());
        assertNotNull(reg.find("orders.db.queue.depth").tag("actor", "w").gauge());
        assertNull(reg.find("litebridge.jobs.submitted").counter());
    }

    @Test
    void rejectsInvalidPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "litebridge."));
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void closeRemovesAllMeters() {
        exporter.recordQueueDepth("a", 1);
        assertFalse(registry.getMeters().isEmpty());

        exporter.close();

        assertTrue(registry.getMeters().isEmpty());
        exporter.incrementSubmitted();
        exporter.recordQueueDepth("b", 1);
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void wiredIntoAClient() {
        try (Client client = Client.builder().metrics(exporter).openBlocking()) {
            client.connBlocking(conn -> JdbcTemplate.queryString(conn, "SELECT 1"));
            assertThrows(ExecutionFailedException.class,
                    () -> client.connBlocking(conn -> JdbcTemplate.queryString(conn, "SELECT * FROM nope")));
        }

        assertEquals(2.0, counter("litebridge.jobs.submitted").count());
        assertEquals(1.0, counter("litebridge.jobs.completed").count());
        assertEquals(1.0, counter("litebridge.jobs.failed").count());
        assertEquals(0.0, depth("litebridge-conn-1").value());
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge depth(String actor) {
        Gauge g = registry.find("litebridge.queue.depth").tag("actor", actor).gauge();
        assertNotNull(g, "Gauge not found for actor: " + actor);
        return g;
    }
}
