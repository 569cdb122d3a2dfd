package io.litebridge.spring.boot;

import io.litebridge.JournalMode;
import io.litebridge.OpenFlag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiteBridgePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(LiteBridgeProperties.class);
            assertTrue(props.isEnabled());
            assertNull(props.getPath());
            assertNull(props.getJournalMode());
            assertTrue(props.getFlags().isEmpty());
            assertTrue(props.getPragmas().isEmpty());
            assertNull(props.getPoolSize());
            assertNull(props.getDrainTimeout());
            assertEquals("litebridge-", props.getThreadNamePrefix());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("litebridge", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "litebridge.enabled=false",
                "litebridge.path=/var/lib/app/app.db",
                "litebridge.journal-mode=wal",
                "litebridge.flags=READ_WRITE,CREATE,NO_MUTEX",
                "litebridge.pragmas[0]=PRAGMA foreign_keys = ON",
                "litebridge.pragmas[1]=PRAGMA busy_timeout = 5000",
                "litebridge.pool-size=6",
                "litebridge.drain-timeout=30s",
                "litebridge.thread-name-prefix=orders-",
                "litebridge.metrics.enabled=false",
                "litebridge.metrics.name-prefix=orders.db"
        ).run(ctx -> {
            var props = ctx.getBean(LiteBridgeProperties.class);
            assertFalse(props.isEnabled());
            assertEquals("/var/lib/app/app.db", props.getPath());
            assertEquals(JournalMode.WAL, props.getJournalMode());
            assertEquals(List.of(OpenFlag.READ_WRITE, OpenFlag.CREATE, OpenFlag.NO_MUTEX), props.getFlags());
            assertEquals(List.of("PRAGMA foreign_keys = ON", "PRAGMA busy_timeout = 5000"), props.getPragmas());
            assertEquals(6, props.getPoolSize());
            assertEquals(Duration.ofSeconds(30), props.getDrainTimeout());
            assertEquals("orders-", props.getThreadNamePrefix());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.db", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(LiteBridgeProperties.class)
    static class PropsConfig {
    }
}
