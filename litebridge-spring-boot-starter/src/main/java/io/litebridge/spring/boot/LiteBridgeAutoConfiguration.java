package io.litebridge.spring.boot;

import io.litebridge.OpenFlag;
import io.litebridge.Pool;
import io.litebridge.PoolBuilder;
import io.litebridge.spi.ConnectionFactory;
import io.litebridge.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for a litebridge {@link Pool}.
 *
 * <p>Opens the pool from {@link LiteBridgeProperties} during context startup and
 * closes it, draining queued work, when the context shuts down. A
 * {@link ConnectionFactory} bean replaces the SQLite settings; a {@link MetricsExporter}
 * bean receives the pool's metrics.
 *
 * @see LiteBridgeProperties
 * @see LiteBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Pool.class)
@ConditionalOnProperty(prefix = "litebridge", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LiteBridgeProperties.class)
public class LiteBridgeAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Pool litebridgePool(LiteBridgeProperties props,
                               ObjectProvider<ConnectionFactory> connectionFactoryProvider,
                               ObjectProvider<MetricsExporter> metricsProvider) {
        PoolBuilder builder = Pool.builder().threadNamePrefix(props.getThreadNamePrefix());

        ConnectionFactory connectionFactory = connectionFactoryProvider.getIfAvailable();
        if (connectionFactory != null) {
            builder.connectionFactory(connectionFactory);
        }
        if (props.getPath() != null) {
            builder.path(Path.of(props.getPath()));
        }
        if (props.getJournalMode() != null) {
            builder.journalMode(props.getJournalMode());
        }
        if (!props.getFlags().isEmpty()) {
            builder.flags(props.getFlags().toArray(new OpenFlag[0]));
        }
        props.getPragmas().forEach(builder::pragma);
        if (props.getPoolSize() != null) {
            builder.numConns(props.getPoolSize());
        }
        if (props.getDrainTimeout() != null) {
            builder.drainTimeout(props.getDrainTimeout());
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.openBlocking();
    }
}
