/**
 * Spring Boot auto-configuration for litebridge.
 *
 * <p>{@link io.litebridge.spring.boot.LiteBridgeAutoConfiguration} opens a
 * {@link io.litebridge.Pool} from {@code litebridge.*} properties and closes it with the
 * context. {@link io.litebridge.spring.boot.LiteBridgeMicrometerAutoConfiguration}
 * supplies a Micrometer-backed metrics exporter when Micrometer is on the classpath.
 *
 * @see io.litebridge.spring.boot.LiteBridgeProperties
 */
package io.litebridge.spring.boot;
