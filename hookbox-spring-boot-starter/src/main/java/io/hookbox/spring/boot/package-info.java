/**
 * Spring Boot auto-configuration: {@link io.hookbox.spring.boot.HookboxAutoConfiguration}
 * wires the relay from a {@code DataSource}, and
 * {@link io.hookbox.spring.boot.HookboxMicrometerAutoConfiguration} adds Micrometer
 * metrics when a {@code MeterRegistry} is present.
 */
package io.hookbox.spring.boot;
