/**
 * Cross-cutting observability support for Warden: per-request correlation context bridged to
 * SLF4J MDC, a Micrometer {@link com.warden.observability.MetricFactory} that tags every meter
 * with the service name, an OpenTelemetry {@link com.warden.observability.SpanHelper}, and a
 * {@link com.warden.observability.SensitiveDataRedactor} for anything that might otherwise log a
 * secret.
 */
package com.warden.observability;
