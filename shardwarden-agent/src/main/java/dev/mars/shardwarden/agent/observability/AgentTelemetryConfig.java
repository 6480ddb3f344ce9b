/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.shardwarden.agent.observability;

import dev.mars.shardwarden.agent.config.AgentConfig;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry configuration for a Shardwarden agent: Prometheus metrics
 * export on a configurable port (default 9465).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0 (OpenTelemetry)
 */
public final class AgentTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentTelemetryConfig.class);

    private AgentTelemetryConfig() {
    }

    /**
     * Registers the global SDK when telemetry is enabled. Must run before
     * {@link AgentMetrics} is created.
     *
     * @param shardId identity reported as the service instance
     * @return the installed SDK, or null when telemetry is disabled
     */
    public static OpenTelemetrySdk install(AgentConfig config, String shardId) {
        if (!config.isTelemetryEnabled()) {
            logger.info("Telemetry disabled");
            return null;
        }

        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", config.getServiceName())
                .put("service.instance.id", shardId)
                .build();

        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(config.getPrometheusPort())
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("Prometheus metrics exposed on port {}", config.getPrometheusPort());
        return sdk;
    }
}
