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

package dev.mars.shardwarden.master.observability;

import dev.mars.shardwarden.master.config.MasterConfig;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the OpenTelemetry SDK with a Prometheus reader.
 *
 * <p>Must run before the first meter is obtained; metrics created earlier stay
 * bound to the no-op provider.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public final class MasterTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(MasterTelemetryConfig.class);

    private MasterTelemetryConfig() {
    }

    /**
     * Registers the global SDK when telemetry is enabled.
     *
     * @return the installed SDK, or null when telemetry is disabled
     */
    public static OpenTelemetrySdk install(MasterConfig config) {
        if (!config.isTelemetryEnabled()) {
            logger.info("Telemetry disabled");
            return null;
        }

        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", config.getServiceName())
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
