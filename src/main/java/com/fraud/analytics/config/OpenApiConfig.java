package com.fraud.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fraud Analytics Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Statistical anomaly detection over cohort time series.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Trigger a run via `POST /analytics/anomalies/detect` (returns `202` with a run id)\n" +
                                "2. Windowed series are fetched per cohort for the detector's metrics\n" +
                                "3. The configured detector scores every window\n" +
                                "4. Each flagged window becomes an anomaly event with a severity and persistence count\n" +
                                "5. The policy engine assigns **investigate**, **monitor** or **ignore**\n\n" +
                                "**Detector Types:**\n" +
                                "- `stl_mad`: seasonal-trend decomposition, residuals scored in MAD units\n" +
                                "- `cusum`: two-sided cumulative sum for level shifts\n" +
                                "- `isoforest`: isolation forest over multi-metric windows\n\n" +
                                "Events are listed via `GET /analytics/anomalies?detector_id=...` once their run has completed.")
                        .contact(new Contact().name("Fraud Analytics Team")));
    }
}
