package com.ethixai.drift.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI driftOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Drift Detection & Alerting API")
                        .description("Drift snapshots, alerts, baselines and retraining requests")
                        .version("1.0"));
    }
}
