package com.pulse.forecast.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI pulseForecastOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pulse Forecast API")
                        .description("Morning prediction and evening outcome phases, predictions and model tracking")
                        .version("1.0"));
    }
}
