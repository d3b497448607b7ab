package com.metadata.infrastructure.config;

import com.metadata.infrastructure.filter.RequestIdFilter;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metadataOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metadata Manager API")
                        .version("1.0")
                        .description("User records keyed by Israeli national ID"));
    }

    // RequestIdFilter reads the header outside Spring MVC, so no handler declares it.
    @Bean
    public OperationCustomizer requestIdHeader() {
        return (operation, handlerMethod) -> operation.addParametersItem(new Parameter()
                .in("header")
                .name(RequestIdFilter.REQUEST_ID_HEADER)
                .required(false)
                .description("Correlation id, echoed on the response and generated when absent")
                .schema(new StringSchema()));
    }
}
