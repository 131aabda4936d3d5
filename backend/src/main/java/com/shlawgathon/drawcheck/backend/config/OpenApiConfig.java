package com.shlawgathon.drawcheck.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${drawcheck.api.server-url:http://localhost:8080}")
    private String serverUrl;

    @Bean
    public OpenAPI drawcheckOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("DrawCheck Validation API")
                        .description("Checks engineering drawings against GD&T (ASME Y14.5), welding (AWS D1.1), "
                                + "material (ASTM/ASME) and API 661 equipment rules. Progress streams over "
                                + "/ws/validations/{requestId}.")
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Validations").description("Submit drawings and read validation reports"),
                        new Tag().name("Standards").description("Reference tables used by the validators")))
                .servers(List.of(new Server().url(serverUrl)));
    }
}
