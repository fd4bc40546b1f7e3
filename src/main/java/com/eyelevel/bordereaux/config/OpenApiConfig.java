package com.eyelevel.bordereaux.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Bordereaux Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API exposes the bordereaux processing pipeline.
                                Partners' premium, claims and exposure files are matched against known templates,
                                mapped to the canonical schema and validated row by row.

                                Key features include:
                                * **Intake:** Files are stored by content hash; the same content is registered once.
                                * **Inspection:** File status, run counters and paginated validation errors.
                                * **Reprocessing:** Finished files can be reset and run again.
                                * **Proposal review:** Files without a template get a suggested mapping that can be approved into a new template or rejected.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
