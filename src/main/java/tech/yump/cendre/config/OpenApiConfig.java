package tech.yump.cendre.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${spring.application.name:cendre}") String applicationName) {
        // No security scheme: the secret id is the only capability a reader holds.
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .description("One-time secret sharing. Payloads are encrypted in the browser; the server only "
                                + "ever stores ciphertext and hands it out once.")
                        .version("v1")
                        .license(new License().name("MIT")));
    }
}
