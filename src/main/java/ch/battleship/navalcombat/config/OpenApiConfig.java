package ch.battleship.navalcombat.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI navalCombatOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Naval Combat API")
                        .description("Turn-based naval combat: fleet placement, munitions, alliances and AI opponents")
                        .version("v1.0.0"));
    }
}
