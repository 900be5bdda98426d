package lovedata.menus.cleaning.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8081}")
    private int serverPort;

    @Bean
    public OpenAPI menuCleaningOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + serverPort);
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Menu Cleaning API")
                .version("1.0.0")
                .description("Cleans historical restaurant menu data: name consolidation, date validation, "
                        + "venue and currency standardization, OCR repair, per-field audit");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
