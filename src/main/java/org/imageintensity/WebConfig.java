package org.imageintensity;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS bez ograniczeń i metadane dokumentu OpenAPI.
 */
@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Web Image Intensity Calculator API",
                description = "A REST API for calculating the average intensity of uploaded images",
                version = "1.0.0"
        ),
        tags = {
                @Tag(name = "Image Processing", description = "Image intensity calculation API"),
                @Tag(name = "Health")
        }
)
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("*")
                .allowedHeaders("*");
    }
}
