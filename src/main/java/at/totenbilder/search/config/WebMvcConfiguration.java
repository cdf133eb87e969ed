package at.totenbilder.search.config;

import at.totenbilder.search.common.web.IndexApiKeyInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Spring MVC configuration: CORS for the front end and the API key guard of the index endpoints
 */
@Configuration
public class WebMvcConfiguration implements WebMvcConfigurer {

    private final ImageSearchProperties properties;

    public WebMvcConfiguration(ImageSearchProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new IndexApiKeyInterceptor(properties))
                .addPathPatterns("/api/index", "/api/index-one");
    }
}
