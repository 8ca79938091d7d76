package com.frosted.tracer.config;

import com.frosted.tracer.CodeTracer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class TracerConfig {

    @Bean
    public CodeTracer codeTracer() {
        return new CodeTracer();
    }

    /**
     * Configure CORS for frontend
     */
    @Bean
    public WebMvcConfigurer corsConfigurer(TracerProperties properties) {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                        .allowedMethods("GET", "POST", "OPTIONS")
                        .allowedHeaders("*");
            }
        };
    }
}
