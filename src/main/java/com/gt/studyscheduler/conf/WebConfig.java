package com.gt.studyscheduler.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final String allowedOrigin;

    @Autowired
    public WebConfig(@Value("${server.cors.allowedOrigin:}") String allowedOrigin) {
        this.allowedOrigin = allowedOrigin;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (allowedOrigin != null && !allowedOrigin.isBlank()) {
            log.info("Setting allowed origin: {}", allowedOrigin);
            registry.addMapping("/rest/**").allowedOrigins(allowedOrigin);
        }
    }
}
