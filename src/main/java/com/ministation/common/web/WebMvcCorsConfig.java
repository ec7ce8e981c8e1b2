package com.ministation.common.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 允许前端页面跨域调用 /station 接口。
 *
 * <p>默认只放行本机 origin；部署时通过 {@code station.cors.allowed-origin-patterns} 收敛到实际域名。</p>
 */
@Configuration
public class WebMvcCorsConfig implements WebMvcConfigurer {

    private final String[] allowedOriginPatterns;

    public WebMvcCorsConfig(
            @Value("${station.cors.allowed-origin-patterns:http://localhost:*,http://127.0.0.1:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/station/**")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders(HttpHeaders.CONTENT_TYPE, "X-Principal")
                .exposedHeaders(HttpHeaders.RETRY_AFTER)
                .maxAge(1800);
    }
}
