package com.ministation.auth.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcAuthConfig implements WebMvcConfigurer {

    private final PrincipalInterceptor principalInterceptor;

    public WebMvcAuthConfig(PrincipalInterceptor principalInterceptor) {
        this.principalInterceptor = principalInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(principalInterceptor)
                .addPathPatterns("/station/**");
    }
}
