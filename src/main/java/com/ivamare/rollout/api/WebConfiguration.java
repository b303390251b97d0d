package com.ivamare.rollout.api;

import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the bearer token check on the API paths.
 */
public class WebConfiguration implements WebMvcConfigurer {

    public static final String API_PATHS = RolloutController.BASE_PATH + "/**";

    private final BearerTokenInterceptor bearerTokenInterceptor;

    public WebConfiguration(BearerTokenInterceptor bearerTokenInterceptor) {
        this.bearerTokenInterceptor = bearerTokenInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(bearerTokenInterceptor).addPathPatterns(API_PATHS);
    }
}
