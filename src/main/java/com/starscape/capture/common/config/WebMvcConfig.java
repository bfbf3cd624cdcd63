package com.starscape.capture.common.config;

import com.starscape.capture.common.observability.RequestMdcInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RequestMdcInterceptor requestMdcInterceptor;

    public WebMvcConfig(RequestMdcInterceptor requestMdcInterceptor) {
        this.requestMdcInterceptor = requestMdcInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestMdcInterceptor);
    }
}
