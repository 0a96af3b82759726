package com.adobe.numeral.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Web MVC Configuration.
 * 
 * Attaches the conversion request log to the endpoints of each numeral system.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    /** First path segment of every conversion endpoint, one per numeral system. */
    static final List<String> NUMERAL_SYSTEMS = List.of("roman", "letters", "tokens");

    private final RequestLoggingInterceptor requestLoggingInterceptor;

    public WebMvcConfig(RequestLoggingInterceptor requestLoggingInterceptor) {
        this.requestLoggingInterceptor = requestLoggingInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor)
                .addPathPatterns(conversionPathPatterns());
    }

    static List<String> conversionPathPatterns() {
        return NUMERAL_SYSTEMS.stream()
            .flatMap(system -> List.of("/" + system, "/" + system + "/**").stream())
            .toList();
    }
}
