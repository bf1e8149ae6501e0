package com.portfolio.mirror.config;

import com.portfolio.mirror.common.constants.BrokerageConstants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Configuration
public class ApiKeyFilterConfig {

    /**
     * Header guard for the internal API, without Spring Security. Disabled while no key is configured.
     */
    @Bean
    public FilterRegistrationBean<OncePerRequestFilter> apiKeyGuard(
            @Value("${portfolio.security.api-key:}") String apiKey) {
        OncePerRequestFilter filter = new OncePerRequestFilter() {
            @Override
            protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
                    throws ServletException, IOException {
                if (apiKey != null && !apiKey.isEmpty()
                        && !apiKey.equals(req.getHeader(BrokerageConstants.API_KEY_HEADER))) {
                    res.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing or invalid API key");
                    return;
                }
                chain.doFilter(req, res);
            }
        };
        FilterRegistrationBean<OncePerRequestFilter> bean = new FilterRegistrationBean<>(filter);
        bean.addUrlPatterns("/api/*");
        bean.setOrder(1);
        return bean;
    }
}
