package com.platform.discovery.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging setup: application name in the logger context and a trace id per request.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    @Value("${spring.application.name:splunk-discovery}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    @Bean
    public TraceIdFilter traceIdFilter() {
        return new TraceIdFilter();
    }
    
    /**
     * Puts the caller's {@code X-Trace-ID} (or a fresh one) into the MDC and echoes it back.
     */
    public static class TraceIdFilter extends OncePerRequestFilter {
        
        static final String TRACE_ID_HEADER = "X-Trace-ID";
        static final String MDC_TRACE_ID = "traceId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String traceId = request.getHeader(TRACE_ID_HEADER);
                if (traceId == null || traceId.isBlank()) {
                    traceId = UUID.randomUUID().toString().substring(0, 8);
                }
                MDC.put(MDC_TRACE_ID, traceId);
                response.setHeader(TRACE_ID_HEADER, traceId);
                
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_TRACE_ID);
            }
        }
    }
}
