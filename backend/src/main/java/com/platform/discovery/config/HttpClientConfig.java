package com.platform.discovery.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

/**
 * HTTP client used to talk to splunkd management ports.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public HttpClient splunkHttpClient(SplunkClientConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER);
        
        if (!config.isVerifyTls()) {
            log.warn("TLS certificate and hostname verification is disabled for splunkd connections");
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }
    
    static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialize TLS context", e);
        }
    }
    
    /**
     * Accepts any server chain and any host name. JSSE only wraps plain
     * {@code X509TrustManager}s with its endpoint identification check, so the
     * engine and socket overloads here are the whole check for this context.
     */
    static class TrustAllManager extends X509ExtendedTrustManager {
        
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // server side only
        }
        
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // server side only
        }
        
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // server side only
        }
        
        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // trust all
        }
        
        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // trust all, hostname included
        }
        
        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // trust all, hostname included
        }
        
        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
