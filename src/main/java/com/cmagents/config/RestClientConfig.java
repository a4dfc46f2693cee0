package com.cmagents.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
public class RestClientConfig {

    private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.cmagents.http.logging");
    private static final int MAX_LOGGED_BODY = 2000;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new ModelTrafficLoggingInterceptor());
            // response bodies are read once for logging and once by the client
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static HttpHeaders redacted(HttpHeaders headers) {
        HttpHeaders copy = new HttpHeaders();
        headers.forEach((name, values) -> {
            if (HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name) || "x-goog-api-key".equalsIgnoreCase(name)) {
                copy.add(name, "[redacted]");
            } else {
                copy.addAll(name, values);
            }
        });
        return copy;
    }

    private static String abbreviate(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() <= MAX_LOGGED_BODY ? text : text.substring(0, MAX_LOGGED_BODY) + "...";
    }

    private static class ModelTrafficLoggingInterceptor implements ClientHttpRequestInterceptor {

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("--> {} {} headers={}", request.getMethod(), request.getURI(),
                        redacted(request.getHeaders()));
                if (body.length > 0) {
                    httpLogger.debug("--> body {}", abbreviate(body));
                }
            }
            long started = System.nanoTime();
            ClientHttpResponse response = execution.execute(request, body);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            httpLogger.info("<-- {} {} {} ({} ms)", response.getStatusCode().value(), request.getMethod(),
                    request.getURI().getPath(), elapsedMs);
            if (httpLogger.isDebugEnabled()) {
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                if (responseBody.length > 0) {
                    httpLogger.debug("<-- body {}", abbreviate(responseBody));
                }
            }
            return response;
        }
    }
}
