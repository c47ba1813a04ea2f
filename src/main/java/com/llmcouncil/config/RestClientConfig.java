package com.llmcouncil.config;

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

/**
 * Wire logging for the model provider calls made through Spring AI's {@code RestClient}.
 * Bodies are only logged at DEBUG since council prompts carry full answers.
 */
@Configuration
public class RestClientConfig {

    private static final int MAX_LOGGED_BODY = 2000;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // lets the interceptor read the response body without consuming it
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.llmcouncil.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            long started = System.currentTimeMillis();
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(request, response, System.currentTimeMillis() - started);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.info("--> {} {}", request.getMethod(), request.getURI());
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("Headers: {}", redact(request.getHeaders()));
                if (body.length > 0) {
                    httpLogger.debug("Body: {}", truncate(new String(body, StandardCharsets.UTF_8)));
                }
            }
        }

        private void logResponse(HttpRequest request, ClientHttpResponse response, long elapsedMs) throws IOException {
            String status;
            try {
                status = response.getStatusCode().toString();
            } catch (IOException e) {
                status = "unknown";
            }
            httpLogger.info("<-- {} {} ({} ms)", status, request.getURI(), elapsedMs);
            if (httpLogger.isDebugEnabled()) {
                byte[] body = StreamUtils.copyToByteArray(response.getBody());
                if (body.length > 0) {
                    httpLogger.debug("Body: {}", truncate(new String(body, StandardCharsets.UTF_8)));
                }
            }
        }

        private HttpHeaders redact(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "Bearer ***");
            }
            return copy;
        }

        private String truncate(String value) {
            return value.length() <= MAX_LOGGED_BODY ? value : value.substring(0, MAX_LOGGED_BODY) + "...";
        }
    }
}
