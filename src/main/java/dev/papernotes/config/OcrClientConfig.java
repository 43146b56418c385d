package dev.papernotes.config;

import dev.papernotes.gateway.HttpOcrEngine;
import dev.papernotes.gateway.OcrEngineKind;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures one {@link HttpOcrEngine} per OCR sidecar.
 *
 * <p>Each engine has its own base URL under {@code papernotes.ocr.a.base-url} and
 * {@code papernotes.ocr.b.base-url}; an engine whose URL is blank gets no bean and the gateway
 * treats it as unavailable. Timeouts are shared via {@code papernotes.ocr.*}.
 */
@Configuration
@EnableRetry
public class OcrClientConfig {

    @Bean
    @ConditionalOnExpression("'${papernotes.ocr.a.base-url:}' != ''")
    public HttpOcrEngine ocrEngineA(
            RestClient.Builder builder,
            @Value("${papernotes.ocr.a.base-url}") String baseUrl,
            @Value("${papernotes.ocr.connect-timeout-ms:2000}") int connectTimeoutMs,
            @Value("${papernotes.ocr.read-timeout-ms:30000}") int readTimeoutMs) {
        return new HttpOcrEngine(OcrEngineKind.A,
                restClient(builder, baseUrl, connectTimeoutMs, readTimeoutMs));
    }

    @Bean
    @ConditionalOnExpression("'${papernotes.ocr.b.base-url:}' != ''")
    public HttpOcrEngine ocrEngineB(
            RestClient.Builder builder,
            @Value("${papernotes.ocr.b.base-url}") String baseUrl,
            @Value("${papernotes.ocr.connect-timeout-ms:2000}") int connectTimeoutMs,
            @Value("${papernotes.ocr.read-timeout-ms:30000}") int readTimeoutMs) {
        return new HttpOcrEngine(OcrEngineKind.B,
                restClient(builder, baseUrl, connectTimeoutMs, readTimeoutMs));
    }

    /**
     * Builds a {@link RestClient} targeting one sidecar. The builder is cloned so the two engines
     * never share a base URL.
     */
    static RestClient restClient(RestClient.Builder builder, String baseUrl,
                                 int connectTimeoutMs, int readTimeoutMs) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
