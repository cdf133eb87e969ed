package at.totenbilder.search.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient of the CLIP encoder service
 */
@Configuration
public class HttpClientConfiguration {

    @Value("${embedding.api.url:http://localhost:8001}")
    private String embeddingApiUrl;

    @Value("${embedding.api.key:}")
    private String embeddingApiKey;

    /**
     * Image requests carry the base64 encoded image, hence the large buffer.
     */
    @Bean
    public WebClient embeddingWebClient() {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(calculateMaxBufferSize()))
            .build();

        WebClient.Builder builder = WebClient.builder()
            .baseUrl(embeddingApiUrl)
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (embeddingApiKey != null && !embeddingApiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embeddingApiKey);
        }
        return builder.build();
    }

    /**
     * 32MB
     */
    private int calculateMaxBufferSize() {
        return 32 * 1024 * 1024;
    }
}
