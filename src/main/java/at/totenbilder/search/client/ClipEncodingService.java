package at.totenbilder.search.client;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.common.support.DependencyAware;
import at.totenbilder.search.common.support.LazyDependency;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Client of the CLIP encoder service.
 *
 * <p>Images and multilingual text are encoded into the same 512 dimensional space,
 * so a text vector can be compared directly with stored image vectors.</p>
 */
@Component
public class ClipEncodingService implements DependencyAware {

    private static final Logger log = LoggerFactory.getLogger(ClipEncodingService.class);

    private final LazyDependency<WebClient> clientDependency;
    private final ObjectMapper jsonParser;
    private final String imageModel;
    private final String textModel;
    private final int vectorDimension;
    private final Duration timeout;

    public ClipEncodingService(WebClient embeddingWebClient,
                               ObjectMapper objectMapper,
                               @Value("${embedding.api.image-model:clip-ViT-B-32}") String imageModel,
                               @Value("${embedding.api.text-model:clip-ViT-B-32-multilingual-v1}") String textModel,
                               @Value("${embedding.api.dimension:512}") int vectorDimension,
                               @Value("${embedding.api.timeout-seconds:60}") long timeoutSeconds) {
        this.jsonParser = objectMapper;
        this.imageModel = imageModel;
        this.textModel = textModel;
        this.vectorDimension = vectorDimension;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.clientDependency = new LazyDependency<>("embedding-model", () -> probe(embeddingWebClient));
    }

    public boolean isAvailable() {
        return clientDependency.isAvailable();
    }

    @Override
    public LazyDependency<?> dependency() {
        return clientDependency;
    }

    /**
     * Encodes raw image bytes with the image model
     *
     * @param imageBytes encoded image (jpeg, png, webp)
     * @return vector of {@code embedding.api.dimension} floats
     */
    public float[] encodeImage(byte[] imageBytes) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", imageModel);
        body.put("image", Base64.getEncoder().encodeToString(imageBytes));
        return encode("/encode/image", body);
    }

    /**
     * Encodes a search text with the multilingual text model
     */
    public float[] encodeText(String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", textModel);
        body.put("text", text);
        return encode("/encode/text", body);
    }

    private float[] encode(String path, Map<String, Object> body) {
        WebClient httpClient = clientDependency.get();
        String response;
        try {
            response = httpClient.post()
                .uri(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetryPolicy())
                .block(timeout);
        } catch (WebClientException e) {
            throw new ServiceException("Encoder call " + path + " failed: " + e.getMessage(), e,
                SearchErrorCode.EMBEDDING_API_ERROR);
        } catch (IllegalStateException e) {
            // block() timeout or exhausted retries
            throw new ServiceException("Encoder call " + path + " failed: " + e.getMessage(), e,
                SearchErrorCode.EMBEDDING_API_ERROR);
        }
        return extractVector(response);
    }

    /**
     * Retries server side failures only
     */
    private Retry createRetryPolicy() {
        return Retry.fixedDelay(3, Duration.ofSeconds(1))
            .filter(error -> error instanceof WebClientResponseException
                && ((WebClientResponseException) error).getStatusCode().is5xxServerError());
    }

    float[] extractVector(String response) {
        JsonNode embeddingNode;
        try {
            embeddingNode = response == null ? null : jsonParser.readTree(response).get("embedding");
        } catch (Exception e) {
            throw new ServiceException("Unreadable encoder response", e, SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        if (embeddingNode == null || !embeddingNode.isArray()) {
            throw new ServiceException("Encoder response without embedding", SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        if (embeddingNode.size() != vectorDimension) {
            throw new ServiceException("Expected " + vectorDimension + " dimensions, got " + embeddingNode.size(),
                SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < embeddingNode.size(); i++) {
            vector[i] = (float) embeddingNode.get(i).asDouble();
        }
        return vector;
    }

    private WebClient probe(WebClient httpClient) {
        httpClient.get()
            .uri("/health")
            .retrieve()
            .toBodilessEntity()
            .block(timeout);
        log.info("Encoder ready, image model {}, text model {}", imageModel, textModel);
        return httpClient;
    }
}
