package at.totenbilder.search.client;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ClipEncodingServiceTest {

    private final List<ClientRequest> requests = Collections.synchronizedList(new ArrayList<>());

    @Test
    public void encodesTextIntoA512DimensionalVector() {
        ClipEncodingService service = service(request -> ok(embeddingJson(512)));

        float[] vector = service.encodeText("Sterbebild mit Kreuz");

        assertThat(vector).hasSize(512);
        assertThat(vector[1]).isEqualTo(0.001f);
        assertThat(requests).extracting(r -> r.method() + " " + r.url().getPath())
            .containsExactly("GET /health", "POST /encode/text");
    }

    @Test
    public void encodesImagesOnTheImageEndpoint() {
        ClipEncodingService service = service(request -> ok(embeddingJson(512)));

        assertThat(service.encodeImage(new byte[]{1, 2, 3})).hasSize(512);
        assertThat(requests.get(requests.size() - 1).url().getPath()).isEqualTo("/encode/image");
    }

    @Test
    public void wrongDimensionIsAnEmbeddingError() {
        ClipEncodingService service = service(request -> ok(embeddingJson(384)));

        assertThatThrownBy(() -> service.encodeText("x"))
            .isInstanceOf(ServiceException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.EMBEDDING_SERVICE_ERROR.code())
            .hasMessageContaining("384");
    }

    @Test
    public void clientErrorsAreNotRetried() {
        ClipEncodingService service = service(request -> request.url().getPath().equals("/health")
            ? ok("{}")
            : status(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> service.encodeText("x"))
            .isInstanceOf(ServiceException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.EMBEDDING_API_ERROR.code());
        assertThat(requests).hasSize(2);
    }

    @Test
    public void serverErrorsAreRetried() {
        AtomicInteger encodeCalls = new AtomicInteger();
        ClipEncodingService service = service(request -> {
            if (request.url().getPath().equals("/health")) {
                return ok("{}");
            }
            return encodeCalls.incrementAndGet() < 3 ? status(HttpStatus.SERVICE_UNAVAILABLE) : ok(embeddingJson(512));
        });

        assertThat(service.encodeText("x")).hasSize(512);
        assertThat(encodeCalls.get()).isEqualTo(3);
    }

    @Test
    public void failedHealthProbeMakesTheModelUnavailable() {
        ClipEncodingService service = service(request -> status(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.encodeText("x"))
            .isInstanceOf(ServiceException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.DEPENDENCY_UNAVAILABLE.code());
        assertThat(requests).hasSize(1);
    }

    private ClipEncodingService service(java.util.function.Function<ClientRequest, Mono<ClientResponse>> responder) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://encoder.local")
            .exchangeFunction(request -> {
                requests.add(request);
                return responder.apply(request);
            })
            .build();
        return new ClipEncodingService(webClient, new ObjectMapper(),
            "clip-ViT-B-32", "clip-ViT-B-32-multilingual-v1", 512, 10);
    }

    private static Mono<ClientResponse> ok(String json) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(json)
            .build());
    }

    private static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("{\"detail\":\"" + status.getReasonPhrase() + "\"}")
            .build());
    }

    private static String embeddingJson(int dimension) {
        StringBuilder json = new StringBuilder("{\"embedding\":[");
        for (int i = 0; i < dimension; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append(i / 1000.0);
        }
        return json.append("]}").toString();
    }
}
