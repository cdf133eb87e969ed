package at.totenbilder.search.common.web;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.config.ImageSearchProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the index endpoints with the {@code X-API-Key} header
 */
@Slf4j
public class IndexApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final ImageSearchProperties properties;

    public IndexApiKeyInterceptor(ImageSearchProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String expected = properties.getIndexing().getApiKey();
        if (expected == null || expected.isBlank()) {
            log.warn("image-search.indexing.api-key is not set, rejecting index request");
            throw new ServiceException("Server configuration error: index API key missing");
        }
        String provided = request.getHeader(API_KEY_HEADER);
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new ClientException(SearchErrorCode.API_KEY_INVALID);
        }
        return true;
    }
}
