package at.totenbilder.search.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the indexing pipeline, reconciliation and search
 */
@Component
@ConfigurationProperties(prefix = "image-search")
@Data
public class ImageSearchProperties {

    private Storage storage = new Storage();
    private Indexing indexing = new Indexing();
    private Reconciliation reconciliation = new Reconciliation();
    private Search search = new Search();
    private Ocr ocr = new Ocr();
    private Cors cors = new Cors();
    private Jobs jobs = new Jobs();

    @Data
    public static class Storage {
        /** Key prefix of all images in the bucket, part of the canonical key */
        private String prefix = "totenbilder/";
        /** Public base URL the image URLs in search results are built from */
        private String publicBaseUrl = "";
    }

    @Data
    public static class Indexing {
        /** Points buffered before one upsert call */
        private int batchSize = 50;
        private List<String> supportedExtensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".webp"));
        /** Expected X-API-Key of the index endpoints */
        private String apiKey;
    }

    @Data
    public static class Reconciliation {
        private int scanPageSize = 1000;
        /** Entries returned per category by the reconciliation endpoint */
        private int sampleLimit = 500;
    }

    @Data
    public static class Search {
        private int defaultLimit = 30;
        private int maxLimit = 200;
        /** Lower bound of kNN num_candidates */
        private int numCandidates = 100;
    }

    @Data
    public static class Ocr {
        private boolean enabled = false;
        /** Tesseract languages, modern German and Fraktur */
        private String language = "deu+frak";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:3000",
            "https://totenbilder.at",
            "https://www.totenbilder.at"
        ));
    }

    @Data
    public static class Jobs {
        /** Finished jobs kept for status queries */
        private int historySize = 200;
    }
}
