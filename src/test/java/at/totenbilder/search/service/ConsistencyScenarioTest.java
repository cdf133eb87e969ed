package at.totenbilder.search.service;

import at.totenbilder.search.client.ClipEncodingService;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.IndexingSummary;
import at.totenbilder.search.dto.PayloadSyncSummary;
import at.totenbilder.search.dto.ReconciliationReport;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ImageRecord;
import at.totenbilder.search.model.ScanPage;
import at.totenbilder.search.repository.ImageRecordRepository;
import at.totenbilder.search.testutils.InMemoryObjectStore;
import at.totenbilder.search.testutils.InMemoryVectorIndex;
import at.totenbilder.search.testutils.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Object store, metadata table and vector index moving through a full indexing cycle
 */
@DataJpaTest
public class ConsistencyScenarioTest {

    @Autowired
    private ImageRecordRepository imageRecordRepository;

    private InMemoryVectorIndex vectorIndex;
    private ReconciliationService reconciliationService;
    private ImageIndexingService indexingService;
    private PayloadSyncService payloadSyncService;

    @BeforeEach
    public void setUp() {
        ImageSearchProperties properties = new ImageSearchProperties();
        InMemoryObjectStore objectStore = new InMemoryObjectStore()
            .put("totenbilder/a.jpg", TestImages.png(1));
        vectorIndex = new InMemoryVectorIndex();

        ClipEncodingService encodingService = mock(ClipEncodingService.class);
        when(encodingService.isAvailable()).thenReturn(true);
        when(encodingService.encodeImage(any(byte[].class)))
            .thenAnswer(invocation -> TestImages.embeddingOf(invocation.getArgument(0)));

        BackgroundJobService jobService = new BackgroundJobService(Runnable::run, properties);
        reconciliationService = new ReconciliationService(imageRecordRepository, vectorIndex, objectStore, properties);
        indexingService = new ImageIndexingService(objectStore, vectorIndex, encodingService,
            new ImageContentProcessor(properties), jobService, properties);
        payloadSyncService = new PayloadSyncService(imageRecordRepository, vectorIndex, jobService, properties);
    }

    @Test
    public void imageMovesFromMissingToIndexedAndReceivesItsPayload() {
        ReconciliationReport empty = reconciliationService.reconcile();
        assertThat(empty.getMissingInIndex()).isEmpty();
        assertThat(empty.getReadyToIndex()).isEmpty();

        imageRecordRepository.save(new ImageRecord("a.jpg", 1L, 0d));
        ReconciliationReport beforeIndexing = reconciliationService.reconcile();
        assertThat(beforeIndexing.getReadyToIndex()).containsExactly("totenbilder/a.jpg");

        IndexingSummary indexing = indexingService.indexAll(false);
        assertThat(indexing.getProcessed()).isEqualTo(1);

        ReconciliationReport afterIndexing = reconciliationService.reconcile();
        assertThat(afterIndexing.getReadyToIndex()).isEmpty();
        assertThat(afterIndexing.getMissingInIndex()).isEmpty();
        ScanPage scan = vectorIndex.scan(null, 1000);
        assertThat(scan.getPoints()).extracting(ImagePoint::filename).containsExactly("totenbilder/a.jpg");

        imageRecordRepository.save(new ImageRecord("a.jpg", 1L, 5d));
        PayloadSyncSummary sync = payloadSyncService.sync("a.jpg", false);
        assertThat(sync.getSuccess()).isEqualTo(1);

        ImagePoint point = vectorIndex.findByFilename("totenbilder/a.jpg", false).orElseThrow();
        assertThat(point.getImage().getDelta()).isEqualTo(5d);
        assertThat(point.getImage().getNid()).isEqualTo(1L);
        assertThat(point.filename()).isEqualTo("totenbilder/a.jpg");
    }

    @Test
    public void fullSyncPagesThroughAllRows() {
        imageRecordRepository.save(new ImageRecord("a.jpg", 1L, 3d));
        imageRecordRepository.save(new ImageRecord("totenbilder/z.jpg", 2L, 0d));
        indexingService.indexAll(false);

        PayloadSyncSummary sync = payloadSyncService.sync(null, true);

        assertThat(sync.getTotal()).isEqualTo(2);
        assertThat(sync.getSuccess()).isEqualTo(1);
        assertThat(sync.getSkipped()).isEqualTo(1);
        assertThat(sync.getErrors()).isZero();
    }
}
