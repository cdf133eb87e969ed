package at.totenbilder.search.service;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.JobStatus;
import at.totenbilder.search.dto.PayloadSyncSummary;
import at.totenbilder.search.model.ImagePoint;
import at.totenbilder.search.model.ImageRecord;
import at.totenbilder.search.model.IndexedImage;
import at.totenbilder.search.repository.ImageRecordRepository;
import at.totenbilder.search.store.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class PayloadSyncServiceTest {

    @Mock
    private ImageRecordRepository imageRecordRepository;

    @Mock
    private VectorIndex vectorIndex;

    private PayloadSyncService payloadSyncService;

    @BeforeEach
    public void setUp() {
        ImageSearchProperties properties = new ImageSearchProperties();
        BackgroundJobService jobService = new BackgroundJobService(Runnable::run, properties);
        payloadSyncService = new PayloadSyncService(imageRecordRepository, vectorIndex, jobService, properties);
    }

    @Test
    public void filenameAndAllTogetherConflict() {
        assertThatThrownBy(() -> payloadSyncService.validate("a.jpg", true))
            .isInstanceOf(ClientException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.PARAM_CONFLICT.code());
    }

    @Test
    public void neitherFilenameNorAllIsRejectedBeforeAnyRead() {
        assertThatThrownBy(() -> payloadSyncService.submitSync(" ", false))
            .isInstanceOf(ClientException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.PARAM_EMPTY.code());
        verifyNoInteractions(imageRecordRepository, vectorIndex);
    }

    @Test
    public void singleFilenameLooksUpBothSpellings() {
        when(vectorIndex.isAvailable()).thenReturn(true);
        when(imageRecordRepository.findByFilenameIn(any())).thenReturn(List.of(new ImageRecord("a.jpg", 4L, 5d)));
        when(vectorIndex.findByFilename("totenbilder/a.jpg", false))
            .thenReturn(Optional.of(new ImagePoint("p-a", new IndexedImage("totenbilder/a.jpg", null))));

        PayloadSyncSummary summary = payloadSyncService.sync("totenbilder/a.jpg", false);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> spellings = ArgumentCaptor.forClass(Collection.class);
        verify(imageRecordRepository).findByFilenameIn(spellings.capture());
        assertThat(spellings.getValue()).containsExactlyInAnyOrder("a.jpg", "totenbilder/a.jpg");
        verify(vectorIndex).setMetadataPayload("p-a", 4L, 5d);
        assertThat(summary).isEqualTo(new PayloadSyncSummary(1, 1, 0, 0));
    }

    @Test
    public void unknownFilenameReportsNothing() {
        when(vectorIndex.isAvailable()).thenReturn(true);
        when(imageRecordRepository.findByFilenameIn(any())).thenReturn(List.of());

        PayloadSyncSummary summary = payloadSyncService.sync("gone.jpg", false);

        assertThat(summary.getTotal()).isZero();
        verify(vectorIndex, never()).setMetadataPayload(anyString(), any(), any());
    }

    @Test
    public void rowsWithoutPointAreSkippedAndFailuresAreCounted() {
        when(vectorIndex.isAvailable()).thenReturn(true);
        Pageable firstPage = PageRequest.of(0, PayloadSyncService.PAGE_SIZE);
        when(imageRecordRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of(
            new ImageRecord("a.jpg", 1L, 0d),
            new ImageRecord("b.jpg", 2L, 1d),
            new ImageRecord("c.jpg", 3L, 2d)), firstPage, 3));
        when(vectorIndex.findByFilename("totenbilder/a.jpg", false))
            .thenReturn(Optional.of(new ImagePoint("p-a", new IndexedImage("totenbilder/a.jpg", null))));
        when(vectorIndex.findByFilename("totenbilder/b.jpg", false)).thenReturn(Optional.empty());
        when(vectorIndex.findByFilename("totenbilder/c.jpg", false))
            .thenReturn(Optional.of(new ImagePoint("p-c", new IndexedImage("totenbilder/c.jpg", null))));
        lenient().doThrow(new ServiceException("version conflict", SearchErrorCode.VECTOR_INDEX_ERROR))
            .when(vectorIndex).setMetadataPayload(eq("p-c"), any(), any());

        PayloadSyncSummary summary = payloadSyncService.sync(null, true);

        assertThat(summary).isEqualTo(new PayloadSyncSummary(3, 1, 1, 1));
        verify(vectorIndex).setMetadataPayload("p-a", 1L, 0d);
    }

    @Test
    public void unavailableIndexFailsFast() {
        when(vectorIndex.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> payloadSyncService.sync(null, true))
            .isInstanceOf(ServiceException.class)
            .hasFieldOrPropertyWithValue("errorCode", SearchErrorCode.DEPENDENCY_UNAVAILABLE.code());
    }

    @Test
    public void submittedSyncRunsAsJob() {
        when(vectorIndex.isAvailable()).thenReturn(true);
        when(imageRecordRepository.findByFilenameIn(any())).thenReturn(List.of());

        JobStatus status = payloadSyncService.submitSync("a.jpg", false);

        assertThat(status.getType()).isEqualTo(JobStatus.Type.PAYLOAD_SYNC);
        assertThat(status.getDescription()).isEqualTo("filename=a.jpg");
        assertThat(status.getState()).isEqualTo(JobStatus.State.SUCCEEDED);
        assertThat(status.getSummary()).isEqualTo(new PayloadSyncSummary());
    }
}
