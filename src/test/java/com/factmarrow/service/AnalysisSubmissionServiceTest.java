package com.factmarrow.service;

import com.factmarrow.model.AnalysisDetail;
import com.factmarrow.model.AnalysisRecord;
import com.factmarrow.model.AnalysisState;
import com.factmarrow.model.AnalysisStatus;
import com.factmarrow.model.AnalysisSubmission;
import com.factmarrow.model.DocumentRecord;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.QualityAssessment;
import com.factmarrow.model.StoredDocument;
import com.factmarrow.orchestrator.WorkflowOrchestrator;
import com.factmarrow.repository.AnalysisRepository;
import com.factmarrow.repository.DocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisSubmissionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private WorkflowOrchestrator orchestrator;

    @Mock
    private DocumentStorageService storageService;

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private AnalysisRepository analysisRepository;

    private final List<Runnable> scheduled = new ArrayList<>();
    private AnalysisSubmissionService service;

    @BeforeEach
    void setUp() {
        service = new AnalysisSubmissionService(orchestrator, storageService, documentRepository,
                analysisRepository, scheduled::add);
    }

    private static AnalysisState completedState(String analysisId) {
        AnalysisState state = new AnalysisState(analysisId, "abc123def456", CLOCK);
        state.advanceTo(AnalysisStatus.PROCESSING);
        state.addClaim(new ExtractedClaim("C-001", "Claim", "causal", null, 0.8, null));
        state.setReportContent("# Report");
        state.setQualityAssessment(new QualityAssessment("Good", 90.0, true));
        state.complete();
        return state;
    }

    @Test
    void shouldQueueAnalysisAndRunItInBackground() {
        // Given
        StoredDocument stored = new StoredDocument("abc123def456", "report.txt", Path.of("data/abc123def456_report.txt"), 5);
        when(storageService.store(eq("report.txt"), any())).thenReturn(stored);

        // When
        AnalysisSubmission submission = service.submit("report.txt", "hello".getBytes());

        // Then
        assertThat(submission.status()).isEqualTo("queued");
        assertThat(submission.documentId()).isEqualTo("abc123def456");
        assertThat(submission.message()).contains("/api/analyses/" + submission.analysisId());
        verify(documentRepository).save(any(DocumentRecord.class));
        ArgumentCaptor<AnalysisRecord> queued = ArgumentCaptor.forClass(AnalysisRecord.class);
        verify(analysisRepository).save(queued.capture());
        assertThat(queued.getValue().status()).isEqualTo("queued");
        assertThat(queued.getValue().analysisType()).isEqualTo(AnalysisRecord.FULL_ASSESSMENT);
        verify(orchestrator, never()).executeAnalysis(anyString(), anyString(), anyString(), anyString());
        assertThat(scheduled).hasSize(1);

        // When the background task runs
        AnalysisState finished = completedState(submission.analysisId());
        when(orchestrator.executeAnalysis(submission.analysisId(), "abc123def456",
                stored.path().toString(), "hello")).thenReturn(finished);
        when(analysisRepository.findById(submission.analysisId())).thenReturn(Optional.of(queued.getValue()));
        scheduled.get(0).run();

        // Then
        ArgumentCaptor<AnalysisRecord> saved = ArgumentCaptor.forClass(AnalysisRecord.class);
        verify(analysisRepository, atLeastOnce()).save(saved.capture());
        AnalysisRecord persisted = saved.getValue();
        assertThat(persisted.status()).isEqualTo("completed");
        assertThat(persisted.claims()).hasSize(1);
        assertThat(persisted.reportQuality()).isEqualTo(AnalysisRecord.QUALITY_DRAFT);
        assertThat(persisted.qaConfidence()).isEqualTo(90.0);
        assertThat(persisted.approvedForPublication()).isTrue();
        assertThat(persisted.completedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void shouldRejectMissingFilenameAndEmptyContent() {
        assertThatThrownBy(() -> service.submit(" ", new byte[]{1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("File must have a filename");
        assertThatThrownBy(() -> service.submit("doc.txt", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("File is empty");
        verify(storageService, never()).store(anyString(), any());
    }

    @Test
    void shouldMarkRecordFailedWhenSchedulingIsRejected() {
        // Given
        service = new AnalysisSubmissionService(orchestrator, storageService, documentRepository,
                analysisRepository, task -> {
                    throw new RejectedExecutionException("pool saturated");
                });
        when(storageService.store(anyString(), any()))
                .thenReturn(new StoredDocument("abc123def456", "doc.txt", Path.of("doc.txt"), 1));
        when(analysisRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.of(AnalysisRecord.queued(invocation.getArgument(0),
                        "abc123def456", CLOCK.instant())));

        // When / Then
        assertThatThrownBy(() -> service.submit("doc.txt", new byte[]{1}))
                .isInstanceOf(RejectedExecutionException.class);
        ArgumentCaptor<AnalysisRecord> saved = ArgumentCaptor.forClass(AnalysisRecord.class);
        verify(analysisRepository, atLeastOnce()).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo("failed");
        assertThat(saved.getValue().errors()).singleElement().asString().contains("pool saturated");
    }

    @Test
    void shouldPreferLiveErrorsInDetail() {
        // Given
        AnalysisRecord record = AnalysisRecord.queued("a-1", "abc123def456", CLOCK.instant())
                .withStatus(AnalysisStatus.VERIFICATION);
        AnalysisState live = new AnalysisState("a-1", "abc123def456", CLOCK);
        live.addError("transient tool error");
        when(analysisRepository.findById("a-1")).thenReturn(Optional.of(record));
        when(orchestrator.getAnalysisState("a-1")).thenReturn(Optional.of(live));
        when(documentRepository.findById("abc123def456")).thenReturn(Optional.of(
                new DocumentRecord("abc123def456", "report.txt", "data/report.txt", 10, CLOCK.instant())));

        // When
        Optional<AnalysisDetail> detail = service.getAnalysis("a-1");

        // Then
        assertThat(detail).hasValueSatisfying(d -> {
            assertThat(d.status()).isEqualTo("verification");
            assertThat(d.documentTitle()).isEqualTo("report.txt");
            assertThat(d.errors()).containsExactly("transient tool error");
            assertThat(d.completedAt()).isNull();
        });
    }

    @Test
    void shouldReturnEmptyDetailForUnknownAnalysis() {
        when(analysisRepository.findById("missing")).thenReturn(Optional.empty());

        assertThat(service.getAnalysis("missing")).isEmpty();
    }

    @Test
    void shouldRecordBackgroundCrash() {
        // Given
        StoredDocument stored = new StoredDocument("abc123def456", "doc.txt", Path.of("doc.txt"), 1);
        when(orchestrator.executeAnalysis(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("orchestrator closed"));
        when(analysisRepository.findById("a-2"))
                .thenReturn(Optional.of(AnalysisRecord.queued("a-2", "abc123def456", CLOCK.instant())));

        // When
        service.run("a-2", stored, "text");

        // Then
        ArgumentCaptor<AnalysisRecord> saved = ArgumentCaptor.forClass(AnalysisRecord.class);
        verify(analysisRepository).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo("failed");
        assertThat(saved.getValue().errors()).containsExactly("Background analysis failed: orchestrator closed");
        assertThat(saved.getValue().completedAt()).isNotNull();
    }
}
