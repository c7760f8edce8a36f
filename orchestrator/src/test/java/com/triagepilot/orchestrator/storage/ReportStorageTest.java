package com.triagepilot.orchestrator.storage;

import com.triagepilot.orchestrator.model.ReportRecord;
import com.triagepilot.orchestrator.repository.ReportRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReportStorage: real files under a temp dir, mocked repository.
 */
@ExtendWith(MockitoExtension.class)
class ReportStorageTest {

    @Mock ReportRecordRepository records;

    @TempDir Path root;

    ReportStorage storage;

    @BeforeEach
    void setUp() {
        storage = new ReportStorage(root.resolve("storage"), records);
    }

    @Test
    void store_copiesFileUnderSessionFolderAndRecordsIt() throws Exception {
        Path report = Files.writeString(root.resolve("medical_report_1.md"), "# report");

        String location = storage.store(report, "patient/1");

        assertThat(location).isEqualTo("patients/cGF0aWVudC8x/reports/medical_report_1.md");
        assertThat(root.resolve("storage").resolve(location)).hasContent("# report");

        ArgumentCaptor<ReportRecord> saved = ArgumentCaptor.forClass(ReportRecord.class);
        verify(records).save(saved.capture());
        assertThat(saved.getValue().getSessionId()).isEqualTo("patient/1");
        assertThat(saved.getValue().getFileName()).isEqualTo("medical_report_1.md");
        assertThat(saved.getValue().getStoragePath()).isEqualTo(location);
    }

    @Test
    void store_idsThatLookAlikeAfterSanitising_getSeparateFolders() throws Exception {
        Path report = Files.writeString(root.resolve("medical_report_2.md"), "# report");

        String slash      = storage.store(report, "a/b");
        String underscore = storage.store(report, "a_b");

        assertThat(slash).isEqualTo("patients/YS9i/reports/medical_report_2.md");
        assertThat(underscore).isEqualTo("patients/YV9i/reports/medical_report_2.md");
    }

    @Test
    void store_missingFile_throwsWithoutRecording() {
        assertThatThrownBy(() -> storage.store(root.resolve("nope.md"), "patient-2"))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("does not exist");

        verify(records, never()).save(any());
    }

    @Test
    void reportsFor_readsRecordsForSession() {
        ReportRecord record = new ReportRecord("patient-3", "r.md", "patients/patient-3/reports/r.md");
        when(records.findBySessionIdOrderByCreatedAtAsc("patient-3")).thenReturn(List.of(record));

        assertThat(storage.reportsFor("patient-3")).containsExactly(record);
    }
}
