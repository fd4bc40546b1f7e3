package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class BordereauxFileRepositoryTest {

    @Autowired
    private BordereauxFileRepository fileRepository;

    private BordereauxFile file;

    @BeforeEach
    void setUp() {
        file = fileRepository.saveAndFlush(newFile("a".repeat(64)));
    }

    private static BordereauxFile newFile(String hash) {
        return BordereauxFile.builder()
                .filename("march.csv")
                .contentHash(hash)
                .fileSize(10L)
                .fileType(FileType.CLAIMS)
                .status(FileStatus.RECEIVED)
                .build();
    }

    @Test
    @DisplayName("only the first claim of a RECEIVED file succeeds")
    void claimIsExclusive() {
        LocalDateTime now = LocalDateTime.now();

        int first = fileRepository.updateStatusIfExpected(file.getId(), FileStatus.MATCHING, FileStatus.RECEIVED, now);
        int second = fileRepository.updateStatusIfExpected(file.getId(), FileStatus.MATCHING, FileStatus.RECEIVED, now);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(fileRepository.findById(file.getId())).get()
                .extracting(BordereauxFile::getStatus).isEqualTo(FileStatus.MATCHING);
    }

    @Test
    @DisplayName("completing a run records counters and leaves other statuses untouched")
    void completeRun() {
        fileRepository.updateStatusIfExpected(file.getId(), FileStatus.PERSISTING, FileStatus.RECEIVED,
                                              LocalDateTime.now());

        assertThat(fileRepository.completeRun(file.getId(), FileStatus.VALIDATING, FileStatus.PROCESSED, 3, 3, 0,
                                              "standard_claims_1", null, LocalDateTime.now())).isZero();
        assertThat(fileRepository.completeRun(file.getId(), FileStatus.PERSISTING, FileStatus.PARTIALLY_PROCESSED,
                                              3, 2, 1, "standard_claims_1", null, LocalDateTime.now())).isEqualTo(1);

        BordereauxFile done = fileRepository.findById(file.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(FileStatus.PARTIALLY_PROCESSED);
        assertThat(done.getTotalRows()).isEqualTo(3);
        assertThat(done.getValidRows()).isEqualTo(2);
        assertThat(done.getErrorRows()).isEqualTo(1);
        assertThat(done.getTemplateId()).isEqualTo("standard_claims_1");
        assertThat(done.getProcessedAt()).isNotNull();
    }

    @Test
    @DisplayName("reset for reprocess clears the previous outcome")
    void resetForReprocess() {
        fileRepository.failIfInStatus(file.getId(), FileStatus.RECEIVED, FileStatus.FAILED, "boom",
                                      LocalDateTime.now());

        assertThat(fileRepository.resetForReprocess(file.getId(), FileStatus.FAILED, FileStatus.RECEIVED,
                                                     LocalDateTime.now())).isEqualTo(1);

        BordereauxFile reset = fileRepository.findById(file.getId()).orElseThrow();
        assertThat(reset.getStatus()).isEqualTo(FileStatus.RECEIVED);
        assertThat(reset.getErrorMessage()).isNull();
        assertThat(reset.getTotalRows()).isZero();
    }

    @Test
    @DisplayName("stale lookup finds in-progress files not updated since the threshold")
    void staleLookup() {
        fileRepository.updateStatusIfExpected(file.getId(), FileStatus.MATCHING, FileStatus.RECEIVED,
                                              LocalDateTime.now().minusHours(2));

        assertThat(fileRepository.findByStatusInAndUpdatedAtBefore(FileStatus.inProgressStatuses(),
                                                                   LocalDateTime.now().minusHours(1)))
                .extracting(BordereauxFile::getId).containsExactly(file.getId());
        assertThat(fileRepository.findByStatusInAndUpdatedAtBefore(EnumSet.of(FileStatus.MAPPING),
                                                                   LocalDateTime.now().minusHours(1)))
                .isEmpty();
    }

    @Test
    @DisplayName("RECEIVED ids come back in id order and content hashes are unique")
    void idsAndUniqueHash() {
        BordereauxFile second = fileRepository.saveAndFlush(newFile("b".repeat(64)));

        assertThat(fileRepository.findIdsByStatus(FileStatus.RECEIVED)).containsExactly(file.getId(), second.getId());
        assertThat(fileRepository.findByContentHash("b".repeat(64))).get()
                .extracting(BordereauxFile::getId).isEqualTo(second.getId());
        assertThatThrownBy(() -> fileRepository.saveAndFlush(newFile("a".repeat(64))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
