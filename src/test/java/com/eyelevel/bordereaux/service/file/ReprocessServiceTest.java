package com.eyelevel.bordereaux.service.file;

import com.eyelevel.bordereaux.exception.ReprocessFailedException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.service.pipeline.BordereauxPipelineService;
import com.eyelevel.bordereaux.service.pipeline.PipelinePersistenceService;
import com.eyelevel.bordereaux.service.pipeline.ProcessingOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReprocessServiceTest {

    @Mock
    private BordereauxFileRepository fileRepository;

    @Mock
    private PipelinePersistenceService persistenceService;

    @Mock
    private BordereauxPipelineService pipelineService;

    @InjectMocks
    private ReprocessService reprocessService;

    private void givenFile(FileStatus status) {
        when(fileRepository.findById(5L))
                .thenReturn(Optional.of(BordereauxFile.builder().id(5L).status(status).build()));
    }

    @ParameterizedTest
    @EnumSource(value = FileStatus.class, names = {"PROCESSED", "PARTIALLY_PROCESSED", "NEEDS_TEMPLATE", "FAILED"})
    @DisplayName("finished file is reset and run again")
    void reprocessesTerminalFile(FileStatus status) {
        givenFile(status);
        ProcessingOutcome rerun = new ProcessingOutcome(5L, FileStatus.PROCESSED, 2, 2, 0, "t", null);
        when(pipelineService.process(5L)).thenReturn(rerun);

        assertThat(reprocessService.reprocess(5L)).isSameAs(rerun);
        InOrder order = inOrder(persistenceService, pipelineService);
        order.verify(persistenceService).resetForReprocess(5L, status);
        order.verify(pipelineService).process(5L);
    }

    @ParameterizedTest
    @EnumSource(value = FileStatus.class, names = {"RECEIVED", "MATCHING", "VALIDATING", "SUGGESTING"})
    @DisplayName("file that has not finished cannot be reprocessed")
    void refusesUnfinishedFile(FileStatus status) {
        givenFile(status);

        assertThatThrownBy(() -> reprocessService.reprocess(5L))
                .isInstanceOf(ReprocessFailedException.class)
                .hasMessageContaining(status.name());
        verifyNoInteractions(persistenceService, pipelineService);
    }

    @Test
    @DisplayName("unknown file is not found")
    void unknownFile() {
        when(fileRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reprocessService.reprocess(5L)).isInstanceOf(NotFoundException.class);
    }
}
