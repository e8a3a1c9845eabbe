package dev.resumescanner;

import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.service.ResumeScannerService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private ResumeScannerService resumeScannerService;

  @InjectMocks
  private PipelineRunner pipelineRunner;

  @Test
  void execute_successfulRun_returnsCandidateCount() {
    // Arrange
    List<CandidateRecord> candidates = List.of(CandidateRecord.builder().build(), CandidateRecord.builder().build());
    when(resumeScannerService.runPipeline()).thenReturn(Mono.just(candidates));

    // Act
    int result = pipelineRunner.execute();

    // Assert
    assertEquals(2, result);
    verify(resumeScannerService).runPipeline();
  }

  @Test
  void execute_emptyResult_returnsZero() {
    when(resumeScannerService.runPipeline()).thenReturn(Mono.just(List.of()));

    assertEquals(0, pipelineRunner.execute());
  }

  @Test
  void execute_nullResult_returnsZero() {
    when(resumeScannerService.runPipeline()).thenReturn(Mono.empty());

    assertEquals(0, pipelineRunner.execute());
  }

  @Test
  void execute_serviceFails_wrapsException() {
    // Arrange
    when(resumeScannerService.runPipeline()).thenReturn(Mono.error(new RuntimeException("disk error")));

    // Act & Assert
    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
    assertEquals("Pipeline execution failed", thrown.getMessage());
    assertInstanceOf(RuntimeException.class, thrown.getCause());
  }
}
