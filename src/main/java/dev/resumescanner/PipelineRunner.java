package dev.resumescanner;

import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.service.ResumeScannerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the resume scanner pipeline once and reports the outcome.
 * Kept apart from the application class so it can be tested without a Spring context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final ResumeScannerService resumeScannerService;

  /**
   * Executes the resume scanner pipeline.
   *
   * @return Number of candidates extracted
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Resume Scanner Starting");
    log.info(SEPARATOR);

    try {
      List<CandidateRecord> candidates = resumeScannerService.runPipeline().block();
      int count = candidates != null ? candidates.size() : 0;

      log.info(SEPARATOR);
      log.info("Resume Scanner Completed Successfully");
      log.info("Candidates extracted: {}", count);
      log.info(SEPARATOR);

      return count;
    } catch (Exception e) {
      log.error("Resume Scanner failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }
}
