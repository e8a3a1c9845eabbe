package dev.resumescanner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns the call to System.exit so that tests can run the application without killing the JVM.
 */
@Slf4j
@Component
public class ExitManager {
  public void exit(int status) {
    if (isTest()) {
      log.debug("Test run detected, not exiting with status {}", status);
      return;
    }
    System.exit(status);
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
