package dev.resumescanner;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExitManagerTest {

  @Test
  void testExitInTestEnvironment() {
    ExitManager exitManager = new ExitManager();
    // Under surefire the classpath check keeps the JVM alive
    exitManager.exit(0);
    exitManager.exit(1);
    assertTrue(exitManager.isTest());
  }
}
