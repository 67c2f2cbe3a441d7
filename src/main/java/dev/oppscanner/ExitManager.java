package dev.oppscanner;

import org.springframework.stereotype.Component;

/**
 * Ends the process after a batch run.
 * Kept behind a bean so tests can run the batch path without killing the test runner.
 */
@Component
public class ExitManager {
  public void exit(int status) {
    if (!isTest()) {
      System.exit(status);
    }
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
