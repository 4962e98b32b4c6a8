package dev.careercrawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ends the process with the exit status of a one-shot crawl.
 * Returns without exiting when a test runner is on the class path.
 */
@Slf4j
@Component
public class ExitManager {

  private static final List<String> TEST_RUNNER_MARKERS = List.of("junit", "surefire");

  public void exit(int status) {
    if (runningUnderTestRunner()) {
      log.debug("Test runner detected, not exiting with status {}", status);
      return;
    }
    log.info("Exiting with status {}", status);
    System.exit(status);
  }

  protected boolean runningUnderTestRunner() {
    String classPath = System.getProperty("java.class.path", "");
    return TEST_RUNNER_MARKERS.stream().anyMatch(classPath::contains);
  }
}
