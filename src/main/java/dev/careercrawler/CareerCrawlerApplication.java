package dev.careercrawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class CareerCrawlerApplication implements CommandLineRunner {

  private final PipelineRunner pipelineRunner;
  private final ExitManager exitManager;

  @Value("${scanner.run-once:true}")
  private boolean runOnce = true;

  public CareerCrawlerApplication(PipelineRunner pipelineRunner, ExitManager exitManager) {
    this.pipelineRunner = pipelineRunner;
    this.exitManager = exitManager;
  }

  public static void main(String[] args) {
    SpringApplication.run(CareerCrawlerApplication.class, args);
  }

  @Override
  public void run(String... args) {
    if (!runOnce) {
      log.info("Career crawler started in service mode. Waiting for scheduled runs.");
      return;
    }

    try {
      pipelineRunner.execute();
      log.info("Career crawler exiting...");
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("Career crawler failed: {}", e.getMessage(), e);
      exitManager.exit(1);
    }
  }
}
