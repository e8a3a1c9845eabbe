package dev.resumescanner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class ResumeScannerApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(ResumeScannerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            pipelineRunner.execute();
            log.info("Resume Scanner exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Resume Scanner failed: {}", e.getMessage());
            exitManager.exit(1);
        }
    }
}
