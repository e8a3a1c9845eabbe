package dev.resumescanner.source;

import dev.resumescanner.model.ResumeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads {@code *.txt} files from a directory. Text is expected to have been extracted from
 * the original PDFs beforehand; each file name becomes the document's source id.
 */
@Slf4j
@Component
public class DirectoryDocumentSource implements DocumentSource {

    private static final String EXTENSION = ".txt";

    @Value("${scanner.input-dir:resumes}")
    private String inputDir;

    @Override
    public String getName() {
        return "Directory";
    }

    @Override
    public Flux<ResumeDocument> fetchDocuments() {
        Path directory = Path.of(inputDir);
        if (!Files.isDirectory(directory)) {
            log.warn("Input directory {} not found. No resumes to scan.", directory.toAbsolutePath());
            return Flux.empty();
        }

        return Flux.defer(() -> {
                    try {
                        return Flux.fromIterable(listTextFiles(directory));
                    } catch (IOException e) {
                        return Flux.error(new IllegalStateException("Could not list " + directory, e));
                    }
                })
                .flatMapSequential(path -> Mono.fromCallable(() -> read(path))
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnError(e -> log.warn("Could not read {}: {}", path, e.getMessage()))
                        .onErrorResume(IOException.class, e -> Mono.empty()))
                .doOnComplete(() -> log.info("Loaded resumes from {}", directory.toAbsolutePath()));
    }

    private static List<Path> listTextFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION))
                    .sorted()
                    .toList();
        }
    }

    private static ResumeDocument read(Path path) throws IOException {
        return new ResumeDocument(Files.readString(path, StandardCharsets.UTF_8), path.getFileName().toString());
    }
}
