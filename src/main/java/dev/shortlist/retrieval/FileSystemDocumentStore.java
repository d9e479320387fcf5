package dev.shortlist.retrieval;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Documents stored as files in the configured data directory. PDF files are
 * read with PDFBox, HTML with jsoup, anything else as UTF-8 text.
 */
@Slf4j
@Component
public class FileSystemDocumentStore implements DocumentStore {

    private final Path root;

    public FileSystemDocumentStore(EvaluationConfig evaluationConfig) {
        this.root = Paths.get(evaluationConfig.getDataDir()).toAbsolutePath().normalize();
        log.debug("Document store rooted at {}", root);
    }

    @Override
    public List<String> list(Collection<String> extensions) {
        if (!Files.isDirectory(root)) {
            throw new CollaboratorUnavailableException("Document directory not found: " + root);
        }
        try (Stream<Path> files = Files.list(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> hasExtension(name, extensions))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + root, e);
        }
    }

    @Override
    public String readText(String name) throws IOException {
        return Files.readString(resolve(name), StandardCharsets.UTF_8);
    }

    @Override
    public String readPdfText(String name) throws IOException {
        try (PDDocument document = Loader.loadPDF(resolve(name).toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }

    @Override
    public String read(String name) throws IOException {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return readPdfText(name);
        }
        if (lower.endsWith(".html") || lower.endsWith(".htm")) {
            return Jsoup.parse(resolve(name).toFile(), StandardCharsets.UTF_8.name()).wholeText();
        }
        return readText(name);
    }

    private Path resolve(String name) throws NoSuchFileException {
        Path path = root.resolve(name).normalize();
        if (!path.startsWith(root) || !Files.isRegularFile(path)) {
            throw new NoSuchFileException(name);
        }
        return path;
    }

    private static boolean hasExtension(String name, Collection<String> extensions) {
        String lower = name.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(extension -> lower.endsWith(extension.toLowerCase(Locale.ROOT)));
    }
}
