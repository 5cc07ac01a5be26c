package com.example.docxcleaner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

@Slf4j
@Service
public class CleanerService {

    private final CleanerProperties props;
    private final CharacterList characters;
    private final ContainerRewriter rewriter;

    /** 上传接口的返回：清理后的字节 + 统计 */
    public static final class CleanedDocument {
        public final byte[] data;
        public final CleanSummary summary;

        public CleanedDocument(byte[] data, CleanSummary summary) {
            this.data = data; this.summary = summary;
        }
    }

    @Autowired
    public CleanerService(CleanerProperties props) throws IOException {
        this(props, loadCharacters(props));
    }

    public CleanerService(CleanerProperties props, CharacterList characters) {
        if (props.getCompressionLevel() < -1 || props.getCompressionLevel() > 9) {
            throw new IllegalArgumentException("docx-cleaner.compression-level must be -1..9: " + props.getCompressionLevel());
        }
        this.props = props;
        this.characters = characters;
        this.rewriter = new ContainerRewriter(props);
    }

    private static CharacterList loadCharacters(CleanerProperties props) throws IOException {
        String file = props.getCharsFile();
        if (file == null || file.trim().isEmpty()) return CharacterListLoader.loadDefault();
        return CharacterListLoader.load(Path.of(file.trim()));
    }

    public CharacterList getCharacters() {
        return characters;
    }

    public CleanSummary clean(Path input, Path output) throws CleanerException {
        CleanSummary summary = rewriter.process(input, output, characters.denylist());
        for (Map.Entry<Integer, Integer> e : summary.getRemovedByCodePoint().entrySet()) {
            log.info("removed {} x {} ({})", e.getValue(), CharacterList.formatCodePoint(e.getKey()),
                    characters.nameOf(e.getKey()));
        }
        for (String w : summary.getWarnings()) log.warn("copied as-is: {}", w);
        return summary;
    }

    /** 上传内容落到临时目录处理，完成后清理临时目录 */
    public CleanedDocument clean(byte[] data, String filename) throws CleanerException {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("docx-cleaner");
        } catch (IOException e) {
            throw new CleanerException(CleanerException.ErrorKind.IO_ERROR, null, "cannot create work directory", e);
        }
        try {
            Path input = workDir.resolve(safeName(filename));
            Files.write(input, data);
            Path output = defaultOutputPath(input);
            CleanSummary summary = clean(input, output);
            return new CleanedDocument(Files.readAllBytes(output), summary);
        } catch (IOException e) {
            throw new CleanerException(CleanerException.ErrorKind.IO_ERROR, null, "upload handling failed", e);
        } finally {
            deleteTree(workDir);
        }
    }

    /** a/b/report.docx -> a/b/report_cleaned.docx */
    public Path defaultOutputPath(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        return parent.resolve(outputFileName(input.getFileName().toString()));
    }

    public String outputFileName(String name) {
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : ".docx";
        return stem + props.getOutputSuffix() + ext;
    }

    private static String safeName(String filename) {
        if (filename == null || filename.trim().isEmpty()) return "upload.docx";
        Path fn = Path.of(filename.replace('\\', '/')).getFileName();
        String n = fn == null ? "" : fn.toString();
        return (n.isEmpty() || n.equals(".") || n.equals("..")) ? "upload.docx" : n;
    }

    private static void deleteTree(Path dir) {
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("failed to clean work directory {}: {}", dir, e.getMessage());
        }
    }
}
