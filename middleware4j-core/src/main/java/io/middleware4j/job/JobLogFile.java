package io.middleware4j.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Unbuffered per-job log file at {@code <dir>/<id>.log}.
 */
final class JobLogFile {
    private static final Logger log = LoggerFactory.getLogger(JobLogFile.class);

    private final Path path;
    private final OutputStream stream;

    private JobLogFile(Path path, OutputStream stream) {
        this.path = path;
        this.stream = stream;
    }

    static JobLogFile open(Path dir, long id) throws IOException {
        Files.createDirectories(dir);
        Path path = dir.resolve(id + ".log");
        OutputStream out = Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new JobLogFile(path, out);
    }

    Path path() {
        return path;
    }

    OutputStream stream() {
        return stream;
    }

    String closeAndExcerpt(int lines) {
        try {
            stream.close();
            List<String> all = Files.readAllLines(path, StandardCharsets.UTF_8);
            int from = Math.max(0, all.size() - Math.max(0, lines));
            return String.join("\n", all.subList(from, all.size()));
        } catch (IOException e) {
            log.warn("job log excerpt unavailable path={} msg={}", path, e.getMessage(), e);
            return null;
        }
    }
}
