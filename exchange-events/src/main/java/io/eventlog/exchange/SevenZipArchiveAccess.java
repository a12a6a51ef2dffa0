package io.eventlog.exchange;

import io.eventlog.error.SourceAccessException;

import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads entries straight out of a 7z archive through the {@code 7z} command line tool, without extracting to disk.
 */
public class SevenZipArchiveAccess implements ArchiveAccess {
    private static final String PATH_PREFIX = "Path = ";

    private final Path archive;
    private final String executable;

    public SevenZipArchiveAccess(Path archive) {
        this(archive, "7z");
    }

    public SevenZipArchiveAccess(Path archive, String executable) {
        this.archive = archive;
        this.executable = executable;
    }

    @Override
    public String location() { return archive.toString(); }

    @Override
    public List<String> listEntries(Predicate<String> filter) {
        List<String> lines = new ArrayList<>();
        try {
            Path stderr = Files.createTempFile("7z-list", ".err");
            try {
                Process proc = new ProcessBuilder(executable, "l", "-slt", archive.toString())
                        .redirectError(stderr.toFile())
                        .start();
                try (BufferedReader br = new BufferedReader(new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = br.readLine()) != null) lines.add(line);
                }
                int code = proc.waitFor();
                if (code != 0) {
                    throw new SourceAccessException(archive.toString(),
                            "7z list failed (exit " + code + "): " + Files.readString(stderr).strip());
                }
            } finally {
                Files.deleteIfExists(stderr);
            }
        } catch (IOException e) {
            throw new SourceAccessException(archive.toString(), "cannot run " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceAccessException(archive.toString(), "interrupted while listing", e);
        }
        return parseListing(lines).stream().filter(filter).toList();
    }

    /** Pulls entry paths out of {@code 7z l -slt} output. The archive's own path is dropped by the caller's filter. */
    static List<String> parseListing(List<String> lines) {
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith(PATH_PREFIX)) {
                out.add(line.substring(PATH_PREFIX.length()).strip());
            }
        }
        return out;
    }

    @Override
    public InputStream open(String entry) {
        try {
            Path stderr = Files.createTempFile("7z-extract", ".err");
            Process proc = new ProcessBuilder(executable, "e", "-so", archive.toString(), entry)
                    .redirectError(stderr.toFile())
                    .start();
            return new ExtractStream(entry, proc, stderr);
        } catch (IOException e) {
            throw new SourceAccessException(entry, "cannot run " + executable + " on " + archive, e);
        }
    }

    /**
     * Entry bytes from a running extraction. Closing after end of stream checks the exit status; closing early
     * stops the extraction.
     */
    static final class ExtractStream extends FilterInputStream {
        private final String entry;
        private final Process proc;
        private final Path stderr;
        private boolean eof = false;

        ExtractStream(String entry, Process proc, Path stderr) {
            super(proc.getInputStream());
            this.entry = entry;
            this.proc = proc;
            this.stderr = stderr;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b < 0) eof = true;
            return b;
        }

        @Override
        public int read(byte[] buf, int off, int len) throws IOException {
            int n = super.read(buf, off, len);
            if (n < 0) eof = true;
            return n;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
                if (!eof) {
                    proc.destroy();
                    return;
                }
                int code = proc.waitFor();
                if (code != 0) {
                    throw new IOException("7z extract failed for " + entry + " (exit " + code + "): "
                            + Files.readString(stderr).strip());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while extracting " + entry, e);
            } finally {
                Files.deleteIfExists(stderr);
            }
        }
    }
}
