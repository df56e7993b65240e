package org.example.shaker.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitClient} running the {@code git} executable.
 * Failures surface as IOExceptions carrying git's output.
 */
public class ProcessGitClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitClient.class);

    private static final long READER_JOIN_MILLIS = 5000;

    private final String executable;
    private final long timeoutSeconds;

    public ProcessGitClient() {
        this("git", 600);
    }

    public ProcessGitClient(String executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void cloneRepository(String source, Path target) throws IOException {
        run(null, "clone", "--quiet", source, target.toString());
    }

    @Override
    public Optional<String> headSha(Path repository) throws IOException {
        if (!Files.isDirectory(repository.resolve(".git"))) {
            return Optional.empty();
        }
        String sha = run(repository, "rev-parse", "HEAD").trim();
        return sha.isEmpty() ? Optional.empty() : Optional.of(sha);
    }

    @Override
    public void fetch(Path repository) throws IOException {
        run(repository, "fetch", "--quiet", "--tags", "origin");
    }

    @Override
    public void checkout(Path repository, String sha) throws IOException {
        run(repository, "checkout", "--quiet", "--detach", sha);
    }

    private String run(Path workingDirectory, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(Arrays.asList(args));

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");

        log.debug("Running {} in {}", command, workingDirectory != null ? workingDirectory : ".");
        Process process = builder.start();
        OutputCopier copier = new OutputCopier(process.getInputStream());
        copier.start();

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                destroy(process);
                copier.join(READER_JOIN_MILLIS);
                throw new IOException("git " + args[0] + " timeout after " + timeoutSeconds + "s: "
                        + copier.getOutput().trim());
            }
            copier.join(READER_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(process);
            throw new IOException("Interrupted while waiting for git " + args[0], e);
        }

        String output = copier.getOutput();
        if (process.exitValue() != 0) {
            throw new IOException(String.format("git %s failed (exit %d): %s",
                    String.join(" ", args), process.exitValue(), output.trim()));
        }
        return output;
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Drains the merged stdout/stderr of a git process so that {@code waitFor}
     * can time out while git is still writing.
     */
    private static class OutputCopier extends Thread {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        OutputCopier(InputStream in) {
            super("git-output");
            this.in = in;
            setDaemon(true);
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(chunk)) >= 0) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                // stream closes when the process is destroyed
                log.trace("git output stream closed: {}", e.getMessage());
            }
        }

        String getOutput() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
