package ca.gc.cra.warper.infrastructure.process;

import ca.gc.cra.warper.application.port.CommandRunner;
import ca.gc.cra.warper.domain.warp.CommandResult;
import ca.gc.cra.warper.domain.warp.FailureKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CommandRunner} that starts external tools through {@link ProcessBuilder}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discard standard output and collect standard error on a helper thread.</li>
 *   <li>Map a missing executable to {@link FailureKind#EXECUTABLE_NOT_FOUND} and non-zero exits to
 *   {@link FailureKind#EXTERNAL_TOOL_ERROR} carrying the stderr text.</li>
 *   <li>Optionally destroy commands that run past a timeout ({@link FailureKind#TIMED_OUT}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration; safe for concurrent workers.</p>
 *
 * @since WARPER 0.1
 */
public final class ProcessCommandRunner implements CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);
  private static final Duration DESTROY_GRACE = Duration.ofSeconds(5);

  private final Optional<Duration> timeout;
  private final Duration stderrGrace;

  /** Creates a runner that waits for commands without a time limit. */
  public ProcessCommandRunner() {
    this(Optional.empty());
  }

  /**
   * Creates a runner with an optional per-command timeout.
   *
   * @param timeout maximum run time; empty waits indefinitely
   */
  public ProcessCommandRunner(Optional<Duration> timeout) {
    this(timeout, DESTROY_GRACE);
  }

  ProcessCommandRunner(Optional<Duration> timeout, Duration stderrGrace) {
    this.timeout = Objects.requireNonNullElse(timeout, Optional.<Duration>empty())
        .filter(d -> !d.isZero() && !d.isNegative());
    this.stderrGrace = Objects.requireNonNull(stderrGrace, "stderrGrace");
  }

  @Override
  public CommandResult run(List<String> argv) throws InterruptedException {
    Objects.requireNonNull(argv, "argv");
    if (argv.isEmpty()) {
      throw new IllegalArgumentException("argv must not be empty");
    }
    String program = argv.get(0);
    long start = System.nanoTime();
    Process process;
    try {
      process = new ProcessBuilder(argv)
          .redirectOutput(ProcessBuilder.Redirect.DISCARD)
          .start();
    } catch (IOException ex) {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      if (isNotFound(ex)) {
        return CommandResult.failure(
            FailureKind.EXECUTABLE_NOT_FOUND, "Command '" + program + "' not found", elapsed);
      }
      return CommandResult.failure(
          FailureKind.EXTERNAL_TOOL_ERROR, "Command '" + program + "' could not be started: " + ex.getMessage(), elapsed);
    }

    StderrCollector stderr = StderrCollector.start(process.getErrorStream(), program);
    try {
      if (timeout.isPresent()) {
        if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Command '{}' exceeded {} ms; destroying", program, timeout.get().toMillis());
          process.destroyForcibly();
          process.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS);
          stderr.await(stderrGrace);
          return CommandResult.failure(
              FailureKind.TIMED_OUT,
              "Command '" + program + "' timed out after " + timeout.get().toSeconds() + " seconds",
              Duration.ofNanos(System.nanoTime() - start));
        }
      } else {
        process.waitFor();
      }
    } catch (InterruptedException ex) {
      process.destroy();
      throw ex;
    }

    String errorText = stderr.await(stderrGrace);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    int exitCode = process.exitValue();
    if (exitCode != 0) {
      log.debug("Command '{}' exited with status {}", program, exitCode);
      return CommandResult.failure(FailureKind.EXTERNAL_TOOL_ERROR, errorText, elapsed);
    }
    return CommandResult.success(
        String.format(Locale.ROOT, "File reprojected in %.1f seconds.", elapsed.toMillis() / 1000d),
        elapsed);
  }

  private static boolean isNotFound(IOException ex) {
    String message = ex.getMessage();
    // ProcessBuilder reports ENOENT as "error=2"; Windows uses "CreateProcess error=2".
    return message != null && message.contains("error=2");
  }

  private static final class StderrCollector {
    private final Thread thread;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final String program;

    private StderrCollector(InputStream stream, String program) {
      this.program = program;
      this.thread = new Thread(() -> drain(stream), "warper-stderr-" + program);
      this.thread.setDaemon(true);
    }

    static StderrCollector start(InputStream stream, String program) {
      StderrCollector collector = new StderrCollector(stream, program);
      collector.thread.start();
      return collector;
    }

    private void drain(InputStream stream) {
      byte[] chunk = new byte[4096];
      try (InputStream in = stream) {
        int read;
        while ((read = in.read(chunk)) != -1) {
          synchronized (buffer) {
            buffer.write(chunk, 0, read);
          }
        }
      } catch (IOException ex) {
        log.debug("Stopped reading stderr: {}", ex.getMessage());
      }
    }

    String await(Duration limit) throws InterruptedException {
      thread.join(limit.toMillis());
      if (thread.isAlive()) {
        log.warn("stderr of '{}' still open after {} ms; captured output may be incomplete", program, limit.toMillis());
      }
      synchronized (buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
      }
    }
  }
}
