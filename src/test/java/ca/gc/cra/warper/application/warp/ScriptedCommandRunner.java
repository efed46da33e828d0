package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.CommandRunner;
import ca.gc.cra.warper.domain.warp.CommandResult;
import ca.gc.cra.warper.domain.warp.FailureKind;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Returns queued results in order and records every argument vector; succeeds once the script runs out. */
final class ScriptedCommandRunner implements CommandRunner {
  final List<List<String>> invocations = new CopyOnWriteArrayList<>();
  private final Deque<CommandResult> script = new ArrayDeque<>();

  ScriptedCommandRunner thenSucceed() {
    script.add(CommandResult.success("File reprojected in 0.1 seconds.", Duration.ofMillis(100)));
    return this;
  }

  ScriptedCommandRunner thenFail(FailureKind kind, String message) {
    script.add(CommandResult.failure(kind, message, Duration.ofMillis(5)));
    return this;
  }

  @Override
  public synchronized CommandResult run(List<String> argv) {
    invocations.add(List.copyOf(argv));
    CommandResult next = script.poll();
    return next != null ? next : CommandResult.success("ok", Duration.ZERO);
  }
}
