package ca.gc.cra.warper.application.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warper.domain.warp.FailureKind;
import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.domain.warp.WorkItem;
import ca.gc.cra.warper.domain.warp.WorkResult;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class ReprojectionStepTest {
  private final ScriptedCommandRunner runner = new ScriptedCommandRunner();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ReprojectionStep step =
      new ReprojectionStep(runner, new WarpCommandBuilder("tool", "addo-tool"), metrics);

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ReprojectionStep.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void reprojectsThenAddsOverviewsAndReportsOutput() throws Exception {
    WorkItem item = geosItem(List.of(2, 4, 8));

    WorkResult result = step.execute(item);

    assertEquals(
        List.of(
            List.of("tool", "-t_srs", "EPSG:4326", "/in/a.tif", "/out/a.tif"),
            List.of("addo-tool", "/out/a.tif", "2", "4", "8")),
        runner.invocations);
    assertTrue(result.succeeded());
    assertEquals("/out/a.tif", result.output().orElseThrow().uri());
    assertEquals("a.tif", result.output().orElseThrow().uid());
    assertEquals(2, metrics.observations("warper.command.latencyNanos").size());
  }

  @Test
  void failedReprojectionSkipsOverviewsAndLogsStderr() throws Exception {
    runner.thenFail(FailureKind.EXTERNAL_TOOL_ERROR, "bad projection\n");

    WorkResult result = step.execute(geosItem(List.of(2, 4, 8)));

    assertFalse(result.succeeded());
    assertEquals(FailureKind.EXTERNAL_TOOL_ERROR, result.failure().orElseThrow());
    assertEquals(1, runner.invocations.size(), "overview step must not run");
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getLevel() == Level.ERROR && e.getFormattedMessage().contains("bad projection")));
  }

  @Test
  void missingExecutableIsReportedWithItsKind() throws Exception {
    runner.thenFail(FailureKind.EXECUTABLE_NOT_FOUND, "Command 'tool' not found");

    WorkResult result = step.execute(geosItem(List.of()));

    assertEquals(FailureKind.EXECUTABLE_NOT_FOUND, result.failure().orElseThrow());
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("Command 'tool' not found")));
  }

  @Test
  void overviewFailureDropsTheOutput() throws Exception {
    runner.thenSucceed().thenFail(FailureKind.EXTERNAL_TOOL_ERROR, "addo exploded");

    WorkResult result = step.execute(geosItem(List.of(2)));

    assertEquals(FailureKind.OVERVIEW_GENERATION_ERROR, result.failure().orElseThrow());
    assertTrue(result.output().isEmpty());
    assertEquals(2, runner.invocations.size());
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getLevel() == Level.ERROR && e.getFormattedMessage().contains("addo exploded")));
  }

  @Test
  void emptyOverviewListRunsOnlyTheReprojection() throws Exception {
    WorkResult result = step.execute(geosItem(List.of()));

    assertTrue(result.succeeded());
    assertEquals(1, runner.invocations.size());
  }

  @Test
  void restoresMdcAfterExecution() throws Exception {
    MDC.remove(ReprojectionStep.MDC_URI);
    runner.thenFail(FailureKind.EXTERNAL_TOOL_ERROR, "boom");

    step.execute(geosItem(List.of()));

    ILoggingEvent error = appender.list.stream()
        .filter(e -> e.getLevel() == Level.ERROR)
        .findFirst()
        .orElseThrow();
    assertEquals("/in/a.tif", error.getMDCPropertyMap().get(ReprojectionStep.MDC_URI));
    assertNull(MDC.get(ReprojectionStep.MDC_URI));
  }

  private static WorkItem geosItem(List<Integer> overviews) {
    return new WorkItem(
        "/in/a.tif",
        Path.of("/out"),
        List.of(ToolOption.tokens("t_srs", "EPSG:4326")),
        overviews,
        Map.of("uri", "/in/a.tif"));
  }
}
