package ca.gc.cra.warper.api;

/**
 * JVM entry point for the warper service.
 *
 * @since WARPER 0.1
 */
public final class Main {
  private Main() {}

  /**
   * Runs the service and exits with its status.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = WarperCli.run(args);
    System.exit(exit.code());
  }
}
