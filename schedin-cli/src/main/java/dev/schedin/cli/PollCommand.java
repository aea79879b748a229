package dev.schedin.cli;

import dev.schedin.job.Job;
import dev.schedin.polling.DuePoller;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "poll",
    description = "Periodically print the jobs that are due, until interrupted")
public class PollCommand implements Callable<Integer> {

  @Option(
      names = {"-i", "--interval"},
      description = "Seconds between polls",
      defaultValue = "60")
  long interval;

  @Option(
      names = {"-l", "--lookahead"},
      description = "Lookahead window in seconds",
      defaultValue = "600")
  long lookahead;

  @Option(
      names = {"--once"},
      description = "Poll a single time and exit")
  boolean once;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();

    try (var client = dbOptions.createClient();
        var poller =
            new DuePoller(
                client::selectDue,
                Duration.ofSeconds(interval),
                Duration.ofSeconds(lookahead),
                jobs -> print(out, jobs))) {
      if (once) {
        poller.poll();
        return 0;
      }

      var stopped = new CountDownLatch(1);
      Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown));
      out.format("Polling every %ds for jobs due within %ds%n", interval, lookahead);
      out.flush();
      poller.start();
      stopped.await();
    }
    return 0;
  }

  private static void print(PrintWriter out, List<Job> jobs) {
    for (var job : jobs) {
      out.format(
          "%s\t%s\t%s\t%s\t%s%n",
          job.nextRunAt(), job.userId(), job.name(), job.type().dbValue(), job.schedule());
    }
    out.flush();
  }
}
