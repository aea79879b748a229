package dev.schedin.cli;

import dev.schedin.schedule.NextRunCalculator;
import dev.schedin.schedule.ScheduleParser;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "parse",
    description = "Check a scheduling expression and show when it would run next")
public class ParseCommand implements Callable<Integer> {

  @Parameters(
      arity = "1..*",
      paramLabel = "EXPRESSION",
      description = "Scheduling expression, e.g. @every 10 min, @daily, @once 2030-01-01 09:00:00")
  List<String> expression;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  public record ParseOutput(String routine, Long intervalSeconds, Instant nextRunAt) {}

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();

    var schedule = new ScheduleParser().parse(String.join(" ", expression));
    var nextRun = new NextRunCalculator().nextRun(schedule);
    var output =
        new ParseOutput(
            schedule.routine().keyword(), schedule.intervalSeconds().orElse(null), nextRun);
    out.println(SchedinCommand.prettyPrint(output));
    return 0;
  }
}
