package dev.schedin.cli;

import dev.schedin.job.JobRequest;
import dev.schedin.job.JobStatus;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "job",
    description = "Manage scheduled jobs",
    subcommands = {
      CreateCommand.class,
      DeleteCommand.class,
      ListCommand.class,
      GetCommand.class,
      EnableCommand.class,
      DisableCommand.class,
      DueCommand.class,
    })
public class JobCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }
}

@Command(name = "create", description = "Create a job from a JSON job request")
class CreateCommand implements Callable<Integer> {

  static class Source {
    @Parameters(index = "0", paramLabel = "JSON", description = "Job request as JSON")
    String json;

    @Option(
        names = {"-f", "--file"},
        description = "Read the job request from this file")
    Path file;
  }

  @ArgGroup(exclusive = true, multiplicity = "1")
  Source source;

  @Option(
      names = {"-o", "--owner"},
      required = true,
      description = "Owner (user id) of the job")
  UUID owner;

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

    var json =
        source.file != null
            ? Files.readString(source.file, StandardCharsets.UTF_8)
            : source.json;
    var description = JobRequest.fromJson(json).toDescription();
    try (var client = dbOptions.createClient()) {
      var jobId = client.insert(description, owner);
      out.format("Created job %s (%s)%n", description.name(), jobId);
    }
    return 0;
  }
}

@Command(name = "delete", description = "Delete a job and its payload")
class DeleteCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Name of the job to delete")
  String name;

  @Option(
      names = {"-o", "--owner"},
      required = true,
      description = "Owner (user id) of the job")
  UUID owner;

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
    try (var client = dbOptions.createClient()) {
      if (client.delete(owner, name)) {
        out.format("Deleted job %s%n", name);
      } else {
        out.format("Job %s does not exist%n", name);
      }
    }
    return 0;
  }
}

@Command(name = "list", description = "List the jobs of an owner")
class ListCommand implements Callable<Integer> {

  @Option(
      names = {"-o", "--owner"},
      required = true,
      description = "Owner (user id) of the jobs")
  UUID owner;

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
    try (var client = dbOptions.createClient()) {
      out.println(SchedinCommand.prettyPrint(client.listJobs(owner)));
    }
    return 0;
  }
}

@Command(name = "get", description = "Show a job")
class GetCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Name of the job to show")
  String name;

  @Option(
      names = {"-o", "--owner"},
      required = true,
      description = "Owner (user id) of the job")
  UUID owner;

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
    try (var client = dbOptions.createClient()) {
      var job = client.getJob(owner, name);
      if (job.isEmpty()) {
        spec.commandLine().getErr().println("Failed to retrieve job %s".formatted(name));
        return SchedinCommand.EXIT_FAILURE;
      }
      out.println(SchedinCommand.prettyPrint(job.get()));
    }
    return 0;
  }
}

abstract class StatusCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Name of the job")
  String name;

  @Option(
      names = {"-o", "--owner"},
      required = true,
      description = "Owner (user id) of the job")
  UUID owner;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  abstract JobStatus status();

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      if (!client.setStatus(owner, name, status())) {
        spec.commandLine().getErr().println("Job %s does not exist".formatted(name));
        return SchedinCommand.EXIT_FAILURE;
      }
      out.format("Job %s is now %s%n", name, status().dbValue());
    }
    return 0;
  }
}

@Command(
    name = "enable",
    description = "Schedule a job again, computing its next run from its schedule")
class EnableCommand extends StatusCommand {
  @Override
  JobStatus status() {
    return JobStatus.SCHEDULED;
  }
}

@Command(name = "disable", description = "Stop a job from being selected as due")
class DisableCommand extends StatusCommand {
  @Override
  JobStatus status() {
    return JobStatus.DISABLED;
  }
}

@Command(name = "due", description = "List the jobs due within a lookahead window")
class DueCommand implements Callable<Integer> {

  @Option(
      names = {"-l", "--lookahead"},
      description = "Lookahead window in seconds",
      defaultValue = "600")
  long lookahead;

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
    try (var client = dbOptions.createClient()) {
      out.println(SchedinCommand.prettyPrint(client.selectDue(Duration.ofSeconds(lookahead))));
    }
    return 0;
  }
}
