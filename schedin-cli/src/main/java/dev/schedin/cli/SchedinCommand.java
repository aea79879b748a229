package dev.schedin.cli;

import dev.schedin.SchedinClient;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.exceptions.SchedinScheduleException;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "schedin",
    description = "Schedin CLI stores scheduled jobs and reports the ones that are due",
    mixinStandardHelpOptions = true,
    subcommands = {
      MigrateCommand.class,
      ResetCommand.class,
      ParseCommand.class,
      JobCommand.class,
      PollCommand.class
    },
    versionProvider = SchedinCommand.class)
public class SchedinCommand implements Runnable, IVersionProvider {

  static final int EXIT_FAILURE = 1;

  private static final ObjectMapper mapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  /** Command line that reports schedule and storage failures as an error message. */
  public static CommandLine commandLine() {
    var cmd = new CommandLine(new SchedinCommand());
    // scheduling expressions start with '@'
    cmd.setExpandAtFiles(false);
    cmd.setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          if (ex instanceof SchedinScheduleException
              || ex instanceof SchedinCrudException
              || ex instanceof IllegalArgumentException) {
            commandLine.getErr().println("Error: " + ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
          }
          throw ex;
        });
    return cmd;
  }

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    var pkg = SchedinClient.class.getPackage();
    var ver = pkg == null ? null : pkg.getImplementationVersion();
    return new String[] {
      "${COMMAND-FULL-NAME} "
          + (ver == null ? "<unknown version>" : "v%s".formatted(ver))
    };
  }

  public static String prettyPrint(Object object) {
    var writer = mapper.writerWithDefaultPrettyPrinter();
    try {
      return writer.writeValueAsString(Objects.requireNonNull(object));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static boolean confirm(String prompt) {
    try (var scanner = new Scanner(System.in)) {
      System.out.print(prompt);
      if (!scanner.hasNextLine()) {
        return false;
      }
      String input = scanner.nextLine();
      return input.equalsIgnoreCase("y") || input.equalsIgnoreCase("yes");
    }
  }
}
