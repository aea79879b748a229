package dev.schedin.cli;

public class Main {
  public static void main(String[] args) {
    var cmd = SchedinCommand.commandLine();
    var exitCode = cmd.execute(args);
    System.exit(exitCode);
  }
}
