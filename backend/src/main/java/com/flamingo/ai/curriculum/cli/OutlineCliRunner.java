package com.flamingo.ai.curriculum.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/** Runs {@link OutlineCommand} when the application is started with arguments. */
@Component
@RequiredArgsConstructor
public class OutlineCliRunner implements CommandLineRunner, ExitCodeGenerator {

  private final OutlineCommand outlineCommand;
  private int exitCode;

  @Override
  public void run(String... args) {
    if (args.length == 0) {
      return;
    }
    exitCode = new CommandLine(outlineCommand).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
