package com.flamingo.ai.curriculum;

import java.util.Optional;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Starts the REST service when launched without arguments, or runs one import from the command
 * line and exits with the command's exit code.
 */
@SpringBootApplication
public class CurriculumOutlineApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(CurriculumOutlineApplication.class);
    if (args.length == 0) {
      application.run(args);
      return;
    }
    application.setWebApplicationType(WebApplicationType.NONE);
    profileOf(args).ifPresent(application::setAdditionalProfiles);
    System.exit(SpringApplication.exit(application.run(args)));
  }

  /** Reads {@code --profile NAME} or {@code --profile=NAME} before the context starts. */
  static Optional<String> profileOf(String[] args) {
    for (int i = 0; i < args.length; i++) {
      if (args[i].startsWith("--profile=")) {
        return Optional.of(args[i].substring("--profile=".length())).filter(p -> !p.isBlank());
      }
      if (args[i].equals("--profile") && i + 1 < args.length) {
        return Optional.of(args[i + 1]);
      }
    }
    return Optional.empty();
  }
}
