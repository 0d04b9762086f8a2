package com.consullo.snip.platform;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Synchronous, no timeout; standard error is inherited.
 *
 * @since 1.0
 */
public final class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public CommandResult run(final List<String> command, final byte[] stdin) throws IOException {
    Validate.notEmpty(command, "command must not be empty");

    LOGGER.debug("Running {}", command);
    final Process process = new ProcessBuilder(command)
        .redirectError(ProcessBuilder.Redirect.INHERIT)
        .start();

    try (OutputStream in = process.getOutputStream()) {
      if (stdin != null) {
        in.write(stdin);
      }
    }

    final byte[] stdout;
    try (InputStream out = process.getInputStream()) {
      stdout = out.readAllBytes();
    }
    return new CommandResult(awaitExit(process, command), stdout);
  }

  @Override
  public int feed(final List<String> command, final byte[] stdin) throws IOException {
    Validate.notEmpty(command, "command must not be empty");
    Validate.notNull(stdin, "stdin must not be null");

    LOGGER.debug("Feeding {} bytes to {}", stdin.length, command);
    final Process process = new ProcessBuilder(command)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .redirectError(ProcessBuilder.Redirect.INHERIT)
        .start();
    try (OutputStream in = process.getOutputStream()) {
      in.write(stdin);
    }
    return awaitExit(process, command);
  }

  private static int awaitExit(final Process process, final List<String> command) throws IOException {
    try {
      final int exitCode = process.waitFor();
      LOGGER.debug("{} exited with {}", command.get(0), exitCode);
      return exitCode;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      throw new IOException("Interrupted while waiting for " + command.get(0), e);
    }
  }
}
