package com.consullo.snip.platform;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion.
 *
 * <p>Every KDE/Wayland collaborator talks to the desktop through this seam, so tests can script the desktop's
 * answers without spawning processes.
 *
 * @since 1.0
 */
public interface CommandRunner {

  /**
   * Runs a command and waits for it to exit.
   *
   * @param command program and arguments
   * @param stdin bytes to write to standard input before closing it, or null for none
   * @return exit status and standard output
   * @throws IOException if the process cannot be started or its streams fail
   */
  CommandResult run(List<String> command, byte[] stdin) throws IOException;

  default CommandResult run(final List<String> command) throws IOException {
    return run(command, null);
  }

  /**
   * Runs a command that only consumes input, discarding its output. Suited to programs that fork a background
   * child which keeps the output pipe open.
   *
   * @param command program and arguments
   * @param stdin bytes to write to standard input before closing it
   * @return exit status
   * @throws IOException if the process cannot be started or its input fails
   */
  int feed(List<String> command, byte[] stdin) throws IOException;
}
