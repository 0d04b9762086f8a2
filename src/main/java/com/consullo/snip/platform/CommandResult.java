package com.consullo.snip.platform;

import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.Validate;

/**
 * Outcome of one external command.
 *
 * @param exitCode process exit status
 * @param stdout everything the process wrote to standard output
 * @since 1.0
 */
public record CommandResult(int exitCode, byte[] stdout) {

  public CommandResult {
    Validate.notNull(stdout, "stdout must not be null");
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  /**
   * Standard output decoded as UTF-8 and trimmed.
   *
   * @return text output
   */
  public String text() {
    return new String(stdout, StandardCharsets.UTF_8).trim();
  }
}
