/*
 * Copyright 2026 The Dreadlock Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dreadlock.scan;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.io.ByteStreams;
import com.google.common.io.Files;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.logging.Logger;

/**
 * Normalizes a source file by running it through an external formatter (clang-format) before it
 * is scanned. The formatted text is kept in a temporary file owned by the returned
 * {@link SanitizedSource}.
 */
public final class SourceSanitizer {

  private static final Logger logger = Logger.getLogger(SourceSanitizer.class.getName());

  private final String formatterPath;

  public SourceSanitizer(String formatterPath) {
    this.formatterPath = checkNotNull(formatterPath);
  }

  /**
   * Formats {@code source} and returns a handle on the result. The caller must close the handle,
   * which deletes the temporary file.
   *
   * @throws IOException if the formatter cannot be started or exits with a non-zero status
   */
  public SanitizedSource sanitize(File source) throws IOException {
    logger.fine("Running " + formatterPath + " on " + source);
    Process process =
        new ProcessBuilder(formatterPath, source.getPath())
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();
    byte[] output;
    try (InputStream in = process.getInputStream()) {
      output = ByteStreams.toByteArray(in);
    }
    int status = waitFor(process);
    if (status != 0) {
      throw new IOException(
          "Formatter '" + formatterPath + "' exited with status " + status + " for " + source);
    }

    File temp = File.createTempFile("dreadlock", extensionOf(source));
    SanitizedSource sanitized = new SanitizedSource(temp);
    try {
      Files.asByteSink(temp).write(output);
    } catch (IOException e) {
      sanitized.close();
      throw e;
    }
    return sanitized;
  }

  private static int waitFor(Process process) throws IOException {
    try {
      return process.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      throw new InterruptedIOException("Interrupted while waiting for the formatter");
    }
  }

  private static String extensionOf(File source) {
    String extension = Files.getFileExtension(source.getName());
    return Strings.isNullOrEmpty(extension) ? null : "." + extension;
  }

  /** Formatted text held in a temporary file that is deleted on {@link #close()}. */
  public static final class SanitizedSource implements Closeable {
    private final File file;

    private SanitizedSource(File file) {
      this.file = file;
    }

    public File getFile() {
      return file;
    }

    /** Reads the formatted text, with the same line ending folding as {@link SourceFiles#read}. */
    public String read() throws IOException {
      return SourceFiles.read(file);
    }

    @Override
    public void close() throws IOException {
      java.nio.file.Files.deleteIfExists(file.toPath());
    }
  }
}
