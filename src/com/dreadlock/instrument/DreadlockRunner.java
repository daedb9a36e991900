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

package com.dreadlock.instrument;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.dreadlock.scan.ScopeMap;
import com.dreadlock.scan.ScopeScanner;
import com.dreadlock.scan.SourceFiles;
import com.dreadlock.scan.SourceSanitizer;
import com.dreadlock.scan.SourceSanitizer.SanitizedSource;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Main binary: instruments C++ files with Dreadlock deadlock bookkeeping, or reverts the
 * instrumentation.
 *
 * <pre>
 * dreadlock [options] file_or_glob...
 * </pre>
 */
public final class DreadlockRunner {

  private static final Logger logger = Logger.getLogger(DreadlockRunner.class.getName());

  /** Parent of every logger in the project; kept strongly reachable so its level sticks. */
  private static final Logger projectLogger = Logger.getLogger("com.dreadlock");

  static final DiagnosticType NO_INPUTS =
      DiagnosticType.error("DREADLOCK_NO_INPUTS", "No files specified!  Nothing to do!");

  static final DiagnosticType MISSING_INPUT =
      DiagnosticType.error("DREADLOCK_MISSING_INPUT", "File ''{0}'' does not exist!");

  static final DiagnosticType MALFORMED_MUTEX =
      DiagnosticType.error("DREADLOCK_MALFORMED_MUTEX", "{0}");

  static final DiagnosticType IO_FAILURE =
      DiagnosticType.error("DREADLOCK_IO_FAILURE", "Cannot process ''{0}'': {1}");

  static final DiagnosticType NO_REVERT_MARKERS =
      DiagnosticType.warning(
          "DREADLOCK_NO_REVERT_MARKERS",
          "No revert markers were found in ''{0}''! (Did you explicitly disable revert for this"
              + " file?)");

  @Option(name = "--help", usage = "Displays this message on stdout and exits")
  private boolean displayHelp = false;

  @Option(
      name = "--indent",
      aliases = {"-i"},
      usage = "Indent used for each scope level of added statements. \\t and <tab> stand for a"
          + " tab.")
  private String indent = InstrumentOptions.DEFAULT_INDENT;

  @Option(
      name = "--apply",
      aliases = {"-a"},
      usage = "Instrument each file to use Dreadlock (the default).")
  private boolean apply = true;

  @Option(
      name = "--revert",
      aliases = {"-r"},
      usage = "Reverse the Dreadlock instrumentation of each file.")
  private boolean revert = false;

  @Option(
      name = "--disable_revert",
      aliases = {"-R"},
      usage = "Instrument files without the ability to revert the changes.")
  private boolean disableRevert = false;

  @Option(
      name = "--overwrite",
      aliases = {"-o"},
      usage = "Overwrite each file with the result instead of printing it.")
  private boolean overwrite = false;

  @Option(
      name = "--debug",
      aliases = {"-d"},
      usage = "Print the scope map of each file instead of instrumenting it.")
  private boolean debug = false;

  @Option(
      name = "--sanitize",
      aliases = {"-s"},
      usage = "Run each file through clang-format before processing. The CLANG_FORMAT_EXE"
          + " environment variable overrides the executable.")
  private boolean sanitize = false;

  @Option(
      name = "--exclude",
      aliases = {"-x"},
      usage = "Mutex name or file to leave alone. A path to an existing file is read as a list"
          + " of names, one per line. You may specify multiple.")
  private List<String> excludes = new ArrayList<>();

  @Option(
      name = "--align",
      aliases = {"-A"},
      usage = "Align added statements with the first indented line of their scope, if possible.")
  private boolean align = false;

  @Option(
      name = "--dry_run",
      aliases = {"-D"},
      usage = "Perform all processing, but do not generate output.")
  private boolean dryRun = false;

  @Option(
      name = "--verbose",
      aliases = {"-v"},
      usage = "Trace every rewritten site and added statement.")
  private boolean verbose = false;

  @Argument private List<String> arguments = new ArrayList<>();

  private final PrintStream out;
  private final PrintStream err;
  private final ErrorManager errorManager;
  private final Map<String, String> environment;
  private final ScopeScanner scanner = new ScopeScanner();

  @VisibleForTesting
  DreadlockRunner(PrintStream out, PrintStream err, Map<String, String> environment) {
    this.out = out;
    this.err = err;
    this.errorManager = new PrintStreamErrorManager(err);
    this.environment = ImmutableMap.copyOf(environment);
  }

  /** Runs the tool and returns the process exit status. */
  @VisibleForTesting
  int doMain(String[] args) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return 1;
    }
    if (displayHelp) {
      parser.printUsage(out);
      return 0;
    }
    projectLogger.setLevel(verbose ? Level.FINE : Level.INFO);
    if (verbose) {
      enableTraceOutput();
    }

    InstrumentOptions options;
    List<String> modules;
    try {
      options = createOptions();
      modules = findSourceFiles(arguments);
    } catch (IllegalArgumentException | IOException e) {
      err.println(e.getMessage());
      return 1;
    }
    if (modules.isEmpty()) {
      return finish(DreadlockError.make(NO_INPUTS));
    }

    for (String module : modules) {
      File file = new File(module);
      if (!file.exists()) {
        return finish(DreadlockError.forFile(module, MISSING_INPUT, module));
      }
      if (options.isExcludedFile(module)) {
        logger.info("Excluding file '" + module + "'.");
        continue;
      }
      try {
        if (revert || !apply) {
          revertFile(file, options);
        } else {
          instrumentFile(file, options);
        }
      } catch (MalformedMutexException e) {
        errorManager.report(
            CheckLevel.ERROR,
            DreadlockError.forLine(module, e.getLineNumber(), MALFORMED_MUTEX, e.getMessage()));
      } catch (IOException e) {
        errorManager.report(
            CheckLevel.ERROR, DreadlockError.forFile(module, IO_FAILURE, module, e.getMessage()));
      }
    }
    return finish(null);
  }

  private int finish(@Nullable DreadlockError fatal) {
    if (fatal != null) {
      errorManager.report(fatal.defaultLevel(), fatal);
    }
    errorManager.generateReport();
    return errorManager.getErrorCount() == 0 ? 0 : 1;
  }

  @VisibleForTesting
  InstrumentOptions createOptions() throws IOException {
    InstrumentOptions options = new InstrumentOptions();
    options.setIndent(InstrumentOptions.parseIndent(indent));
    options.setAlign(align);
    options.setDisableRevert(disableRevert);
    options.setExcludes(InstrumentOptions.expandExcludes(excludes));
    options.setDryRun(dryRun);
    options.setOverwrite(overwrite);
    options.setDebug(debug);
    options.setSanitize(sanitize);
    if (sanitize) {
      options.setFormatterPath(
          InstrumentOptions.resolveFormatterPath(environment, System.getProperty("os.name", "")));
    }
    return options;
  }

  private void instrumentFile(File file, InstrumentOptions options) throws IOException {
    if (options.isSanitize()) {
      try (SanitizedSource sanitized =
          new SourceSanitizer(options.getFormatterPath()).sanitize(file)) {
        instrumentText(file, sanitized.read(), options);
      }
    } else {
      instrumentText(file, SourceFiles.read(file), options);
    }
  }

  private void instrumentText(File file, String text, InstrumentOptions options)
      throws IOException {
    ScopeMap map = scanner.scan(text);
    if (options.isDebug()) {
      out.print(map.toDebugString());
      return;
    }
    InstrumentResult result = new Instrumenter(options).instrument(file.getPath(), map);
    if (!result.isChanged()) {
      logger.info("'" + file + "' was not modified.");
      return;
    }
    emit(file, result.toText(), options);
    logger.info(
        "Instrumented '"
            + file
            + "': "
            + result.getRewrittenSites()
            + " site(s) rewritten, "
            + result.getSyntheticStatements()
            + " statement(s) added.");
  }

  private void revertFile(File file, InstrumentOptions options) throws IOException {
    RevertResult result = new Reverter().revert(SourceFiles.read(file));
    if (!result.foundMarkers()) {
      errorManager.report(
          CheckLevel.WARNING, DreadlockError.forFile(file.getPath(), NO_REVERT_MARKERS, file));
      return;
    }
    emit(file, result.toText(), options);
    logger.info("Reverted " + result.getRevertedLines() + " line(s) of '" + file + "'.");
  }

  private void emit(File file, String text, InstrumentOptions options) throws IOException {
    if (options.isDryRun()) {
      return;
    }
    if (options.isOverwrite()) {
      Files.asCharSink(file, UTF_8).write(text);
    } else {
      out.print(text);
    }
  }

  private static void enableTraceOutput() {
    for (java.util.logging.Handler handler : projectLogger.getHandlers()) {
      if (handler instanceof ConsoleHandler) {
        return;
      }
    }
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    projectLogger.addHandler(handler);
    projectLogger.setUseParentHandlers(false);
  }

  /**
   * Returns the files named by {@code patterns}, in order and without duplicates. A pattern
   * holding {@code *} or {@code ?} is a glob, where {@code **} crosses directories; a glob that
   * matches nothing, like any other pattern, is taken as a plain file name.
   */
  @VisibleForTesting
  static ImmutableList<String> findSourceFiles(Collection<String> patterns) throws IOException {
    // Normalized absolute path to the path as given.
    Map<String, String> inputs = new LinkedHashMap<>();
    for (String pattern : patterns) {
      if (!isGlob(pattern) || !matchPaths(pattern, inputs)) {
        inputs.putIfAbsent(absolute(new File(pattern).toPath()), pattern);
      }
    }
    return ImmutableList.copyOf(inputs.values());
  }

  private static boolean isGlob(String pattern) {
    return pattern.contains("*") || pattern.contains("?");
  }

  private static boolean matchPaths(String pattern, final Map<String, String> inputs)
      throws IOException {
    FileSystem fs = FileSystems.getDefault();
    String separator = File.separator.equals("\\") ? "\\\\" : File.separator;

    // Split the pattern into the non-globbing prefix and the globbing rest.
    List<String> patternParts = Splitter.on(File.separator).splitToList(pattern);
    String prefix = ".";
    String glob = pattern;
    for (int i = 0; i < patternParts.size(); i++) {
      if (isGlob(patternParts.get(i))) {
        if (i > 0) {
          prefix = Joiner.on(separator).join(patternParts.subList(0, i));
          glob = Joiner.on(separator).join(patternParts.subList(i, patternParts.size()));
        }
        break;
      }
    }
    Path root = fs.getPath(prefix.isEmpty() ? separator : prefix);
    if (!java.nio.file.Files.isDirectory(root)) {
      return false;
    }

    final PathMatcher matcher = fs.getPathMatcher("glob:" + prefix + separator + glob);
    final List<Path> matches = new ArrayList<>();
    java.nio.file.Files.walkFileTree(
        root,
        new SimpleFileVisitor<Path>() {
          @Override
          public FileVisitResult visitFile(Path p, BasicFileAttributes attrs) {
            if (matcher.matches(p) || matcher.matches(p.normalize())) {
              matches.add(p);
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException e) {
            return FileVisitResult.SKIP_SUBTREE;
          }
        });
    for (Path match : matches) {
      inputs.putIfAbsent(absolute(match), match.toString());
    }
    return !matches.isEmpty();
  }

  private static String absolute(Path path) {
    return path.normalize().toAbsolutePath().toString();
  }

  public static void main(String[] args) {
    DreadlockRunner runner = new DreadlockRunner(System.out, System.err, System.getenv());
    System.exit(runner.doMain(args));
  }
}
