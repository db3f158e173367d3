/*
 * Copyright 2026 The phpcheck Authors.
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


package dev.phpcheck.check;

import static com.google.common.base.Throwables.throwIfUnchecked;

import com.google.common.collect.ImmutableList;
import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.ParseException;
import dev.phpcheck.syntax.Parser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Analyzes PHP files for reads of undefined variables.
 *
 * <p>Each file is read, parsed and checked on its own, so files are processed in parallel when
 * {@link AnalyzerOptions#setNumThreads} allows it. Diagnostics are reported to the {@link
 * ErrorManager} in the order of the inputs.
 */
public class Analyzer implements SourceExcerptProvider {

  public static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("parse.error", "Parse error: {0}");

  public static final DiagnosticType READ_ERROR =
      DiagnosticType.error("read.error", "Cannot read {0}: {1}");

  // The checks recurse once per nesting level of the tree.
  static final long ANALYZER_STACK_SIZE = (1 << 26); // About 64MB

  private static final Logger logger = Logger.getLogger(Analyzer.class.getName());

  private final AnalyzerOptions options;
  private final ErrorManager errorManager;
  private final Map<String, SourceFile> inputsByName = new ConcurrentHashMap<>();

  public Analyzer(AnalyzerOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
  }

  /** Creates an analyzer that prints its diagnostics, with source excerpts, to a logger. */
  public Analyzer(AnalyzerOptions options) {
    this.options = options;
    this.errorManager = new LoggerErrorManager(new LightweightMessageFormatter(this), logger);
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** The checks run on every parsed file, in order. */
  ImmutableList<CheckPass> getChecks() {
    return ImmutableList.of(new UndefinedVariableCheck(options));
  }

  /**
   * Analyzes {@code inputs} and reports what was found to the error manager. A file that cannot
   * be read or parsed gets a single diagnostic; the other files are still analyzed.
   */
  public Result analyze(List<SourceFile> inputs) {
    for (SourceFile input : inputs) {
      inputsByName.put(input.getName(), input);
    }

    List<Callable<ImmutableList<PhpError>>> tasks = new ArrayList<>();
    for (SourceFile input : inputs) {
      tasks.add(() -> analyzeFile(input));
    }

    ExecutorService executor = newExecutorService(options.getNumThreads());
    try {
      for (Future<ImmutableList<PhpError>> future : executor.invokeAll(tasks)) {
        report(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (ExecutionException e) {
      throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    } finally {
      executor.shutdown();
    }

    errorManager.generateReport();
    return new Result(errorManager.getErrors(), errorManager.getWarnings());
  }

  /** Runs the checks on a tree that was already parsed from {@code source}. */
  public ImmutableList<PhpError> analyzeSource(Node root, SourceFile source) {
    ImmutableList.Builder<PhpError> errors = ImmutableList.builder();
    for (CheckPass check : getChecks()) {
      logger.log(Level.FINEST, "Running {0} on {1}", new Object[] {check, source.getName()});
      errors.addAll(check.check(source, root));
    }
    return errors.build();
  }

  private ImmutableList<PhpError> analyzeFile(SourceFile input) {
    String code;
    try {
      code = input.getCode();
    } catch (IOException e) {
      logger.log(Level.FINE, "Cannot read " + input.getName(), e);
      return ImmutableList.of(
          PhpError.builder(READ_ERROR, input.getName(), String.valueOf(e.getMessage()))
              .setSourceLocation(input.getName(), -1, -1)
              .build());
    }

    Node root;
    try {
      logger.fine("Parsing " + input.getName());
      root = Parser.parse(code);
    } catch (ParseException e) {
      logger.log(Level.FINE, "Parse error in " + input.getName(), e);
      return ImmutableList.of(
          PhpError.builder(PARSE_ERROR, e.getMessage()).setOffset(input, e.getOffset()).build());
    }
    ImmutableList<PhpError> errors = analyzeSource(root, input);
    logger.fine(errors.size() + " diagnostic(s) in " + input.getName());
    return errors;
  }

  private void report(ImmutableList<PhpError> errors) {
    for (PhpError error : errors) {
      CheckLevel level = options.getLevel(error);
      if (level.isOn()) {
        errorManager.report(level, error);
      }
    }
  }

  static ExecutorService newExecutorService(int numThreads) {
    AtomicInteger count = new AtomicInteger();
    return Executors.newFixedThreadPool(
        numThreads,
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t =
                new Thread(null, r, "phpcheck-" + count.incrementAndGet(), ANALYZER_STACK_SIZE);
            t.setDaemon(true); // Do not prevent the JVM from exiting.
            return t;
          }
        });
  }

  @Override
  public @Nullable String getSourceLine(String sourceName, int lineNumber) {
    SourceFile input = inputsByName.get(sourceName);
    return input == null ? null : input.getLine(lineNumber);
  }
}
