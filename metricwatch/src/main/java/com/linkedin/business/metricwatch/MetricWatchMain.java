/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.business.metricwatch.config.MetricWatchConfig;
import com.linkedin.business.metricwatch.detector.ScorerModel;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.config.MetricWatchConfig.readConfig;
import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;

/**
 * The main class to run MetricWatch.
 *
 * <pre>
 *   start metricwatch.properties            Monitor every enabled metric until terminated.
 *   train metricwatch.properties metricId   Train the model of a single metric and exit.
 * </pre>
 */
public final class MetricWatchMain {
  private static final Logger LOG = LoggerFactory.getLogger(MetricWatchMain.class);
  static final String START_COMMAND = "start";
  static final String TRAIN_COMMAND = "train";
  static final String USAGE = String.format("USAGE: java %s %s metricwatch.properties | %s metricwatch.properties metricId",
                                            MetricWatchMain.class.getSimpleName(), START_COMMAND, TRAIN_COMMAND);

  private MetricWatchMain() { }

  /**
   * The main function to run MetricWatch.
   * @param args Arguments passed while starting MetricWatch.
   */
  public static void main(String[] args) {
    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));
    int exitCode = run(args, System.out, System.err);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  /**
   * Run a command. The start command returns once MetricWatch is stopped by the shutdown hook.
   *
   * @param args Command line arguments.
   * @param out Stream for regular output.
   * @param err Stream for errors.
   * @return The exit code.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length < 2) {
      err.println(USAGE);
      return 1;
    }
    try {
      MetricWatchConfig config = readConfig(args[1]);
      switch (args[0]) {
        case START_COMMAND:
          MetricWatchApp app = new MetricWatchApp(config);
          app.registerShutdownHook();
          return startAndAwait(app);
        case TRAIN_COMMAND:
          if (args.length < 3) {
            err.println(USAGE);
            return 1;
          }
          return train(config, args[2], out);
        default:
          err.println("Unknown command " + args[0] + ". " + USAGE);
          return 1;
      }
    } catch (Exception e) {
      LOG.error("Command {} failed.", Arrays.toString(args), e);
      err.println("ERROR: " + e.getMessage());
      return 1;
    }
  }

  /**
   * Start the given app and wait until it is stopped.
   *
   * @param app The app to run.
   * @return The exit code.
   */
  static int startAndAwait(MetricWatchApp app) throws IOException, InterruptedException {
    app.start();
    app.awaitShutdown();
    LOG.info("MetricWatch stopped.");
    return 0;
  }

  private static int train(MetricWatchConfig config, String metricId, PrintStream out) throws Exception {
    MetricWatch metricWatch = new MetricWatch(config, Time.SYSTEM, new MetricRegistry());
    try {
      metricWatch.loadDefinitions();
      ScorerModel model = metricWatch.trainModel(metricId);
      out.printf("Trained model of metric %s on %d samples at %s, training anomaly rate %.4f.%n", metricId,
                 model.sampleCount(), utcDateFor(model.trainedAtMs()), model.trainingAnomalyRate());
      return 0;
    } finally {
      metricWatch.shutdown();
    }
  }
}
