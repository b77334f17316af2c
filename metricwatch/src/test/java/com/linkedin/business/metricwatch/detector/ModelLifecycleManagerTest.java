/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.business.metricwatch.baseline.BaselineStore;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.MetricDefinitionRegistry;
import com.linkedin.business.metricwatch.registry.Severity;
import com.linkedin.metricwatch.exception.ModelTrainingException;
import com.linkedin.metricwatch.exception.NotEnoughSamplesException;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.io.File;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.alternating;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.metricDefinition;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.percentageAlert;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.samples;
import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.MODEL_STORE_DIRECTORY_CONFIG;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Unit test for {@link ModelLifecycleManager}.
 */
public class ModelLifecycleManagerTest {
  private static final long START_MS = 1_700_000_000_000L;
  private static final long RETRAIN_INTERVAL_MS = TimeUnit.HOURS.toMillis(1);
  private static final int RETRAIN_MIN_NEW_SAMPLES = 5;
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private MockTime _time;
  private MetricDefinitionRegistry _registry;
  private BaselineStore _store;
  private AnomalyScorer _scorer;
  private MetricWatchSensors _sensors;
  private ModelLifecycleManager _manager;
  private MetricDefinition _definition;

  @Before
  public void setUp() {
    _time = new MockTime(0, START_MS, 0);
    _registry = new MetricDefinitionRegistry(_time);
    _definition = metricDefinition("orders", percentageAlert(Severity.HIGH));
    _registry.put(_definition);
    _store = new BaselineStore(id -> _registry.get(id).map(MetricDefinition::historical).orElse(null));
    _scorer = new AnomalyScorer(ZoneOffset.UTC, _time);
    _sensors = new MetricWatchSensors(new MetricRegistry());
    _manager = new ModelLifecycleManager(_scorer, _store, _registry, _time, RETRAIN_INTERVAL_MS, RETRAIN_MIN_NEW_SAMPLES,
                                         _sensors);
  }

  private void appendValues(int count) {
    double[] values = new double[count];
    for (int i = 0; i < count; i++) {
      values[i] = 100.0 + (i * 7) % 11;
    }
    _store.appendAll("orders", samples(_time.milliseconds(), values));
  }

  @Test
  public void testUntrainedUntilMinimumSamples() {
    appendValues(29);
    assertEquals(ModelState.UNTRAINED, _manager.check(_definition));
    assertNull(_scorer.model("orders"));

    appendValues(1);
    assertEquals(ModelState.TRAINED, _manager.check(_definition));
    assertEquals(30, _scorer.model("orders").sampleCount());
    assertEquals(1L, _sensors.modelTrainings().getCount());
  }

  @Test
  public void testStaleAfterRetrainInterval() {
    appendValues(30);
    _manager.check(_definition);
    ScorerModel first = _scorer.model("orders");

    _time.sleep(RETRAIN_INTERVAL_MS - 1);
    assertEquals(ModelState.TRAINED, _manager.check(_definition));
    assertSame(first, _scorer.model("orders"));

    _time.sleep(1);
    assertEquals(ModelState.TRAINED, _manager.check(_definition));
    assertNotSame(first, _scorer.model("orders"));
    assertEquals(START_MS + RETRAIN_INTERVAL_MS, _scorer.model("orders").trainedAtMs());
  }

  @Test
  public void testStaleAfterNewSamples() {
    appendValues(30);
    _manager.check(_definition);
    ScorerModel first = _scorer.model("orders");

    appendValues(RETRAIN_MIN_NEW_SAMPLES - 1);
    _manager.check(_definition);
    assertSame(first, _scorer.model("orders"));

    appendValues(1);
    _manager.check(_definition);
    ScorerModel second = _scorer.model("orders");
    assertNotSame(first, second);
    assertEquals(30L + RETRAIN_MIN_NEW_SAMPLES, second.baselineSequence());
  }

  @Test
  public void testFailedRetrainKeepsPreviousModel() {
    appendValues(30);
    _manager.check(_definition);
    ScorerModel first = _scorer.model("orders");

    // The window drops below the minimum, so the retrain of the stale model fails.
    _store.clear("orders");
    appendValues(3);
    _manager.definitionChanged("orders");
    assertEquals(ModelState.STALE, _manager.state("orders"));
    assertEquals(ModelState.STALE, _manager.check(_definition));
    try {
      _manager.trainNow("orders");
      fail("Should throw NotEnoughSamplesException");
    } catch (NotEnoughSamplesException e) {
      assertEquals(3, e.available());
    } catch (ModelTrainingException e) {
      fail("Unexpected exception " + e);
    }
    assertSame(first, _scorer.model("orders"));
    assertEquals(ModelState.STALE, _manager.state("orders"));

    appendValues(30);
    assertEquals(ModelState.TRAINED, _manager.check(_definition));
    assertNotSame(first, _scorer.model("orders"));
  }

  @Test
  public void testTrainNowUnknownMetric() throws Exception {
    try {
      _manager.trainNow("unknown");
      fail("Should throw IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("unknown"));
    }
  }

  @Test
  public void testTrainNowDisabledMetric() throws Exception {
    _registry.put(_definition.withEnabled(false));
    appendValues(30);
    try {
      _manager.trainNow("orders");
      fail("Should throw IllegalStateException");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("disabled"));
    }
    assertNull(_scorer.model("orders"));
    assertEquals(ModelState.UNTRAINED, _manager.state("orders"));
    assertEquals(0L, _sensors.modelTrainings().getCount());
  }

  @Test
  public void testCheckDoesNotInstallModelOfRemovedMetric() {
    appendValues(30);
    // A worker still holding the old definition checks after the metric is deleted.
    _registry.remove("orders");
    assertEquals(ModelState.UNTRAINED, _manager.check(_definition));
    assertNull(_scorer.model("orders"));
    assertEquals(0, _manager.retrainAll());
  }

  @Test
  public void testRemoveWaitsForOngoingTraining() throws Exception {
    appendValues(30);
    CountDownLatch trainingStarted = new CountDownLatch(1);
    CountDownLatch releaseTraining = new CountDownLatch(1);
    AnomalyScorer slowScorer = new AnomalyScorer(ZoneOffset.UTC, _time) {
      @Override
      public ScorerModel train(MetricDefinition definition, List<Sample> window, long baselineSequence)
          throws NotEnoughSamplesException, ModelTrainingException {
        trainingStarted.countDown();
        try {
          releaseTraining.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return super.train(definition, window, baselineSequence);
      }
    };
    ModelLifecycleManager manager = new ModelLifecycleManager(slowScorer, _store, _registry, _time, RETRAIN_INTERVAL_MS,
                                                              RETRAIN_MIN_NEW_SAMPLES, _sensors);
    Thread trainer = new Thread(() -> manager.check(_definition));
    trainer.start();
    assertTrue(trainingStarted.await(10, TimeUnit.SECONDS));

    Thread remover = new Thread(() -> {
      _registry.remove("orders");
      manager.remove("orders");
    });
    remover.start();
    Thread.sleep(100);
    assertTrue(remover.isAlive());

    releaseTraining.countDown();
    trainer.join(10000);
    remover.join(10000);
    assertFalse(remover.isAlive());
    assertNull(slowScorer.model("orders"));
    assertEquals(ModelState.UNTRAINED, manager.state("orders"));
  }

  @Test
  public void testTrainedModelsAreStoredAndReloaded() throws Exception {
    File directory = _folder.newFolder("models");
    FileModelStore modelStore = new FileModelStore();
    modelStore.configure(Collections.singletonMap(MODEL_STORE_DIRECTORY_CONFIG, directory.getAbsolutePath()));
    ModelLifecycleManager manager = new ModelLifecycleManager(_scorer, _store, _registry, _time, RETRAIN_INTERVAL_MS,
                                                              RETRAIN_MIN_NEW_SAMPLES, _sensors, modelStore);
    appendValues(30);
    ScorerModel trained = manager.trainNow("orders");
    assertEquals(1, modelStore.loadModels().size());

    // A restarted process has an empty window and a fresh scorer.
    BaselineStore restartedStore = new BaselineStore(id -> _registry.get(id).map(MetricDefinition::historical).orElse(null));
    AnomalyScorer restartedScorer = new AnomalyScorer(ZoneOffset.UTC, _time);
    ModelLifecycleManager restarted = new ModelLifecycleManager(restartedScorer, restartedStore, _registry, _time,
                                                                RETRAIN_INTERVAL_MS, RETRAIN_MIN_NEW_SAMPLES, _sensors,
                                                                modelStore);
    assertEquals(1, restarted.loadStoredModels(TimeUnit.DAYS.toMillis(30)));
    assertEquals(ModelState.TRAINED, restarted.state("orders"));
    ScorerModel loaded = restartedScorer.model("orders");
    assertEquals(trained.trainedAtMs(), loaded.trainedAtMs());
    assertEquals(0L, loaded.baselineSequence());

    // Seeding the empty window does not make the loaded model stale.
    assertTrue(restartedStore.appendIfEmpty("orders", _store.window("orders")));
    restarted.windowSeeded("orders");
    assertEquals(30L, restartedScorer.model("orders").baselineSequence());
    assertEquals(ModelState.TRAINED, restarted.check(_definition));
    assertEquals(loaded.trainedAtMs(), restartedScorer.model("orders").trainedAtMs());
    assertEquals(1L, _sensors.modelTrainings().getCount());

    List<Sample> window = _store.window("orders");
    Sample sample = new Sample(_time.milliseconds() + 1, 70.0);
    assertEquals(_scorer.score(_definition, window, sample), restartedScorer.score(_definition, window, sample));

    restarted.remove("orders");
    assertTrue(modelStore.loadModels().isEmpty());
  }

  @Test
  public void testLoadStoredModelsSkipsDisabledAndExpiredModels() throws Exception {
    File directory = _folder.newFolder("models");
    FileModelStore modelStore = new FileModelStore();
    modelStore.configure(Collections.singletonMap(MODEL_STORE_DIRECTORY_CONFIG, directory.getAbsolutePath()));
    MetricDefinition signups = metricDefinition("signups", percentageAlert(Severity.LOW));
    _registry.put(signups);
    List<Sample> window = samples(_time.milliseconds(), alternating(30, 95.0, 105.0));
    modelStore.storeModel(_scorer.train(_definition, window, 30L));
    modelStore.storeModel(_scorer.train(signups, window, 30L));
    _registry.put(signups.withEnabled(false));

    ModelLifecycleManager manager = new ModelLifecycleManager(_scorer, _store, _registry, _time, RETRAIN_INTERVAL_MS,
                                                              RETRAIN_MIN_NEW_SAMPLES, _sensors, modelStore);
    assertEquals(1, manager.loadStoredModels(TimeUnit.DAYS.toMillis(30)));
    assertEquals(ModelState.TRAINED, manager.state("orders"));
    assertNull(_scorer.model("signups"));

    _scorer.removeModel("orders");
    _time.sleep(TimeUnit.DAYS.toMillis(31));
    assertEquals(0, manager.loadStoredModels(TimeUnit.DAYS.toMillis(30)));
    assertTrue(modelStore.loadModels().isEmpty());
  }

  @Test
  public void testRetrainAllAndModelStatus() {
    MetricDefinition other = metricDefinition("signups", percentageAlert(Severity.LOW));
    _registry.put(other);
    appendValues(30);

    assertEquals(1, _manager.retrainAll());
    SortedMap<String, ModelStatus> status = _manager.modelStatus();
    assertEquals(2, status.size());
    assertTrue(status.get("orders").trained());
    assertEquals(ModelState.TRAINED, status.get("orders").state());
    assertEquals(30, status.get("orders").getJsonStructure().get("sample_count"));
    assertFalse(status.get("signups").trained());
    assertEquals(ModelState.UNTRAINED, status.get("signups").state());
  }

  @Test
  public void testRemove() {
    appendValues(30);
    _manager.check(_definition);
    _manager.remove("orders");
    assertNull(_scorer.model("orders"));
    assertEquals(ModelState.UNTRAINED, _manager.state("orders"));
  }

  @Test
  public void testModelScoresAfterTraining() {
    appendValues(30);
    _manager.check(_definition);
    List<Sample> window = _store.window("orders");
    Sample sample = new Sample(_time.milliseconds() + 1, 104.0);
    assertEquals(ScoringPath.MODEL, _scorer.score(_definition, window, sample).path());
  }
}
