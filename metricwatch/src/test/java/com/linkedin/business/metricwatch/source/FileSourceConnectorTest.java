/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.FileSourceSpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class FileSourceConnectorTest {
  private static final long DAY_MS = 86_400_000L;
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private final FileSourceConnector _connector = new FileSourceConnector(ZoneOffset.UTC);

  private FileSourceSpec write(String name, String content, FileSourceSpec.Format format) throws IOException {
    File file = _folder.newFile(name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return new FileSourceSpec(file.getAbsolutePath(), "revenue", "date", format);
  }

  private void assertFailsWith(FileSourceSpec spec, SourceException.Kind kind) {
    try {
      _connector.fetchCurrent(spec);
      fail("Should throw SourceException");
    } catch (SourceException e) {
      assertEquals(e.getMessage(), kind, e.kind());
    }
  }

  @Test
  public void testCsv() throws Exception {
    FileSourceSpec spec = write("revenue.csv", "date,revenue,region\n"
                                               + "1970-01-03,1200.5,emea\n"
                                               + "1970-01-01,1000,emea\n"
                                               + "1970-01-02,,emea\n"
                                               + "1970-01-02T12:00:00Z,1100,emea\n", FileSourceSpec.Format.CSV);
    assertEquals(1200.5, _connector.fetchCurrent(spec), 0.0);
    List<Sample> history = _connector.fetchHistorical(spec);
    assertEquals(3, history.size());
    assertEquals(new Sample(0L, 1000.0), history.get(0));
    assertEquals(new Sample(DAY_MS + DAY_MS / 2, 1100.0), history.get(1));
    assertEquals(new Sample(2 * DAY_MS, 1200.5), history.get(2));
  }

  @Test
  public void testJson() throws Exception {
    FileSourceSpec spec = write("revenue.json", "[{\"date\": 172800000, \"revenue\": 12},"
                                                + " {\"date\": \"1970-01-01\", \"revenue\": \"10\"},"
                                                + " {\"date\": \"1970-01-02\", \"revenue\": null}]",
                                FileSourceSpec.Format.JSON);
    assertEquals(12.0, _connector.fetchCurrent(spec), 0.0);
    List<Sample> history = _connector.fetchHistorical(spec);
    assertEquals(2, history.size());
    assertEquals(new Sample(0L, 10.0), history.get(0));
  }

  @Test
  public void testFailures() throws Exception {
    assertFailsWith(new FileSourceSpec(_folder.getRoot().getAbsolutePath() + "/missing.csv", "revenue", "date",
                                       FileSourceSpec.Format.CSV), SourceException.Kind.NOT_FOUND);
    assertFailsWith(write("no-column.csv", "date,sales\n1970-01-01,3\n", FileSourceSpec.Format.CSV),
                    SourceException.Kind.PARSE);
    assertFailsWith(write("empty.csv", "date,revenue\n", FileSourceSpec.Format.CSV), SourceException.Kind.NOT_FOUND);
    assertFailsWith(write("bad-value.csv", "date,revenue\n1970-01-01,lots\n", FileSourceSpec.Format.CSV),
                    SourceException.Kind.PARSE);
    assertFailsWith(write("bad-date.csv", "date,revenue\nyesterday,3\n", FileSourceSpec.Format.CSV),
                    SourceException.Kind.PARSE);
    assertFailsWith(write("object.json", "{\"date\": 1, \"revenue\": 2}", FileSourceSpec.Format.JSON),
                    SourceException.Kind.PARSE);
    assertFailsWith(write("malformed.json", "[{\"date\": 1,", FileSourceSpec.Format.JSON), SourceException.Kind.PARSE);
  }
}
