// This file is part of tsbridge.
// Copyright (C) 2026  The tsbridge Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsbridge.storage.rrd;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.exceptions.QueryValidationException;

public class TestNoTagsLabelStrategy {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("sys")
      .setName("load.1m")
      .addLabel("host")
      .build();
  
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();
  
  private NoTagsLabelStrategy strategy;
  
  @Before
  public void before() throws Exception {
    strategy = new NoTagsLabelStrategy(folder.getRoot().getAbsolutePath(), 
        null, false);
  }
  
  @Test
  public void generateFilename() throws Exception {
    assertEquals("sys/load.1m.rrd", strategy.generateFilename(METRIC, null));
    
    try {
      strategy.generateFilename(METRIC, ImmutableMap.of("host", "web01"));
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
  
  @Test
  public void decode() throws Exception {
    final LabelIndexEntry entry = strategy.decode("sys/load.1m.rrd");
    assertEquals("sys", entry.namespace());
    assertEquals("load.1m", entry.name());
    assertTrue(entry.labels().isEmpty());
    
    try {
      strategy.decode("sys/load/host=a.rrd");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void listFilenames() throws Exception {
    touch("sys/load.1m.rrd");
    touch("sys/load.5m.rrd");
    touch("sys/load/host=a.rrd");
    
    assertEquals(Arrays.asList("sys/load.1m.rrd"), 
        strategy.listFilenames(METRIC));
    assertTrue(strategy.listLabelNames(Arrays.asList(METRIC)).isEmpty());
  }
  
  private void touch(final String path) throws Exception {
    final File file = new File(folder.getRoot(), path);
    file.getParentFile().mkdirs();
    assertTrue(file.createNewFile());
  }
}
