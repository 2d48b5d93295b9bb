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

import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;

import net.tsbridge.query.CompiledQuery;
import net.tsbridge.query.ConsolidationFunction;
import net.tsbridge.query.DataQuery;

/**
 * An {@code xport} command graph: ordered {@code DEF}, {@code CDEF}, 
 * {@code VDEF} and {@code XPORT} elements plus the time window. Each 
 * {@link Xport} remembers the stream, metric and labels it was compiled 
 * from so exported columns can be mapped back onto series.
 * 
 * @since 1.0
 */
public class RrdXportQuery implements CompiledQuery {
  private final DataQuery query;
  private final List<Element> elements;
  private final String start;
  private final String end;
  private final Long step;
  
  protected RrdXportQuery(final Builder builder) {
    query = builder.query;
    elements = ImmutableList.copyOf(builder.elements);
    start = builder.start;
    end = builder.end;
    step = builder.step;
  }
  
  /** @return The query this graph was compiled from. */
  public DataQuery query() {
    return query;
  }
  
  /** @return The elements in emission order. */
  public List<Element> elements() {
    return elements;
  }
  
  /** @return The export elements in column order. */
  public List<Xport> outputs() {
    final List<Xport> outputs = Lists.newArrayList();
    for (final Element element : elements) {
      if (element instanceof Xport) {
        outputs.add((Xport) element);
      }
    }
    return outputs;
  }
  
  public String start() {
    return start;
  }
  
  public String end() {
    return end;
  }
  
  /** @return The step in seconds or null to let rrdtool pick. */
  public Long step() {
    return step;
  }
  
  /** @return The variable names in emission order, excluding exports. */
  public List<String> variables() {
    final List<String> names = Lists.newArrayList();
    for (final Element element : elements) {
      if (!(element instanceof Xport)) {
        names.add(element.name());
      }
    }
    return names;
  }
  
  /** @return The command for an rrdtool executor. */
  public RrdCommand toCommand() {
    final List<String> options = Lists.newArrayList(
        "--json", "--start", start, "--end", end);
    if (step != null) {
      options.add("--step");
      options.add(Long.toString(step));
    }
    final List<String> arguments = Lists.newArrayListWithCapacity(
        elements.size());
    for (final Element element : elements) {
      arguments.add(element.render());
    }
    return new RrdCommand(RrdCommandType.XPORT, null, options, arguments);
  }
  
  @Override
  public String driver() {
    return RrdDriver.NAME;
  }

  @Override
  public String alias() {
    final List<String> aliases = Lists.newArrayList();
    for (final Xport xport : outputs()) {
      if (!aliases.contains(xport.alias())) {
        aliases.add(xport.alias());
      }
    }
    return Joiner.on(',').join(aliases);
  }
  
  @Override
  public String toString() {
    return toCommand().toString();
  }
  
  /**
   * Escapes the characters rrdtool treats as separators in paths and 
   * legends.
   * @param value A non-null value.
   * @return The escaped value.
   */
  static String escape(final String value) {
    return value.replace("\\", "\\\\").replace(":", "\\:");
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private DataQuery query;
    private final List<Element> elements = Lists.newArrayList();
    private String start;
    private String end;
    private Long step;
    
    public Builder setQuery(final DataQuery query) {
      this.query = query;
      return this;
    }
    
    public Builder addElement(final Element element) {
      elements.add(element);
      return this;
    }
    
    public Builder setStart(final String start) {
      this.start = start;
      return this;
    }
    
    public Builder setEnd(final String end) {
      this.end = end;
      return this;
    }
    
    public Builder setStep(final Long step) {
      this.step = step;
      return this;
    }
    
    public RrdXportQuery build() {
      if (start == null || end == null) {
        throw new IllegalArgumentException("Start and end are required.");
      }
      return new RrdXportQuery(this);
    }
  }
  
  /** One positional argument of the graph. */
  public abstract static class Element {
    protected final String name;
    
    protected Element(final String name) {
      this.name = name;
    }
    
    /** @return The variable name bound or exported. */
    public String name() {
      return name;
    }
    
    /** @return The argument text. */
    public abstract String render();
    
    @Override
    public String toString() {
      return render();
    }
  }
  
  /** A raw data source reference. */
  public static class Def extends Element {
    private final String path;
    private final String data_source;
    private final ConsolidationFunction cf;
    
    public Def(final String name, 
               final String path, 
               final String data_source, 
               final ConsolidationFunction cf) {
      super(name);
      this.path = path;
      this.data_source = data_source;
      this.cf = cf;
    }
    
    public String path() {
      return path;
    }
    
    @Override
    public String render() {
      return "DEF:" + name + "=" + escape(path) + ":" + data_source + ":" + cf;
    }
  }
  
  /** A per-row expression in stack notation. */
  public static class Cdef extends Element {
    private final String rpn;
    
    public Cdef(final String name, final String rpn) {
      super(name);
      this.rpn = rpn;
    }
    
    public String rpn() {
      return rpn;
    }
    
    @Override
    public String render() {
      return "CDEF:" + name + "=" + rpn;
    }
  }
  
  /** A summary over a whole series, yielding a single value. */
  public static class Vdef extends Element {
    private final String rpn;
    
    public Vdef(final String name, final String rpn) {
      super(name);
      this.rpn = rpn;
    }
    
    public String rpn() {
      return rpn;
    }
    
    @Override
    public String render() {
      return "VDEF:" + name + "=" + rpn;
    }
  }
  
  /** An exported column. */
  public static class Xport extends Element {
    private final String legend;
    private final int stream;
    private final String metric;
    private final String alias;
    private final Map<String, String> labels;
    
    /**
     * Default ctor.
     * @param name The variable to export.
     * @param legend The column legend.
     * @param stream The index of the stream in the query.
     * @param metric The metric key.
     * @param alias The series alias.
     * @param labels The labels shared by every contributing archive.
     */
    public Xport(final String name, 
                 final String legend, 
                 final int stream, 
                 final String metric,
                 final String alias,
                 final Map<String, String> labels) {
      super(name);
      this.legend = legend;
      this.stream = stream;
      this.metric = metric;
      this.alias = alias;
      this.labels = ImmutableSortedMap.copyOf(labels);
    }
    
    public String legend() {
      return legend;
    }
    
    public int stream() {
      return stream;
    }
    
    public String metric() {
      return metric;
    }
    
    public String alias() {
      return alias;
    }
    
    public Map<String, String> labels() {
      return labels;
    }
    
    @Override
    public String render() {
      return "XPORT:" + name + ":" + escape(legend);
    }
  }
}
