/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.eddy.exec.physical.config;

import java.time.Duration;
import java.time.Instant;

import org.eddy.exec.physical.base.AbstractProcedureSpec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;

/**
 * Assigns each row to the time windows that contain its time value and
 * regroups the rows by window. Durations are written as ISO-8601 strings
 * (<tt>PT1M</tt>); <tt>location</tt> is a time zone id whose offset
 * shifts the window boundaries.
 */
@JsonTypeName(WindowSpec.KIND)
public class WindowSpec extends AbstractProcedureSpec {

  public static final String KIND = "window";

  public static final String DEFAULT_TIME_COLUMN = "_time";
  public static final String DEFAULT_START_COLUMN = "_start";
  public static final String DEFAULT_STOP_COLUMN = "_stop";
  public static final String DEFAULT_LOCATION = "UTC";

  /**
   * Half-open range <tt>[start, stop)</tt> that limits the windows.
   */
  public static class Bounds {
    private final Instant start;
    private final Instant stop;

    public Bounds(Instant start, Instant stop) {
      this.start = Preconditions.checkNotNull(start);
      this.stop = Preconditions.checkNotNull(stop);
    }

    @JsonCreator
    public Bounds(@JsonProperty("start") String start, @JsonProperty("stop") String stop) {
      this(Instant.parse(start), Instant.parse(stop));
    }

    @JsonIgnore
    public Instant getStart() { return start; }

    @JsonIgnore
    public Instant getStop() { return stop; }

    @JsonProperty("start")
    public String getStartString() { return start.toString(); }

    @JsonProperty("stop")
    public String getStopString() { return stop.toString(); }

    @Override
    public String toString() {
      return "[" + start + ", " + stop + ")";
    }
  }

  private final Duration every;
  private final Duration period;
  private final Duration offset;
  private final String location;
  private final boolean createEmpty;
  private final String timeColumn;
  private final String startColumn;
  private final String stopColumn;
  private final Bounds bounds;

  public WindowSpec(Duration every, Duration period, Duration offset, String location,
      boolean createEmpty, String timeColumn, String startColumn, String stopColumn, Bounds bounds) {
    this.every = Preconditions.checkNotNull(every, "window without every");
    this.period = period == null ? every : period;
    this.offset = offset == null ? Duration.ZERO : offset;
    this.location = location == null ? DEFAULT_LOCATION : location;
    this.createEmpty = createEmpty;
    this.timeColumn = timeColumn == null ? DEFAULT_TIME_COLUMN : timeColumn;
    this.startColumn = startColumn == null ? DEFAULT_START_COLUMN : startColumn;
    this.stopColumn = stopColumn == null ? DEFAULT_STOP_COLUMN : stopColumn;
    this.bounds = bounds;
  }

  public WindowSpec(Duration every) {
    this(every, null, null, null, false, null, null, null, null);
  }

  @JsonCreator
  public static WindowSpec fromJson(@JsonProperty("every") String every,
                                    @JsonProperty("period") String period,
                                    @JsonProperty("offset") String offset,
                                    @JsonProperty("location") String location,
                                    @JsonProperty("createEmpty") boolean createEmpty,
                                    @JsonProperty("timeColumn") String timeColumn,
                                    @JsonProperty("startColumn") String startColumn,
                                    @JsonProperty("stopColumn") String stopColumn,
                                    @JsonProperty("bounds") Bounds bounds) {
    return new WindowSpec(parse(every), parse(period), parse(offset), location,
        createEmpty, timeColumn, startColumn, stopColumn, bounds);
  }

  private static Duration parse(String value) {
    return value == null ? null : Duration.parse(value);
  }

  @Override
  public String getKind() { return KIND; }

  @JsonIgnore
  public Duration getEvery() { return every; }

  @JsonIgnore
  public Duration getPeriod() { return period; }

  @JsonIgnore
  public Duration getOffset() { return offset; }

  @JsonProperty("every")
  public String getEveryString() { return every.toString(); }

  @JsonProperty("period")
  public String getPeriodString() { return period.toString(); }

  @JsonProperty("offset")
  public String getOffsetString() { return offset.toString(); }

  @JsonProperty("location")
  public String getLocation() { return location; }

  @JsonProperty("createEmpty")
  public boolean isCreateEmpty() { return createEmpty; }

  @JsonProperty("timeColumn")
  public String getTimeColumn() { return timeColumn; }

  @JsonProperty("startColumn")
  public String getStartColumn() { return startColumn; }

  @JsonProperty("stopColumn")
  public String getStopColumn() { return stopColumn; }

  @JsonProperty("bounds")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public Bounds getBounds() { return bounds; }
}
