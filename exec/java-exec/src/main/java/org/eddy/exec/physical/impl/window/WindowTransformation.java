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
package org.eddy.exec.physical.impl.window;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.WindowSpec;
import org.eddy.exec.physical.impl.common.BuilderCache;
import org.eddy.exec.physical.impl.common.OrderedGroupLookup;
import org.eddy.exec.physical.impl.common.RandomAccessGroupLookup;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.GroupTransformation;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.GroupKeyBuilder;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;
import org.joda.time.DateTimeZone;

/**
 * Splits each input table into time windows.
 * <p>
 * Window boundaries are multiples of <tt>every</tt> in the wall-clock
 * time of the time zone, shifted by <tt>offset</tt>; each window is
 * <tt>period</tt> of wall-clock time long, so a daily window across a
 * daylight saving change lasts 23 or 25 hours. A row belongs to every window that contains its
 * time: more than one if windows overlap, none if it falls in a gap.
 * Windows are truncated to the bounds of the input, taken from the
 * operator's bounds or, failing that, from the start and stop columns of
 * the input key. Rows outside the bounds are dropped.
 * <p>
 * The output key is the input key without its start and stop columns,
 * plus the window's start and stop. The output columns are start, stop
 * and then the other input columns. Windows of an input key are emitted,
 * in window order and each followed by a flush, when the input key is
 * flushed or the input ends. With <tt>createEmpty</tt>, every window in
 * the bounds that received no row is emitted as an empty table. Without
 * bounds no empty windows can be created.
 */
public class WindowTransformation implements GroupTransformation {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(WindowTransformation.class);

  private static final long NANOS_PER_MILLI = 1_000_000L;

  /**
   * Windows under construction for one input key.
   */
  private static class KeyState {
    final BuilderCache<ArrayTableBuilder, TableBuffer> windows;
    final long[] bounds;
    List<ColumnMeta> schema;

    KeyState(BufferAllocator allocator, long[] bounds) {
      this.windows = BuilderCache.arrays(new OrderedGroupLookup<ArrayTableBuilder>(), allocator);
      this.bounds = bounds;
    }
  }

  private final OperatorContext context;
  private final long every;
  private final long period;
  private final long offset;
  private final DateTimeZone zone;
  private final boolean createEmpty;
  private final String timeColumn;
  private final String startColumn;
  private final String stopColumn;
  private final long[] fixedBounds;
  private final RandomAccessGroupLookup<KeyState> states = new RandomAccessGroupLookup<>();

  public WindowTransformation(WindowSpec spec, OperatorContext context) {
    this.context = context;
    this.every = spec.getEvery().toNanos();
    this.period = spec.getPeriod().toNanos();
    this.offset = spec.getOffset().toNanos();
    if (every <= 0) {
      throw UserException.invalidError()
          .message("window every must be positive")
          .addContext("Every", spec.getEveryString())
          .build(logger);
    }
    if (period <= 0) {
      throw UserException.invalidError()
          .message("window period must be positive")
          .addContext("Period", spec.getPeriodString())
          .build(logger);
    }
    try {
      this.zone = DateTimeZone.forID(spec.getLocation());
    } catch (IllegalArgumentException e) {
      throw UserException.invalidError(e)
          .message("unknown time zone \"%s\"", spec.getLocation())
          .build(logger);
    }
    this.createEmpty = spec.isCreateEmpty();
    this.timeColumn = spec.getTimeColumn();
    this.startColumn = spec.getStartColumn();
    this.stopColumn = spec.getStopColumn();
    if (spec.getBounds() == null) {
      fixedBounds = null;
    } else {
      fixedBounds = new long[] {
          TypeHelper.toNanos(spec.getBounds().getStart()),
          TypeHelper.toNanos(spec.getBounds().getStop())};
    }
  }

  @Override
  public void process(TableView view, Dataset dataset, BufferAllocator allocator) {
    int timeIndex = view.colIndex(timeColumn);
    if (timeIndex == -1) {
      throw UserException.failedPreconditionError()
          .message("missing time column \"%s\"", timeColumn)
          .addContext("Group key", view.key().toString())
          .build(logger);
    }
    if (view.col(timeIndex).getType() != ColumnType.TIME) {
      throw UserException.failedPreconditionError()
          .message("time column \"%s\" is of type %s, not time", timeColumn, view.col(timeIndex).getType())
          .build(logger);
    }

    KeyState state = states.lookup(view.key());
    if (state == null) {
      state = new KeyState(allocator, boundsFor(view.key()));
      states.set(view.key(), state);
    }
    List<Integer> carried = new ArrayList<>();
    List<ColumnMeta> schema = new ArrayList<>();
    schema.add(ColumnMeta.of(startColumn, ColumnType.TIME));
    schema.add(ColumnMeta.of(stopColumn, ColumnType.TIME));
    for (int j = 0; j < view.nCols(); j++) {
      String label = view.col(j).getLabel();
      if (! label.equals(startColumn) && ! label.equals(stopColumn)) {
        carried.add(j);
        schema.add(view.col(j));
      }
    }
    if (state.schema == null) {
      state.schema = schema;
    }

    ValueArray times = view.values(timeIndex);
    for (int i = 0; i < view.len(); i++) {
      context.checkContinue();
      if (times.isNull(i)) {
        throw UserException.failedPreconditionError()
            .message("time column \"%s\" contains a null value", timeColumn)
            .addContext("Group key", view.key().toString())
            .build(logger);
      }
      long t = TypeHelper.toNanos((Instant) times.getObject(i));
      long local = toLocal(t);
      for (long start = localWindowStart(local); start + period > local; start -= every) {
        long[] window = truncate(start, state.bounds);
        if (window == null || t < window[0] || t >= window[1]) {
          continue;
        }
        ArrayTableBuilder builder = builderFor(state, view.key(), window);
        builder.appendValue(0, TypeHelper.toInstant(window[0]));
        builder.appendValue(1, TypeHelper.toInstant(window[1]));
        for (int j : carried) {
          builder.appendFrom(builder.addCol(view.col(j)), view.values(j), i);
        }
        builder.finishRow();
      }
    }
  }

  @Override
  public void flushKey(GroupKey key, Dataset dataset, BufferAllocator allocator) {
    KeyState state = states.delete(key);
    if (state != null) {
      emit(key, state, dataset);
    }
  }

  @Override
  public void finish(final Dataset dataset, BufferAllocator allocator) {
    states.range((key, state) -> {
      states.delete(key);
      emit(key, state, dataset);
    });
  }

  @Override
  public void discard() {
    states.range((key, state) -> state.windows.clear());
    states.clear();
  }

  private void emit(GroupKey inputKey, KeyState state, final Dataset dataset) {
    if (createEmpty && state.bounds != null) {
      long first = toLocal(state.bounds[0]);
      long start = localWindowStart(first);
      while (start - every + period > first) {
        start -= every;
      }
      for (; toUtc(start) < state.bounds[1]; start += every) {
        long[] window = truncate(start, state.bounds);
        if (window != null) {
          builderFor(state, inputKey, window);
        }
      }
    }
    state.windows.forEach((key, buffer) -> {
      dataset.process(buffer.asView());
      dataset.flushKey(key);
    });
  }

  private ArrayTableBuilder builderFor(KeyState state, GroupKey inputKey, long[] window) {
    BuilderCache.Entry<ArrayTableBuilder> entry = state.windows.getOrCreate(windowKey(inputKey, window));
    if (entry.created()) {
      entry.builder().addCols(state.schema);
    }
    return entry.builder();
  }

  private GroupKey windowKey(GroupKey inputKey, long[] window) {
    GroupKeyBuilder builder = new GroupKeyBuilder();
    for (int k = 0; k < inputKey.nCols(); k++) {
      String label = inputKey.col(k).getLabel();
      if (! label.equals(startColumn) && ! label.equals(stopColumn)) {
        builder.addKeyValue(inputKey.col(k), inputKey.value(k));
      }
    }
    builder.addKeyValue(startColumn, ColumnType.TIME, TypeHelper.toInstant(window[0]));
    builder.addKeyValue(stopColumn, ColumnType.TIME, TypeHelper.toInstant(window[1]));
    return builder.build();
  }

  /**
   * Wall-clock start of the latest window that starts at or before the
   * wall-clock time <tt>local</tt>.
   */
  private long localWindowStart(long local) {
    return local - Math.floorMod(local - offset, every);
  }

  /**
   * Wall-clock time in the zone, as nanoseconds from the local epoch.
   */
  private long toLocal(long t) {
    return t + zone.getOffset(Math.floorDiv(t, NANOS_PER_MILLI)) * NANOS_PER_MILLI;
  }

  /**
   * Instant of a wall-clock time. The conversion is not strict, so a time
   * inside a daylight saving gap still maps to an instant.
   */
  private long toUtc(long local) {
    long millis = Math.floorDiv(local, NANOS_PER_MILLI);
    return zone.convertLocalToUTC(millis, false) * NANOS_PER_MILLI + Math.floorMod(local, NANOS_PER_MILLI);
  }

  /**
   * The window starting at the wall-clock time <tt>localStart</tt>, as
   * instants cut to the bounds; null if nothing of it is left.
   */
  private long[] truncate(long localStart, long[] bounds) {
    long start = toUtc(localStart);
    long stop = toUtc(localStart + period);
    if (bounds != null) {
      start = Math.max(start, bounds[0]);
      stop = Math.min(stop, bounds[1]);
    }
    return start < stop ? new long[] {start, stop} : null;
  }

  private long[] boundsFor(GroupKey key) {
    if (fixedBounds != null) {
      return fixedBounds;
    }
    int start = key.index(startColumn);
    int stop = key.index(stopColumn);
    if (start == -1 || stop == -1
        || key.col(start).getType() != ColumnType.TIME || key.col(stop).getType() != ColumnType.TIME
        || key.isNull(start) || key.isNull(stop)) {
      return null;
    }
    return new long[] {
        TypeHelper.toNanos((Instant) key.value(start)),
        TypeHelper.toNanos((Instant) key.value(stop))};
  }
}
