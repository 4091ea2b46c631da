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
package org.eddy.exec.physical.impl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.base.ProcedureSpec;
import org.eddy.exec.physical.config.CountSpec;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.config.GroupSpec;
import org.eddy.exec.physical.config.KurtosisSpec;
import org.eddy.exec.physical.config.MapSpec;
import org.eddy.exec.physical.config.MeanSpec;
import org.eddy.exec.physical.config.ModeSpec;
import org.eddy.exec.physical.config.SortLimitSpec;
import org.eddy.exec.physical.config.SortSpec;
import org.eddy.exec.physical.config.SumSpec;
import org.eddy.exec.physical.config.TopSpec;
import org.eddy.exec.physical.config.UnionSpec;
import org.eddy.exec.physical.config.ValuesSpec;
import org.eddy.exec.physical.config.WindowSpec;
import org.eddy.exec.physical.config.YieldSpec;
import org.eddy.exec.physical.impl.aggregate.ColumnAggregateCreator;
import org.eddy.exec.physical.impl.aggregate.CountAggregate;
import org.eddy.exec.physical.impl.aggregate.KurtosisAggregate;
import org.eddy.exec.physical.impl.aggregate.MeanAggregate;
import org.eddy.exec.physical.impl.aggregate.SumAggregate;
import org.eddy.exec.physical.impl.filter.FilterCreator;
import org.eddy.exec.physical.impl.group.GroupCreator;
import org.eddy.exec.physical.impl.map.MapCreator;
import org.eddy.exec.physical.impl.mode.ModeCreator;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.sort.SortCreator;
import org.eddy.exec.physical.impl.sort.SortLimitCreator;
import org.eddy.exec.physical.impl.transform.AbstractTransport;
import org.eddy.exec.physical.impl.union.PassThroughCreator;
import org.eddy.exec.physical.impl.values.ValuesCreator;
import org.eddy.exec.physical.impl.window.WindowCreator;

/**
 * Maps each procedure kind to the creator of its operator. The registry
 * is filled when the process starts and frozen before the first query
 * runs; after that it is only read, and may be shared across threads.
 */
public class OperatorCreatorRegistry {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperatorCreatorRegistry.class);

  private static class Registration {
    final Class<? extends ProcedureSpec> specClass;
    final OperatorCreator<?> creator;
    final boolean source;

    Registration(Class<? extends ProcedureSpec> specClass, OperatorCreator<?> creator, boolean source) {
      this.specClass = specClass;
      this.creator = creator;
      this.source = source;
    }
  }

  private final Map<String, Registration> registrations = new LinkedHashMap<>();
  private volatile boolean frozen;

  /**
   * Registry holding every operator of the engine, already frozen.
   */
  public static OperatorCreatorRegistry createDefault() {
    OperatorCreatorRegistry registry = new OperatorCreatorRegistry();
    registry.registerDefaults();
    registry.freeze();
    return registry;
  }

  public void registerDefaults() {
    registerSource(ValuesSpec.KIND, ValuesSpec.class, new ValuesCreator());
    registerTransformation(FilterSpec.KIND, FilterSpec.class, new FilterCreator());
    registerTransformation(MapSpec.KIND, MapSpec.class, new MapCreator());
    registerTransformation(GroupSpec.KIND, GroupSpec.class, new GroupCreator());
    registerTransformation(CountSpec.KIND, CountSpec.class,
        new ColumnAggregateCreator<CountSpec>(CountAggregate::new));
    registerTransformation(SumSpec.KIND, SumSpec.class,
        new ColumnAggregateCreator<SumSpec>(SumAggregate::new));
    registerTransformation(MeanSpec.KIND, MeanSpec.class,
        new ColumnAggregateCreator<MeanSpec>(MeanAggregate::new));
    registerTransformation(KurtosisSpec.KIND, KurtosisSpec.class,
        new ColumnAggregateCreator<KurtosisSpec>(KurtosisAggregate::new));
    registerTransformation(ModeSpec.KIND, ModeSpec.class, new ModeCreator());
    registerTransformation(WindowSpec.KIND, WindowSpec.class, new WindowCreator());
    registerTransformation(SortSpec.KIND, SortSpec.class, new SortCreator());
    registerTransformation(SortLimitSpec.KIND, SortLimitSpec.class, new SortLimitCreator());
    registerTransformation(TopSpec.KIND, TopSpec.class, new SortLimitCreator());
    registerTransformation(UnionSpec.KIND, UnionSpec.class, new PassThroughCreator());
    registerTransformation(YieldSpec.KIND, YieldSpec.class, new PassThroughCreator());
  }

  public <T extends ProcedureSpec> void registerTransformation(String kind, Class<T> specClass,
      TransformationCreator<? super T> creator) {
    register(kind, new Registration(specClass, creator, false));
  }

  public <T extends ProcedureSpec> void registerSource(String kind, Class<T> specClass,
      SourceCreator<? super T> creator) {
    register(kind, new Registration(specClass, creator, true));
  }

  private synchronized void register(String kind, Registration registration) {
    if (frozen) {
      throw UserException.internalError()
          .message("cannot register kind %s: the operator registry is frozen", kind)
          .build(logger);
    }
    if (registrations.containsKey(kind)) {
      throw UserException.internalError()
          .message("duplicate registration for kind %s", kind)
          .build(logger);
    }
    registrations.put(kind, registration);
    logger.debug("Registered {} for kind {}", registration.creator.getClass().getSimpleName(), kind);
  }

  public synchronized void freeze() {
    frozen = true;
  }

  public boolean isFrozen() { return frozen; }

  public boolean isRegistered(String kind) {
    return registrations.containsKey(kind);
  }

  public boolean isSource(String kind) {
    return lookup(kind).source;
  }

  /**
   * Spec classes of all registered kinds, for the plan reader.
   */
  public List<Class<? extends ProcedureSpec>> getSpecClasses() {
    List<Class<? extends ProcedureSpec>> classes = new ArrayList<>();
    for (Registration registration : registrations.values()) {
      classes.add(registration.specClass);
    }
    return classes;
  }

  @SuppressWarnings("unchecked")
  public AbstractTransport createTransport(ProcedureSpec spec, OperatorContext context, Dataset dataset) {
    Registration registration = checkSpec(spec, false);
    return ((TransformationCreator<ProcedureSpec>) registration.creator).getTransport(spec, context, dataset);
  }

  @SuppressWarnings("unchecked")
  public Source createSource(ProcedureSpec spec, int instance, int instances,
      OperatorContext context, Dataset dataset) {
    Registration registration = checkSpec(spec, true);
    return ((SourceCreator<ProcedureSpec>) registration.creator)
        .getSource(spec, instance, instances, context, dataset);
  }

  private Registration checkSpec(ProcedureSpec spec, boolean source) {
    Registration registration = lookup(spec.getKind());
    if (! registration.specClass.isInstance(spec)) {
      throw UserException.internalError()
          .message("invalid spec type")
          .addContext("Kind", spec.getKind())
          .addContext("Expected", registration.specClass.getSimpleName())
          .addContext("Found", spec.getClass().getSimpleName())
          .build(logger);
    }
    if (registration.source != source) {
      throw UserException.internalError()
          .message("kind %s is not a %s", spec.getKind(), source ? "source" : "transformation")
          .build(logger);
    }
    return registration;
  }

  private Registration lookup(String kind) {
    Registration registration = registrations.get(kind);
    if (registration == null) {
      throw UserException.internalError()
          .message("no operator registered for kind %s", kind)
          .build(logger);
    }
    return registration;
  }
}
