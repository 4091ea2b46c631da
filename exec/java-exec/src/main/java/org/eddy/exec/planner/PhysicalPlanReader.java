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
package org.eddy.exec.planner;

import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.physical.PhysicalPlan;
import org.eddy.exec.physical.base.ProcedureSpec;
import org.eddy.exec.physical.impl.OperatorCreatorRegistry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes physical plans as JSON. The spec of each node is
 * resolved through its <tt>kind</tt> property, which must name a kind of
 * the operator registry.
 */
public class PhysicalPlanReader {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PhysicalPlanReader.class);

  private final ObjectMapper mapper;

  public PhysicalPlanReader(OperatorCreatorRegistry registry) {
    mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    List<Class<? extends ProcedureSpec>> specClasses = registry.getSpecClasses();
    mapper.registerSubtypes(specClasses.toArray(new Class<?>[specClasses.size()]));
  }

  public ObjectMapper getMapper() { return mapper; }

  public PhysicalPlan readPhysicalPlan(String json) {
    try {
      return mapper.readValue(json, PhysicalPlan.class);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof UserException) {
        throw (UserException) e.getCause();
      }
      throw UserException.invalidError(e)
          .message("failed to parse physical plan: %s", e.getOriginalMessage())
          .build(logger);
    }
  }

  public String writeJson(PhysicalPlan plan) {
    try {
      return mapper.writeValueAsString(plan);
    } catch (JsonProcessingException e) {
      throw UserException.internalError(e)
          .message("failed to serialize physical plan")
          .build(logger);
    }
  }
}
