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
package org.eddy.exec.work.foreman.rm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.eddy.categories.PlannerTest;
import org.eddy.exec.expr.Functions;
import org.eddy.exec.physical.PhysicalPlan;
import org.eddy.exec.physical.base.AbstractProcedureSpec;
import org.eddy.exec.physical.base.ParallelRunAttribute;
import org.eddy.exec.physical.base.PlanNode;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.config.UnionSpec;
import org.eddy.exec.physical.config.ValuesSpec;
import org.eddy.exec.physical.config.YieldSpec;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(PlannerTest.class)
public class TestConcurrencyPlanner {

  /**
   * Accumulates plan nodes; node ids double as yield names.
   */
  private static class PlanBuilder {
    private final List<PlanNode> nodes = new ArrayList<>();
    private PhysicalPlan.Resources resources = PhysicalPlan.Resources.none();

    PlanBuilder values(String id) {
      return add(id, new ValuesSpec());
    }

    PlanBuilder values(String id, int factor) {
      return add(id, parallel(new ValuesSpec(), factor));
    }

    PlanBuilder filter(String id, String input) {
      return add(id, filterSpec(), input);
    }

    PlanBuilder filter(String id, String input, int factor) {
      return add(id, parallel(filterSpec(), factor), input);
    }

    PlanBuilder yield(String id, String input) {
      return add(id, new YieldSpec(id), input);
    }

    PlanBuilder union(String id, String... inputs) {
      return add(id, new UnionSpec(), inputs);
    }

    PlanBuilder union(String id, int factor, String... inputs) {
      return add(id, parallel(new UnionSpec(), factor), inputs);
    }

    PlanBuilder quota(int quota) {
      resources = new PhysicalPlan.Resources(quota, 0);
      return this;
    }

    private PlanBuilder add(String id, AbstractProcedureSpec spec, String... inputs) {
      nodes.add(new PlanNode(id, spec, inputs));
      return this;
    }

    private static FilterSpec filterSpec() {
      return new FilterSpec(Functions.predicate(row -> true), false);
    }

    private static <T extends AbstractProcedureSpec> T parallel(T spec, int factor) {
      spec.setParallelRun(new ParallelRunAttribute(factor));
      return spec;
    }

    PhysicalPlan build() {
      return new PhysicalPlan(resources, nodes);
    }
  }

  private static PlanBuilder plan() {
    return new PlanBuilder();
  }

  private static int quota(PlanBuilder builder) {
    return ConcurrencyPlanner.quota(builder.build(), 0);
  }

  private static PlanBuilder oneResult() {
    return plan().values("s").yield("y", "s");
  }

  private static PlanBuilder twoResults() {
    return plan().values("s").yield("y1", "s").yield("y2", "s");
  }

  private static PlanBuilder fiveResults() {
    PlanBuilder plan = plan().values("s");
    for (int i = 1; i <= 5; i++) {
      plan.yield("y" + i, "s");
    }
    return plan;
  }

  @Test
  public void testOneResult() {
    assertEquals(1, quota(oneResult()));
  }

  @Test
  public void testTwoResults() {
    assertEquals(2, quota(twoResults()));
  }

  @Test
  public void testFiveResults() {
    assertEquals(5, quota(fiveResults()));
  }

  @Test
  public void testFiveSeparatePipelines() {
    PlanBuilder plan = plan();
    for (int i = 1; i <= 5; i++) {
      plan.values("s" + i).yield("y" + i, "s" + i);
    }
    assertEquals(5, quota(plan));
  }

  @Test
  public void testChainedYields() {
    PlanBuilder plan = plan().values("s")
        .yield("y1", "s").yield("y2", "y1").yield("y3", "y2")
        .yield("y4", "s").yield("y5", "y4");
    assertEquals(2, quota(plan));
  }

  @Test
  public void testUnion() {
    PlanBuilder plan = plan().values("s1").values("s2")
        .union("u", "s1", "s2")
        .yield("y", "u");
    assertEquals(2, quota(plan));
  }

  @Test
  public void testTwoUnions() {
    PlanBuilder plan = plan().values("s1").values("s2").values("s3").values("s4")
        .union("u1", "s1", "s2").yield("y1", "u1")
        .union("u2", "s1", "s2", "s3", "s4").yield("y2", "u2");
    assertEquals(6, quota(plan));
  }

  @Test
  public void testTwoUnionsBehindYieldChain() {
    PlanBuilder plan = plan().values("s1").values("s2").values("s3").values("s4")
        .union("u1", "s1", "s2").yield("y1", "u1").yield("y2", "y1")
        .union("u2", "s1", "s2", "s3", "s4").yield("y3", "u2");
    assertEquals(6, quota(plan));
  }

  @Test
  public void testUnionBehindFilter() {
    PlanBuilder plan = plan().values("s1").values("s2")
        .union("u", "s1", "s2")
        .filter("f", "u")
        .yield("y", "f");
    assertEquals(2, quota(plan));
  }

  /**
   * A yield in the middle of a pipeline starts a second result.
   */
  @Test
  public void testInlineYield() {
    PlanBuilder plan = plan().values("s")
        .yield("y", "s")
        .filter("f", "y");
    assertEquals(2, quota(plan));
  }

  @Test
  public void testInlineYieldBeforeYield() {
    PlanBuilder plan = plan().values("s")
        .yield("y1", "s")
        .filter("f", "y1")
        .yield("y2", "f");
    assertEquals(2, quota(plan));
  }

  @Test
  public void testInlineYieldChain() {
    PlanBuilder plan = plan().values("s")
        .yield("y1", "s").yield("y2", "y1")
        .filter("f", "y2")
        .yield("y3", "f");
    assertEquals(2, quota(plan));
  }

  @Test
  public void testTwoInlineYields() {
    PlanBuilder plan = plan().values("s")
        .yield("y1", "s")
        .filter("f1", "y1")
        .yield("y2", "f1")
        .filter("f2", "y2")
        .yield("y3", "f2");
    assertEquals(3, quota(plan));
  }

  @Test
  public void testInlineYieldsBehindUnions() {
    PlanBuilder plan = plan().values("s1").values("s2").values("s3").values("s4")
        .union("u1", "s1", "s2").yield("y1", "u1").yield("y2", "y1").filter("f", "y2")
        .union("u2", "s1", "s2", "s3", "s4").yield("y3", "u2");
    assertEquals(7, quota(plan));
  }

  @Test
  public void testIncrease() {
    assertEquals(2, ConcurrencyPlanner.quota(oneResult().build(), 1));
    assertEquals(4, ConcurrencyPlanner.quota(twoResults().build(), 2));
    assertEquals(10, ConcurrencyPlanner.quota(fiveResults().build(), 5));
    assertEquals(8, ConcurrencyPlanner.quota(fiveResults().build(), 3));
  }

  @Test
  public void testIncreaseIsMonotonic() {
    PhysicalPlan plan = fiveResults().build();
    int previous = ConcurrencyPlanner.quota(plan, 0);
    for (int increase = 1; increase < 10; increase++) {
      int quota = ConcurrencyPlanner.quota(plan, increase);
      assertTrue(quota >= previous);
      previous = quota;
    }
  }

  @Test
  public void testNeverBelowOne() {
    assertEquals(1, ConcurrencyPlanner.quota(fiveResults().build(), -20));
    assertEquals(1, ConcurrencyPlanner.quota(plan().build(), 0));
  }

  @Test
  public void testQuotaFromPlan() {
    assertEquals(9, quota(fiveResults().quota(9)));
    assertEquals(11, ConcurrencyPlanner.quota(oneResult().quota(9).build(), 2));
  }

  @Test
  public void testParallelSource() {
    PlanBuilder plan = plan().values("s", 3).yield("y", "s");
    assertEquals(3, quota(plan));
  }

  @Test
  public void testParallelUnion() {
    PlanBuilder plan = plan().values("s1").values("s2")
        .union("u", 2, "s1", "s2")
        .yield("y", "u");
    assertEquals(3, quota(plan));
  }

  /**
   * A parallel transformation adds its extra instances to the branch it
   * sits in; an unrelated branch adds its own worker.
   */
  @Test
  public void testParallelTransformation() {
    PlanBuilder plan = plan().values("s1")
        .filter("f", "s1", 4)
        .yield("y1", "f")
        .values("s2")
        .yield("y2", "s2");
    assertEquals(5, quota(plan));
  }

  @Test
  public void testRootWithoutYield() {
    PlanBuilder plan = plan().values("s").filter("f", "s");
    assertEquals(1, quota(plan));
  }
}
