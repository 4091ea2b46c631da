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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.eddy.categories.OperatorTest;
import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.base.AbstractProcedureSpec;
import org.eddy.exec.physical.config.CountSpec;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.config.SortSpec;
import org.eddy.exec.physical.config.ValuesSpec;
import org.eddy.exec.physical.config.YieldSpec;
import org.eddy.exec.physical.impl.protocol.TransportDataset;
import org.eddy.exec.physical.impl.transform.AbstractTransport;
import org.eddy.exec.physical.impl.transform.NarrowTransport;
import org.eddy.test.SubOperatorTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(OperatorTest.class)
public class TestOperatorCreatorRegistry extends SubOperatorTest {

  private static class EchoSpec extends AbstractProcedureSpec {
    static final String KIND = "echo";

    @Override
    public String getKind() { return KIND; }
  }

  /**
   * Claims a registered kind without being that kind's spec class.
   */
  private static class ImpostorSpec extends AbstractProcedureSpec {
    @Override
    public String getKind() { return SortSpec.KIND; }
  }

  private static final TransformationCreator<EchoSpec> ECHO_CREATOR =
      (spec, context, dataset) -> new NarrowTransport(
          (view, out, allocator) -> out.process(view.retain()), context, dataset);

  private void expectInternal(Runnable action, String message) {
    try {
      action.run();
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.INTERNAL, e.getErrorType());
      assertEquals(message, e.getOriginalMessage());
    }
  }

  @Test
  public void testDefaultRegistry() {
    OperatorCreatorRegistry registry = OperatorCreatorRegistry.createDefault();
    assertTrue(registry.isFrozen());
    assertTrue(registry.isSource(ValuesSpec.KIND));
    assertFalse(registry.isSource(FilterSpec.KIND));
    assertTrue(registry.isRegistered(YieldSpec.KIND));
    assertFalse(registry.isRegistered(EchoSpec.KIND));
    assertTrue(registry.getSpecClasses().contains(CountSpec.class));
    assertEquals(15, registry.getSpecClasses().size());
  }

  @Test
  public void testFrozenRegistry() {
    OperatorCreatorRegistry registry = OperatorCreatorRegistry.createDefault();
    expectInternal(() -> registry.registerTransformation(EchoSpec.KIND, EchoSpec.class, ECHO_CREATOR),
        "cannot register kind echo: the operator registry is frozen");
  }

  @Test
  public void testDuplicateRegistration() {
    OperatorCreatorRegistry registry = new OperatorCreatorRegistry();
    registry.registerTransformation(EchoSpec.KIND, EchoSpec.class, ECHO_CREATOR);
    expectInternal(() -> registry.registerTransformation(EchoSpec.KIND, EchoSpec.class, ECHO_CREATOR),
        "duplicate registration for kind echo");
  }

  @Test
  public void testCustomTransformation() {
    OperatorCreatorRegistry registry = new OperatorCreatorRegistry();
    registry.registerTransformation(EchoSpec.KIND, EchoSpec.class, ECHO_CREATOR);
    registry.freeze();

    OperatorContext context = fixture.newOperatorContext(EchoSpec.KIND, "input");
    TransportDataset dataset = fixture.newDataset(context);
    AbstractTransport transport = registry.createTransport(new EchoSpec(), context, dataset);
    assertNotNull(transport);
    assertEquals(dataset, transport.getDataset());
  }

  @Test
  public void testUnknownKind() {
    OperatorCreatorRegistry registry = OperatorCreatorRegistry.createDefault();
    OperatorContext context = fixture.newOperatorContext(EchoSpec.KIND, "input");
    TransportDataset dataset = fixture.newDataset(context);
    expectInternal(() -> registry.createTransport(new EchoSpec(), context, dataset),
        "no operator registered for kind echo");
    expectInternal(() -> registry.isSource(EchoSpec.KIND),
        "no operator registered for kind echo");
  }

  @Test
  public void testWrongShape() {
    OperatorCreatorRegistry registry = OperatorCreatorRegistry.createDefault();
    OperatorContext context = fixture.newOperatorContext(ValuesSpec.KIND);
    TransportDataset dataset = fixture.newDataset(context);
    expectInternal(() -> registry.createTransport(new ValuesSpec(), context, dataset),
        "kind values is not a transformation");
    expectInternal(() -> registry.createSource(new CountSpec(), 0, 1, context, dataset),
        "kind count is not a source");
  }

  @Test
  public void testInvalidSpecType() {
    OperatorCreatorRegistry registry = OperatorCreatorRegistry.createDefault();
    OperatorContext context = fixture.newOperatorContext(SortSpec.KIND, "input");
    TransportDataset dataset = fixture.newDataset(context);
    try {
      registry.createTransport(new ImpostorSpec(), context, dataset);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.INTERNAL, e.getErrorType());
      assertEquals("invalid spec type", e.getOriginalMessage());
      assertTrue(e.getContext().contains("Found ImpostorSpec"));
      assertTrue(e.getContext().contains("Expected SortSpec"));
    }
  }
}
