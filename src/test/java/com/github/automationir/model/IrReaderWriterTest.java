package com.github.automationir.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.AutomationException;
import com.github.automationir.Fixtures;
import com.github.automationir.model.Transition.TransitionBuilder;

/**
 * Tests to check the typed view over canonical IR documents.
 */
public class IrReaderWriterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testReadHallLight() throws AutomationException {
    // 1. read the canonical fixture
    final Automation automation = IrReader.readAutomation(Fixtures.load(Fixtures.HALL_LIGHT));
    assertEquals("0.1", automation.getVersion());
    assertEquals(2, automation.getDevices().size());

    // 2. check states and labels
    final StateMachineDefinition machine = automation.getStateMachine();
    assertEquals("Idle", machine.getInitial());
    assertEquals(2, machine.getStates().size());
    final State lightOn = machine.findState("LightOn");
    assertTrue(lightOn.hasLabel());
    assertEquals("Hall \"Light\" On", lightOn.getDisplayName());
    assertEquals(1, lightOn.getInvariants().size());
    assertFalse(machine.findState("Idle").hasLabel());
    assertEquals("Idle", machine.findState("Idle").getDisplayName());

    // 3. check the guarded transition
    final Transition offTransition = machine.getTransitions().get(1);
    assertEquals("t2", offTransition.getId());
    assertEquals(2, offTransition.getTriggers().size());
    assertTrue(offTransition.getTriggers().get(1) instanceof Trigger.After);
    assertEquals(120, ((Trigger.After) offTransition.getTriggers().get(1)).getSeconds());
    final Expression expected = Expression.op(Operator.AND,
        Expression.op(Operator.EQ, Expression.ref("light_hall", "switch"),
            Expression.lit(Literal.ofString("on"))),
        Expression.op(Operator.NOT, Expression.op(Operator.EQ,
            Expression.ref("motion_hall", "motion"), Expression.lit(Literal.ofString("active")))));
    assertEquals(expected, offTransition.getGuard());
    assertEquals(new Action.Command("light_hall", "off"), offTransition.getActions().get(0));
    assertEquals(new Action.Notify("Hall light \"off\" after 2 min"),
        offTransition.getActions().get(1));
    assertNull(machine.getTransitions().get(0).getGuard());
  }

  @Test
  public void testWriteMirrorsRead() throws AutomationException {
    // 1. a canonical document survives a read and a write unchanged
    for (String fixture : Arrays.asList(Fixtures.HALL_LIGHT, Fixtures.DELAYED_OFF)) {
      final JsonNode document = Fixtures.load(fixture);
      final JsonNode written = IrWriter.write(IrReader.readAutomation(document));
      assertEquals(IrJson.canonicalString(document), IrJson.canonicalString(written));
    }
  }

  @Test
  public void testLiteralKindsStayDistinct() {
    // 1. integers and decimals of the same magnitude are different literals
    assertNotEquals(Literal.ofInteger(5), Literal.ofDecimal(5.0));
    assertEquals("5", Literal.ofInteger(5).valueText());
    assertEquals("5.0", Literal.ofDecimal(5.0).valueText());
    assertEquals("10000000.0", Literal.ofDecimal(1.0E7).valueText());
    assertEquals("-120.0", Literal.ofDecimal(-1.2E2).valueText());
    assertEquals("0.00010", Literal.ofDecimal(0.0001).valueText());

    // 2. strings never equal numbers or booleans
    assertNotEquals(Literal.ofString("true"), Literal.ofBool(true));
    assertNotEquals(Literal.ofString("5"), Literal.ofInteger(5));
    assertEquals(Literal.ofBool(false), Literal.ofBool(false));

    // 3. the writer keeps the kind
    assertTrue(IrWriter.writeLiteral(Literal.ofInteger(5)).get(IrJson.NUMBER).isIntegralNumber());
    assertTrue(IrWriter.writeLiteral(Literal.ofDecimal(5.0)).get(IrJson.NUMBER).isDouble());
  }

  @Test
  public void testTransitionBuilderCopies() {
    // 1. toBuilder yields an equal transition that can be modified independently
    final Transition original = TransitionBuilder.newBuilder().id("t9").from("A").to("B")
        .trigger(new Trigger.Schedule("0 7 * * *")).action(new Action.Delay(5)).build();
    final Transition copy = original.toBuilder().build();
    assertEquals(original, copy);
    final Transition retargeted = original.toBuilder().to("C").build();
    assertEquals("C", retargeted.getToState());
    assertEquals("B", original.getToState());
    assertEquals(original.getTriggers(), retargeted.getTriggers());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTransitionNeedsEndpoints() {
    TransitionBuilder.newBuilder().from("A").build();
  }

  @Test
  public void testCanonicalStringIgnoresKeyOrder() throws AutomationException {
    final JsonNode left = IrJson.parse("{\"b\":1,\"a\":{\"y\":[1,2],\"x\":true}}");
    final JsonNode right = IrJson.parse("{\"a\":{\"x\":true,\"y\":[1,2]},\"b\":1}");
    assertEquals(IrJson.canonicalString(left), IrJson.canonicalString(right));
    assertEquals("{\"a\":{\"x\":true,\"y\":[1,2]},\"b\":1}", IrJson.canonicalString(left));
  }
}
