package com.github.automationir.codec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.automationir.model.DeviceRef;
import com.github.automationir.model.Literal;
import com.github.automationir.model.Trigger;

/**
 * Tests to check the trigger forms accepted in transition labels.
 */
public class TriggerParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testTriggerForms() throws DiagramParseException {
    assertEquals(new Trigger.Becomes(new DeviceRef("motion_hall", "motion"),
        Literal.ofString("active")), TriggerParser.parse("motion_hall.motion becomes \"active\""));
    assertEquals(new Trigger.Becomes(new DeviceRef("lamp_living", "level"),
        Literal.ofInteger(40)), TriggerParser.parse(" lamp_living.level becomes 40 "));
    assertEquals(new Trigger.Changes(new DeviceRef("door_front", "contact")),
        TriggerParser.parse("door_front.contact changes"));
    assertEquals(new Trigger.After(90), TriggerParser.parse("after 90s"));
    assertEquals(new Trigger.After(5), TriggerParser.parse("AFTER 5 s"));
    assertEquals(new Trigger.Schedule("0 7 * * 1-5"), TriggerParser.parse("schedule 0 7 * * 1-5"));
    assertEquals(new Trigger.Schedule("@daily"), TriggerParser.parse("Schedule @daily"));
  }

  @Test
  public void testRefSplitsAtFirstDot() throws DiagramParseException {
    final Trigger trigger = TriggerParser.parse("thermostat_main.setpoint.heating changes");
    assertEquals(new DeviceRef("thermostat_main", "setpoint.heating"),
        ((Trigger.Changes) trigger).getRef());
  }

  @Test
  public void testRejectedTriggers() {
    for (String bad : new String[] {"motion_hall.motion becomes active", "motion changes",
        "after 5 minutes", "after 99999999999s", "schedule ", "whenever"}) {
      try {
        TriggerParser.parse(bad);
        fail("expected a parse failure for: " + bad);
      } catch (DiagramParseException expected) {
        // reported as a diagnostic by the decoder
      }
    }
  }
}
