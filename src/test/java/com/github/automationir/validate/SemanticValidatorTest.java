package com.github.automationir.validate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.automationir.AutomationException;
import com.github.automationir.Fixtures;
import com.github.automationir.catalog.CapabilityCatalog;
import com.github.automationir.catalog.CatalogLoader;
import com.github.automationir.catalog.DeviceCatalog;
import com.github.automationir.model.IrJson;

/**
 * Tests to check the catalog-aware checks run over structurally valid documents.
 */
public class SemanticValidatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static DeviceCatalog devices;
  private static CapabilityCatalog capabilities;
  private static AutomationValidator validator;

  @BeforeClass
  public static void loadCatalogs() throws AutomationException {
    devices = CatalogLoader.defaultDeviceCatalog();
    capabilities = CatalogLoader.defaultCapabilityCatalog();
    validator = new AutomationValidator(IrSchema.canonical(), devices, capabilities);
  }

  @Test
  public void testCleanDocument() throws AutomationException {
    final ValidationReport report = validator.validate(Fixtures.load(Fixtures.HALL_LIGHT));
    assertTrue(report.isOk());
    assertTrue(report.getDiagnostics().isEmpty());
    assertTrue(report.getPatches().isEmpty());
  }

  @Test
  public void testUnknownDevice() throws AutomationException {
    // 1. misspell the commanded device
    final ObjectNode document = hallLight();
    action(document, 0, 0).put(IrJson.DEVICE, "lite_hall");

    // 2. exactly one error, with suggestions from the catalog
    final ValidationReport report = validator.validate(document);
    assertFalse(report.isOk());
    assertEquals(1, report.getDiagnostics().size());
    final Diagnostic diagnostic = report.getDiagnostics().get(0);
    assertEquals("E110", diagnostic.getCodeValue());
    assertEquals("$.stateMachine.transitions[0].actions[0]", diagnostic.getPath());
    assertTrue(diagnostic.getSuggestions().contains("light_hall"));
    assertEquals(devices.sortedIds(), diagnostic.getSuggestions());
  }

  @Test
  public void testEnumValueCasePatch() throws AutomationException {
    // 1. right value, wrong case
    final ObjectNode document = hallLight();
    ((ObjectNode) trigger(document, 0, 0).get(IrJson.VALUE)).put(IrJson.STRING, "Active");

    // 2. an error plus a case-fixing patch
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.withCode("E220").size());
    assertEquals(Arrays.asList("active", "inactive"),
        report.withCode("E220").get(0).getSuggestions());
    assertEquals(1, report.getPatches().size());
    final NormalizationPatch patch = report.getPatches().get(0);
    assertEquals("replace", patch.getOp());
    assertEquals("$.stateMachine.transitions[0].triggers[0].value.string", patch.getPath());
    assertEquals("active", patch.getValue().asText());

    // 3. a value that matches nothing gets no patch
    ((ObjectNode) trigger(document, 0, 0).get(IrJson.VALUE)).put(IrJson.STRING, "sleepy");
    final ValidationReport unpatched = validator.validate(document);
    assertEquals(1, unpatched.withCode("E220").size());
    assertTrue(unpatched.getPatches().isEmpty());
  }

  @Test
  public void testEnumTypeMismatch() throws AutomationException {
    final ObjectNode document = hallLight();
    trigger(document, 0, 0).set(IrJson.VALUE, IrJson.nodes().objectNode().put(IrJson.NUMBER, 1));
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.errors().size());
    assertEquals("E210", report.errors().get(0).getCodeValue());
  }

  @Test
  public void testUnknownAttributeAndCommand() throws AutomationException {
    // 1. bad attribute in a trigger and bad command in an action
    final ObjectNode document = hallLight();
    ((ObjectNode) trigger(document, 0, 0).get(IrJson.REF)).put(IrJson.PATH, "brightness");
    action(document, 0, 0).put(IrJson.COMMAND, "dim");

    // 2. both reported, enum check skipped for the unknown attribute
    final ValidationReport report = validator.validate(document);
    assertEquals(2, report.errors().size());
    assertEquals(Arrays.asList("motion"), report.withCode("E200").get(0).getSuggestions());
    assertEquals(Arrays.asList("off", "on"), report.withCode("E300").get(0).getSuggestions());
    assertTrue(report.withCode("E220").isEmpty());
  }

  @Test
  public void testDeviceKindWithoutCapabilities() throws AutomationException {
    final Map<String, String> kinds = new HashMap<>();
    kinds.put("light_hall", "toaster");
    kinds.put("motion_hall", "motionSensor");
    final AutomationValidator toasterValidator =
        new AutomationValidator(IrSchema.canonical(), DeviceCatalog.of(kinds), capabilities);
    final ValidationReport report = toasterValidator.validate(hallLight());
    assertFalse(report.isOk());
    assertFalse(report.withCode("E205").isEmpty());
    for (Diagnostic diagnostic : report.errors()) {
      assertEquals("E205", diagnostic.getCodeValue());
    }
  }

  @Test
  public void testConflictingCommands() throws AutomationException {
    final ObjectNode document = hallLight();
    final ArrayNode actions = (ArrayNode) transition(document, 0).get(IrJson.ACTIONS);
    actions.addObject().put(IrJson.TYPE, "command").put(IrJson.DEVICE, "light_hall")
        .put(IrJson.COMMAND, "off");
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.errors().size());
    final Diagnostic conflict = report.errors().get(0);
    assertEquals("E530", conflict.getCodeValue());
    assertEquals("$.stateMachine.transitions[0].actions", conflict.getPath());
  }

  @Test
  public void testUnknownInitialState() throws AutomationException {
    // 1. initial points nowhere
    final ObjectNode document = hallLight();
    ((ObjectNode) document.get(IrJson.STATE_MACHINE)).put(IrJson.INITIAL, "Nowhere");

    // 2. one error listing the states, and no reachability warnings
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.getDiagnostics().size());
    final Diagnostic diagnostic = report.getDiagnostics().get(0);
    assertEquals("E111", diagnostic.getCodeValue());
    assertEquals("$.stateMachine.initial", diagnostic.getPath());
    assertEquals(Arrays.asList("Idle", "LightOn"), diagnostic.getSuggestions());
  }

  @Test
  public void testUnknownTransitionEndpoint() throws AutomationException {
    final ObjectNode document = hallLight();
    transition(document, 1).put(IrJson.TO, "Gone");
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.errors().size());
    assertEquals("$.stateMachine.transitions[1].to", report.errors().get(0).getPath());
  }

  @Test
  public void testUnreachableStateWarning() throws AutomationException {
    // 1. a state nothing leads to
    final ObjectNode document = hallLight();
    ((ArrayNode) document.get(IrJson.STATE_MACHINE).get(IrJson.STATES)).addObject()
        .put(IrJson.ID, "Orphan");

    // 2. the warning does not fail the report
    final ValidationReport report = validator.validate(document);
    assertTrue(report.isOk());
    assertEquals(1, report.warnings().size());
    assertEquals("W500", report.warnings().get(0).getCodeValue());
    assertTrue(report.warnings().get(0).getMessage().contains("'Orphan'"));
  }

  @Test
  public void testOperatorArity() throws AutomationException {
    // 1. not with two arguments, and with one
    final ObjectNode document = hallLight();
    final ObjectNode ref = IrJson.nodes().objectNode();
    ref.putObject(IrJson.REF).put(IrJson.DEVICE, "light_hall").put(IrJson.PATH, "switch");
    final ObjectNode badNot = IrJson.nodes().objectNode().put(IrJson.OP, "not");
    badNot.putArray(IrJson.ARGS).add(ref.deepCopy()).add(ref.deepCopy());
    final ObjectNode badAnd = IrJson.nodes().objectNode().put(IrJson.OP, "and");
    badAnd.putArray(IrJson.ARGS).add(badNot);
    transition(document, 0).set(IrJson.GUARD, badAnd);

    // 2. both arity errors reported at their own paths
    final ValidationReport report = validator.validate(document);
    assertEquals(2, report.withCode("E400").size());
    assertEquals("$.stateMachine.transitions[0].guard", report.withCode("E400").get(0).getPath());
    assertEquals("$.stateMachine.transitions[0].guard.args[0]",
        report.withCode("E400").get(1).getPath());
  }

  @Test
  public void testInvariantsAreChecked() throws AutomationException {
    final ObjectNode document = hallLight();
    final ObjectNode invariant = (ObjectNode) document.get(IrJson.STATE_MACHINE)
        .get(IrJson.STATES).get(1).get(IrJson.INVARIANTS).get(0);
    ((ObjectNode) invariant.get(IrJson.ARGS).get(1).get(IrJson.LIT)).put(IrJson.STRING, "dim");
    final ValidationReport report = validator.validate(document);
    assertEquals(1, report.errors().size());
    assertEquals("E220", report.errors().get(0).getCodeValue());
    assertEquals("$.stateMachine.states[1].invariants[0]", report.errors().get(0).getPath());
  }

  @Test
  public void testReportJson() throws AutomationException {
    final ObjectNode document = hallLight();
    action(document, 0, 0).put(IrJson.DEVICE, "lite_hall");
    final ObjectNode json = validator.validate(document).toJson();
    assertFalse(json.get("ok").asBoolean());
    assertEquals("E110", json.get("diagnostics").get(0).get("code").asText());
    assertEquals(0, json.get("patches").size());
  }

  private static ObjectNode hallLight() throws AutomationException {
    return (ObjectNode) Fixtures.load(Fixtures.HALL_LIGHT);
  }

  private static ObjectNode transition(final ObjectNode document, final int index) {
    return (ObjectNode) document.get(IrJson.STATE_MACHINE).get(IrJson.TRANSITIONS).get(index);
  }

  private static ObjectNode trigger(final ObjectNode document, final int transition,
      final int index) {
    return (ObjectNode) transition(document, transition).get(IrJson.TRIGGERS).get(index);
  }

  private static ObjectNode action(final ObjectNode document, final int transition,
      final int index) {
    return (ObjectNode) transition(document, transition).get(IrJson.ACTIONS).get(index);
  }
}
