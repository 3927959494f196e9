package com.github.automationir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.automationir.model.IrJson;

/**
 * Classpath access to the JSON documents under {@code /fixtures}.
 */
public final class Fixtures {
  public static final String HALL_LIGHT = "hall_light.json";
  public static final String DELAYED_OFF = "delayed_off.json";
  public static final String LOOSE_LLM_OUTPUT = "loose_llm_output.json";
  public static final String LOOSE_ALARM = "loose_alarm.json";

  public static JsonNode load(final String name) throws AutomationException {
    try (InputStream stream = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (stream == null) {
        throw new IllegalStateException("Missing fixture " + name);
      }
      final byte[] bytes = stream.readAllBytes();
      return IrJson.parse(new String(bytes, StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new IllegalStateException("Unreadable fixture " + name, problem);
    }
  }

  private Fixtures() {}
}
