package ca.gc.cra.warper.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"config=/etc/warper.yaml", "projection=geos"});
    assertEquals("/etc/warper.yaml", map.get("config"));
    assertEquals("geos", map.get("projection"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelEndpoint=http://otel:4317/?a=b"});
    assertEquals("http://otel:4317/?a=b", map.get("otelEndpoint"));
  }

  @Test
  void rejectsMalformedAndDuplicateArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"config"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"config="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"config=a.yaml", "config=b.yaml"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
