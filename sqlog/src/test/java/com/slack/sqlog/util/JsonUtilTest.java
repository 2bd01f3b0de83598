package com.slack.sqlog.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.slack.sqlog.stream.LogEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class JsonUtilTest {

  @Test
  public void testWriteAndReadRecord() throws JsonProcessingException {
    LogEvent event = new LogEvent("e1", 1000L, "[ERROR] boom", 1005L);
    String json = JsonUtil.writeAsString(event);
    assertThat(json)
        .isEqualTo(
            "{\"eventId\":\"e1\",\"timestampMs\":1000,\"message\":\"[ERROR] boom\","
                + "\"ingestionTimeMs\":1005}");
    assertThat(JsonUtil.read(json, LogEvent.class)).isEqualTo(event);
  }

  @Test
  public void testUnknownPropertiesAreIgnored() throws JsonProcessingException {
    LogEvent event =
        JsonUtil.read(
            "{\"eventId\":\"e1\",\"timestampMs\":1,\"message\":\"m\",\"ingestionTimeMs\":2,"
                + "\"logStreamName\":\"s\"}",
            LogEvent.class);
    assertThat(event.eventId()).isEqualTo("e1");
  }

  @Test
  public void testColumnOrderIsPreserved() throws JsonProcessingException {
    Map<String, String> row = new LinkedHashMap<>();
    row.put("@timestamp", "t");
    row.put("@message", "m");
    row.put("count", "1");
    String json = JsonUtil.writeAsString(row);
    assertThat(json).isEqualTo("{\"@timestamp\":\"t\",\"@message\":\"m\",\"count\":\"1\"}");
    Map<String, String> read = JsonUtil.read(json, new TypeReference<>() {});
    assertThat(read).containsExactlyEntriesOf(row);
  }
}
