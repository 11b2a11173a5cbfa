package io.tasks4j.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;

import static org.assertj.core.api.Assertions.assertThat;

class JobInfoTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesWithSnakeCaseNextRunTime() throws Exception {
        IntervalTrigger trigger = new IntervalTrigger(Duration.ofMinutes(10), Instant.parse("2026-01-01T00:00:00Z"));
        JobInfo info = new JobInfo("water-plants", "turn on the sprinkler",
                Instant.parse("2026-01-01T00:10:00Z"), trigger.type(), trigger.describe(), false);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(info));

        assertThat(json.get("id").asText()).isEqualTo("water-plants");
        assertThat(json.get("command").asText()).isEqualTo("turn on the sprinkler");
        assertThat(json.get("next_run_time").asText()).isEqualTo("2026-01-01T00:10:00Z");
        assertThat(json.get("trigger_type").asText()).isEqualTo("INTERVAL");
        assertThat(json.get("trigger").get("period").asText()).isEqualTo("PT10M");
        assertThat(json.get("stalled").asBoolean()).isFalse();
        assertThat(json.has("nextRunAt")).isFalse();
    }

    @Test
    void triggerSummaryKeepsDescribeOrder() {
        CronTrigger trigger = CronTrigger.builder().dayOfWeek("mon").hour("9").minute("0").zone(java.time.ZoneOffset.UTC).build();
        JobInfo info = new JobInfo("standup", "read my calendar", Instant.EPOCH, trigger.type(), trigger.describe(), false);

        Iterator<String> keys = info.trigger().keySet().iterator();

        assertThat(keys.next()).isEqualTo("type");
        assertThat(keys.next()).isEqualTo("day_of_week");
        assertThat(keys.next()).isEqualTo("hour");
        assertThat(keys.next()).isEqualTo("minute");
        assertThat(keys.next()).isEqualTo("timezone");
    }
}
