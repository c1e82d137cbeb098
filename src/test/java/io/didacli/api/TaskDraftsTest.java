package io.didacli.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TaskDraftsTest {
    private final TaskDrafts drafts = new TaskDrafts("Asia/Shanghai", List.of("cli"), true);

    @Test
    void localTimesAreConvertedToUtc() {
        Assertions.assertEquals("2024-03-10T01:30:00+0000", TaskDrafts.toUtc("2024-03-10 09:30", "Asia/Shanghai"));
        Assertions.assertEquals("2024-03-09T23:00:00+0000", TaskDrafts.toUtc("2024-03-10 07:00", "Asia/Shanghai"));
        Assertions.assertEquals("2024-07-01T10:00:00+0000", TaskDrafts.toUtc(" 2024-07-01 12:00 ", "Europe/Berlin"));
    }

    @Test
    void invalidDatesAreRejected() {
        Assertions.assertThrows(ValidationException.class, () -> TaskDrafts.toUtc("2024-02-30 10:00", "UTC"));
        Assertions.assertThrows(ValidationException.class, () -> TaskDrafts.toUtc("2024-03-10T10:00", "UTC"));
        Assertions.assertThrows(ValidationException.class, () -> TaskDrafts.toUtc("tomorrow", "UTC"));
    }

    @Test
    void buildsFullDraft() {
        ObjectNode draft = drafts.build(new TaskDrafts.TaskInput(
                "Write report", "body", null, "2024-03-10 09:00", "2024-03-10 18:00", false,
                List.of("TRIGGER:-PT15M"), "RRULE:FREQ=DAILY", 3, 100L,
                List.of("{\"title\":\"step 1\",\"startDate\":\"2024-03-10 10:00\"}"),
                List.of("Focus"), null), true);

        Assertions.assertEquals("Write report", draft.get("title").asText());
        Assertions.assertEquals("body", draft.get("content").asText());
        Assertions.assertFalse(draft.has("desc"));
        Assertions.assertFalse(draft.has("isAllDay"));
        Assertions.assertEquals("2024-03-10T01:00:00+0000", draft.get("startDate").asText());
        Assertions.assertEquals("2024-03-10T10:00:00+0000", draft.get("dueDate").asText());
        Assertions.assertEquals("TRIGGER:-PT15M", draft.get("reminders").get(0).asText());
        Assertions.assertEquals("RRULE:FREQ=DAILY", draft.get("repeatFlag").asText());
        Assertions.assertEquals(3, draft.get("priority").asInt());
        Assertions.assertEquals(100L, draft.get("sortOrder").asLong());
        Assertions.assertEquals("Asia/Shanghai", draft.get("timeZone").asText());

        JsonNode item = draft.get("items").get(0);
        Assertions.assertEquals("step 1", item.get("title").asText());
        Assertions.assertEquals("2024-03-10T02:00:00+0000", item.get("startDate").asText());

        Assertions.assertEquals("cli", draft.get("tags").get(0).asText());
        Assertions.assertEquals("focus", draft.get("tags").get(1).asText());
    }

    @Test
    void requiredTagsCanBeDisabledPerTask() {
        ObjectNode draft = drafts.build(input("t", List.of(), Boolean.FALSE), true);
        Assertions.assertFalse(draft.has("tags"));

        TaskDrafts disabled = new TaskDrafts("UTC", List.of("cli"), false);
        ObjectNode forced = disabled.build(input("t", List.of("x"), Boolean.TRUE), true);
        Assertions.assertEquals(2, forced.get("tags").size());
    }

    @Test
    void titleIsRequiredOnlyWhenAsked() {
        Assertions.assertThrows(ValidationException.class, () -> drafts.build(input(" ", List.of(), null), true));

        ObjectNode update = drafts.build(input(null, List.of(), null), false);
        Assertions.assertFalse(update.has("title"));
    }

    @Test
    void invalidItemJsonIsAValidationError() {
        TaskDrafts.TaskInput broken = new TaskDrafts.TaskInput("t", null, null, null, null, true, null, null,
                null, null, List.of("{title"), null, null);
        ValidationException error = Assertions.assertThrows(ValidationException.class, () -> drafts.build(broken, true));
        Assertions.assertTrue(error.getMessage().startsWith("Invalid --item JSON"));

        TaskDrafts.TaskInput notObject = new TaskDrafts.TaskInput("t", null, null, null, null, true, null, null,
                null, null, List.of("[1]"), null, null);
        Assertions.assertThrows(ValidationException.class, () -> drafts.build(notObject, true));
    }

    private static TaskDrafts.TaskInput input(String title, List<String> tags, Boolean enableRequiredTags) {
        return new TaskDrafts.TaskInput(title, null, null, null, null, false, List.of(), null, null, null,
                List.of(), tags, enableRequiredTags);
    }
}
