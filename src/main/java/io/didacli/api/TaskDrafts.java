package io.didacli.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ValidationException;
import io.didacli.util.Jsons;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Builds task request bodies from command-line input: local date-times are
 * converted to UTC and required tags are injected.
 */
public final class TaskDrafts {
    static final DateTimeFormatter LOCAL_INPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);
    static final DateTimeFormatter API_OUTPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'+0000'");

    private final String timezone;
    private final List<String> requiredTags;
    private final boolean enableRequiredTags;

    public TaskDrafts(String timezone, List<String> requiredTags, boolean enableRequiredTags) {
        this.timezone = timezone;
        this.requiredTags = requiredTags == null ? List.of() : requiredTags;
        this.enableRequiredTags = enableRequiredTags;
    }

    public ObjectNode build(TaskInput input, boolean requireTitle) {
        if (requireTitle && (input.title() == null || input.title().trim().isEmpty())) {
            throw new ValidationException("Task title is required", "title");
        }
        ObjectNode draft = Jsons.mapper().createObjectNode();
        putIfPresent(draft, "title", input.title());
        putIfPresent(draft, "content", input.content());
        putIfPresent(draft, "desc", input.desc());
        if (input.allDay()) {
            draft.put("isAllDay", true);
        }
        if (input.start() != null) {
            draft.put("startDate", toUtc(input.start(), timezone));
        }
        if (input.due() != null) {
            draft.put("dueDate", toUtc(input.due(), timezone));
        }
        putIfPresent(draft, "repeatFlag", input.repeatFlag());
        if (input.priority() != null) {
            draft.put("priority", input.priority());
        }
        if (input.sortOrder() != null) {
            draft.put("sortOrder", input.sortOrder());
        }
        draft.put("timeZone", timezone);

        if (input.reminders() != null && !input.reminders().isEmpty()) {
            ArrayNode reminders = draft.putArray("reminders");
            input.reminders().forEach(reminders::add);
        }
        if (input.items() != null && !input.items().isEmpty()) {
            ArrayNode items = draft.putArray("items");
            for (String raw : input.items()) {
                items.add(parseItem(raw));
            }
        }

        boolean requiredEnabled = input.enableRequiredTags() == null ? enableRequiredTags : input.enableRequiredTags();
        List<String> tags = TaskTags.merge(requiredTags, input.tagHints(), requiredEnabled);
        if (!tags.isEmpty()) {
            ArrayNode arr = draft.putArray("tags");
            tags.forEach(arr::add);
        }
        return draft;
    }

    /** {@code yyyy-MM-dd HH:mm} in {@code zone} to {@code yyyy-MM-dd'T'HH:mm:ss+0000}. */
    public static String toUtc(String localDateTime, String zone) {
        LocalDateTime local;
        try {
            local = LocalDateTime.parse(localDateTime.trim(), LOCAL_INPUT);
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    "Invalid date-time \"" + localDateTime + "\": expected yyyy-MM-dd HH:mm", "date");
        }
        return local.atZone(ZoneId.of(zone)).withZoneSameInstant(ZoneOffset.UTC).format(API_OUTPUT);
    }

    private ObjectNode parseItem(String raw) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid --item JSON: " + e.getOriginalMessage(), "item");
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("Invalid --item JSON: expected an object", "item");
        }
        ObjectNode item = (ObjectNode) node;
        for (String field : new String[]{"startDate", "completedTime"}) {
            JsonNode value = item.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                item.put(field, toUtc(value.asText(), timezone));
            }
        }
        return item;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    /** Raw task fields as given on the command line. */
    public record TaskInput(
            String title,
            String content,
            String desc,
            String start,
            String due,
            boolean allDay,
            List<String> reminders,
            String repeatFlag,
            Integer priority,
            Long sortOrder,
            List<String> items,
            List<String> tagHints,
            Boolean enableRequiredTags
    ) {
    }
}
