package io.didacli.api;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

final class TaskTagsTest {

    @Test
    void normalizeTrimsStripsWhitespaceAndLowercases() {
        Assertions.assertEquals("deepwork", TaskTags.normalize("  Deep Work "));
        Assertions.assertEquals("", TaskTags.normalize(null));
        Assertions.assertEquals("", TaskTags.normalize(" \t "));
    }

    @Test
    void dedupeKeepsFirstOccurrenceAndDropsEmpties() {
        Assertions.assertEquals(List.of("work", "home"), TaskTags.dedupe(Arrays.asList("Work", " ", "home", "WORK", null)));
    }

    @Test
    void requiredTagsComeFirstWhenEnabled() {
        List<String> required = List.of("cli");
        List<String> hints = List.of("Focus", "CLI", "focus");

        Assertions.assertEquals(List.of("cli", "focus"), TaskTags.merge(required, hints, true));
        Assertions.assertEquals(List.of("focus", "cli"), TaskTags.merge(required, hints, false));
        Assertions.assertEquals(List.of("cli"), TaskTags.merge(required, null, true));
    }
}
