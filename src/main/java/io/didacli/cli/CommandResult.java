package io.didacli.cli;

import java.util.ArrayList;
import java.util.List;

/** What a command hands to {@link OutputPrinter}: payload plus optional warnings and metadata. */
public record CommandResult(Object data, List<String> warnings, Object meta) {
    public static CommandResult of(Object data) {
        return new CommandResult(data, List.of(), null);
    }

    public CommandResult withWarnings(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings == null ? List.of() : warnings);
        merged.addAll(extra);
        return new CommandResult(data, merged, meta);
    }
}
