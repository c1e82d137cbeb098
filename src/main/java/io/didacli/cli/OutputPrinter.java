package io.didacli.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ApiException;
import io.didacli.error.DidaException;
import io.didacli.util.Jsons;

import java.io.PrintWriter;

/**
 * Writes the JSON envelope to stdout:
 * {@code {"ok":true,"data":..,"warnings":[..],"meta":..}} on success and
 * {@code {"ok":false,"error":{"type","code","message"}}} on failure.
 * Pretty-printed unless compact output was requested.
 */
public final class OutputPrinter {
    private final PrintWriter out;
    private final boolean compact;

    public OutputPrinter(PrintWriter out, boolean compact) {
        this.out = out;
        this.compact = compact;
    }

    public void success(CommandResult result) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("ok", true);
        payload.set("data", Jsons.mapper().valueToTree(result.data()));
        if (result.warnings() != null && !result.warnings().isEmpty()) {
            ArrayNode warnings = payload.putArray("warnings");
            result.warnings().forEach(warnings::add);
        }
        if (result.meta() != null) {
            payload.set("meta", Jsons.mapper().valueToTree(result.meta()));
        }
        print(payload);
    }

    public void error(Throwable error) {
        print(errorEnvelope(error));
    }

    static ObjectNode errorEnvelope(Throwable error) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("ok", false);
        ObjectNode body = payload.putObject("error");
        if (error instanceof DidaException dida) {
            body.put("type", dida.type());
            body.put("code", dida.code());
        } else {
            body.put("type", "UnknownError");
            body.put("code", "UNKNOWN_ERROR");
        }
        String message = error.getMessage();
        body.put("message", message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
        if (error instanceof ApiException api && api.path() != null) {
            ObjectNode details = body.putObject("details");
            details.put("status", api.status());
            details.put("path", api.path());
        }
        return payload;
    }

    private void print(ObjectNode payload) {
        out.println(compact ? Jsons.toCompactJson(payload) : Jsons.toJson(payload));
        out.flush();
    }
}
