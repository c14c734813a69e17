package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.compile.CompileError;
import io.regrada.core.compile.Diagnostic;
import io.regrada.core.compile.SourceSpan;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads `{"stackTrace": [{"message", "location": {"from": {line, column}, "to": {line, column}}}]}`,
/// with or without the enclosing `compileError` key.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class CompileErrorDeserializer extends StdDeserializer<CompileError> {

    @Serial private static final long serialVersionUID = 3650772258131150968L;

    CompileErrorDeserializer() {
        super(CompileError.class);
    }

    @Override
    public CompileError deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode error = root.has("compileError") ? root.get("compileError") : root;
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (JsonNode entry : error.path("stackTrace")) {
            diagnostics.add(new Diagnostic(entry.path("message").asText(""), span(entry.path("location"))));
        }
        return new CompileError(diagnostics);
    }

    private static SourceSpan span(JsonNode location) {
        if (!location.isObject()) {
            return null;
        }
        JsonNode from = location.path("from");
        JsonNode to = location.path("to");
        return new SourceSpan(
                from.path("line").asInt(), from.path("column").asInt(),
                to.path("line").asInt(), to.path("column").asInt());
    }
}
