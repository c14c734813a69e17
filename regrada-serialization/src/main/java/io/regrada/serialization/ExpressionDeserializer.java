package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.projection.model.Expression;
import java.io.IOException;
import java.io.Serial;

/// Reads the compile service's tagged expression objects.
///
/// | tag | payload |
/// |---|---|
/// | `binaryOp` | `{expr1, expr2, op}` |
/// | `propDeref` | `{propBasedExpr, prop}` |
/// | `eventRef` | `{value}` |
/// | `intLit`, `stringLit`, `boolLit`, `floatLit` | `{value}` |
///
/// An untagged `{propBasedExpr, prop}` object is read as a dereference.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class ExpressionDeserializer extends StdDeserializer<Expression> {

    @Serial private static final long serialVersionUID = 2914088815237016284L;

    ExpressionDeserializer() {
        super(Expression.class);
    }

    @Override
    public Expression deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        return read(p, root);
    }

    static Expression read(JsonParser p, JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.has("binaryOp")) {
            JsonNode op = node.get("binaryOp");
            return new Expression.BinaryOp(
                    read(p, op.get("expr1")), read(p, op.get("expr2")), op.path("op").asText());
        }
        if (node.has("propDeref")) {
            return readDeref(p, node.get("propDeref"));
        }
        if (node.has("propBasedExpr")) {
            return readDeref(p, node);
        }
        if (node.has("eventRef")) {
            return new Expression.EventRef(node.get("eventRef").path("value").asText());
        }
        if (node.has("intLit")) {
            return new Expression.IntLit(node.get("intLit").path("value").asLong());
        }
        if (node.has("stringLit")) {
            return new Expression.StringLit(node.get("stringLit").path("value").asText());
        }
        if (node.has("boolLit")) {
            return new Expression.BoolLit(node.get("boolLit").path("value").asBoolean());
        }
        if (node.has("floatLit")) {
            return new Expression.FloatLit(node.get("floatLit").path("value").asDouble());
        }
        throw JsonMappingException.from(p, "Unknown expression: " + node);
    }

    private static Expression readDeref(JsonParser p, JsonNode deref) throws IOException {
        Expression base = read(p, deref.get("propBasedExpr"));
        if (base == null) {
            throw JsonMappingException.from(p, "Property dereference without a base: " + deref);
        }
        return new Expression.PropDeref(base, deref.path("prop").asText());
    }
}
