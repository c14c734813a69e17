package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.projection.model.RoleExpr;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads compiled role expressions:
/// `{"initiatorExpr": {"eventId"}}`, `{"receiverExpr": {"eventId"}}`,
/// `{"roleExpr": {"roleLabel", "params"}}` or an untagged `{"roleLabel", "params"}`.
///
/// A parameter without `value` is a wildcard.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class RoleExprDeserializer extends StdDeserializer<RoleExpr> {

    @Serial private static final long serialVersionUID = 7338014420991867313L;

    RoleExprDeserializer() {
        super(RoleExpr.class);
    }

    @Override
    public RoleExpr deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        return read(p, root);
    }

    static RoleExpr read(JsonParser p, JsonNode node) throws IOException {
        if (node.has("initiatorExpr")) {
            return new RoleExpr.InitiatorOf(node.get("initiatorExpr").path("eventId").asText());
        }
        if (node.has("receiverExpr")) {
            return new RoleExpr.ReceiverOf(node.get("receiverExpr").path("eventId").asText());
        }
        JsonNode ref = node.has("roleExpr") ? node.get("roleExpr") : node;
        if (!ref.has("roleLabel")) {
            throw JsonMappingException.from(p, "Unknown role expression: " + node);
        }
        List<RoleExpr.Param> params = new ArrayList<>();
        for (JsonNode param : ref.path("params")) {
            params.add(new RoleExpr.Param(
                    param.path("name").asText(), ExpressionDeserializer.read(p, param.get("value"))));
        }
        return new RoleExpr.RoleRef(ref.get("roleLabel").asText(), params);
    }
}
