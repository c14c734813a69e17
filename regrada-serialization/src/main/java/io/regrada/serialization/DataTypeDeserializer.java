package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.projection.model.DataType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads `{"valueType": "int"}` or
/// `{"recordType": {"fields": [{"name": "x", "type": {"valueType": "int"}}]}}`.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class DataTypeDeserializer extends StdDeserializer<DataType> {

    @Serial private static final long serialVersionUID = -6048931742040260372L;

    DataTypeDeserializer() {
        super(DataType.class);
    }

    @Override
    public DataType deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        return read(p, root);
    }

    static DataType read(JsonParser p, JsonNode node) throws IOException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new DataType.Value("void");
        }
        if (node.has("valueType")) {
            return new DataType.Value(node.get("valueType").asText());
        }
        if (node.has("recordType")) {
            List<DataType.Field> fields = new ArrayList<>();
            for (JsonNode field : node.get("recordType").path("fields")) {
                fields.add(new DataType.Field(field.path("name").asText(), typeName(field.path("type"))));
            }
            return new DataType.RecordType(fields);
        }
        throw JsonMappingException.from(p, "Unknown data type: " + node);
    }

    /// Accepts both `"int"` and `{"valueType": "int"}`.
    static String typeName(JsonNode type) {
        return type.isTextual() ? type.asText() : type.path("valueType").asText("void");
    }
}
