package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.RoleParameter;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads a project-file role. A missing `label` falls back to the `role` name.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class RoleDeserializer extends StdDeserializer<Role> {

    @Serial private static final long serialVersionUID = -1893530527126005564L;

    RoleDeserializer() {
        super(Role.class);
    }

    @Override
    public Role deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        String name = root.path("role").asText("");
        String label = root.path("label").asText(name);
        if (label.isEmpty()) {
            throw JsonMappingException.from(p, "Role needs a label");
        }
        List<RoleParameter> parameters = new ArrayList<>();
        for (JsonNode type : root.path("types")) {
            parameters.add(new RoleParameter(type.path("var").asText(), type.path("type").asText()));
        }
        List<String> participants = new ArrayList<>();
        for (JsonNode participant : root.path("participants")) {
            participants.add(participant.asText());
        }
        return new Role(label, name, parameters, participants);
    }
}
