package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.graph.Event;
import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.IdAllocator;
import io.regrada.core.graph.IdPools;
import io.regrada.core.graph.Marking;
import io.regrada.core.graph.NestMode;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ScopeKind;
import io.regrada.core.graph.ValueType;
import io.regrada.core.layout.Position;
import io.regrada.core.project.NodeGeometry;
import io.regrada.core.project.Project;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Reads a project file of either [ProjectFormat] into a [Project].
///
/// Node `type` selects the element: `event`, `nest` or `subprocess`. An empty
/// or missing `parentId` means the global scope. When the pool arrays are
/// absent, each pool is rebuilt from the ids in use.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
/// @see ProjectDocumentSerializer for the inverse operation
class ProjectDocumentDeserializer extends StdDeserializer<Project> {

    @Serial private static final long serialVersionUID = -3361807402815594470L;

    ProjectDocumentDeserializer() {
        super(Project.class);
    }

    /// Reads the whole document and builds the graph.
    ///
    /// @throws IOException if a node type is unknown, a required field is
    ///     missing, or the resulting graph is inconsistent
    @Override
    public Project deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return readProject(p, mapper, root);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid project: " + e.getMessage(), e);
        }
    }

    private Project readProject(JsonParser p, ObjectMapper mapper, JsonNode root) throws IOException {
        Graph.Builder builder = Graph.builder();
        Map<String, NodeGeometry> geometry = new LinkedHashMap<>();
        List<String> eventIds = new ArrayList<>();
        List<String> nestIds = new ArrayList<>();
        List<String> subprocessIds = new ArrayList<>();

        for (JsonNode node : root.path("nodes")) {
            String id = required(p, node, "id");
            String type = required(p, node, "type");
            String parent = parentOf(node);
            JsonNode data = node.path("data");
            if (ProjectDocumentSerializer.EVENT_NODE.equals(type)) {
                builder.event(readEvent(id, parent, data));
                eventIds.add(id);
            } else if (ScopeKind.NEST.jsonName().equals(type)) {
                builder.scope(new Scope(id, ScopeKind.NEST, data.path("label").asText(id),
                        NestMode.fromJsonName(data.path("nestType").asText(NestMode.GROUP.jsonName())),
                        readMarking(data), parent));
                nestIds.add(id);
            } else if (ScopeKind.SUBPROCESS.jsonName().equals(type)) {
                builder.scope(new Scope(id, ScopeKind.SUBPROCESS, data.path("label").asText(id),
                        null, readMarking(data), parent));
                subprocessIds.add(id);
            } else {
                throw JsonMappingException.from(p, "Unknown node type '" + type + "' for node " + id);
            }
            readGeometry(node).ifPresent(g -> geometry.put(id, g));
        }

        List<Relation> relations = new ArrayList<>();
        for (JsonNode edge : root.path("edges")) {
            relations.add(mapper.treeToValue(edge, Relation.class));
        }
        List<Role> roles = new ArrayList<>();
        for (JsonNode role : root.path("roles")) {
            roles.add(mapper.treeToValue(role, Role.class));
        }

        builder.relations(relations)
                .roles(roles)
                .security(root.path("security").asText(""))
                .idPools(new IdPools(
                        readPool(root, "nextNodeId", IdPools.EVENT_PREFIX, eventIds),
                        readPool(root, "nextGroupId", IdPools.NEST_PREFIX, nestIds),
                        readPool(root, "nextSubprocessId", IdPools.SUBPROCESS_PREFIX, subprocessIds)));

        return new Project(builder.build(), root.path("code").asText(""), geometry);
    }

    private static Event readEvent(String id, String parent, JsonNode data) {
        EventKind kind = EventKind.fromCode(data.path("type").asText(EventKind.INPUT.code()));
        Event.Builder event = Event.builder()
                .id(id)
                .label(data.path("label").asText(id))
                .name(data.path("name").asText(null))
                .kind(kind)
                .security(data.path("security").asText(""))
                .marking(readMarking(data))
                .initiators(readStrings(data.path("initiators")))
                .receivers(readStrings(data.path("receivers")))
                .parent(parent);
        if (kind == EventKind.INPUT) {
            event.valueType(readInput(data.path("input")));
        } else {
            event.expression(data.path("expression").asText(""));
        }
        return event.build();
    }

    private static ValueType readInput(JsonNode input) {
        String type = input.path("type").asText(ValueType.UNIT);
        if (!ValueType.RECORD.equals(type)) {
            return ValueType.primitive(type);
        }
        List<ValueType.Field> fields = new ArrayList<>();
        for (JsonNode field : input.path("record")) {
            fields.add(new ValueType.Field(field.path("var").asText(), field.path("type").asText()));
        }
        return new ValueType.Record(fields);
    }

    private static Marking readMarking(JsonNode data) {
        JsonNode marking = data.path("marking");
        return new Marking(marking.path("included").asBoolean(true), marking.path("pending").asBoolean(false));
    }

    private static Optional<NodeGeometry> readGeometry(JsonNode node) {
        JsonNode position = node.path("position");
        Position at = position.isObject()
                ? new Position(position.path("x").asDouble(), position.path("y").asDouble())
                : null;
        Double width = node.hasNonNull("width") ? node.get("width").asDouble() : null;
        Double height = node.hasNonNull("height") ? node.get("height").asDouble() : null;
        if (at == null && width == null && height == null) {
            return Optional.empty();
        }
        return Optional.of(new NodeGeometry(at, width, height));
    }

    private static IdAllocator readPool(JsonNode root, String field, String prefix, List<String> usedIds) {
        JsonNode stored = root.path(field);
        if (!stored.isArray()) {
            return IdAllocator.fromUsed(prefix, usedIds);
        }
        List<Integer> available = new ArrayList<>();
        for (JsonNode suffix : stored) {
            available.add(suffix.asInt());
        }
        return IdAllocator.fromAvailable(prefix, available);
    }

    private static List<String> readStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            values.add(value.asText());
        }
        return values;
    }

    private static String parentOf(JsonNode node) {
        String parent = node.path("parentId").asText("");
        return parent.isEmpty() ? Scope.GLOBAL_ID : parent;
    }

    private static String required(JsonParser p, JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, "Node is missing required field '" + field + "'");
        }
        return value.asText();
    }
}
