package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.RoleParameter;
import io.regrada.core.projection.model.DataType;
import io.regrada.core.projection.model.EventCommon;
import io.regrada.core.projection.model.ProjectedRole;
import io.regrada.core.projection.model.Projection;
import io.regrada.core.projection.model.ProjectionEvent;
import io.regrada.core.projection.model.ProjectionGraph;
import io.regrada.core.projection.model.ProjectionRelation;
import io.regrada.core.projection.model.RoleExpr;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads one compiled projection: `{"role": {...}, "graph": {"events": [...], "relations": [...]}}`.
///
/// ### Events
/// `{"inputEvent": {common, receivers}}`, `{"receiveEvent": {common, initiators}}` or
/// `{"computationEvent": {common, dataExpr, receivers}}`, where `common` carries
/// `choreoElementUID`, `endpointElementUID`, `label`, `dataType`,
/// `marking: {isIncluded, isPending}` and an optional `instantiationConstraint`.
///
/// ### Relations
/// `{"controlFlowRelation": {"relationCommon": {"sourceId"}, "relationType", "targetId"}}` or
/// `{"spawnRelation": {"relationCommon": {"sourceId"}, "graph"}}`; the spawned graph nests.
///
/// A missing `events` or `relations` array reads as empty.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class ProjectionDeserializer extends StdDeserializer<Projection> {

    @Serial private static final long serialVersionUID = -5283327713309516448L;

    ProjectionDeserializer() {
        super(Projection.class);
    }

    @Override
    public Projection deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode role = root.path("role");
        if (!role.has("label")) {
            throw JsonMappingException.from(p, "Projection without a role label");
        }
        List<RoleParameter> params = new ArrayList<>();
        for (JsonNode param : role.path("params")) {
            params.add(new RoleParameter(
                    param.path("name").asText(),
                    DataType.primitiveName(DataTypeDeserializer.typeName(param.path("type")))));
        }
        return new Projection(
                new ProjectedRole(role.get("label").asText(), params), readGraph(p, root.path("graph")));
    }

    private static ProjectionGraph readGraph(JsonParser p, JsonNode graph) throws IOException {
        List<ProjectionEvent> events = new ArrayList<>();
        for (JsonNode event : graph.path("events")) {
            events.add(readEvent(p, event));
        }
        List<ProjectionRelation> relations = new ArrayList<>();
        for (JsonNode relation : graph.path("relations")) {
            relations.add(readRelation(p, relation));
        }
        return new ProjectionGraph(events, relations);
    }

    private static ProjectionEvent readEvent(JsonParser p, JsonNode event) throws IOException {
        if (event.has("inputEvent")) {
            JsonNode body = event.get("inputEvent");
            return new ProjectionEvent.InputEvent(readCommon(p, body), readRoles(p, body.path("receivers")));
        }
        if (event.has("receiveEvent")) {
            JsonNode body = event.get("receiveEvent");
            return new ProjectionEvent.ReceiveEvent(readCommon(p, body), readRoles(p, body.path("initiators")));
        }
        if (event.has("computationEvent")) {
            JsonNode body = event.get("computationEvent");
            return new ProjectionEvent.ComputationEvent(
                    readCommon(p, body),
                    ExpressionDeserializer.read(p, body.get("dataExpr")),
                    readRoles(p, body.path("receivers")));
        }
        throw JsonMappingException.from(p, "Unknown event kind: " + event.fieldNames().next());
    }

    private static EventCommon readCommon(JsonParser p, JsonNode body) throws IOException {
        JsonNode common = body.path("common");
        JsonNode marking = common.path("marking");
        String choreoUid = common.path("choreoElementUID").asText("");
        String endpointUid = common.path("endpointElementUID").asText("");
        if (choreoUid.isEmpty() || endpointUid.isEmpty()) {
            throw JsonMappingException.from(p, "Event without element uids: " + common);
        }
        return new EventCommon(
                choreoUid,
                endpointUid,
                common.path("label").asText(null),
                DataTypeDeserializer.read(p, common.get("dataType")),
                marking.path("isIncluded").asBoolean(true),
                marking.path("isPending").asBoolean(false),
                ExpressionDeserializer.read(p, common.get("instantiationConstraint")));
    }

    private static List<RoleExpr> readRoles(JsonParser p, JsonNode array) throws IOException {
        List<RoleExpr> roles = new ArrayList<>();
        for (JsonNode role : array) {
            roles.add(RoleExprDeserializer.read(p, role));
        }
        return roles;
    }

    private static ProjectionRelation readRelation(JsonParser p, JsonNode relation) throws IOException {
        if (relation.has("controlFlowRelation")) {
            JsonNode body = relation.get("controlFlowRelation");
            RelationKind kind;
            try {
                kind = RelationKind.fromJsonName(body.path("relationType").asText(""));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
            return new ProjectionRelation.ControlFlow(
                    body.path("relationCommon").path("sourceId").asText(), kind, body.path("targetId").asText());
        }
        if (relation.has("spawnRelation")) {
            JsonNode body = relation.get("spawnRelation");
            return new ProjectionRelation.Spawn(
                    body.path("relationCommon").path("sourceId").asText(), readGraph(p, body.path("graph")));
        }
        throw JsonMappingException.from(p, "Unknown relation kind: " + relation);
    }
}
