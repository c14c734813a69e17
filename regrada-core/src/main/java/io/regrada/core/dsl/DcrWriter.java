package io.regrada.core.dsl;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.RoleParameter;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ValueType;
import io.regrada.core.scope.ScopeIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Writes a [Graph] as choreography source text.
///
/// Output is roles, `;`, the security lattice, `;`, then the global block.
/// A block lists its events, including those of nests inside it since nests
/// have no textual form, then `;` and its relations. Spawn blocks come first
/// so that every label they define exists before later lines refer to it.
///
/// ### Scope endpoints
/// A relation whose source or target is a scope is written once per pair of
/// leaf events, the inverse of the parser's comma lists:
/// ```
/// e0 -->* s0        with s0 holding e1 and e2
/// ```
/// becomes
/// ```
/// e0 -->* e1
/// e0 -->* e2
/// ```
///
/// A subprocess no spawn relation reaches has no textual form; it is skipped
/// with a warning, as is every relation line that would name its events.
///
/// @implNote Stateless; every call builds its own [ScopeIndex].
public final class DcrWriter {

    private static final Logger logger = Logger.getLogger(DcrWriter.class.getName());

    private static final String INDENT = "\t";

    private DcrWriter() {}

    /// Writes the graph.
    ///
    /// @param graph graph to write, not null
    /// @return source text, never null
    public static String write(Graph graph) {
        ScopeIndex index = ScopeIndex.of(graph);
        Map<String, Relation> spawnOf = chooseSpawns(graph, index);
        for (Scope scope : graph.getScopes()) {
            if (scope.isSubprocess() && !spawnOf.containsKey(scope.id())) {
                logger.warning("Subprocess " + scope.id() + " is not spawned by any event and is not written");
            }
        }

        List<String> lines = new ArrayList<>();
        for (Role role : graph.getRoles()) {
            lines.add(formatRole(role));
        }
        lines.add(DcrParser.SEPARATOR);
        lines.add(graph.getSecurity());
        lines.add(DcrParser.SEPARATOR);
        lines.addAll(writeBlock(Scope.GLOBAL_ID, index, spawnOf));
        return String.join("\n", lines);
    }

    /// Formats a role declaration such as `P(id:Integer; name:String)`.
    public static String formatRole(Role role) {
        if (role.parameters().isEmpty()) {
            return role.label();
        }
        List<String> params = new ArrayList<>();
        for (RoleParameter param : role.parameters()) {
            params.add(param.name() + ":" + param.type());
        }
        return role.label() + "(" + String.join("; ", params) + ")";
    }

    /// Formats one event declaration line.
    public static String formatEvent(Event event) {
        StringBuilder line = new StringBuilder();
        if (!event.getMarking().included()) {
            line.append('%');
        }
        if (event.getMarking().pending()) {
            line.append('!');
        }
        line.append('(').append(event.getLabel()).append(':').append(event.getName()).append(") ");
        line.append('(').append(event.getSecurity()).append(") [");
        if (event.isInput()) {
            line.append(formatValueType(event.getValueType()));
        } else {
            line.append(event.getExpression());
        }
        line.append("] [").append(String.join(", ", event.getInitiators()));
        if (!event.getReceivers().isEmpty()) {
            line.append(" -> ").append(String.join(", ", event.getReceivers()));
        }
        return line.append(']').toString();
    }

    static String formatValueType(ValueType type) {
        if (type instanceof ValueType.Unit) {
            return "?";
        }
        if (type instanceof ValueType.Record record) {
            List<String> fields = new ArrayList<>();
            for (ValueType.Field field : record.fields()) {
                fields.add(field.name() + ":" + field.type());
            }
            return "?:{" + String.join("; ", fields) + "}";
        }
        return "?:" + type.typeName();
    }

    /// Picks, per subprocess, the spawn relation whose block is written.
    ///
    /// A spawn block sits in the block enclosing its subprocess, so a spawn is
    /// usable once that block is written and its trigger is declared there or
    /// further out. The first usable spawn in relation order wins.
    private static Map<String, Relation> chooseSpawns(Graph graph, ScopeIndex index) {
        Map<String, Relation> spawnOf = new HashMap<>();
        Set<String> written = new LinkedHashSet<>();
        written.add(Scope.GLOBAL_ID);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Relation relation : graph.getRelations()) {
                if (relation.kind() != RelationKind.SPAWN || spawnOf.containsKey(relation.target())) {
                    continue;
                }
                String home = spawnBlock(relation, index);
                String triggerBlock = index.blockOf(graph.parentOf(relation.source())).id();
                if (written.contains(home) && graph.isWithin(home, triggerBlock)) {
                    spawnOf.put(relation.target(), relation);
                    written.add(relation.target());
                    changed = true;
                }
            }
        }
        return spawnOf;
    }

    /// Block the spawn line of a relation is written in.
    private static String spawnBlock(Relation spawn, ScopeIndex index) {
        return index.blockOf(index.graph().parentOf(spawn.target())).id();
    }

    private static List<String> writeBlock(String blockId, ScopeIndex index, Map<String, Relation> spawnOf) {
        Graph graph = index.graph();
        List<String> lines = new ArrayList<>();
        for (Event event : graph.getEvents()) {
            if (index.blockOf(event.getParent()).id().equals(blockId)) {
                lines.add(formatEvent(event));
            }
        }

        List<String> body = new ArrayList<>();
        for (Relation relation : graph.getRelations()) {
            if (relation.kind() != RelationKind.SPAWN || !spawnBlock(relation, index).equals(blockId)) {
                continue;
            }
            if (!relation.equals(spawnOf.get(relation.target()))) {
                logger.warning("Spawn " + relation.id() + " targets a subprocess written elsewhere and is skipped");
                continue;
            }
            String trigger = graph.findEvent(relation.source()).orElseThrow().getLabel();
            body.add(trigger + " " + RelationKind.SPAWN.arrow() + " {");
            for (String child : writeBlock(relation.target(), index, spawnOf)) {
                body.add(INDENT + child);
            }
            body.add(DcrParser.BLOCK_END);
        }

        Set<String> relationLines = new LinkedHashSet<>();
        for (Relation relation : graph.getRelations()) {
            if (relation.kind() == RelationKind.SPAWN || !ownedBy(relation, blockId, index)) {
                continue;
            }
            relationLines.addAll(expand(relation, index, spawnOf));
        }
        body.addAll(relationLines);

        if (!body.isEmpty()) {
            lines.add(DcrParser.SEPARATOR);
            lines.addAll(body);
        }
        return lines;
    }

    private static boolean ownedBy(Relation relation, String blockId, ScopeIndex index) {
        String owner = index.graph().parentOf(relation.source());
        return index.blockOf(owner == null ? Scope.GLOBAL_ID : owner).id().equals(blockId);
    }

    /// Writes one line per leaf-event pair of a relation.
    private static List<String> expand(Relation relation, ScopeIndex index, Map<String, Relation> spawnOf) {
        List<String> lines = new ArrayList<>();
        String guard = relation.hasGuard() ? " [" + relation.guard() + "]" : "";
        for (Event source : index.leafEvents(relation.source())) {
            for (Event target : index.leafEvents(relation.target())) {
                if (source.getId().equals(target.getId()) && !relation.kind().allowsSelfRelation()) {
                    continue;
                }
                if (!isWritten(source, index, spawnOf) || !isWritten(target, index, spawnOf)) {
                    logger.warning("Relation " + relation.id() + " names an event of an unwritten subprocess");
                    continue;
                }
                lines.add(source.getLabel() + " " + relation.kind().arrow() + " " + target.getLabel() + guard);
            }
        }
        return lines;
    }

    private static boolean isWritten(Event event, ScopeIndex index, Map<String, Relation> spawnOf) {
        String block = index.blockOf(event.getParent()).id();
        return Scope.GLOBAL_ID.equals(block) || spawnOf.containsKey(block);
    }
}
