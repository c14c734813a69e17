package io.regrada.core.dsl;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Marking;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.RoleParameter;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ValueType;
import io.regrada.core.role.RoleExpression;
import io.regrada.core.role.RoleExpressionSyntaxException;
import io.regrada.core.role.RoleExpressions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses choreography source text into a [Graph].
///
/// ### Source layout
/// ```
/// P(id:Integer)                                   roles
/// ;
/// Public flows Public                             security lattice
/// ;
/// (e0:readDocument) (Public) [?] [P(id=1)]        events of the global block
/// ;
/// e0 -->* e1                                      relations and spawn blocks
/// e1 -->> {
///     (e3:review) (Public) [?] [P(id=2)]
/// }
/// ```
///
/// Lines are trimmed. Blank lines and lines starting with `//` are ignored.
/// A spawn line consumes the lines up to its matching `}` and parses them as
/// the body of a new subprocess owned by the current block.
///
/// ### Errors
/// Parsing never stops at the first problem. Each line that does not match,
/// names an unknown label, declares a relation the graph would reject, or
/// leaves a block unbalanced yields a [ParseError] and contributes nothing to
/// the graph.
///
/// @implNote Stateless; every call builds its own context.
public final class DcrParser {

    private static final Logger logger = Logger.getLogger(DcrParser.class.getName());

    static final String SEPARATOR = ";";
    static final String BLOCK_END = "}";

    private static final Pattern ROLE = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:\\((.*)\\))?$");
    private static final Pattern EVENT = Pattern.compile(
            "^([%!]{0,2})\\s*\\(\\s*([^:()\\s]+)\\s*:\\s*([^()]*?)\\s*\\)\\s*"
                    + "\\(\\s*([^()]*?)\\s*\\)\\s*\\[(.*?)\\]\\s*\\[(.*)\\]$");
    private static final Pattern RELATION = Pattern.compile(
            "^(.+?)\\s*(-->\\*|\\*-->|-->\\+|-->%|--<>)\\s*(.+?)(?:\\s*\\[(.*)\\])?$");
    private static final Pattern SPAWN = Pattern.compile("^(\\S+)\\s*-->>\\s*\\{$");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");

    private DcrParser() {}

    /// Parses source text.
    ///
    /// @param source choreography source, not null
    /// @return graph plus errors, never null
    public static ParseResult parse(String source) {
        List<SourceLine> lines = clean(source);
        Context ctx = new Context();
        if (lines.isEmpty()) {
            return new ParseResult(ctx.build(), ctx.errors);
        }

        int next = parseRoles(lines, ctx);
        if (next > lines.size()) {
            ctx.error(lines.get(lines.size() - 1).number(), "Missing ';' after the roles section");
            return new ParseResult(ctx.build(), ctx.errors);
        }

        List<String> lattice = new ArrayList<>();
        int i = next;
        while (i < lines.size() && !lines.get(i).is(SEPARATOR)) {
            lattice.add(lines.get(i).text());
            i++;
        }
        ctx.builder.security(String.join("\n", lattice));
        if (i >= lines.size()) {
            ctx.error(lines.get(lines.size() - 1).number(), "Missing ';' after the security lattice");
            return new ParseResult(ctx.build(), ctx.errors);
        }

        parseBlock(lines.subList(i + 1, lines.size()), Scope.GLOBAL_ID, ctx);

        Graph graph = ctx.build();
        if (!ctx.errors.isEmpty()) {
            logger.info("Parsed source with " + ctx.errors.size() + " error(s)");
        }
        return new ParseResult(graph, ctx.errors);
    }

    static List<SourceLine> clean(String source) {
        List<SourceLine> lines = new ArrayList<>();
        String[] raw = source.split("\\r?\\n", -1);
        for (int n = 0; n < raw.length; n++) {
            String text = raw[n].trim();
            if (!text.isEmpty() && !text.startsWith("//")) {
                lines.add(new SourceLine(n + 1, text));
            }
        }
        return lines;
    }

    private static int parseRoles(List<SourceLine> lines, Context ctx) {
        int i = 0;
        while (i < lines.size() && !lines.get(i).is(SEPARATOR)) {
            SourceLine line = lines.get(i);
            Matcher m = ROLE.matcher(line.text());
            if (!m.matches()) {
                ctx.error(line.number(), "Invalid role declaration '" + line.text() + "'");
            } else if (ctx.roleLabels.contains(m.group(1))) {
                ctx.error(line.number(), "Duplicate role '" + m.group(1) + "'");
            } else {
                List<RoleParameter> params = parseFields(m.group(2));
                if (params == null) {
                    ctx.error(line.number(), "Invalid role parameters in '" + line.text() + "'");
                } else {
                    ctx.roleLabels.add(m.group(1));
                    ctx.builder.role(new Role(m.group(1), m.group(1), params, List.of()));
                }
            }
            i++;
        }
        return i + 1;
    }

    /// Parses `name:Type; name:Type`, returning null when malformed.
    private static List<RoleParameter> parseFields(String text) {
        List<RoleParameter> fields = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return fields;
        }
        for (String part : text.split(";")) {
            String[] pair = part.split(":", -1);
            if (pair.length != 2) {
                return null;
            }
            String name = pair[0].trim();
            String type = pair[1].trim();
            if (!NAME.matcher(name).matches() || !NAME.matcher(type).matches()) {
                return null;
            }
            fields.add(new RoleParameter(name, type));
        }
        return fields;
    }

    private static void parseBlock(List<SourceLine> lines, String scopeId, Context ctx) {
        int i = 0;
        while (i < lines.size() && !lines.get(i).is(SEPARATOR)) {
            parseEvent(lines.get(i), scopeId, ctx);
            i++;
        }
        i++;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            Matcher spawn = SPAWN.matcher(line.text());
            if (spawn.matches()) {
                int end = matchingEnd(lines, i + 1);
                if (end == lines.size()) {
                    ctx.error(line.number(), "Unbalanced block: missing '}'");
                }
                List<SourceLine> body = lines.subList(i + 1, end);
                parseSpawn(line, spawn.group(1), body, scopeId, ctx);
                i = end + 1;
            } else if (line.is(BLOCK_END)) {
                ctx.error(line.number(), "Unbalanced block: unexpected '}'");
                i++;
            } else if (line.is(SEPARATOR)) {
                ctx.error(line.number(), "Unexpected ';'");
                i++;
            } else {
                parseRelation(line, scopeId, ctx);
                i++;
            }
        }
    }

    /// Returns the index of the `}` closing a block whose body starts at `from`,
    /// or the list size when the block is never closed.
    private static int matchingEnd(List<SourceLine> lines, int from) {
        int depth = 0;
        for (int i = from; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (line.text().endsWith("{")) {
                depth++;
            } else if (line.is(BLOCK_END)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return lines.size();
    }

    private static void parseSpawn(
            SourceLine line, String triggerLabel, List<SourceLine> body, String scopeId, Context ctx) {
        Event trigger = ctx.resolve(triggerLabel, scopeId);
        if (trigger == null) {
            ctx.error(line.number(), "Unknown spawn trigger '" + triggerLabel + "'");
            return;
        }
        String subprocessId = ctx.builder.idPools().subprocesses().allocate();
        ctx.addScope(Scope.subprocess(subprocessId, scopeId));
        Relation spawn = Relation.of(RelationKind.SPAWN, trigger.getId(), subprocessId);
        ctx.relationIds.add(spawn.id());
        ctx.spawns.add(spawn);
        parseBlock(body, subprocessId, ctx);
    }

    private static void parseEvent(SourceLine line, String scopeId, Context ctx) {
        Matcher m = EVENT.matcher(line.text());
        if (!m.matches()) {
            ctx.error(line.number(), "Invalid event declaration '" + line.text() + "'");
            return;
        }
        String prefix = m.group(1);
        String label = m.group(2);
        if (ctx.isLocal(label, scopeId)) {
            ctx.error(line.number(), "Duplicate event label '" + label + "' in this scope");
            return;
        }

        Event.Builder event = Event.builder()
                .label(label)
                .name(m.group(3))
                .security(m.group(4))
                .marking(new Marking(!prefix.contains("%"), prefix.contains("!")))
                .parent(scopeId);

        String type = m.group(5).trim();
        if (type.startsWith("?")) {
            ValueType valueType = parseValueType(type.substring(1).trim());
            if (valueType == null) {
                ctx.error(line.number(), "Invalid input type '" + type + "'");
                return;
            }
            event.kind(EventKind.INPUT).valueType(valueType);
        } else {
            event.kind(EventKind.COMPUTATION).expression(type);
        }

        String participants = m.group(6);
        int arrow = Splitter.indexOfTopLevel(participants, "->");
        String initiators = arrow < 0 ? participants : participants.substring(0, arrow);
        String receivers = arrow < 0 ? "" : participants.substring(arrow + 2);
        try {
            event.initiators(checkRoles(Splitter.splitTopLevel(initiators, ','), ctx, line));
            event.receivers(checkRoles(Splitter.splitTopLevel(receivers, ','), ctx, line));
        } catch (RoleExpressionSyntaxException e) {
            ctx.error(line.number(), e.getMessage());
            return;
        }

        event.id(ctx.builder.idPools().events().allocate());
        ctx.addEvent(event.build());
    }

    private static ValueType parseValueType(String annotation) {
        if (annotation.isEmpty()) {
            return ValueType.unit();
        }
        if (!annotation.startsWith(":")) {
            return null;
        }
        String type = annotation.substring(1).trim();
        if (type.startsWith("{") && type.endsWith("}")) {
            List<RoleParameter> fields = parseFields(type.substring(1, type.length() - 1));
            if (fields == null || fields.isEmpty()) {
                return null;
            }
            List<ValueType.Field> recordFields = new ArrayList<>();
            for (RoleParameter field : fields) {
                recordFields.add(new ValueType.Field(field.name(), field.type()));
            }
            return new ValueType.Record(recordFields);
        }
        return NAME.matcher(type).matches() ? ValueType.primitive(type) : null;
    }

    private static List<String> checkRoles(List<String> texts, Context ctx, SourceLine line)
            throws RoleExpressionSyntaxException {
        List<String> roles = new ArrayList<>();
        for (String text : texts) {
            RoleExpression expression = RoleExpressions.parse(text);
            String roleLabel = RoleExpressions.roleLabel(expression);
            if (roleLabel != null && !ctx.roleLabels.isEmpty() && !ctx.roleLabels.contains(roleLabel)) {
                logger.warning("Line " + line.number() + ": role '" + roleLabel + "' is not declared");
            }
            roles.add(text);
        }
        return roles;
    }

    private static void parseRelation(SourceLine line, String scopeId, Context ctx) {
        Matcher m = RELATION.matcher(line.text());
        if (!m.matches()) {
            ctx.error(line.number(), "Invalid relation '" + line.text() + "'");
            return;
        }
        RelationKind kind = RelationKind.fromArrow(m.group(2));
        List<Event> sources = resolveAll(m.group(1), scopeId, ctx, line);
        List<Event> targets = resolveAll(m.group(3), scopeId, ctx, line);
        if (sources == null || targets == null) {
            return;
        }

        List<Relation> accepted = new ArrayList<>();
        for (Event source : sources) {
            for (Event target : targets) {
                Relation relation = Relation.of(kind, source.getId(), target.getId(), m.group(4));
                if (source.getId().equals(target.getId()) && !kind.allowsSelfRelation()) {
                    ctx.error(line.number(), "Rejected relation " + source.getLabel() + " " + kind.arrow()
                            + " " + target.getLabel() + ": only exclude and response may target their source");
                    return;
                }
                if (ctx.relationIds.contains(relation.id())
                        || accepted.stream().anyMatch(r -> r.id().equals(relation.id()))) {
                    ctx.error(line.number(), "Rejected relation " + source.getLabel() + " " + kind.arrow()
                            + " " + target.getLabel() + ": already declared");
                    return;
                }
                accepted.add(relation);
            }
        }
        for (Relation relation : accepted) {
            ctx.relationIds.add(relation.id());
            ctx.relations.add(relation);
        }
    }

    private static List<Event> resolveAll(String labels, String scopeId, Context ctx, SourceLine line) {
        List<Event> events = new ArrayList<>();
        for (String label : Splitter.splitTopLevel(labels, ',')) {
            Event event = ctx.resolve(label, scopeId);
            if (event == null) {
                ctx.error(line.number(), "Unknown event label '" + label + "'");
                return null;
            }
            events.add(event);
        }
        if (events.isEmpty()) {
            ctx.error(line.number(), "Relation names no events");
            return null;
        }
        return events;
    }

    /// Mutable state of one parse run.
    private static final class Context {
        private final Graph.Builder builder = Graph.builder();
        private final List<ParseError> errors = new ArrayList<>();
        private final Set<String> roleLabels = new HashSet<>();
        private final Map<String, Map<String, Event>> localEvents = new HashMap<>();
        private final Map<String, String> scopeParents = new HashMap<>();
        private final Map<String, Event> documentOrder = new LinkedHashMap<>();
        private final Set<String> relationIds = new HashSet<>();
        private final List<Relation> spawns = new ArrayList<>();
        private final List<Relation> relations = new ArrayList<>();

        private Context() {
            scopeParents.put(Scope.GLOBAL_ID, null);
        }

        void error(int line, String reason) {
            errors.add(new ParseError(line, reason));
        }

        void addScope(Scope scope) {
            builder.scope(scope);
            scopeParents.put(scope.id(), scope.parent());
        }

        void addEvent(Event event) {
            builder.event(event);
            localEvents.computeIfAbsent(event.getParent(), k -> new HashMap<>()).put(event.getLabel(), event);
            documentOrder.put(event.getId(), event);
        }

        boolean isLocal(String label, String scopeId) {
            return localEvents.getOrDefault(scopeId, Map.of()).containsKey(label);
        }

        /// Local scope, then ancestors, then anywhere in document order.
        Event resolve(String label, String scopeId) {
            String current = scopeId;
            while (current != null) {
                Event event = localEvents.getOrDefault(current, Map.of()).get(label);
                if (event != null) {
                    return event;
                }
                current = scopeParents.get(current);
            }
            for (Event event : documentOrder.values()) {
                if (event.getLabel().equals(label)) {
                    return event;
                }
            }
            return null;
        }

        Graph build() {
            List<Relation> all = new ArrayList<>(spawns);
            all.addAll(relations);
            return builder.relations(all).build();
        }
    }
}
