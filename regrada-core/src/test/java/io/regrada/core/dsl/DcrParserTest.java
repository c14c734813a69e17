package io.regrada.core.dsl;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RoleParameter;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ScopeKind;
import io.regrada.core.graph.ValueType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DcrParser")
class DcrParserTest {

    static final String DOCUMENT = String.join("\n",
            "P(id:Integer)",
            "Q",
            ";",
            "Public flows Public",
            ";",
            "(a:start) (Public) [?] [P(id=1) -> Q]",
            "%!(b:approve) (Public) [?:{amount:Integer; note:String}] [Q -> P(id=1)]",
            "(c:total) (Public) [a.value + 1] [P(id=1)]",
            ";",
            "a -->* b",
            "a, b *--> c [a.value > 2]",
            "b -->> {",
            "\t(d:review) (Public) [?:Integer] [Q]",
            "\t;",
            "\td -->% d",
            "}");

    @Nested
    @DisplayName("well-formed source")
    class WellFormed {

        @Test
        @DisplayName("reads roles and the security lattice")
        void shouldParseHeader() {
            // When
            ParseResult result = DcrParser.parse(DOCUMENT);

            // Then
            assertThat(result.isSuccessful()).isTrue();
            var graph = result.graph();
            assertThat(graph.getRoles()).extracting(r -> r.label()).containsExactly("P", "Q");
            assertThat(graph.findRole("P").orElseThrow().parameters())
                    .containsExactly(new RoleParameter("id", "Integer"));
            assertThat(graph.getSecurity()).isEqualTo("Public flows Public");
        }

        @Test
        @DisplayName("reads events with markings, types and participants")
        void shouldParseEvents() {
            var graph = DcrParser.parse(DOCUMENT).graph();

            Event start = graph.findEvent("e0").orElseThrow();
            assertThat(start.getLabel()).isEqualTo("a");
            assertThat(start.getName()).isEqualTo("start");
            assertThat(start.getValueType()).isEqualTo(ValueType.unit());
            assertThat(start.getInitiators()).containsExactly("P(id=1)");
            assertThat(start.getReceivers()).containsExactly("Q");

            Event approve = graph.findEvent("e1").orElseThrow();
            assertThat(approve.getMarking().included()).isFalse();
            assertThat(approve.getMarking().pending()).isTrue();
            assertThat(approve.getValueType()).isEqualTo(new ValueType.Record(List.of(
                    new ValueType.Field("amount", "Integer"),
                    new ValueType.Field("note", "String"))));

            Event total = graph.findEvent("e2").orElseThrow();
            assertThat(total.getKind()).isEqualTo(EventKind.COMPUTATION);
            assertThat(total.getExpression()).isEqualTo("a.value + 1");
            assertThat(total.getReceivers()).isEmpty();
        }

        @Test
        @DisplayName("expands comma lists and keeps guards")
        void shouldExpandCommaLists() {
            var relations = DcrParser.parse(DOCUMENT).graph().getRelations();

            assertThat(relations).extracting(Relation::id)
                    .containsExactly("s-e1-s0", "c-e0-e1", "r-e0-e2", "r-e1-e2", "e-e3-e3");
            assertThat(relations.get(2).guard()).isEqualTo("a.value > 2");
            assertThat(relations.get(1).hasGuard()).isFalse();
        }

        @Test
        @DisplayName("turns a spawn block into a subprocess owned by the enclosing block")
        void shouldParseSpawnBlock() {
            var graph = DcrParser.parse(DOCUMENT).graph();

            Scope subprocess = graph.findScope("s0").orElseThrow();
            assertThat(subprocess.kind()).isEqualTo(ScopeKind.SUBPROCESS);
            assertThat(subprocess.parent()).isEqualTo(Scope.GLOBAL_ID);
            Event review = graph.findEvent("e3").orElseThrow();
            assertThat(review.getParent()).isEqualTo("s0");
            assertThat(review.getValueType()).isEqualTo(new ValueType.Primitive("Integer"));
        }

        @Test
        @DisplayName("leaves the pools ready for the next element")
        void shouldAdvancePools() {
            var pools = DcrParser.parse(DOCUMENT).graph().getIdPools();

            assertThat(pools.events().allocate()).isEqualTo("e4");
            assertThat(pools.subprocesses().allocate()).isEqualTo("s1");
        }

        @Test
        @DisplayName("accepts empty source")
        void shouldAcceptEmptySource() {
            ParseResult result = DcrParser.parse("  \n\n");

            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.graph().getEvents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("malformed source")
    class Malformed {

        @Test
        @DisplayName("reports a missing roles separator")
        void shouldReportMissingRolesSeparator() {
            ParseResult result = DcrParser.parse("P\nQ");

            assertThat(result.errors()).containsExactly(new ParseError(2, "Missing ';' after the roles section"));
        }

        @Test
        @DisplayName("reports a missing lattice separator")
        void shouldReportMissingLatticeSeparator() {
            ParseResult result = DcrParser.parse("P\n;\nPublic");

            assertThat(result.errors())
                    .containsExactly(new ParseError(3, "Missing ';' after the security lattice"));
        }

        @Test
        @DisplayName("reports bad lines with their source line numbers and keeps the rest")
        void shouldReportLineNumbers() {
            // Given
            String source = String.join("\n",
                    "P",
                    ";",
                    "// lattice",
                    "",
                    ";",
                    "(a:first) () [?] [P]",
                    "(b second) () [?] [P]",
                    "(a:again) () [?] [P]",
                    ";",
                    "a -->* zz",
                    "a -->+ a",
                    "a -->% a",
                    "a -->% a");

            // When
            ParseResult result = DcrParser.parse(source);

            // Then
            assertThat(result.isSuccessful()).isFalse();
            assertThat(result.errors()).extracting(ParseError::line).containsExactly(7, 8, 10, 11, 13);
            assertThat(result.errors().get(0).reason()).startsWith("Invalid event declaration");
            assertThat(result.errors().get(1).reason()).isEqualTo("Duplicate event label 'a' in this scope");
            assertThat(result.errors().get(2).reason()).isEqualTo("Unknown event label 'zz'");
            assertThat(result.errors().get(3).reason()).startsWith("Rejected relation a -->+ a");
            assertThat(result.errors().get(4).reason()).endsWith("already declared");
            assertThat(result.graph().getEvents()).hasSize(1);
            assertThat(result.graph().getRelations()).extracting(Relation::id).containsExactly("e-e0-e0");
        }

        @Test
        @DisplayName("reports an unclosed spawn block but parses its body")
        void shouldReportUnclosedBlock() {
            String source = String.join("\n",
                    ";", ";",
                    "(a:x) () [?] []",
                    ";",
                    "a -->> {",
                    "(b:y) () [?] []");

            ParseResult result = DcrParser.parse(source);

            assertThat(result.errors()).containsExactly(new ParseError(5, "Unbalanced block: missing '}'"));
            assertThat(result.graph().findEvent("e1").orElseThrow().getParent()).isEqualTo("s0");
        }

        @Test
        @DisplayName("skips the block of an unknown spawn trigger")
        void shouldSkipUnknownTrigger() {
            String source = String.join("\n",
                    ";", ";",
                    "(a:x) () [?] []",
                    ";",
                    "zz -->> {",
                    "(b:y) () [?] []",
                    "}",
                    "}");

            ParseResult result = DcrParser.parse(source);

            assertThat(result.errors()).containsExactly(
                    new ParseError(5, "Unknown spawn trigger 'zz'"),
                    new ParseError(8, "Unbalanced block: unexpected '}'"));
            assertThat(result.graph().getScopes()).hasSize(1);
            assertThat(result.graph().getEvents()).hasSize(1);
        }

        @Test
        @DisplayName("rejects malformed role expressions in participants")
        void shouldRejectBadRoleExpression() {
            ParseResult result = DcrParser.parse(";\n;\n(a:x) () [?] [P(id)]");

            assertThat(result.errors()).hasSize(1);
            assertThat(result.errors().get(0).line()).isEqualTo(3);
            assertThat(result.graph().getEvents()).isEmpty();
        }
    }
}
