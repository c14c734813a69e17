package io.regrada.cli.commands;

import io.regrada.core.Regrada;
import io.regrada.core.engine.EventState;
import io.regrada.core.engine.FireResult;
import io.regrada.core.engine.SimulationState;
import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/// Starts a simulation, fires the requested events in order, and prints the marking.
///
/// Firing stops at the first event the engine rejects; the marking printed is
/// the one reached before it.
///
/// ### Usage
/// ```bash
/// regrada simulate <source> [--fire e0,e1,...] [--all]
/// ```
@CommandLine.Command(name = "simulate", description = "Fire events and print the resulting marking")
class SimulateCommand extends SourceCommand {

    private static final String ROW = "   %-6s %-16s %-9s %-8s %-9s %s%n";

    @CommandLine.Option(
            names = {"-f", "--fire"},
            split = ",",
            description = "Event ids to fire, in order")
    private List<String> fire = new ArrayList<>();

    @CommandLine.Option(
            names = {"--all"},
            description = "Also list events hidden inside unspawned subprocesses")
    private boolean all;

    @Override
    protected void execute() {
        try {
            Graph graph = loadGraph();
            SimulationState state = Regrada.start(graph);

            for (String eventId : fire) {
                FireResult result = Regrada.step(graph, state, eventId);
                if (!result.isFired()) {
                    System.err.println(" [FAIL] Cannot fire " + eventId + ": "
                            + result.getRejection().map(Enum::name).orElse("rejected"));
                    break;
                }
                System.out.println(" [OK] Fired " + eventId);
                state = result.state();
            }

            printMarking(graph, state);
        } catch (Exception e) {
            System.err.println(" [FAIL] Simulation failed: " + e.getMessage());
        }
    }

    private void printMarking(Graph graph, SimulationState state) {
        System.out.println();
        System.out.printf(ROW, "id", "label", "included", "pending", "executed", "enabled");
        for (Event event : graph.getEvents()) {
            EventState marking = state.event(event.getId());
            if (!all && !marking.visible()) {
                continue;
            }
            System.out.printf(ROW,
                    event.getId(),
                    event.getLabel(),
                    flag(marking.included()),
                    flag(marking.pending()),
                    flag(marking.executed()),
                    flag(marking.visible() && marking.executable()));
        }
        System.out.println();
        System.out.println("   Enabled: " + String.join(", ", state.enabledEvents()));
        System.out.println("   Pending: " + String.join(", ", state.pendingEvents()));
    }

    private static String flag(boolean value) {
        return value ? "yes" : "-";
    }
}
