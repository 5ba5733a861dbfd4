package io.github.hotbrkm.routersim.simulator.router.shell;

import io.github.hotbrkm.routersim.simulator.router.log.ActivityLogException;
import io.github.hotbrkm.routersim.simulator.router.model.ForwardResult;
import io.github.hotbrkm.routersim.simulator.router.model.RouteEntry;
import io.github.hotbrkm.routersim.simulator.router.service.RouterService;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Interprets one command line at a time and prints the result.
 * <p>
 * Supported commands: {@code add}, {@code del}, {@code show}, {@code send}, {@code help}, {@code exit}.
 * Invalid input and activity log failures are reported and never end the session.
 */
@Slf4j
public class CommandInterpreter {

    static final String USAGE_ADD = "Usage: add <network> <gateway> <metric>";
    static final String USAGE_DEL = "Usage: del <network>";
    static final String USAGE_SEND = "Usage: send <source> <destination> <protocol>";
    static final String UNKNOWN_COMMAND = "Unknown command. Type 'help' to list available commands.";

    private static final List<String> HELP_LINES = List.of(
            "=== IP Router Simulator ===",
            "Available commands:",
            "  add <network> <gateway> <metric>  - adds a route (e.g. add 192.168.1.0/24 192.168.1.1 10)",
            "  del <network>                     - removes a route (e.g. del 192.168.1.0/24)",
            "  show                              - shows the routing table",
            "  send <source> <dest> <protocol>   - sends a packet (e.g. send 10.0.0.1 192.168.1.100 ICMP)",
            "  help                              - shows this help",
            "  exit                              - exits the program");

    private final RouterService routerService;
    private final PrintWriter out;

    public CommandInterpreter(RouterService routerService, PrintWriter out) {
        this.routerService = Objects.requireNonNull(routerService, "routerService must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Executes a single command line.
     *
     * @param line raw input line
     * @return false if the session should end, true otherwise
     */
    public boolean execute(String line) {
        if (line == null || line.isBlank()) {
            return true;
        }

        String[] tokens = line.trim().split("\\s+");
        String command = tokens[0].toLowerCase(Locale.ROOT);
        String[] args = Arrays.copyOfRange(tokens, 1, tokens.length);

        try {
            switch (command) {
                case "add":
                    handleAdd(args);
                    break;
                case "del":
                    handleDelete(args);
                    break;
                case "show":
                    handleShow();
                    break;
                case "send":
                    handleSend(args);
                    break;
                case "help":
                    printHelp();
                    break;
                case "exit":
                    return false;
                default:
                    out.println(UNKNOWN_COMMAND);
                    break;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Command '{}' rejected: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
        } catch (ActivityLogException e) {
            // the table change already applied; only the record is missing
            log.warn("Activity log write failed for command '{}'", command, e);
            out.println("Error: " + e.getMessage());
        } finally {
            out.flush();
        }
        return true;
    }

    public void printHelp() {
        HELP_LINES.forEach(out::println);
        out.flush();
    }

    private void handleAdd(String[] args) {
        Integer metric = args.length < 3 ? null : parseMetric(args[2]);
        if (metric == null) {
            out.println(USAGE_ADD);
            return;
        }

        routerService.addRoute(args[0], args[1], metric);
        out.println("Route added.");
    }

    private void handleDelete(String[] args) {
        if (args.length < 1) {
            out.println(USAGE_DEL);
            return;
        }

        int removed = routerService.deleteRoute(args[0]);
        out.println(removed > 0 ? "Route removed." : "Route not found.");
    }

    private void handleShow() {
        List<RouteEntry> routes = routerService.listRoutes();
        if (routes.isEmpty()) {
            out.println("Routing table is empty.");
            return;
        }

        out.println("Current routing table:");
        for (RouteEntry route : routes) {
            out.println("  " + route);
        }
    }

    private void handleSend(String[] args) {
        if (args.length < 3) {
            out.println(USAGE_SEND);
            return;
        }

        ForwardResult result = routerService.forward(args[0], args[1], args[2]);
        out.println(result.packet());
        if (result.isForwarded()) {
            out.println("Forwarding packet via gateway: " + result.decision().gateway());
        } else {
            out.println("Packet dropped (no matching route).");
        }
    }

    private static Integer parseMetric(String text) {
        try {
            int metric = Integer.parseInt(text);
            return metric < 0 ? null : metric;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
