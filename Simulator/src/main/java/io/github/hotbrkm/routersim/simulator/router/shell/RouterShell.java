package io.github.hotbrkm.routersim.simulator.router.shell;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;

/**
 * Interactive loop: prints the help text, then reads and executes commands until
 * {@code exit} or end of input.
 */
@Slf4j
public class RouterShell implements CommandLineRunner {

    private final CommandInterpreter interpreter;
    private final BufferedReader in;
    private final PrintWriter out;
    private final String prompt;

    public RouterShell(CommandInterpreter interpreter, BufferedReader in, PrintWriter out, String prompt) {
        this.interpreter = interpreter;
        this.in = in;
        this.out = out;
        this.prompt = prompt == null ? "" : prompt;
    }

    @Override
    public void run(String... args) {
        log.info("Router shell started.");
        interpreter.printHelp();

        while (true) {
            out.println();
            out.print(prompt);
            out.flush();

            String line = readLine();
            if (line == null || !interpreter.execute(line)) {
                break;
            }
        }

        log.info("Router shell stopped.");
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read command input", e);
        }
    }
}
