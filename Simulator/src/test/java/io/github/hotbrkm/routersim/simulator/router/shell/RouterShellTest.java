package io.github.hotbrkm.routersim.simulator.router.shell;

import io.github.hotbrkm.routersim.simulator.router.log.RecordingActivityLog;
import io.github.hotbrkm.routersim.simulator.router.metrics.RouterMetricsRecorder;
import io.github.hotbrkm.routersim.simulator.router.service.PacketForwarder;
import io.github.hotbrkm.routersim.simulator.router.service.RouterService;
import io.github.hotbrkm.routersim.simulator.router.table.RoutingTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RouterShell Test")
class RouterShellTest {

    private RoutingTable table;
    private RecordingActivityLog activityLog;
    private StringWriter buffer;
    private PrintWriter out;
    private CommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        table = new RoutingTable();
        activityLog = new RecordingActivityLog();
        RouterService service = new RouterService(table, new PacketForwarder(table), activityLog,
                new RouterMetricsRecorder(null));
        buffer = new StringWriter();
        out = new PrintWriter(buffer);
        interpreter = new CommandInterpreter(service, out);
    }

    @Test
    @DisplayName("Runs a full session and stops at exit")
    void shouldRunSessionUntilExit() {
        // Given
        String script = String.join("\n",
                "add 10.0.0.0/8 10.0.0.1 20",
                "add 10.1.0.0/16 10.1.0.1 10",
                "add 10.0.0.0/33 10.0.0.1 1",
                "send 192.168.0.1 10.1.2.3 TCP",
                "del 10.0.0.0/8",
                "exit",
                "add 11.0.0.0/8 11.0.0.1 1");
        RouterShell shell = new RouterShell(interpreter, new BufferedReader(new StringReader(script)), out, "> ");

        // When
        shell.run();

        // Then
        assertThat(buffer.toString())
                .contains("=== IP Router Simulator ===")
                .contains("Error: ")
                .contains("Forwarding packet via gateway: 10.1.0.1/32")
                .contains("Route removed.");
        assertThat(table.getEntries()).extracting(entry -> entry.network().toString())
                .containsExactly("10.1.0.0/16");
        assertThat(activityLog.getLines()).containsExactly(
                "ADD 10.0.0.0/8 via 10.0.0.1/32 metric 20",
                "ADD 10.1.0.0/16 via 10.1.0.1/32 metric 10",
                "FWD Packet from 192.168.0.1/32 to 10.1.2.3/32 [TCP] via 10.1.0.1/32",
                "DEL 10.0.0.0/8 removed 1");
    }

    @Test
    @DisplayName("Stops at end of input without exit")
    void shouldStopAtEndOfInput() {
        RouterShell shell = new RouterShell(interpreter, new BufferedReader(new StringReader("show\n")), out, "> ");

        shell.run();

        assertThat(buffer.toString()).contains("Routing table is empty.");
    }

    @Test
    @DisplayName("Fails when the input cannot be read")
    void shouldFailOnUnreadableInput() {
        Reader broken = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("stream closed");
            }

            @Override
            public void close() {
            }
        };
        RouterShell shell = new RouterShell(interpreter, new BufferedReader(broken), out, "> ");

        assertThatThrownBy(() -> shell.run())
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("command input");
    }
}
