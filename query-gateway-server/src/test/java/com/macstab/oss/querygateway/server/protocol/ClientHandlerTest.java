/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.macstab.oss.querygateway.report.MaintenanceService;
import com.macstab.oss.querygateway.scheduler.Task;
import com.macstab.oss.querygateway.scheduler.TaskQueue;

/**
 * Tests for {@link ClientHandler}.
 *
 * <p>Parsing is tested directly; the connection flow runs over a real loopback socket pair.
 */
@DisplayName("ClientHandler")
class ClientHandlerTest {

  @Nested
  @DisplayName("parsePriority")
  class ParsePriority {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
      "0, 0",
      "1, 1",
      "5, 5",
      "9, 9",
      "10, 9",
      "99999999999999999999, 9",
      "' 7 ', 7",
      "-3, 1",
      "abc, 1",
      "'', 1",
      "4.5, 1"
    })
    @DisplayName("maps handshake text to a priority")
    void parsePriority_Maps(final String raw, final int expected) {
      assertThat(ClientHandler.parsePriority(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("treats null as priority 1")
    void parsePriority_Null() {
      assertThat(ClientHandler.parsePriority(null)).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("parseLatencies")
  class ParseLatencies {

    @Test
    @DisplayName("parses a JSON array of numbers")
    void parseLatencies_Array() throws JsonProcessingException {
      assertThat(ClientHandler.parseLatencies("[0.1, 0.25, 3]"))
          .contains(List.of(0.1, 0.25, 3.0));
    }

    @Test
    @DisplayName("reports an incomplete payload as empty")
    void parseLatencies_Incomplete() throws JsonProcessingException {
      assertThat(ClientHandler.parseLatencies("[0.1, 0.2")).isEmpty();
      assertThat(ClientHandler.parseLatencies("   ")).isEmpty();
    }

    @Test
    @DisplayName("drops null entries")
    void parseLatencies_DropsNulls() throws JsonProcessingException {
      assertThat(ClientHandler.parseLatencies("[0.1, null, 0.2]")).contains(List.of(0.1, 0.2));
    }

    @Test
    @DisplayName("rejects a payload that is not a number array")
    void parseLatencies_Malformed() {
      assertThatThrownBy(() -> ClientHandler.parseLatencies("{\"a\":1}"))
          .isInstanceOf(JsonProcessingException.class);
    }
  }

  @Nested
  @DisplayName("Connection flow")
  class ConnectionFlow {

    private static final ProtocolSettings SETTINGS = new ProtocolSettings(64, 16384, 8192);

    private ServerSocket server;
    private Socket client;
    private TaskQueue queue;
    private MaintenanceService maintenance;
    private ClientHandler handler;
    private Thread handlerThread;

    @BeforeEach
    void setUp() throws IOException {
      server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
      client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
      final Socket accepted = server.accept();
      queue = new TaskQueue();
      maintenance = mock(MaintenanceService.class);
      handler =
          new ClientHandler(
              "test-client", accepted, queue, maintenance, SETTINGS, Clock.systemUTC());
      handlerThread = new Thread(handler, "test-handler");
      handlerThread.start();
    }

    @AfterEach
    void tearDown() throws Exception {
      client.close();
      server.close();
      handlerThread.join(2000);
    }

    private void send(final String text) throws IOException {
      final OutputStream out = client.getOutputStream();
      out.write(text.getBytes(StandardCharsets.UTF_8));
      out.flush();
    }

    @Test
    @DisplayName("enqueues each received query with the handshake priority")
    void streaming_EnqueuesQueries() throws Exception {
      // Act
      send("7\n");
      send("SELECT 1");

      // Assert
      await().atMost(2, SECONDS).until(() -> queue.size() == 1);
      final Task task = queue.selectAndRemove().orElseThrow();
      assertThat(task.priority()).isEqualTo(7);
      assertThat(task.query()).isEqualTo("SELECT 1");
      assertThat(task.clientId()).isEqualTo("test-client");
      assertThat(handler.getState()).isEqualTo(ProtocolState.STREAMING);
      verifyNoInteractions(maintenance);
    }

    @Test
    @DisplayName("closes on EOF")
    void streaming_ClosesOnEof() throws Exception {
      // Act
      send("3\n");
      client.shutdownOutput();

      // Assert
      await().atMost(2, SECONDS).until(() -> handler.getState() == ProtocolState.CLOSED);
      assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("runs one maintenance cycle with the received latencies")
    void maintenance_RunsCycle() throws Exception {
      // Act
      send("0\n");
      send("[0.5, 1.5]");

      // Assert
      verify(maintenance, timeout(2000)).runMaintenance(List.of(0.5, 1.5));
      await().atMost(2, SECONDS).until(() -> handler.getState() == ProtocolState.CLOSED);
      assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("treats a malformed maintenance payload as no latencies")
    void maintenance_MalformedPayload() throws Exception {
      // Act
      send("0\n");
      send("not json");

      // Assert
      verify(maintenance, timeout(2000)).runMaintenance(List.of());
    }
  }

  @Nested
  @DisplayName("Failure handling")
  class FailureHandling {

    @Test
    @DisplayName("keeps a maintenance failure inside the handler")
    void maintenance_FailureDoesNotEscape() throws Exception {
      // Arrange
      final var maintenance = mock(MaintenanceService.class);
      when(maintenance.runMaintenance(List.of(0.5)))
          .thenThrow(new IllegalStateException("report failed"));
      try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
          var client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort())) {
        final Socket accepted = server.accept();
        client.getOutputStream().write("0\n[0.5]".getBytes(StandardCharsets.UTF_8));
        client.shutdownOutput();
        final var handler =
            new ClientHandler(
                "failing-client",
                accepted,
                new TaskQueue(),
                maintenance,
                new ProtocolSettings(64, 16384, 8192),
                Clock.systemUTC());

        // Act & Assert
        assertThatCode(handler::run).doesNotThrowAnyException();
        assertThat(handler.getState()).isEqualTo(ProtocolState.CLOSED);
        assertThat(accepted.isClosed()).isTrue();
      }
    }
  }
}
