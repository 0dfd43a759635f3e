package me.golemcore.proxy.adapter.outbound.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.domain.model.MessageDirection;
import me.golemcore.proxy.domain.model.MessageType;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jActivityLogAdapterTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private Logger activityLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;
    private Slf4jActivityLogAdapter adapter;

    @BeforeEach
    void setUp() {
        activityLogger = (Logger) LoggerFactory.getLogger(Slf4jActivityLogAdapter.ACTIVITY_LOGGER);
        previousLevel = activityLogger.getLevel();
        activityLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        activityLogger.addAppender(appender);
        adapter = new Slf4jActivityLogAdapter(objectMapper, clock);
    }

    @AfterEach
    void tearDown() {
        activityLogger.detachAppender(appender);
        activityLogger.setLevel(previousLevel);
    }

    @Test
    void writesOneJsonLinePerEvent() throws Exception {
        adapter.record(ProxyEvent.builder()
                .kind(ProxyEvent.EventKind.REQUEST)
                .sessionId("session_1")
                .serverId("stdio_npx_1")
                .transport(Transport.STDIO)
                .direction(MessageDirection.CLIENT_TO_SERVER)
                .messageType(MessageType.REQUEST)
                .message("{\"id\":1,\"method\":\"ping\"}")
                .success(true)
                .build());

        assertEquals(1, appender.list.size());
        JsonNode logged = objectMapper.readTree(appender.list.get(0).getFormattedMessage());
        assertEquals("2026-03-01T12:00:00Z", logged.path("timestamp").asText());
        assertEquals("REQUEST", logged.path("kind").asText());
        assertEquals("session_1", logged.path("session_id").asText());
        assertEquals("stdio_npx_1", logged.path("server_id").asText());
        assertEquals("stdio", logged.path("transport").asText());
        assertEquals("client_to_server", logged.path("direction").asText());
        assertEquals("request", logged.path("message_type").asText());
        assertTrue(logged.path("success").asBoolean());
        assertFalse(logged.has("error"));
    }

    @Test
    void keepsExistingTimestamp() throws Exception {
        adapter.record(ProxyEvent.builder()
                .kind(ProxyEvent.EventKind.STOP)
                .timestamp(Instant.parse("2025-12-31T23:59:59Z"))
                .success(true)
                .build());

        JsonNode logged = objectMapper.readTree(appender.list.get(0).getFormattedMessage());
        assertEquals("2025-12-31T23:59:59Z", logged.path("timestamp").asText());
    }

    @Test
    void skipsWhenActivityLoggerIsOff() {
        activityLogger.setLevel(Level.OFF);

        adapter.record(ProxyEvent.builder().kind(ProxyEvent.EventKind.START).build());

        assertTrue(appender.list.isEmpty());
    }
}
