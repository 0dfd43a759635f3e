package me.golemcore.proxy.adapter.inbound.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.domain.model.GatewayConfig;
import me.golemcore.proxy.domain.model.McpServerConfig;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProxyConfig;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.ProcessorChainFactory;
import me.golemcore.proxy.domain.processor.ProcessorExecutor;
import me.golemcore.proxy.domain.service.ConfigurationException;
import me.golemcore.proxy.domain.service.ProxyConfigService;
import me.golemcore.proxy.domain.service.ProxyConfigValidator;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HttpRelayRegistryTest {

    private ProxyConfigService configService;
    private ActivityLogPort activityLog;
    private HttpRelayRegistry registry;

    @BeforeEach
    void setUp() {
        configService = mock(ProxyConfigService.class);
        activityLog = mock(ActivityLogPort.class);
        ProcessorChainFactory chainFactory = new ProcessorChainFactory(new ProcessorExecutor(List.of()),
                new ObjectMapper(), Clock.systemUTC());
        registry = new HttpRelayRegistry(configService, new ProxyConfigValidator(), chainFactory, activityLog);
    }

    private static ProcessorConfig processor(String name) {
        return ProcessorConfig.builder().name(name).type("cli").config(Map.of("command", name)).build();
    }

    private ProxyConfig config() {
        Map<String, McpServerConfig> servers = new LinkedHashMap<>();
        servers.put("search", McpServerConfig.builder()
                .url("https://search.example.com/mcp")
                .headers(new LinkedHashMap<>(Map.of("X-Api-Key", "static-key")))
                .build());
        servers.put("legacy", McpServerConfig.builder().url("http://localhost:7000/mcp").enabled(false).build());
        Map<String, GatewayConfig> gateways = new LinkedHashMap<>();
        gateways.put("dev", GatewayConfig.builder()
                .mcpServers(servers)
                .processors(List.of(processor("validator")))
                .build());
        return ProxyConfig.builder().gateways(gateways).processors(List.of(processor("logger"))).build();
    }

    @Test
    void registersActiveServers() {
        ProxyConfig config = config();
        when(configService.getConfig()).thenReturn(config);
        when(configService.getProcessorsForGateway("dev"))
                .thenReturn(List.of(processor("logger"), processor("validator")));

        registry.init();

        HttpRelayEndpoint endpoint = registry.find("dev", "search").orElseThrow();
        assertEquals("/mcp/dev/search", endpoint.getPath());
        assertEquals("search.example.com", endpoint.getTarget().host());
        assertEquals("static-key", endpoint.getHeaders().get("X-Api-Key"));
        assertTrue(endpoint.getSessionId().startsWith("http_endpoint_mcp_dev_search_"));
        assertEquals(List.of("logger", "validator"),
                endpoint.getChain().getProcessors().stream().map(ProcessorConfig::getName).toList());
        assertTrue(registry.find("dev", "legacy").isEmpty());
        assertEquals(1, registry.getEndpoints().size());
    }

    @Test
    void recordsStartAndStopEvents() {
        when(configService.getConfig()).thenReturn(config());
        when(configService.getProcessorsForGateway("dev")).thenReturn(List.of());

        registry.init();
        registry.shutdown();

        ArgumentCaptor<ProxyEvent> events = ArgumentCaptor.forClass(ProxyEvent.class);
        verify(activityLog, times(4)).record(events.capture());
        List<ProxyEvent> recorded = events.getAllValues();
        assertEquals(ProxyEvent.EventKind.START, recorded.get(0).getKind());
        assertEquals("/mcp/dev/search", recorded.get(0).getEndpoint());
        assertEquals(ProxyEvent.EventKind.START, recorded.get(1).getKind());
        assertEquals("/mcp/dev", recorded.get(1).getEndpoint());
        assertEquals(ProxyEvent.EventKind.STOP, recorded.get(2).getKind());
        assertEquals(ProxyEvent.EventKind.STOP, recorded.get(3).getKind());
        assertEquals(Transport.HTTP, recorded.get(0).getTransport());
    }

    @Test
    void registersAggregatedGatewayOverActiveServers() {
        when(configService.getConfig()).thenReturn(config());
        when(configService.getProcessorsForGateway("dev")).thenReturn(List.of());

        registry.init();

        AggregatedGateway gateway = registry.findGateway("dev").orElseThrow();
        assertEquals("/mcp/dev", gateway.getPath());
        assertEquals(List.of("search"), List.copyOf(gateway.getServers().keySet()));
        assertSame(registry.find("dev", "search").orElseThrow(), gateway.getServers().get("search"));
        assertTrue(gateway.getSessionId().startsWith("http_gateway_mcp_dev_"));
        assertTrue(registry.findGateway("prod").isEmpty());
    }

    @Test
    void configWithoutGatewaysFailsStartup() {
        when(configService.getConfig()).thenReturn(ProxyConfig.builder().build());

        assertThrows(ConfigurationException.class, () -> registry.init());
    }

    @Test
    void commandServerFailsStartup() {
        ProxyConfig config = config();
        config.getGateways().get("dev").getMcpServers().put("fs", McpServerConfig.builder().command("npx").build());
        when(configService.getConfig()).thenReturn(config);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> registry.init());
        assertTrue(ex.getMessage().contains("'fs'"));
    }

    @Test
    void unknownEndpointIsEmpty() {
        when(configService.getConfig()).thenReturn(config());
        when(configService.getProcessorsForGateway("dev")).thenReturn(List.of());
        registry.init();

        assertTrue(registry.find("prod", "search").isEmpty());
    }
}
