package me.golemcore.proxy.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProxyConfig;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProxyConfigServiceTest {

    private static final String CONFIG = """
            {
              "name": "test",
              "version": "1.0",
              "proxy": {"host": "127.0.0.1", "port": 9090},
              "processors": [
                {"name": "logger", "type": "cli", "config": {"command": "logger.sh"}}
              ],
              "gateways": {
                "dev": {
                  "mcpServers": {
                    "github": {"url": "https://api.example.com/mcp", "headers": {"Authorization": "Bearer $TOKEN"}},
                    "fs": {"command": "npx", "args": ["-y", "server-filesystem"], "enabled": false}
                  },
                  "processors": [
                    {"name": "validator", "type": "cli", "timeout": 3, "config": {"command": "validate.sh", "args": ["--strict"]}}
                  ]
                }
              }
            }
            """;

    @TempDir
    Path tempDir;

    private ProxyProperties properties;
    private ProxyConfigService service;

    @BeforeEach
    void setUp() {
        properties = new ProxyProperties();
        properties.setConfigPath(tempDir.resolve("config.json").toString());
        service = new ProxyConfigService(properties, new ObjectMapper(), new ProxyConfigValidator());
    }

    @Test
    void missingFileYieldsDefaults() {
        ProxyConfig config = service.getConfig();

        assertEquals("1.0", config.getVersion());
        assertTrue(config.getGateways().isEmpty());
        assertTrue(config.getProcessors().isEmpty());
        assertEquals(8080, config.getProxy().getPort());
    }

    @Test
    void loadsGatewaysAndProcessors() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), CONFIG);

        ProxyConfig config = service.getConfig();

        assertEquals(9090, config.getProxy().getPort());
        assertEquals(List.of("github", "fs"), List.copyOf(config.getGateways().get("dev").getMcpServers().keySet()));
        assertFalse(config.getGateways().get("dev").getMcpServers().get("fs").isActive());
        assertEquals("Bearer $TOKEN",
                config.getGateways().get("dev").getMcpServers().get("github").getHeaders().get("Authorization"));
    }

    @Test
    void appliesDefaultTimeoutOnlyWhenUnset() throws Exception {
        properties.getProcessors().setDefaultTimeoutSeconds(20);
        Files.writeString(tempDir.resolve("config.json"), CONFIG);

        List<ProcessorConfig> processors = service.getProcessorsForGateway("dev");

        assertEquals(20, processors.get(0).getTimeout());
        assertEquals(3, processors.get(1).getTimeout());
    }

    @Test
    void gatewayChainIsGlobalThenGatewayProcessors() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), CONFIG);

        assertEquals(List.of("logger", "validator"),
                service.getProcessorsForGateway("dev").stream().map(ProcessorConfig::getName).toList());
        assertEquals(List.of("logger"),
                service.getProcessorsForGateway("unknown").stream().map(ProcessorConfig::getName).toList());
        assertEquals(List.of("logger"),
                service.getGlobalProcessors().stream().map(ProcessorConfig::getName).toList());
    }

    @Test
    void configIsCached() throws Exception {
        ProxyConfig first = service.getConfig();
        Files.writeString(tempDir.resolve("config.json"), CONFIG);

        assertSame(first, service.getConfig());
    }

    @Test
    void malformedJsonIsConfigurationError() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), "{ not json");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> service.getConfig());
        assertTrue(ex.getMessage().startsWith("failed to read configuration"));
    }

    @Test
    void invalidProcessorFailsLoad() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), """
                {"version": "1.0", "processors": [{"name": "x", "type": "grpc", "config": {"command": "x"}}]}
                """);

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void nullSectionsAreNormalized() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), """
                {"version": "1.0", "proxy": null, "processors": null, "gateways": null}
                """);

        ProxyConfig config = service.getConfig();

        assertNotNull(config.getProxy());
        assertTrue(config.getProcessors().isEmpty());
        assertTrue(config.getGateways().isEmpty());
    }
}
