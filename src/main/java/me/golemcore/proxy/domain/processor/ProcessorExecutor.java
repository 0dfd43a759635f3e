package me.golemcore.proxy.domain.processor;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorInput;
import me.golemcore.proxy.domain.model.ProcessorOutput;
import me.golemcore.proxy.domain.model.ProcessorType;
import me.golemcore.proxy.port.outbound.ProcessorPort;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a processor invocation to the {@link ProcessorPort} registered
 * for its kind.
 *
 * <p>
 * Disabled processors and unknown kinds are refused before anything is
 * spawned.
 */
@Service
@Slf4j
public class ProcessorExecutor {

    private final Map<ProcessorType, ProcessorPort> ports = new EnumMap<>(ProcessorType.class);

    public ProcessorExecutor(List<ProcessorPort> processorPorts) {
        for (ProcessorPort port : processorPorts) {
            ports.put(port.getType(), port);
        }
        log.debug("[Processor] Registered processor kinds: {}", ports.keySet());
    }

    public ProcessorOutput execute(ProcessorConfig config, ProcessorInput input)
            throws ProcessorExecutionException {
        if (!config.isEnabled()) {
            throw new ProcessorExecutionException(String.format("processor '%s' is disabled", config.getName()));
        }
        ProcessorType type = ProcessorType.fromValue(config.getType())
                .orElseThrow(() -> new ProcessorExecutionException(
                        String.format("unsupported processor type '%s'", config.getType())));
        ProcessorPort port = ports.get(type);
        if (port == null) {
            throw new ProcessorExecutionException(
                    String.format("unsupported processor type '%s'", config.getType()));
        }
        return port.run(config, input);
    }
}
