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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.Transport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds {@link ProcessorChain} instances bound to one connection.
 */
@Component
@RequiredArgsConstructor
public class ProcessorChainFactory {

    private final ProcessorExecutor executor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProcessorChain create(List<ProcessorConfig> processors, String serverName, Transport transport,
            String sessionId) {
        return new ProcessorChain(processors, executor, objectMapper, clock, serverName, transport, sessionId);
    }
}
