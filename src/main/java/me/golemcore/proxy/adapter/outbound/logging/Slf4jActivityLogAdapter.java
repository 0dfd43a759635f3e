package me.golemcore.proxy.adapter.outbound.logging;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes activity events as one JSON object per line to the
 * {@code mcp.activity} logger. logback-spring.xml routes that logger to a
 * rolling {@code activity.jsonl} file under {@code proxy.logs-dir}.
 */
@Component
@Slf4j
public class Slf4jActivityLogAdapter implements ActivityLogPort {

    static final String ACTIVITY_LOGGER = "mcp.activity";

    private final Logger activityLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Slf4jActivityLogAdapter(ObjectMapper objectMapper, Clock clock) {
        this.activityLog = LoggerFactory.getLogger(ACTIVITY_LOGGER);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void record(ProxyEvent event) {
        if (!activityLog.isInfoEnabled()) {
            return;
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(Instant.now(clock));
        }
        try {
            activityLog.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("[Activity] Failed to serialize {} event for session {}: {}", event.getKind(),
                    event.getSessionId(), e.getMessage());
        }
    }
}
