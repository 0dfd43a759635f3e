package me.golemcore.proxy.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declaration of one processor in a chain, as written in the configuration
 * file. The {@code config} map holds kind-specific settings; for {@code cli}
 * processors these are {@code command} and {@code args}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorConfig {

    public static final int DEFAULT_TIMEOUT_SECONDS = 15;

    private String name;
    private String type;

    @Builder.Default
    private boolean enabled = true;

    private int timeout;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @JsonIgnore
    public int getEffectiveTimeoutSeconds() {
        return timeout > 0 ? timeout : DEFAULT_TIMEOUT_SECONDS;
    }
}
