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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document a processor prints on stdout.
 *
 * <p>
 * {@code status} follows HTTP conventions: 2xx lets the frame through,
 * 4xx rejects it and 5xx reports a failure. {@code error} is always present
 * once {@code status >= 400}; the executor synthesizes one when a processor
 * omits it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessorOutput {

    private int status;
    private JsonNode payload;
    private String error;
    private JsonNode metadata;

    @JsonIgnore
    public boolean isRejected() {
        return status >= 400;
    }

    /**
     * Creates a 500 output that keeps the given payload untouched.
     */
    public static ProcessorOutput failure(JsonNode payload, String error) {
        return ProcessorOutput.builder()
                .status(500)
                .payload(payload)
                .error(error)
                .build();
    }
}
