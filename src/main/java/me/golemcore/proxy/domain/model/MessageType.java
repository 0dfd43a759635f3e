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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Logical JSON-RPC message kind, derived from the fields a frame carries.
 *
 * <p>
 * A frame with both {@code method} and {@code id} is a request, a frame with
 * only {@code method} is a notification and a frame with only {@code id} is a
 * response. Anything else (including non-object frames) is classified as
 * {@link #SYSTEM}.
 */
public enum MessageType {

    REQUEST("request"), RESPONSE("response"), NOTIFICATION("notification"), SYSTEM("system");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MessageType classify(JsonNode frame) {
        if (frame == null || !frame.isObject()) {
            return SYSTEM;
        }
        boolean hasMethod = frame.hasNonNull("method");
        boolean hasId = frame.has("id");
        if (hasMethod && hasId) {
            return REQUEST;
        }
        if (hasMethod) {
            return NOTIFICATION;
        }
        if (hasId) {
            return RESPONSE;
        }
        return SYSTEM;
    }
}
