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

import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of running every element of a JSON-RPC batch through a processor
 * chain. {@code forward} continues towards the receiver, {@code replies} goes
 * back to the sender. Either may be empty.
 */
@Data
@Builder
public class BatchResult {

    private ArrayNode forward;
    private ArrayNode replies;

    @Builder.Default
    private List<ChainResult> rejections = new ArrayList<>();

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }
}
