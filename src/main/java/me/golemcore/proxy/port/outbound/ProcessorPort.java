package me.golemcore.proxy.port.outbound;

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

import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorInput;
import me.golemcore.proxy.domain.model.ProcessorOutput;
import me.golemcore.proxy.domain.model.ProcessorType;
import me.golemcore.proxy.domain.processor.ProcessorExecutionException;

/**
 * Port for one kind of processor backend.
 *
 * <p>
 * Implementations run a single processor invocation and always report the
 * outcome as a {@link ProcessorOutput}: timeouts, crashes and contract
 * violations of the processor are converted into 500 outputs that keep the
 * input payload. {@link ProcessorExecutionException} is reserved for the cases
 * where nothing was run at all because the declaration itself is unusable.
 *
 * <p>
 * New processor kinds are added by providing another implementation; the
 * {@link me.golemcore.proxy.domain.processor.ProcessorExecutor} picks it up by
 * {@link #getType()}.
 */
public interface ProcessorPort {

    ProcessorType getType();

    ProcessorOutput run(ProcessorConfig config, ProcessorInput input) throws ProcessorExecutionException;
}
