package me.golemcore.proxy.adapter.inbound.stdio;

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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Client channel over a fixed pair of streams, by default the proxy's own
 * stdin and stdout.
 *
 * <p>
 * Closing it closes the input (a blocked read on {@code System.in} may still
 * not return until the next byte arrives) and only flushes the output, so
 * stdout stays usable for the rest of the process.
 */
public class StandardStreamsChannel implements ClientChannel {

    private final InputStream input;
    private final OutputStream output;

    public StandardStreamsChannel() {
        this(System.in, System.out);
    }

    public StandardStreamsChannel(InputStream input, OutputStream output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public InputStream input() {
        return input;
    }

    @Override
    public OutputStream output() {
        return output;
    }

    @Override
    public String describe() {
        return "standard streams";
    }

    @Override
    public void close() throws IOException {
        try {
            output.flush();
        } finally {
            input.close();
        }
    }
}
