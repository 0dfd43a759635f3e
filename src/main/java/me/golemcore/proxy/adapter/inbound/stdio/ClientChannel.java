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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Client side of a stdio relay: where client frames come from and where
 * server frames go. Closing the channel must unblock a pending read where the
 * underlying transport allows it.
 */
public interface ClientChannel extends Closeable {

    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    String describe();
}
