package me.golemcore.proxy.domain.service;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Expands {@code ${VAR}} and {@code $VAR} references against an environment.
 * Unset variables expand to an empty string. A {@code $} that does not start
 * a reference is kept literally.
 */
public final class EnvSubstitution {

    private EnvSubstitution() {
    }

    public static String expand(String value) {
        return expand(value, System::getenv);
    }

    public static String expand(String value, UnaryOperator<String> lookup) {
        if (value == null || value.indexOf('$') < 0) {
            return value;
        }
        StringBuilder result = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c != '$' || i + 1 >= value.length()) {
                result.append(c);
                i++;
                continue;
            }
            char next = value.charAt(i + 1);
            if (next == '{') {
                int close = value.indexOf('}', i + 2);
                if (close < 0) {
                    result.append(value, i, value.length());
                    break;
                }
                result.append(resolve(value.substring(i + 2, close), lookup));
                i = close + 1;
            } else if (isNameChar(next)) {
                int end = i + 1;
                while (end < value.length() && isNameChar(value.charAt(end))) {
                    end++;
                }
                result.append(resolve(value.substring(i + 1, end), lookup));
                i = end;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    public static Map<String, String> expandValues(Map<String, String> values) {
        Map<String, String> expanded = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> expanded.put(key, expand(value)));
        }
        return expanded;
    }

    private static String resolve(String name, UnaryOperator<String> lookup) {
        String resolved = lookup.apply(name);
        return resolved != null ? resolved : "";
    }

    private static boolean isNameChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
