////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vittels.util;

import java.net.URI;

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "document"} so that log lines written
 * while handling a request name the document they concern.
 *
 * <h3>Usage at entry points:</h3>
 * <pre>{@code
 * MdcDocumentContext.setDocument(uri);
 * try {
 *     // ... all log calls inside here include [main.vit]
 * } finally {
 *     MdcDocumentContext.clear();
 * }
 * }</pre>
 */
public final class MdcDocumentContext {

    /** MDC key used in the logback pattern via {@code %X{document}}. */
    public static final String MDC_KEY = "document";

    private MdcDocumentContext() {
        // utility class
    }

    /**
     * Sets the MDC key to the last path segment of {@code uri}, or to the
     * whole URI when it has no path.
     */
    public static void setDocument(URI uri) {
        MDC.put(MDC_KEY, label(uri));
    }

    /** Removes the MDC {@code "document"} key from the current thread. */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    static String label(URI uri) {
        if (uri == null) {
            return "unknown";
        }
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return uri.toString();
        }
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        return name.isEmpty() ? path : name;
    }
}
