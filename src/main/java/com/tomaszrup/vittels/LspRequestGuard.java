////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vittels;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a request with a fallback value when its handler throws, so that a
 * formatter bug shows up in the log instead of as an error on the client.
 *
 * <p>Handlers complete synchronously; their result is resolved before it is
 * returned. An {@link Error}, thrown directly or carried by the future, is
 * not caught.</p>
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	<T> CompletableFuture<T> callOrFallback(String requestName, URI uri,
			Supplier<CompletableFuture<T>> handler, T fallback) {
		try {
			CompletableFuture<T> pending = handler.get();
			T result = pending != null ? pending.join() : null;
			return CompletableFuture.completedFuture(result != null ? result : fallback);
		} catch (RuntimeException e) {
			Throwable cause = rootCause(e);
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			logger.warn("{} failed for {}: {}", requestName, uri, describe(cause));
			logger.debug("{} failure details", requestName, cause);
			return CompletableFuture.completedFuture(fallback);
		}
	}

	static Throwable rootCause(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	static String describe(Throwable throwable) {
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getSimpleName();
		}
		return throwable.getClass().getSimpleName() + ": " + message;
	}
}
