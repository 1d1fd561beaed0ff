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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vittels.config.StyleOptionsParser;
import com.tomaszrup.vittels.format.StyleOptions;
import com.tomaszrup.vittels.providers.FormattingProvider;
import com.tomaszrup.vittels.util.FileContentsTracker;
import com.tomaszrup.vittels.util.MdcDocumentContext;

/**
 * Handles LSP document formatting requests: looks up the document text,
 * lays the request's options over the workspace options and hands both to
 * the {@link FormattingProvider}.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FormattingProvider formattingProvider;
	private final FileContentsTracker fileContentsTracker;

	FormattingHandler(FormattingProvider formattingProvider, FileContentsTracker fileContentsTracker) {
		this.formattingProvider = formattingProvider;
		this.fileContentsTracker = fileContentsTracker;
	}

	@SuppressWarnings("java:S1452")
	CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params,
			StyleOptions workspaceOptions) {
		URI uri = URI.create(params.getTextDocument().getUri());
		MdcDocumentContext.setDocument(uri);
		try {
			String sourceText = fileContentsTracker.getContents(uri);
			if (sourceText == null) {
				logger.debug("No contents for {}, nothing to format", uri);
				return CompletableFuture.completedFuture(Collections.emptyList());
			}
			StyleOptions options = effectiveOptions(params, workspaceOptions);
			logger.debug("Formatting {} with {}", uri, options);
			return formattingProvider.provideFormatting(sourceText, options)
					.thenApply(edits -> edits);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	static StyleOptions effectiveOptions(DocumentFormattingParams params, StyleOptions workspaceOptions) {
		return StyleOptionsParser.fromFormattingOptions(params.getOptions(), workspaceOptions);
	}
}
