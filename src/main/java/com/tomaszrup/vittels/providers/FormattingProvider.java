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
package com.tomaszrup.vittels.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.vittels.format.LineModel;
import com.tomaszrup.vittels.format.StyleFormatter;
import com.tomaszrup.vittels.format.StyleOptions;
import com.tomaszrup.vittels.format.StyleOptions.EndOfLine;

/**
 * Provides textDocument/formatting support for Vitte source files.
 *
 * <p>The result is either empty, when the document is already in canonical
 * form, or a single edit replacing the whole document. The comparison is made
 * against the source re-joined with the target line terminator, so line
 * endings alone never produce an edit; they are converted whenever some other
 * rule rewrites the document.</p>
 */
public class FormattingProvider {
	private static final Logger logger = LoggerFactory.getLogger(FormattingProvider.class);

	public CompletableFuture<List<TextEdit>> provideFormatting(String sourceText, StyleOptions options) {
		return CompletableFuture.completedFuture(computeEdits(sourceText, options));
	}

	public List<TextEdit> computeEdits(String sourceText, StyleOptions options) {
		String text = sourceText != null ? sourceText : "";
		StyleOptions effective = options != null ? options : StyleOptions.defaults();

		String formatted = new StyleFormatter(effective).format(text);
		String normalizedSource = normalizeLineEndings(text, effective.getEndOfLine());
		if (formatted.equals(normalizedSource)) {
			logger.debug("Document already formatted ({} chars)", text.length());
			return new ArrayList<>();
		}
		logger.debug("Formatting replaces {} chars with {} chars", text.length(), formatted.length());
		return new ArrayList<>(Collections.singletonList(
				new TextEdit(Ranges.wholeDocument(text), formatted)));
	}

	/** Re-joins {@code text} with {@code endOfLine} and changes nothing else. */
	public static String normalizeLineEndings(String text, EndOfLine endOfLine) {
		return LineModel.join(LineModel.split(text), endOfLine);
	}
}
