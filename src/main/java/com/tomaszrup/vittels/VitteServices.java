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
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vittels.format.StyleOptions;
import com.tomaszrup.vittels.providers.FormattingProvider;
import com.tomaszrup.vittels.util.FileContentsTracker;
import com.tomaszrup.vittels.util.MdcDocumentContext;

/**
 * Thin facade implementing the LSP {@link TextDocumentService},
 * {@link WorkspaceService}, and {@link LanguageClientAware} interfaces.
 * Delegates to:
 * <ul>
 *   <li>{@link FileContentsTracker} for open document text</li>
 *   <li>{@link FormattingHandler} for textDocument/formatting</li>
 *   <li>{@link ConfigurationChangeHandler} for workspace settings</li>
 * </ul>
 */
public class VitteServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(VitteServices.class);

	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	private final FormattingHandler formattingHandler;
	private final LspRequestGuard requestGuard;
	private final ConfigurationChangeHandler configChangeHandler;

	public VitteServices() {
		this(new FormattingProvider());
	}

	VitteServices(FormattingProvider formattingProvider) {
		this.formattingHandler = new FormattingHandler(formattingProvider, fileContentsTracker);
		this.requestGuard = new LspRequestGuard();
		this.configChangeHandler = new ConfigurationChangeHandler();
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	LanguageClient getLanguageClient() {
		return languageClient.get();
	}

	public void setSettingsChangeListener(ConfigurationChangeHandler.SettingsChangeListener listener) {
		configChangeHandler.setSettingsChangeListener(listener);
	}

	/** Options from {@code initializationOptions.format}. */
	public void setInitialFormatOptions(StyleOptions options) {
		configChangeHandler.setInitialOptions(options);
	}

	public StyleOptions getWorkspaceFormatOptions() {
		return configChangeHandler.getWorkspaceOptions();
	}

	public boolean isFormattingEnabled() {
		return configChangeHandler.isFormattingEnabled();
	}

	FileContentsTracker getFileContentsTracker() {
		return fileContentsTracker;
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		runNotification("didOpen", params.getTextDocument().getUri(),
				() -> fileContentsTracker.didOpen(params));
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		runNotification("didChange", params.getTextDocument().getUri(),
				() -> fileContentsTracker.didChange(params));
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		runNotification("didClose", params.getTextDocument().getUri(),
				() -> fileContentsTracker.didClose(params));
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		String text = params.getText();
		if (text == null) {
			return;
		}
		// clients that include text on save may have skipped a change notification
		runNotification("didSave", params.getTextDocument().getUri(), () -> {
			URI uri = URI.create(params.getTextDocument().getUri());
			if (fileContentsTracker.isOpen(uri)) {
				fileContentsTracker.setContents(uri, text);
			}
		});
	}

	/**
	 * Runs a notification handler so that an unexpected exception is logged
	 * rather than propagated to LSP4J's listener thread, which would drop
	 * the connection.
	 */
	private void runNotification(String name, String uri, Runnable handler) {
		try {
			MdcDocumentContext.setDocument(uri != null ? URI.create(uri) : null);
			handler.run();
		} catch (Exception e) {
			logger.warn("Unexpected exception during {} for {}: {}", name, uri, e.getMessage());
			logger.debug("{} exception details", name, e);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// document text comes from the client; files on disk are not watched
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		try {
			configChangeHandler.handleConfigurationChange(params.getSettings());
		} catch (Exception e) {
			logger.warn("Unexpected exception during didChangeConfiguration: {}", e.getMessage());
			logger.debug("didChangeConfiguration exception details", e);
		}
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		if (!configChangeHandler.isFormattingEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.callOrFallback("formatting", uri,
				() -> formattingHandler.formatting(params, configChangeHandler.getWorkspaceOptions()),
				Collections.emptyList());
	}
}
