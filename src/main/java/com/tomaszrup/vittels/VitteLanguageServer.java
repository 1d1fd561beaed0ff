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

import com.google.gson.JsonObject;
import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

public class VitteLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(VitteLanguageServer.class);

    static final int DEFAULT_PORT = 5007;
    static final String SERVER_NAME = "vitte-language-server";
    static final String LOG_LEVEL_SETTING = "logLevel";

    public static void main(String[] args) throws IOException {
        // Log unexpected exceptions on any thread instead of letting the
        // JVM die silently, which the client sees as an EPIPE.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}",
                        thread.getName(), throwable.getMessage(), throwable));

        // Unmatched $/cancelRequest notifications are normal and noisy.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_PORT;
            if (args.length > 1) {
                Integer parsed = parsePort(args[1]);
                if (parsed == null) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                    return;
                }
                port = parsed;
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Vitte Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("Vitte Language Server starting in stdio mode.");
            InputStream in = System.in;
            OutputStream out = System.out;
            startServer(in, out);
        }
    }

    /** Returns the port, or {@code null} if {@code value} is not in 0..65535. */
    static Integer parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            return port >= 0 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // Redirect System.out to System.err to avoid corrupting the communication channel
        System.setOut(new PrintStream(System.err));

        VitteLanguageServer server = new VitteLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // Keep the main thread alive until the connection closes.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final VitteServices vitteServices;
    private volatile boolean shutdownRequested;

    public VitteLanguageServer() {
        this(new VitteServices());
    }

    VitteLanguageServer(VitteServices vitteServices) {
        this.vitteServices = vitteServices;
        this.vitteServices.setSettingsChangeListener(this::applyServerSettings);
    }

    /** Picks up {@code vitte.logLevel} from workspace settings. */
    private void applyServerSettings(JsonObject settings) {
        if (!settings.has(ConfigurationChangeHandler.SECTION)
                || !settings.get(ConfigurationChangeHandler.SECTION).isJsonObject()) {
            return;
        }
        JsonObject vitte = settings.getAsJsonObject(ConfigurationChangeHandler.SECTION);
        if (vitte.has(LOG_LEVEL_SETTING) && vitte.get(LOG_LEVEL_SETTING).isJsonPrimitive()) {
            InitializationOptionsParser.applyLogLevel(vitte.get(LOG_LEVEL_SETTING).getAsString());
        }
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions parsed =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (parsed != null) {
            vitteServices.setInitialFormatOptions(parsed.format);
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(true);

        InitializeResult initializeResult = new InitializeResult(serverCapabilities);
        initializeResult.setServerInfo(new ServerInfo(SERVER_NAME, serverVersion()));
        logger.info("Initialized with format options {}", vitteServices.getWorkspaceFormatOptions());
        return CompletableFuture.completedFuture(initializeResult);
    }

    static String serverVersion() {
        String version = VitteLanguageServer.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        shutdownRequested = true;
        return CompletableFuture.completedFuture(new Object());
    }

    boolean isShutdownRequested() {
        return shutdownRequested;
    }

    @Override
    public void exit() {
        System.exit(shutdownRequested ? 0 : 1);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return vitteServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return vitteServices;
    }

    @Override
    public void connect(LanguageClient client) {
        vitteServices.connect(client);
    }
}
