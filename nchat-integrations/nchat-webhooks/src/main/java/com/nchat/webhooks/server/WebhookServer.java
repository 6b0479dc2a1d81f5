package com.nchat.webhooks.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nchat.webhooks.config.WebhookServerConfig;
import com.nchat.webhooks.manager.WebhookHandlerManager;
import com.nchat.webhooks.model.WebhookFailure;
import com.nchat.webhooks.model.WebhookResult;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded Jetty HTTP endpoint in front of a {@link WebhookHandlerManager}.
 *
 * <h2>Usage</h2>
 * <pre>
 *   WebhookHandlerManager manager = new WebhookHandlerManager();
 *   manager.setSignatureSecret(WebhookSource.GITHUB, "gh-secret");
 *   manager.registerHandler(WebhookSource.GITHUB, new LoggingWebhookHandler());
 *
 *   WebhookServer server = new WebhookServer(WebhookServerConfig.builder().port(8080).build(), manager);
 *   server.start();
 *   // ... application runs ...
 *   server.stop();
 * </pre>
 *
 * Status codes: 200 accepted, 400 invalid JSON, 401 bad signature, 404 no
 * handler for the source, 405 anything but POST, 413 body too large, 500
 * handler failure.
 */
public class WebhookServer {

    private static final Logger log = LoggerFactory.getLogger(WebhookServer.class);

    private final WebhookServerConfig   config;
    private final WebhookHandlerManager manager;
    private final ObjectMapper          mapper = new ObjectMapper();

    private Server          jettyServer;
    private ServerConnector connector;

    public WebhookServer(WebhookServerConfig config, WebhookHandlerManager manager) {
        this.config  = config;
        this.manager = manager;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public synchronized void start() throws Exception {
        if (jettyServer != null) {
            throw new IllegalStateException("Webhook server already started");
        }
        QueuedThreadPool pool = new QueuedThreadPool(config.getMaxThreads(), config.getMinThreads());
        pool.setName("webhook-http");
        Server server = new Server(pool);

        ServerConnector serverConnector = new ServerConnector(server);
        serverConnector.setHost(config.getHost());
        serverConnector.setPort(config.getPort());
        server.addConnector(serverConnector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        ctx.addServlet(new ServletHolder(new WebhookServlet()), config.getPath());
        server.setHandler(ctx);

        server.start();
        this.jettyServer = server;
        this.connector = serverConnector;
        log.info("Webhook server listening on port {} at path {}", getPort(), config.getPath());
    }

    public synchronized void stop() throws Exception {
        if (jettyServer != null) {
            jettyServer.stop();
            jettyServer = null;
            connector = null;
            log.info("Webhook server stopped");
        }
    }

    /** The bound port, which differs from the configured one when that was {@code 0}. */
    public synchronized int getPort() {
        return connector != null ? connector.getLocalPort() : config.getPort();
    }

    public synchronized boolean isRunning() {
        return jettyServer != null && jettyServer.isRunning();
    }

    static int statusFor(WebhookResult result) {
        if (result.isSuccess()) {
            return HttpServletResponse.SC_OK;
        }
        WebhookFailure failure = result.getFailure();
        return switch (failure) {
            case INVALID_JSON      -> HttpServletResponse.SC_BAD_REQUEST;
            case INVALID_SIGNATURE -> HttpServletResponse.SC_UNAUTHORIZED;
            case NO_HANDLER        -> HttpServletResponse.SC_NOT_FOUND;
            case HANDLER_FAILED    -> HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        };
    }

    // ------------------------------------------------------------------
    // Internal servlet
    // ------------------------------------------------------------------

    private class WebhookServlet extends HttpServlet {

        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            if (!"POST".equals(req.getMethod())) {
                resp.setHeader("Allow", "POST");
                writeJson(resp, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "rejected", "Method not allowed");
                return;
            }

            byte[] body = readBody(req);
            if (body == null) {
                log.warn("Rejected webhook delivery larger than {} bytes", config.getMaxBodyBytes());
                writeJson(resp, HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, "rejected", "Payload too large");
                return;
            }

            WebhookResult result = manager.processWebhook(body, headersOf(req));
            int status = statusFor(result);
            if (result.isSuccess()) {
                writeJson(resp, status, "accepted", null);
            } else {
                writeJson(resp, status, "rejected", result.getError());
            }
        }

        private byte[] readBody(HttpServletRequest req) throws IOException {
            int limit = config.getMaxBodyBytes();
            if (req.getContentLengthLong() > limit) {
                return null;
            }
            try (InputStream in = req.getInputStream()) {
                byte[] body = in.readNBytes(limit + 1);
                return body.length > limit ? null : body;
            }
        }

        private Map<String, String> headersOf(HttpServletRequest req) {
            Map<String, String> headers = new LinkedHashMap<>();
            Enumeration<String> names = req.getHeaderNames();
            while (names.hasMoreElements()) {
                String name = names.nextElement();
                headers.put(name, req.getHeader(name));
            }
            return headers;
        }

        private void writeJson(HttpServletResponse resp, int status, String outcome, String error)
                throws IOException {
            ObjectNode body = mapper.createObjectNode().put("status", outcome);
            if (error != null) {
                body.put("error", error);
            }
            resp.setStatus(status);
            resp.setContentType("application/json");
            resp.setCharacterEncoding("UTF-8");
            resp.getWriter().write(mapper.writeValueAsString(body));
        }
    }
}
