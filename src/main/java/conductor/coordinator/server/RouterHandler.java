package conductor.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import conductor.coordinator.api.Controller;
import conductor.coordinator.api.Controller.ControllerResponse;
import conductor.coordinator.config.CoordinatorConfig;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (worker-facing API, guarded by X-Conductor-Key when a key is configured)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String AGENT_KEY_HEADER = "X-Conductor-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, e);

            StringBuilder errorChain = new StringBuilder(e.toString());
            Throwable cause = e.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }

            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"" + escapeJson(errorChain.toString()) + "\"}");
        }
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true; // No auth configured
        }

        // Only internal endpoints require auth
        if (!path.startsWith("/internal/")) {
            return true;
        }

        String providedKey = req.headers().get(AGENT_KEY_HEADER);
        return config.agentKey().equals(providedKey);
    }

    /**
     * Write a response; if that fails, try a bare 500 and close the channel as a last resort.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            try {
                byte[] errorBytes = "{\"error\":\"failed to write response\"}".getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (RuntimeException e2) {
                log.error("Complete failure writing error response", e2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}");
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
