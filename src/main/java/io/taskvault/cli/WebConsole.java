package io.taskvault.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.taskvault.error.AuthenticationFailedException;
import io.taskvault.error.DecryptionFailedException;
import io.taskvault.error.LimitExceededException;
import io.taskvault.error.NotFoundException;
import io.taskvault.error.SessionLockedException;
import io.taskvault.error.SlotConflictException;
import io.taskvault.error.StorageBusyException;
import io.taskvault.error.TaskVaultException;
import io.taskvault.error.ValidationException;
import io.taskvault.error.VersionMismatchException;
import io.taskvault.model.BackupType;
import io.taskvault.model.SettingsPatch;
import io.taskvault.model.SlotChange;
import io.taskvault.model.StrikeMode;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskPatch;
import io.taskvault.model.TaskQuery;
import io.taskvault.runtime.TaskVaultRuntime;
import io.taskvault.tasks.TaskImporter;
import io.taskvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON API over the runtime, bound to the loopback interface only.
 */
public final class WebConsole {
    private static final Logger log = LoggerFactory.getLogger(WebConsole.class);

    private final TaskVaultRuntime runtime;
    private final HttpServer server;
    private final ExecutorService executor;

    public WebConsole(TaskVaultRuntime runtime, int port) throws IOException {
        this.runtime = runtime;
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        this.executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "taskvault-web");
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);
        registerRoutes();
    }

    public void start() {
        server.start();
        log.info("Web console listening on http://{}:{}", server.getAddress().getHostString(), port());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void registerRoutes() {
        route("/health", exchange -> {
            if (!allowMethods(exchange, "GET")) {
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("initialized", runtime.isInitialized());
            body.put("unlocked", runtime.isUnlocked());
            body.put("timestamp", Instant.now().toString());
            writeJson(exchange, body, 200);
        });
        route("/api/auth/status", exchange -> {
            if (!allowMethods(exchange, "GET")) {
                return;
            }
            writeJson(exchange, Map.of("initialized", runtime.isInitialized(), "unlocked", runtime.isUnlocked()), 200);
        });
        route("/api/auth/setup", exchange -> {
            if (!allowMethods(exchange, "POST")) {
                return;
            }
            char[] password = password(readBody(exchange), "password");
            try {
                runtime.initialize(password);
            } finally {
                Arrays.fill(password, '\0');
            }
            writeJson(exchange, Map.of("status", "initialized"), 200);
        });
        route("/api/auth/login", exchange -> {
            if (!allowMethods(exchange, "POST")) {
                return;
            }
            char[] password = password(readBody(exchange), "password");
            try {
                runtime.login(password);
            } finally {
                Arrays.fill(password, '\0');
            }
            writeJson(exchange, Map.of("status", "unlocked"), 200);
        });
        route("/api/auth/change-password", exchange -> {
            if (!allowMethods(exchange, "POST")) {
                return;
            }
            JsonNode body = readBody(exchange);
            char[] oldPassword = password(body, "old_password");
            char[] newPassword = password(body, "new_password");
            try {
                runtime.changePassword(oldPassword, newPassword);
            } finally {
                Arrays.fill(oldPassword, '\0');
                Arrays.fill(newPassword, '\0');
            }
            writeJson(exchange, Map.of("status", "changed"), 200);
        });
        route("/api/auth/logout", exchange -> {
            if (!allowMethods(exchange, "POST")) {
                return;
            }
            runtime.logout();
            writeJson(exchange, Map.of("status", "locked"), 200);
        });
        route("/api/tasks", this::handleTasks);
        route("/api/planner/schedule", exchange -> {
            if (!allowMethods(exchange, "GET", "POST")) {
                return;
            }
            if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                List<SlotChange> changes = Jsons.mapper().readerForListOf(SlotChange.class).readValue(readList(exchange));
                writeJson(exchange, Map.of("tasks", runtime.applySchedule(changes)), 200);
                return;
            }
            Map<String, String> query = parseQuery(exchange);
            LocalDate date = parseDate(query.get("date"), "date");
            LocalDate day = date == null ? runtime.today() : date;
            writeJson(exchange, Map.of("date", day.toString(), "tasks", runtime.scheduleFor(day)), 200);
        });
        route("/api/settings", exchange -> {
            if (!allowMethods(exchange, "GET", "PUT")) {
                return;
            }
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, runtime.settings(), 200);
                return;
            }
            SettingsPatch patch = Jsons.mapper().treeToValue(readBody(exchange), SettingsPatch.class);
            writeJson(exchange, runtime.updateSettings(patch), 200);
        });
        route("/api/backups", exchange -> {
            String path = exchange.getRequestURI().getPath();
            if (path.equals("/api/backups") || path.equals("/api/backups/")) {
                if (!allowMethods(exchange, "GET")) {
                    return;
                }
                writeJson(exchange, Map.of("backups", runtime.listBackups()), 200);
            } else if (path.equals("/api/backups/create")) {
                if (!allowMethods(exchange, "POST")) {
                    return;
                }
                JsonNode body = readBody(exchange);
                BackupType type = BackupType.fromString(body.path("type").asText(""));
                writeJson(exchange, runtime.createBackup(type), 201);
            } else if (path.equals("/api/backups/restore")) {
                if (!allowMethods(exchange, "POST")) {
                    return;
                }
                String name = requireText(readBody(exchange), "name");
                runtime.restoreBackup(name);
                writeJson(exchange, Map.of("status", "restored", "name", name), 200);
            } else {
                writeJson(exchange, Map.of("error", "not_found"), 404);
            }
        });
    }

    private void handleTasks(HttpExchange exchange) throws IOException {
        String rest = exchange.getRequestURI().getPath().substring("/api/tasks".length());
        String[] parts = rest.isEmpty() || rest.equals("/") ? new String[0] : rest.substring(1).split("/");
        if (parts.length == 0) {
            if (!allowMethods(exchange, "GET", "POST")) {
                return;
            }
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                Map<String, String> query = parseQuery(exchange);
                String completed = query.get("completed");
                TaskQuery filter = new TaskQuery(
                        query.get("project"),
                        completed == null || completed.isBlank() ? null : Boolean.valueOf(completed),
                        parseDate(query.get("date"), "date"),
                        query.get("q"));
                writeJson(exchange, Map.of("tasks", runtime.list(filter)), 200);
                return;
            }
            TaskDraft draft = Jsons.mapper().treeToValue(readBody(exchange), TaskDraft.class);
            writeJson(exchange, runtime.create(draft), 201);
            return;
        }
        if (parts.length == 1 && parts[0].equals("import")) {
            if (!allowMethods(exchange, "POST")) {
                return;
            }
            JsonNode body = readBody(exchange);
            TaskImporter.Format format = body.hasNonNull("format")
                    ? TaskImporter.Format.fromString(body.get("format").asText())
                    : TaskImporter.Format.fromFileName(body.path("filename").asText(""));
            writeJson(exchange, runtime.importTasks(format, body.path("content").asText("")), 200);
            return;
        }
        String id = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
        if (parts.length == 1) {
            if (!allowMethods(exchange, "GET", "PATCH", "DELETE")) {
                return;
            }
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            if (method.equals("GET")) {
                writeJson(exchange, runtime.get(id), 200);
            } else if (method.equals("PATCH")) {
                TaskPatch patch = Jsons.mapper().treeToValue(readBody(exchange), TaskPatch.class);
                writeJson(exchange, runtime.update(id, patch), 200);
            } else {
                runtime.delete(id);
                writeJson(exchange, Map.of("status", "deleted", "id", id), 200);
            }
            return;
        }
        if (parts.length != 2) {
            writeJson(exchange, Map.of("error", "not_found"), 404);
            return;
        }
        if (!allowMethods(exchange, "POST")) {
            return;
        }
        JsonNode body = readBody(exchange);
        switch (parts[1]) {
            case "strike" -> writeJson(exchange, runtime.strike(id,
                    StrikeMode.fromString(body.path("mode").asText("")),
                    body.path("report").asText(null)), 200);
            case "undo-strike" -> writeJson(exchange, runtime.undoStrike(id), 200);
            case "complete" -> writeJson(exchange, runtime.complete(id), 200);
            case "uncomplete" -> writeJson(exchange, runtime.uncomplete(id), 200);
            case "schedule" -> {
                LocalDate date = parseDate(body.path("date").asText(null), "date");
                Integer duration = body.hasNonNull("duration") ? body.get("duration").asInt() : null;
                writeJson(exchange, runtime.schedule(id, body.path("hour").asText(null),
                        date == null ? runtime.today() : date, duration), 200);
            }
            case "unschedule" -> writeJson(exchange, runtime.unschedule(id), 200);
            default -> writeJson(exchange, Map.of("error", "not_found"), 404);
        }
    }

    private void route(String path, Route route) {
        server.createContext(path, exchange -> {
            try {
                route.handle(exchange);
            } catch (Exception e) {
                writeError(exchange, e);
            } finally {
                exchange.close();
            }
        });
    }

    static int statusFor(Throwable e) {
        if (e instanceof ValidationException || e instanceof JsonProcessingException
                || e instanceof IllegalArgumentException || e instanceof DateTimeException) {
            return 400;
        }
        if (e instanceof AuthenticationFailedException) {
            return 401;
        }
        if (e instanceof NotFoundException) {
            return 404;
        }
        if (e instanceof SlotConflictException || e instanceof LimitExceededException
                || e instanceof VersionMismatchException || e instanceof IllegalStateException) {
            return 409;
        }
        if (e instanceof SessionLockedException) {
            return 423;
        }
        if (e instanceof StorageBusyException) {
            return 503;
        }
        return 500;
    }

    private static String errorCode(Throwable e) {
        if (e instanceof JsonProcessingException) {
            return "validation";
        }
        if (e instanceof IllegalStateException) {
            return "conflict";
        }
        if (e instanceof DecryptionFailedException) {
            return "decryption_failed";
        }
        if (e instanceof TaskVaultException) {
            String simple = e.getClass().getSimpleName().replace("Exception", "");
            return simple.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
        }
        return statusFor(e) == 400 ? "validation" : "internal_error";
    }

    private static void writeError(HttpExchange exchange, Exception e) throws IOException {
        int status = statusFor(e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", errorCode(e));
        if (e instanceof JsonProcessingException json) {
            body.put("message", json.getOriginalMessage());
        } else {
            body.put("message", e.getMessage());
        }
        if (e instanceof ValidationException validation) {
            body.put("field", validation.field());
        }
        if (e instanceof SlotConflictException conflict) {
            body.put("occupying_task_id", conflict.occupyingTaskId());
            body.put("occupying_title", conflict.occupyingTitle());
        }
        if (e instanceof DecryptionFailedException failed) {
            body.put("document", failed.document());
        }
        if (status >= 500) {
            log.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
        }
        writeJson(exchange, body, status);
    }

    private static JsonNode readBody(HttpExchange exchange) throws IOException {
        String body = readText(exchange);
        if (body.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode node = Jsons.mapper().readTree(body);
        if (node == null || !node.isObject()) {
            throw new ValidationException("body", "must be a JSON object");
        }
        return node;
    }

    private static JsonNode readList(HttpExchange exchange) throws IOException {
        String body = readText(exchange);
        JsonNode node = body.isEmpty() ? null : Jsons.mapper().readTree(body);
        if (node == null || !node.isArray()) {
            throw new ValidationException("body", "must be a JSON array");
        }
        return node;
    }

    private static String readText(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        return new String(raw, StandardCharsets.UTF_8).trim();
    }

    private static char[] password(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual()) {
            throw new ValidationException(field, "is required");
        }
        return value.asText().toCharArray();
    }

    private static String requireText(JsonNode body, String field) {
        String value = body.path(field).asText("");
        if (value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
        return value;
    }

    private static LocalDate parseDate(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeException e) {
            throw new ValidationException(field, "must be an ISO date (yyyy-MM-dd)");
        }
    }

    private static Map<String, String> parseQuery(HttpExchange exchange) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }
}
