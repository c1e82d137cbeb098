package io.didacli.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.api.DidaClient;
import io.didacli.api.SearchResult;
import io.didacli.api.TaskDrafts;
import io.didacli.auth.Credential;
import io.didacli.auth.LoginFlow;
import io.didacli.auth.OAuthClient;
import io.didacli.auth.TokenStore;
import io.didacli.config.CliConfig;
import io.didacli.config.ConfigLoader;
import io.didacli.config.GlobalOptions;
import io.didacli.config.OAuthSettings;
import io.didacli.error.ValidationException;
import io.didacli.security.SensitiveDataMasker;
import io.didacli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "dida",
        mixinStandardHelpOptions = true,
        description = "Command-line client for the Dida365 open API",
        subcommands = {
                DidaCommand.StatusCommand.class,
                DidaCommand.AuthCommand.class,
                DidaCommand.ConfigCommand.class,
                DidaCommand.ProjectsCommand.class,
                DidaCommand.TasksCommand.class,
                DidaCommand.CacheCommand.class
        }
)
public final class DidaCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DidaCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--json"}, description = "Compact single-line JSON output")
    boolean json;

    @Option(names = {"--config"}, description = "Config file path")
    String configPath;

    @Option(names = {"--token"}, description = "Access token (overrides the stored OAuth token)")
    String token;

    @Option(names = {"--cache-dir"}, description = "Cache directory")
    String cacheDir;

    @Option(names = {"--timezone"}, description = "Time zone for task dates, e.g. Asia/Shanghai")
    String timezone;

    private final ConfigLoader loader;
    private final TokenStore tokenStore;
    private final BufferedReader stdin;

    public DidaCommand() {
        this(ConfigLoader.system(), new TokenStore(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    DidaCommand(ConfigLoader loader, TokenStore tokenStore, BufferedReader stdin) {
        this.loader = loader;
        this.tokenStore = tokenStore;
        this.stdin = stdin;
    }

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: status | auth | config | projects | tasks | cache");
    }

    /** Command line whose argument errors are reported as a validation envelope. */
    public static CommandLine newCommandLine(DidaCommand root) {
        CommandLine cli = new CommandLine(root);
        cli.setParameterExceptionHandler((ex, args) -> {
            boolean compact = ex.getCommandLine().getParseResult() != null
                    && ex.getCommandLine().getParseResult().hasMatchedOption("--json");
            new OutputPrinter(ex.getCommandLine().getOut(), compact || root.json)
                    .error(new ValidationException(ex.getMessage()));
            return ExitCode.VALIDATION;
        });
        return cli;
    }

    GlobalOptions globals() {
        return new GlobalOptions(configPath, token, cacheDir, timezone);
    }

    /** Runs {@code action} and prints its envelope; failures become an error envelope and exit code. */
    int execute(Action action) {
        OutputPrinter printer = new OutputPrinter(spec.commandLine().getOut(), json);
        CommandContext ctx = new CommandContext(loader, globals(), tokenStore);
        try {
            CommandResult result = action.run(ctx);
            printer.success(result.withWarnings(ctx.warnings()));
            return ExitCode.OK;
        } catch (RuntimeException e) {
            log.debug("command failed", e);
            printer.error(e);
            return ExitCode.forError(e);
        }
    }

    String readLine() {
        try {
            String line = stdin.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from stdin", e);
        }
    }

    @FunctionalInterface
    interface Action {
        CommandResult run(CommandContext ctx);
    }

    static Optional<Credential> loadToken(CommandContext ctx, Path tokenPath) {
        try {
            return ctx.tokenStore().load(tokenPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load token from " + tokenPath, e);
        }
    }

    static String formatEpochMs(Long epochMs) {
        return epochMs == null ? null : Instant.ofEpochMilli(epochMs).toString();
    }

    static Map<String, Object> tokenSummary(Path tokenPath, Credential credential) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tokenPath", tokenPath.toString());
        out.put("expiresAt", credential == null ? null : formatEpochMs(credential.expiresAt()));
        out.put("hasRefreshToken", credential != null && credential.hasRefreshToken());
        return out;
    }

    @Command(name = "status", description = "Show authentication and configuration status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        DidaCommand parent;

        @Override
        public Integer call() {
            return parent.execute(ctx -> {
                CliConfig config = ctx.config();
                Path tokenPath = config.tokenPath();
                Credential stored = loadToken(ctx, tokenPath).orElse(null);
                Map<String, Object> data = new LinkedHashMap<>();
                String source = config.token() != null ? "explicit" : stored != null ? "token-file" : "none";
                data.put("authenticated", !"none".equals(source));
                data.put("tokenSource", source);
                data.put("tokenPath", tokenPath.toString());
                data.put("expiresAt", stored == null ? null : formatEpochMs(stored.expiresAt()));
                data.put("expired", stored != null && ctx.tokenStore().isExpired(stored));
                data.put("baseUrl", config.baseUrl());
                data.put("timezone", config.timezone());
                data.put("requiredTags", config.enableRequiredTags() ? config.requiredTags() : List.of());
                data.put("cacheDir", config.cacheDir().toString());
                data.put("configPath", ctx.loaded().path() == null ? null : ctx.loaded().path().toString());
                return CommandResult.of(data);
            });
        }
    }

    @Command(
            name = "auth",
            description = "OAuth commands",
            subcommands = {
                    AuthCommand.LoginCommand.class,
                    AuthCommand.RefreshCommand.class,
                    AuthCommand.LogoutCommand.class
            }
    )
    static final class AuthCommand implements Runnable {
        @ParentCommand
        DidaCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "login", description = "OAuth login (local callback by default; --headless to paste the code)")
        static final class LoginCommand implements Callable<Integer> {
            @ParentCommand
            AuthCommand parent;

            @Option(names = {"--headless"}, description = "Print the URL and paste the code manually")
            boolean headless;

            @Option(names = {"--no-browser"}, description = "Do not open a browser automatically")
            boolean noBrowser;

            @Option(names = {"--timeout-ms"}, description = "Callback timeout in ms")
            Long timeoutMs;

            @Override
            public Integer call() {
                DidaCommand root = parent.root;
                return root.execute(ctx -> {
                    OAuthSettings oauth = ctx.config().oauth();
                    LoginFlow flow = new LoginFlow(
                            oauth,
                            new OAuthClient(oauth),
                            LoginFlow.Browser.desktopOr(System.err),
                            root.stdin,
                            System.err
                    );
                    Duration timeout = Duration.ofMillis(timeoutMs == null || timeoutMs <= 0
                            ? oauth.callbackTimeoutMs()
                            : timeoutMs);
                    Credential credential = flow.login(headless, !noBrowser && oauth.openBrowser(), timeout);
                    Credential saved = save(ctx, oauth.tokenPath(), credential);
                    log.info("login successful: tokenPath={}", oauth.tokenPath());
                    return CommandResult.of(tokenSummary(oauth.tokenPath(), saved));
                });
            }
        }

        @Command(name = "refresh", description = "Refresh the access token using the stored refresh_token")
        static final class RefreshCommand implements Callable<Integer> {
            @ParentCommand
            AuthCommand parent;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    Credential refreshed = ctx.credentials().refresh();
                    return CommandResult.of(tokenSummary(ctx.config().tokenPath(), refreshed));
                });
            }
        }

        @Command(name = "logout", description = "Delete the stored token")
        static final class LogoutCommand implements Callable<Integer> {
            @ParentCommand
            AuthCommand parent;

            @Option(names = {"--force"}, description = "Confirm logout")
            boolean force;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    if (!force) {
                        throw new ValidationException("Refusing to logout without --force");
                    }
                    Path tokenPath = ctx.config().tokenPath();
                    try {
                        ctx.tokenStore().clear(tokenPath);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to remove token " + tokenPath, e);
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("loggedOut", true);
                    data.put("tokenPath", tokenPath.toString());
                    return CommandResult.of(data);
                });
            }
        }

        private static Credential save(CommandContext ctx, Path tokenPath, Credential credential) {
            try {
                return ctx.tokenStore().save(tokenPath, credential);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save token to " + tokenPath, e);
            }
        }
    }

    @Command(
            name = "config",
            description = "Config utilities",
            subcommands = {
                    ConfigCommand.GetCommand.class,
                    ConfigCommand.SetCommand.class
            }
    )
    static final class ConfigCommand implements Runnable {
        @ParentCommand
        DidaCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "get", description = "Show the config file (or a single dotted key); secrets are masked")
        static final class GetCommand implements Callable<Integer> {
            @ParentCommand
            ConfigCommand parent;

            @Parameters(index = "0", arity = "0..1", description = "Dotted key, e.g. http.timeoutMs")
            String key;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    ConfigLoader.LoadedConfig loaded = ctx.loaded();
                    String path = loaded.path() == null ? null : loaded.path().toString();
                    Map<String, Object> data = new LinkedHashMap<>();
                    if (key == null || key.isBlank()) {
                        data.put("config", SensitiveDataMasker.masked(loaded.raw()));
                        data.put("path", path);
                        Map<String, String> defaults = new LinkedHashMap<>();
                        defaults.put("home", ctx.loader().defaultConfigPath().toString());
                        defaults.put("cwd", ctx.loader().cwdConfigPath().toString());
                        data.put("defaults", defaults);
                        return CommandResult.of(data);
                    }
                    data.put("key", key);
                    data.put("value", SensitiveDataMasker.maskedValue(key, ConfigLoader.getByDottedPath(loaded.raw(), key)));
                    data.put("path", path);
                    return CommandResult.of(data);
                });
            }
        }

        @Command(name = "set", description = "Set a dotted key and write the config file back")
        static final class SetCommand implements Callable<Integer> {
            @ParentCommand
            ConfigCommand parent;

            @Parameters(index = "0", description = "Dotted key, e.g. timezone or tags.requiredTags")
            String key;

            @Parameters(index = "1", description = "Value; JSON literals are parsed, e.g. '[\"work\"]' or 30000")
            String value;

            @Option(names = {"--file"}, description = "Config file to write (overrides --config)")
            String file;

            @Override
            public Integer call() {
                DidaCommand root = parent.root;
                return root.execute(ctx -> {
                    JsonNode parsed = ConfigLoader.parseValue(value);
                    String source = file != null ? file : root.configPath;
                    ConfigLoader.LoadedConfig loaded = ctx.loader().load(source);
                    ctx.warnings().addAll(loaded.warnings());
                    ObjectNode next = loaded.raw().deepCopy();
                    ConfigLoader.setByDottedPath(next, key, parsed);
                    try {
                        CliConfig.resolve(ConfigLoader.toConfigFile(next, null), GlobalOptions.none());
                    } catch (ValidationException e) {
                        throw new ValidationException("Config validation failed: " + e.getMessage(), key);
                    }
                    Path outPath = ctx.loader().resolveWritePath(source);
                    try {
                        ConfigLoader.write(outPath, next);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to write config " + outPath, e);
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("path", outPath.toString());
                    data.put("key", key);
                    data.put("value", SensitiveDataMasker.maskedValue(key, parsed));
                    data.put("config", SensitiveDataMasker.masked(next));
                    return CommandResult.of(data);
                });
            }
        }
    }

    @Command(
            name = "projects",
            description = "Project operations",
            subcommands = {
                    ProjectsCommand.ListCommand.class,
                    ProjectsCommand.CreateCommand.class,
                    ProjectsCommand.UpdateCommand.class,
                    ProjectsCommand.DeleteCommand.class
            }
    )
    static final class ProjectsCommand implements Runnable {
        @ParentCommand
        DidaCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "list", description = "List projects (cache-first)")
        static final class ListCommand implements Callable<Integer> {
            @ParentCommand
            ProjectsCommand parent;

            @Option(names = {"--force-refresh"}, description = "Fetch from the API and overwrite the cache")
            boolean forceRefresh;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    DidaClient client = ctx.client();
                    return ctx.cachedRead(CommandContext.PROJECTS_KEY, ctx.config().projectsCacheTtlMs(),
                            forceRefresh, client::projectsList);
                });
            }
        }

        static ObjectNode projectBody(String name, String color, String viewMode, String kind, Long sortOrder) {
            ObjectNode body = Jsons.mapper().createObjectNode();
            if (name != null) {
                body.put("name", name);
            }
            if (color != null) {
                body.put("color", color);
            }
            if (viewMode != null) {
                body.put("viewMode", viewMode);
            }
            if (kind != null) {
                body.put("kind", kind);
            }
            if (sortOrder != null) {
                body.put("sortOrder", sortOrder);
            }
            return body;
        }

        @Command(name = "create", description = "Create a project")
        static final class CreateCommand implements Callable<Integer> {
            @ParentCommand
            ProjectsCommand parent;

            @Option(names = {"--name"}, required = true, description = "Project name")
            String name;

            @Option(names = {"--color"}, description = "Color hex, e.g. #F18181")
            String color;

            @Option(names = {"--view-mode"}, description = "View mode: list | kanban | timeline")
            String viewMode;

            @Option(names = {"--kind"}, description = "Kind: TASK | NOTE")
            String kind;

            @Option(names = {"--sort-order"}, description = "Sort order")
            Long sortOrder;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    JsonNode created = ctx.client().projectsCreate(projectBody(name, color, viewMode, kind, sortOrder));
                    ctx.invalidateProjects();
                    return CommandResult.of(created);
                });
            }
        }

        @Command(name = "update", description = "Update a project")
        static final class UpdateCommand implements Callable<Integer> {
            @ParentCommand
            ProjectsCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--name"}, description = "Project name")
            String name;

            @Option(names = {"--color"}, description = "Color hex")
            String color;

            @Option(names = {"--view-mode"}, description = "View mode")
            String viewMode;

            @Option(names = {"--kind"}, description = "Kind")
            String kind;

            @Option(names = {"--sort-order"}, description = "Sort order")
            Long sortOrder;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    JsonNode updated = ctx.client().projectsUpdate(projectId,
                            projectBody(name, color, viewMode, kind, sortOrder));
                    ctx.invalidateProjects();
                    return CommandResult.of(updated);
                });
            }
        }

        @Command(name = "delete", description = "Delete a project")
        static final class DeleteCommand implements Callable<Integer> {
            @ParentCommand
            ProjectsCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--force"}, description = "Confirm deletion")
            boolean force;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    if (!force) {
                        throw new ValidationException("Refusing to delete without --force");
                    }
                    JsonNode deleted = ctx.client().projectsDelete(projectId);
                    ctx.invalidateTasks(projectId);
                    return CommandResult.of(deleted);
                });
            }
        }
    }

    @Command(
            name = "tasks",
            description = "Task operations",
            subcommands = {
                    TasksCommand.CreateCommand.class,
                    TasksCommand.GetCommand.class,
                    TasksCommand.UpdateCommand.class,
                    TasksCommand.CompleteCommand.class,
                    TasksCommand.DeleteCommand.class,
                    TasksCommand.SearchCommand.class,
                    TasksCommand.GetAllCommand.class
            }
    )
    static final class TasksCommand implements Runnable {
        @ParentCommand
        DidaCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        /** Task fields shared by create and update. */
        static class DraftOptions {
            @Option(names = {"--content"}, description = "Task content")
            String content;

            @Option(names = {"--desc"}, description = "Checklist description")
            String desc;

            @Option(names = {"--start"}, description = "Start, yyyy-MM-dd HH:mm in the configured time zone")
            String start;

            @Option(names = {"--due"}, description = "Due, yyyy-MM-dd HH:mm in the configured time zone")
            String due;

            @Option(names = {"--all-day"}, description = "All-day task")
            boolean allDay;

            @Option(names = {"--reminder"}, description = "Reminder trigger (repeatable)")
            List<String> reminders = new ArrayList<>();

            @Option(names = {"--repeat-flag"}, description = "Recurrence rule")
            String repeatFlag;

            @Option(names = {"--priority"}, description = "Priority: 0 | 1 | 3 | 5")
            Integer priority;

            @Option(names = {"--sort-order"}, description = "Sort order")
            Long sortOrder;

            @Option(names = {"--item"}, description = "Sub-item as a JSON object (repeatable)")
            List<String> items = new ArrayList<>();

            @Option(names = {"--tag", "--tag-hint"}, description = "Extra tag (repeatable)")
            List<String> tags = new ArrayList<>();

            @Option(names = {"--enable-required-tags"}, description = "Add the configured required tags")
            boolean enableRequiredTags;

            @Option(names = {"--disable-required-tags"}, description = "Skip the configured required tags")
            boolean disableRequiredTags;

            TaskDrafts.TaskInput toInput(String title) {
                Boolean requiredTags = enableRequiredTags ? Boolean.TRUE : disableRequiredTags ? Boolean.FALSE : null;
                return new TaskDrafts.TaskInput(title, content, desc, start, due, allDay, reminders, repeatFlag,
                        priority, sortOrder, items, tags, requiredTags);
            }
        }

        @Command(name = "create", description = "Create a task")
        static final class CreateCommand extends DraftOptions implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--title"}, required = true, description = "Task title")
            String title;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    ObjectNode draft = ctx.drafts().build(toInput(title), true);
                    JsonNode created = ctx.client().tasksCreate(projectId, draft);
                    ctx.invalidateTasks(projectId);
                    return CommandResult.of(created);
                });
            }
        }

        @Command(name = "get", description = "Get a task")
        static final class GetCommand implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--task-id"}, required = true, description = "Task ID")
            String taskId;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> CommandResult.of(ctx.client().tasksGet(projectId, taskId)));
            }
        }

        @Command(name = "update", description = "Update a task")
        static final class UpdateCommand extends DraftOptions implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--task-id"}, required = true, description = "Task ID")
            String taskId;

            @Option(names = {"--title"}, description = "Task title")
            String title;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    ObjectNode draft = ctx.drafts().build(toInput(title), false);
                    JsonNode updated = ctx.client().tasksUpdate(projectId, taskId, draft);
                    ctx.invalidateTasks(projectId);
                    return CommandResult.of(updated);
                });
            }
        }

        @Command(name = "complete", description = "Complete a task")
        static final class CompleteCommand implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--task-id"}, required = true, description = "Task ID")
            String taskId;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    JsonNode completed = ctx.client().tasksComplete(projectId, taskId);
                    ctx.invalidateTasks(projectId);
                    return CommandResult.of(completed);
                });
            }
        }

        @Command(name = "delete", description = "Delete a task")
        static final class DeleteCommand implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"--project-id"}, required = true, description = "Project ID")
            String projectId;

            @Option(names = {"--task-id"}, required = true, description = "Task ID")
            String taskId;

            @Option(names = {"--force"}, description = "Confirm deletion")
            boolean force;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    if (!force) {
                        throw new ValidationException("Refusing to delete without --force.");
                    }
                    JsonNode deleted = ctx.client().tasksDelete(projectId, taskId);
                    ctx.invalidateTasks(projectId);
                    return CommandResult.of(deleted);
                });
            }
        }

        @Command(name = "search", description = "Search tasks by keyword over cached task lists")
        static final class SearchCommand implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Parameters(index = "0", arity = "0..1", description = "Keyword matched against title, content and desc")
            String keyword;

            @Option(names = {"--query"}, description = "Keyword (alternative to the positional argument)")
            String query;

            @Option(names = {"--project-ids"}, split = ",", description = "Project IDs to search (default: all projects)")
            List<String> projectIds;

            @Option(names = {"--status"}, description = "Filter by status (0=active, 2=completed)")
            Integer status;

            @Option(names = {"--force-refresh"}, description = "Fetch from the API and overwrite the cache")
            boolean forceRefresh;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    String q = keyword != null && !keyword.isBlank() ? keyword : query;
                    if (q == null || q.isBlank()) {
                        throw new ValidationException("Search query is required. Use: dida tasks search <keyword>", "query");
                    }
                    CliConfig config = ctx.config();
                    DidaClient client = ctx.client();
                    // built here so the search workers share one instance
                    ctx.cache();

                    List<String> targets = new ArrayList<>();
                    if (projectIds != null && !projectIds.isEmpty()) {
                        for (String id : projectIds) {
                            if (!id.trim().isEmpty()) {
                                targets.add(id.trim());
                            }
                        }
                    } else {
                        JsonNode projects = ctx.cachedValue(CommandContext.PROJECTS_KEY,
                                config.projectsCacheTtlMs(), forceRefresh, client::projectsList);
                        targets.addAll(projectIdsOf(projects));
                    }
                    if (targets.isEmpty()) {
                        throw new ValidationException("No projects to search", "projectIds");
                    }

                    long ttl = config.tasksCacheTtlMs();
                    SearchResult result = client.tasksSearchLocal(q, targets, status, projectId ->
                            ctx.cachedValue(CommandContext.tasksKey(projectId), ttl, forceRefresh,
                                    () -> client.tasksGetAll(projectId)));
                    return CommandResult.of(result);
                });
            }
        }

        @Command(name = "get-all", description = "Get all tasks (all projects unless --project-id is given)")
        static final class GetAllCommand implements Callable<Integer> {
            @ParentCommand
            TasksCommand parent;

            @Option(names = {"-p", "--project-id"}, description = "Project ID (omit for all projects)")
            String projectId;

            @Option(names = {"--force-refresh"}, description = "Fetch from the API and overwrite the cache")
            boolean forceRefresh;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> {
                    DidaClient client = ctx.client();
                    long ttl = ctx.config().tasksCacheTtlMs();
                    if (projectId != null && !projectId.isBlank()) {
                        return ctx.cachedRead(CommandContext.tasksKey(projectId), ttl, forceRefresh,
                                () -> client.tasksGetAll(projectId));
                    }
                    return ctx.cachedRead(CommandContext.ALL_TASKS_KEY, ttl, forceRefresh, () -> {
                        ArrayNode all = Jsons.mapper().createArrayNode();
                        for (String id : projectIdsOf(client.projectsList())) {
                            DidaClient.tasksOf(client.tasksGetAll(id)).forEach(all::add);
                        }
                        return all;
                    });
                });
            }
        }

        static List<String> projectIdsOf(JsonNode projects) {
            List<String> ids = new ArrayList<>();
            if (projects != null && projects.isArray()) {
                for (JsonNode project : projects) {
                    String id = project.path("id").asText("");
                    if (!id.isEmpty()) {
                        ids.add(id);
                    }
                }
            }
            return ids;
        }
    }

    @Command(
            name = "cache",
            description = "Cache utilities",
            subcommands = {
                    CacheCommand.StatusCommand.class,
                    CacheCommand.PurgeCommand.class
            }
    )
    static final class CacheCommand implements Runnable {
        @ParentCommand
        DidaCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "status", description = "Show cache location and counters")
        static final class StatusCommand implements Callable<Integer> {
            @ParentCommand
            CacheCommand parent;

            @Override
            public Integer call() {
                return parent.root.execute(ctx -> CommandResult.of(ctx.cache().stats()));
            }
        }

        @Command(name = "purge", description = "Delete every cache entry")
        static final class PurgeCommand implements Callable<Integer> {
            @ParentCommand
            CacheCommand parent;

            @Option(names = {"--force"}, description = "Skip the confirmation prompt")
            boolean force;

            @Override
            public Integer call() {
                DidaCommand root = parent.root;
                return root.execute(ctx -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    if (!force) {
                        System.err.print("Are you sure you want to purge all cache? This cannot be undone. [y/N]: ");
                        System.err.flush();
                        if (!"y".equals(root.readLine().toLowerCase(Locale.ROOT))) {
                            data.put("cancelled", true);
                            return CommandResult.of(data);
                        }
                    }
                    ctx.cache().purge();
                    data.put("purged", true);
                    return CommandResult.of(data);
                });
            }
        }
    }
}
