package io.taskvault.cli;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.BackupType;
import io.taskvault.model.Settings;
import io.taskvault.model.SettingsPatch;
import io.taskvault.model.StrikeMode;
import io.taskvault.model.Task;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskQuery;
import io.taskvault.runtime.TaskVaultRuntime;
import io.taskvault.storage.PathResolver;
import io.taskvault.storage.StorageLocation;
import io.taskvault.tasks.TaskImporter;
import io.taskvault.tasks.TaskRepository;
import io.taskvault.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "taskvault",
        mixinStandardHelpOptions = true,
        description = "Local encrypted task manager",
        subcommands = {
                TaskVaultCommand.WhereCommand.class,
                TaskVaultCommand.InitCommand.class,
                TaskVaultCommand.ChangePasswordCommand.class,
                TaskVaultCommand.TasksCommand.class,
                TaskVaultCommand.AddCommand.class,
                TaskVaultCommand.StrikeCommand.class,
                TaskVaultCommand.CompleteCommand.class,
                TaskVaultCommand.ScheduleCommand.class,
                TaskVaultCommand.SettingsCommand.class,
                TaskVaultCommand.BackupCreateCommand.class,
                TaskVaultCommand.BackupsCommand.class,
                TaskVaultCommand.BackupRestoreCommand.class,
                TaskVaultCommand.ImportCommand.class,
                TaskVaultCommand.ServeWebCommand.class
        }
)
public final class TaskVaultCommand implements Runnable {
    @Option(names = {"--root"}, description = "Storage root tried before the default locations (env TASKVAULT_ROOT)")
    String root;

    @Option(names = {"--kdf-iterations"}, hidden = true, defaultValue = "" + TaskVaultConfig.DEFAULT_KDF_ITERATIONS,
            description = "PBKDF2 iterations for new key envelopes")
    int kdfIterations;

    @Override
    public void run() {
        System.out.println("Use subcommands: where | init | change-password | tasks | add | strike | complete | schedule | settings | backup-create | backups | backup-restore | import | serve-web");
    }

    StorageLocation resolveStorage() {
        Path installDir = Paths.get("").toAbsolutePath();
        return new PathResolver(PathResolver.defaultCandidates(installDir, root)).resolve();
    }

    TaskVaultRuntime runtime() {
        StorageLocation location = resolveStorage();
        TaskVaultConfig config = TaskVaultConfig.fromRoot(location.activeRoot()).withKdfIterations(kdfIterations);
        return TaskVaultRuntime.open(config, location);
    }

    /**
     * Opens the runtime and unlocks it; the caller closes it, which flushes pending changes.
     */
    TaskVaultRuntime session(char[] password) {
        TaskVaultRuntime runtime = runtime();
        try {
            runtime.login(password);
            return runtime;
        } catch (RuntimeException e) {
            runtime.close();
            throw e;
        } finally {
            Arrays.fill(password, '\0');
        }
    }

    @Command(name = "where", description = "Show the resolved storage root and every probed candidate")
    static final class WhereCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Override
        public Integer call() {
            StorageLocation location = parent.resolveStorage();
            List<Map<String, String>> attempts = new ArrayList<>();
            for (StorageLocation.Attempt attempt : location.attempts()) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put("path", attempt.path().toString());
                row.put("reason", attempt.reason().name());
                row.put("detail", attempt.detail());
                attempts.add(row);
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("activeRoot", location.activeRoot().toString());
            out.put("attempts", attempts);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "init", description = "Create the key envelope for a new storage root")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "New password")
        char[] password;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.runtime()) {
                runtime.initialize(password);
                System.out.println("Initialized TaskVault at: " + runtime.config().rootDir());
            } finally {
                Arrays.fill(password, '\0');
            }
            return 0;
        }
    }

    @Command(name = "change-password", description = "Re-encrypt all documents under a new password")
    static final class ChangePasswordCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Current password")
        char[] password;

        @Option(names = {"--new-password"}, interactive = true, arity = "0..1", required = true, description = "New password")
        char[] newPassword;

        @Override
        public Integer call() {
            char[] current = password.clone();
            try (TaskVaultRuntime runtime = parent.session(password)) {
                runtime.changePassword(current, newPassword);
                System.out.println("Password changed");
            } finally {
                Arrays.fill(current, '\0');
                Arrays.fill(newPassword, '\0');
            }
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Option(names = {"--project"}, description = "Only tasks of this project")
        String project;

        @Option(names = {"--completed"}, arity = "1", description = "Filter by completion (true|false)")
        Boolean completed;

        @Option(names = {"--date"}, description = "Only tasks scheduled on this date (yyyy-MM-dd)")
        LocalDate date;

        @Option(names = {"--query"}, description = "Free-text match on title and description")
        String query;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                List<Task> tasks = runtime.list(new TaskQuery(project, completed, date, query));
                System.out.println(Jsons.toJson(tasks));
            }
            return 0;
        }
    }

    @Command(name = "add", description = "Create a task")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, description = "Task description")
        String description;

        @Option(names = {"--project"}, description = "Project name")
        String project;

        @Option(names = {"--duration"}, description = "Estimated minutes (5-480, default 60)")
        Integer duration;

        @Option(names = {"--due"}, description = "Due date (yyyy-MM-dd)")
        LocalDate due;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                Task task = runtime.create(new TaskDraft(title, description, project, due, duration));
                System.out.println(Jsons.toJson(task));
            }
            return 0;
        }
    }

    @Command(name = "strike", description = "Record progress on a task")
    static final class StrikeCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--mode"}, defaultValue = "today", description = "today | forever")
        String mode;

        @Option(names = {"--report"}, required = true, description = "What was done")
        String report;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                System.out.println(Jsons.toJson(runtime.strike(taskId, StrikeMode.fromString(mode), report)));
            }
            return 0;
        }
    }

    @Command(name = "complete", description = "Mark a task completed")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--undo"}, defaultValue = "false", description = "Reopen instead")
        boolean undo;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                Task task = undo ? runtime.uncomplete(taskId) : runtime.complete(taskId);
                System.out.println(Jsons.toJson(task));
            }
            return 0;
        }
    }

    @Command(name = "schedule", description = "Place a task in the planner")
    static final class ScheduleCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--hour"}, description = "Start time HH:MM; omit with --clear")
        String hour;

        @Option(names = {"--date"}, description = "Day (yyyy-MM-dd, default today)")
        LocalDate date;

        @Option(names = {"--duration"}, description = "Slot minutes (5-480, default 30)")
        Integer duration;

        @Option(names = {"--clear"}, defaultValue = "false", description = "Remove the task from the planner")
        boolean clear;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                Task task = clear
                        ? runtime.unschedule(taskId)
                        : runtime.schedule(taskId, hour, date == null ? runtime.today() : date, duration);
                System.out.println(Jsons.toJson(task));
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Show or change settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Option(names = {"--autosave-seconds"}, description = "Autosave interval (5-3600)")
        Integer autosaveSeconds;

        @Option(names = {"--reset-time"}, description = "Daily reset time HH:MM")
        String resetTime;

        @Option(names = {"--theme"}, description = "UI theme name")
        String theme;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                SettingsPatch patch = SettingsPatch.empty();
                if (autosaveSeconds != null) {
                    patch = patch.withAutosaveIntervalSeconds(autosaveSeconds);
                }
                if (resetTime != null) {
                    patch = patch.withDailyResetTime(resetTime);
                }
                if (theme != null) {
                    patch = patch.withTheme(theme);
                }
                boolean changed = autosaveSeconds != null || resetTime != null || theme != null;
                Settings settings = changed ? runtime.updateSettings(patch) : runtime.settings();
                System.out.println(Jsons.toJson(settings));
            }
            return 0;
        }
    }

    @Command(name = "backup-create", description = "Snapshot the encrypted documents")
    static final class BackupCreateCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Option(names = {"--type"}, defaultValue = "manual", description = "manual | automatic | pre-update")
        String type;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                System.out.println(Jsons.toJson(runtime.createBackup(BackupType.fromString(type))));
            }
            return 0;
        }
    }

    @Command(name = "backups", description = "List backups, newest first")
    static final class BackupsCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                System.out.println(Jsons.toJson(runtime.listBackups()));
            }
            return 0;
        }
    }

    @Command(name = "backup-restore", description = "Replace live documents with a backup (destructive)")
    static final class BackupRestoreCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Parameters(index = "0", description = "Backup name")
        String name;

        @Override
        public Integer call() {
            try (TaskVaultRuntime runtime = parent.session(password)) {
                runtime.restoreBackup(name);
                System.out.println("Restored backup: " + name);
            }
            return 0;
        }
    }

    @Command(name = "import", description = "Import tasks from a .csv or .txt file")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--password"}, interactive = true, arity = "0..1", required = true, description = "Password")
        char[] password;

        @Option(names = {"--file"}, required = true, description = "Input file")
        Path file;

        @Override
        public Integer call() throws Exception {
            TaskImporter.Format format = TaskImporter.Format.fromFileName(file.getFileName().toString());
            String content = Files.readString(file, StandardCharsets.UTF_8);
            try (TaskVaultRuntime runtime = parent.session(password)) {
                TaskRepository.ImportResult result = runtime.importTasks(format, content);
                System.out.println(Jsons.toJson(result));
                return result.errors().isEmpty() ? 0 : 2;
            }
        }
    }

    @Command(name = "serve-web", description = "Serve the JSON API on 127.0.0.1")
    static final class ServeWebCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--port"}, defaultValue = "" + TaskVaultConfig.DEFAULT_WEB_PORT, description = "Bind port")
        int port;

        @Override
        public Integer call() throws Exception {
            TaskVaultRuntime runtime = parent.runtime();
            WebConsole console = new WebConsole(runtime, port);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                console.stop();
                runtime.close();
                stopped.countDown();
            }, "taskvault-shutdown-hook"));
            console.start();
            System.out.println("TaskVault web console on http://127.0.0.1:" + console.port()
                    + ", root=" + runtime.config().rootDir());
            stopped.await();
            return 0;
        }
    }
}
