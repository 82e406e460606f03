package app;

import engine.CrashConfig;
import engine.CrashPhase;
import engine.DeterminismViolationException;
import engine.EngineConfig;
import engine.HistoryEntry;
import engine.HistoryLog;
import engine.HistoryStoreException;
import engine.WorkflowDriver;
import engine.WorkflowOutcome;
import examples.notify.ApprovalDecision;
import examples.notify.ApprovalRequest;
import examples.notify.ApprovalWorkflow;
import examples.notify.NotificationServices;
import examples.notify.NotifyCatalog;
import examples.notify.NotifyRequest;
import examples.notify.NotifyWorkflow;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class App {
    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{1,63}$");
    private static final Pattern STEP_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._:-]{0,63}$");
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("^#?[a-z0-9][a-z0-9_-]{0,79}$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z .'-]{1,99}$");
    private static final Set<String> ALLOWED_OPTIONS = Set.of(
            "workflow-id", "type", "channel", "rounds", "interval-ms", "subject", "approver",
            "remind-after-ms", "store", "history", "outbox", "signal", "decided-by", "wait", "status",
            "crash-step", "crash-phase", "help");
    private static final Set<String> ALLOWED_HISTORY_EXTENSIONS = Set.of(".json", ".db", ".sqlite", ".sqlite3");
    private static final long WAIT_POLL_MS = 200L;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> argMap = parseArgs(args);
        if (argMap.containsKey("help")) {
            printUsage();
            return;
        }

        String workflowId = validateValue(
                "workflow-id",
                argMap.getOrDefault("workflow-id", "wf-notify-001"),
                ID_PATTERN,
                64);
        String type = argMap.getOrDefault("type", NotifyWorkflow.TYPE);
        if (!NotifyWorkflow.TYPE.equals(type) && !ApprovalWorkflow.TYPE.equals(type)) {
            throw new IllegalArgumentException("type must be " + NotifyWorkflow.TYPE + " or " + ApprovalWorkflow.TYPE);
        }
        EngineConfig.StoreKind storeKind = EngineConfig.StoreKind.fromValue(argMap.getOrDefault("store", "json"));
        Path historyPath = resolveSafePath(
                argMap.getOrDefault("history", storeKind == EngineConfig.StoreKind.JSON ? "history.json" : "history.db"));
        Path outboxPath = resolveSafePath(argMap.getOrDefault("outbox", "outbox.db"));
        String crashStep = argMap.get("crash-step") == null
                ? null
                : validateValue("crash-step", argMap.get("crash-step"), STEP_PATTERN, 64);
        CrashPhase crashPhase = CrashPhase.fromValue(argMap.getOrDefault("crash-phase", "none"));
        boolean wait = parseBoolean("wait", argMap.getOrDefault("wait", "false"));

        System.out.println("Workflow ID     : " + workflowId);
        System.out.println("Workflow type   : " + type);
        System.out.println("History store   : " + storeKind + " " + historyPath.getFileName());
        System.out.println("Crash step      : " + (crashStep == null ? "<none>" : crashStep));
        System.out.println("Crash phase     : " + crashPhase);

        EngineConfig config = EngineConfig.load().withStore(storeKind, historyPath);
        int exitCode = run(workflowId, type, argMap, config, outboxPath, new CrashConfig(crashStep, crashPhase), wait);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static int run(String workflowId,
                           String type,
                           Map<String, String> argMap,
                           EngineConfig config,
                           Path outboxPath,
                           CrashConfig crashConfig,
                           boolean wait) throws Exception {
        NotificationServices services = new NotificationServices(outboxPath);
        try {
            services.initialize();
        } catch (SQLException sqlException) {
            String state = sqlException.getSQLState() == null ? "n/a" : sqlException.getSQLState();
            System.err.printf(
                    "Database error while preparing the outbox (SQLState=%s, code=%d).%n",
                    state,
                    sqlException.getErrorCode());
            throw sqlException;
        }

        try (WorkflowDriver driver = WorkflowDriver.create(
                config, NotifyCatalog.workflows(), NotifyCatalog.activities(services), crashConfig)) {
            Map<String, WorkflowOutcome> recovered = driver.recover();
            recovered.forEach((id, outcome) -> System.out.println("Recovered       : " + id + " -> " + summarize(outcome)));

            if (argMap.containsKey("status")) {
                printHistory(driver.describe(workflowId));
                return 0;
            }

            WorkflowOutcome outcome;
            if (argMap.containsKey("signal")) {
                outcome = deliverDecision(driver, workflowId, argMap);
            } else if (recovered.containsKey(workflowId)) {
                outcome = recovered.get(workflowId);
            } else if (driver.describe(workflowId).isPresent()) {
                outcome = driver.resume(workflowId);
            } else {
                outcome = driver.start(workflowId, type, buildInput(type, argMap));
            }
            System.out.println("Outcome         : " + summarize(outcome));

            if (wait && outcome instanceof WorkflowOutcome.Suspended suspended && suspended.wakeAtMs() != null) {
                outcome = awaitTerminal(driver, workflowId);
                System.out.println("Final status    : " + summarize(outcome));
            }
            return exitCode(outcome);
        } catch (HistoryStoreException e) {
            System.err.println("History store unavailable: " + e.getMessage());
            throw e;
        }
    }

    private static WorkflowOutcome deliverDecision(WorkflowDriver driver,
                                                   String workflowId,
                                                   Map<String, String> argMap) throws HistoryStoreException {
        boolean approved = parseBoolean("signal", argMap.get("signal"));
        String decidedBy = validateValue("decided-by", argMap.getOrDefault("decided-by", "operator"), NAME_PATTERN, 100);
        return driver.signal(workflowId, ApprovalWorkflow.DECISION_SIGNAL,
                new ApprovalDecision(approved, decidedBy, approved ? "approved from CLI" : "rejected from CLI"));
    }

    static Object buildInput(String type, Map<String, String> argMap) {
        String channel = validateValue("channel", argMap.getOrDefault("channel", "#general"), CHANNEL_PATTERN, 80);
        if (ApprovalWorkflow.TYPE.equals(type)) {
            return new ApprovalRequest(
                    channel,
                    validateValue("subject", argMap.getOrDefault("subject", "Quarterly budget"), NAME_PATTERN, 100),
                    validateValue("approver", argMap.getOrDefault("approver", "Ada Lovelace"), NAME_PATTERN, 100),
                    parseBoundedLong("remind-after-ms", argMap.getOrDefault("remind-after-ms", "0"), 0, 86_400_000L));
        }
        int rounds = (int) parseBoundedLong("rounds", argMap.getOrDefault("rounds", "3"), 1, 100);
        long intervalMs = parseBoundedLong("interval-ms", argMap.getOrDefault("interval-ms", "3000"), 1, 86_400_000L);
        return new NotifyRequest(channel, rounds, intervalMs);
    }

    static WorkflowOutcome awaitTerminal(WorkflowDriver driver, String workflowId) throws Exception {
        System.out.println("Waiting for the workflow to finish...");
        while (true) {
            WorkflowOutcome outcome = driver.resume(workflowId);
            if (!(outcome instanceof WorkflowOutcome.Suspended suspended) || suspended.wakeAtMs() == null) {
                return outcome;
            }
            Thread.sleep(Math.max(WAIT_POLL_MS, suspended.wakeAtMs() - System.currentTimeMillis()));
        }
    }

    private static void printHistory(Optional<HistoryLog> history) {
        if (history.isEmpty()) {
            System.out.println("No history recorded for this workflow.");
            return;
        }
        HistoryLog log = history.get();
        System.out.println("Status          : " + log.status());
        int position = 0;
        for (HistoryEntry entry : log.entries()) {
            System.out.printf("  %3d %-8s %-24s %s%n", position++, entry.kind(), entry.stepName(), entry.status());
        }
        if (log.failure() != null) {
            System.out.println("Failure         : " + log.failure());
        }
    }

    static String summarize(WorkflowOutcome outcome) {
        if (outcome instanceof WorkflowOutcome.Completed completed) {
            return "COMPLETED " + completed.result();
        }
        if (outcome instanceof WorkflowOutcome.Suspended suspended) {
            return "SUSPENDED (" + suspended.reason() + ")";
        }
        WorkflowOutcome.Failed failed = (WorkflowOutcome.Failed) outcome;
        return (failed.isDeterminismViolation() ? "DETERMINISM VIOLATION " : "FAILED ") + failed.error().getMessage();
    }

    static int exitCode(WorkflowOutcome outcome) {
        if (outcome instanceof WorkflowOutcome.Failed failed) {
            return failed.error() instanceof DeterminismViolationException ? 2 : 1;
        }
        return 0;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> parsed = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                parsed.put("help", "true");
                continue;
            }
            if ("--status".equals(arg)) {
                parsed.put("status", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for argument: " + arg);
            }
            String key = arg.substring(2);
            if (!ALLOWED_OPTIONS.contains(key)) {
                throw new IllegalArgumentException("Unsupported argument: " + arg);
            }
            if (parsed.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate argument provided: " + arg);
            }

            String value = args[++i];
            if (value.length() > 512) {
                throw new IllegalArgumentException("Argument too long for " + arg);
            }
            if (containsControlChars(value)) {
                throw new IllegalArgumentException("Invalid control characters in " + arg);
            }
            parsed.put(key, value.trim());
        }
        return parsed;
    }

    static String validateValue(String fieldName, String value, Pattern pattern, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(fieldName + " exceeds max length " + maxLength);
        }
        if (!pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid format for " + fieldName);
        }
        return value;
    }

    private static long parseBoundedLong(String fieldName, String value, long min, long max) {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(fieldName + " must be a number", e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalArgumentException(fieldName + " must be between " + min + " and " + max);
        }
        return parsed;
    }

    private static boolean parseBoolean(String fieldName, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "approve" -> true;
            case "false", "no", "reject" -> false;
            default -> throw new IllegalArgumentException(fieldName + " must be true or false");
        };
    }

    private static Path resolveSafePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (rawPath.length() > 255) {
            throw new IllegalArgumentException("path exceeds max length");
        }
        if (containsControlChars(rawPath) || rawPath.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("path contains invalid characters");
        }

        Path baseDir = Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path candidate;
        try {
            candidate = Path.of(rawPath);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path format", e);
        }

        Path resolved = candidate.isAbsolute()
                ? candidate.toAbsolutePath().normalize()
                : baseDir.resolve(candidate).normalize();

        String lowerName = resolved.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean extensionAllowed = ALLOWED_HISTORY_EXTENSIONS.stream().anyMatch(lowerName::endsWith);
        if (!extensionAllowed) {
            throw new IllegalArgumentException("file must use .json, .db, .sqlite, or .sqlite3 extension");
        }

        try {
            Path realBase = baseDir.toRealPath();
            Path parent = resolved.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path realParent = parent == null ? realBase : parent.toRealPath();
            if (!realParent.startsWith(realBase)) {
                throw new IllegalArgumentException("path traversal is not allowed");
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException("Unable to prepare directory", e);
        }
        return resolved;
    }

    private static boolean containsControlChars(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  mvn -q -pl app exec:java -Dexec.args=\"[options]\"");
        System.out.println();
        System.out.println("Starts the workflow if it has no history yet, otherwise resumes it.");
        System.out.println("Incomplete workflows found in the history store are recovered first.");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --workflow-id <id>         Workflow instance id (default: wf-notify-001)");
        System.out.println("  --type <notify|approval>   Workflow type (default: notify)");
        System.out.println("  --channel <channel>        Chat channel (default: #general)");
        System.out.println("  --rounds <n>               notify: number of messages (default: 3)");
        System.out.println("  --interval-ms <ms>         notify: sleep between messages (default: 3000)");
        System.out.println("  --subject <text>           approval: what needs approving");
        System.out.println("  --approver <name>          approval: who is asked");
        System.out.println("  --remind-after-ms <ms>     approval: remind the approver once after this delay (0: never)");
        System.out.println("  --signal <true|false>      approval: deliver the approver's decision");
        System.out.println("  --decided-by <name>        approval: name recorded with the decision");
        System.out.println("  --store <json|sqlite>      History store kind (default: json)");
        System.out.println("  --history <file>           History file (default: history.json / history.db)");
        System.out.println("  --outbox <sqlite.db>       Outbox database (default: outbox.db)");
        System.out.println("  --wait <true|false>        Stay alive until a sleeping workflow finishes");
        System.out.println("  --status                   Print the recorded history and exit");
        System.out.println("  --crash-step <step>        Optional step name to crash at");
        System.out.println("  --crash-phase <phase>      none | before-execute | after-execute-before-record");
    }
}
