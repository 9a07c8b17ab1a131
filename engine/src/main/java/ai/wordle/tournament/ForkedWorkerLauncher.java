package ai.wordle.tournament;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each worker in its own JVM.
 * <p>
 * The child is started with a heap cap ({@code -Xmx}), exits on the first
 * {@code OutOfMemoryError}, sees a single processor, and on Linux is pinned to one CPU with
 * {@code taskset} (CPUs are handed out round-robin). It reads the job from stdin and reports
 * each game on stdout; see {@link WorkerMain}.
 * <p>
 * Two layers enforce the per-game deadline:
 * <ol>
 *   <li>inside the child, each game runs on its own thread; if that thread survives its
 *       interrupt the child exits with {@link WorkerMain#EXIT_RESTART} and is relaunched here
 *       for the secrets it did not play;</li>
 *   <li>here, a child that stays silent for longer than the deadline plus a grace period is
 *       killed with its descendants, the game in progress is scored as a timeout, and a new
 *       child continues with the rest.</li>
 * </ol>
 * Every live child is tracked and destroyed by a shutdown hook if the coordinator exits.
 */
public class ForkedWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ForkedWorkerLauncher.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** Silence allowed beyond the game deadline before the child is killed. */
    static final long KILL_GRACE_MILLIS = 2_000L;

    /** Extra silence allowed before the first result of a launch (JVM start, tree loading). */
    static final long STARTUP_GRACE_MILLIS = 30_000L;

    private static final Set<Process> LIVE = ConcurrentHashMap.newKeySet();
    private static final AtomicInteger NEXT_CPU = new AtomicInteger();

    static {
        Runtime.getRuntime().addShutdownHook(new Thread(ForkedWorkerLauncher::destroyAll, "worker-reaper"));
    }

    private final int memoryLimitMb;
    private final List<String> baseCommand;
    private final boolean pinCpus;

    public ForkedWorkerLauncher(int memoryLimitMb) {
        this.memoryLimitMb = memoryLimitMb;
        this.baseCommand = javaCommand();
        this.pinCpus = tasksetAvailable();
        if (!pinCpus) {
            log.info("taskset not available; worker JVMs will not be pinned to a CPU");
        }
    }

    @Override
    public List<GameOutcome> run(WorkerJob job) throws WorkerFailedException, InterruptedException {
        List<GameOutcome> outcomes = new ArrayList<>();
        List<String> remaining = new ArrayList<>(job.getSecrets());
        while (!remaining.isEmpty()) {
            Launch launch = launch(job.withSecrets(remaining), remaining.size() < job.getSecrets().size());
            outcomes.addAll(launch.outcomes);
            remaining = new ArrayList<>(remaining.subList(launch.outcomes.size(), remaining.size()));

            if (launch.killed) {
                // Silent past the deadline: the game in progress is the first unplayed secret.
                if (!remaining.isEmpty()) {
                    outcomes.add(GameOutcome.timeout(job.getStrategy(), remaining.get(0), job.getMaxGuesses()));
                    remaining.remove(0);
                }
                continue;
            }
            if (launch.exitCode == WorkerMain.EXIT_RESTART && !launch.outcomes.isEmpty()) {
                if (log.isDebugEnabled()) {
                    log.debug("Relaunching {} for {} remaining secrets", job.getStrategy(), remaining.size());
                }
                continue;
            }
            if (launch.exitCode == WorkerMain.EXIT_OK && remaining.isEmpty()) {
                break;
            }
            String reason = launch.error != null ? launch.error : describeExit(launch.exitCode);
            throw new WorkerFailedException(job.getStrategy(), reason);
        }
        return outcomes;
    }

    private Launch launch(WorkerJob job, boolean relaunch) throws WorkerFailedException, InterruptedException {
        List<String> command = command();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new WorkerFailedException(job.getStrategy(), "Cannot start worker JVM: " + e.getMessage(), e);
        }
        LIVE.add(process);
        try {
            BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
            Thread reader = new Thread(() -> pump(process, lines), "worker-out-" + job.getStrategy());
            reader.setDaemon(true);
            reader.start();

            try (OutputStream stdin = process.getOutputStream()) {
                OBJECT_MAPPER.writeValue(stdin, job);
            } catch (IOException e) {
                // The child may have died on startup; its exit code tells the rest.
                log.warn("Could not send job to worker {}: {}", job.getStrategy(), e.getMessage());
            }

            Launch launch = new Launch();
            long silenceLimit = job.gameTimeoutMillis() + KILL_GRACE_MILLIS + STARTUP_GRACE_MILLIS;
            while (true) {
                Optional<String> line = lines.poll(silenceLimit, TimeUnit.MILLISECONDS);
                if (line == null) {
                    log.warn("Worker {} silent for {} ms; killing it", job.getStrategy(), silenceLimit);
                    destroy(process);
                    launch.killed = true;
                    break;
                }
                if (line.isEmpty()) {
                    break;
                }
                String text = line.get();
                if (text.startsWith(WorkerMain.RESULT_PREFIX)) {
                    launch.outcomes.add(OBJECT_MAPPER.readValue(
                            text.substring(WorkerMain.RESULT_PREFIX.length()), GameOutcome.class));
                    silenceLimit = job.gameTimeoutMillis() + KILL_GRACE_MILLIS;
                } else if (text.startsWith(WorkerMain.ERROR_PREFIX)) {
                    launch.error = text.substring(WorkerMain.ERROR_PREFIX.length());
                } else if (log.isDebugEnabled()) {
                    log.debug("[{}] {}", job.getStrategy(), text);
                }
            }
            launch.exitCode = process.waitFor();
            if (log.isDebugEnabled()) {
                log.debug("Worker {} ({}) exited with {} after {} games", job.getStrategy(),
                        relaunch ? "relaunch" : "first launch", launch.exitCode, launch.outcomes.size());
            }
            return launch;
        } catch (IOException e) {
            destroy(process);
            throw new WorkerFailedException(job.getStrategy(), "Malformed worker output: " + e.getMessage(), e);
        } finally {
            LIVE.remove(process);
        }
    }

    private static void pump(Process process, BlockingQueue<Optional<String>> lines) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(Optional.of(line));
            }
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("Worker output closed: {}", e.getMessage());
            }
        } finally {
            lines.add(Optional.empty());
        }
    }

    List<String> command() {
        List<String> command = new ArrayList<>();
        if (pinCpus) {
            int cpus = Math.max(1, Runtime.getRuntime().availableProcessors());
            command.add("taskset");
            command.add("-c");
            command.add(String.valueOf(Math.floorMod(NEXT_CPU.getAndIncrement(), cpus)));
        }
        command.add(baseCommand.get(0));
        command.add("-Xmx" + memoryLimitMb + "m");
        command.add("-XX:+ExitOnOutOfMemoryError");
        command.add("-XX:ActiveProcessorCount=1");
        if (Boolean.getBoolean("log.episodes")) {
            command.add("-Dlog.episodes=true");
        }
        command.addAll(baseCommand.subList(1, baseCommand.size()));
        return command;
    }

    /**
     * {@code java -cp <classpath> WorkerMain}, or the Spring Boot launcher form when running from
     * an executable jar whose classes are nested.
     */
    private static List<String> javaCommand() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classpath = System.getProperty("java.class.path");
        List<String> command = new ArrayList<>();
        command.add(java);
        if (isBootJar(classpath)) {
            command.add("-Dloader.main=" + WorkerMain.class.getName());
            command.add("-cp");
            command.add(classpath);
            command.add("org.springframework.boot.loader.launch.PropertiesLauncher");
        } else {
            command.add("-cp");
            command.add(classpath);
            command.add(WorkerMain.class.getName());
        }
        return command;
    }

    private static boolean isBootJar(String classpath) {
        if (classpath == null || !classpath.endsWith(".jar") || classpath.contains(File.pathSeparator)) {
            return false;
        }
        try (JarFile jar = new JarFile(classpath)) {
            Manifest manifest = jar.getManifest();
            return manifest != null && manifest.getMainAttributes().getValue("Spring-Boot-Classes") != null;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean tasksetAvailable() {
        if (!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux")) {
            return false;
        }
        return Files.isExecutable(Path.of("/usr/bin/taskset")) || Files.isExecutable(Path.of("/bin/taskset"));
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void destroyAll() {
        for (Process process : LIVE) {
            destroy(process);
        }
    }

    static String describeExit(int exitCode) {
        if (exitCode == WorkerMain.EXIT_OK) {
            return "Worker exited before playing every secret";
        }
        // ExitOnOutOfMemoryError exits with 3.
        return exitCode == 3 ? "Worker ran out of memory" : "Worker exited with code " + exitCode;
    }

    private static final class Launch {
        private final List<GameOutcome> outcomes = new ArrayList<>();
        private boolean killed;
        private int exitCode;
        private String error;
    }
}
