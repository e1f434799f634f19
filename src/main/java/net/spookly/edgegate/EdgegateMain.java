package net.spookly.edgegate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.agent.AgentSettings;
import net.spookly.edgegate.agent.TunnelAgent;
import net.spookly.edgegate.config.ConfigException;
import net.spookly.edgegate.config.ConfigLoader;
import net.spookly.edgegate.config.ConfigPrinter;
import net.spookly.edgegate.config.ConfigWarnings;
import net.spookly.edgegate.config.EdgegateConfig;

/**
 * Process entry point. Runs the server side, or the edge agent when {@code agent.enabled} is set.
 */
@Slf4j
public final class EdgegateMain {
    static final String DEFAULT_CONFIG = "config/edgegate.yaml";

    private EdgegateMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        EdgegateConfig config;
        try {
            config = ConfigLoader.load(options.configPath());
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        for (String warning : ConfigWarnings.collect(config, options.configPath())) {
            log.warn("Config warning: {}", warning);
        }
        if (options.printEffectiveConfig()) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun()) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        AutoCloseable running;
        if (config.agent != null && Boolean.TRUE.equals(config.agent.enabled)) {
            TunnelAgent agent = new TunnelAgent(AgentSettings.fromConfig(config.agent), Clock.systemUTC());
            agent.start();
            log.info("Edge agent started for environment {} towards {}", config.agent.environmentId, config.agent.server);
            running = agent;
        } else {
            EdgegateApplication application = new EdgegateApplication(config, Clock.systemUTC());
            application.start();
            running = application;
        }

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                running.close();
            } catch (Exception e) {
                log.warn("Shutdown failed: {}", e.getMessage());
            }
            latch.countDown();
        }, "edgegate-shutdown"));

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, false, false);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (("--config".equals(arg) || "-c".equals(arg)) && i + 1 < args.length) {
                configPath = Paths.get(args[++i]);
            } else if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
