package net.spookly.dimensions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

import net.spookly.dimensions.api.RestApi;
import net.spookly.dimensions.config.ConfigLoader;
import net.spookly.dimensions.config.ConfigPrinter;
import net.spookly.dimensions.config.ConfigWarnings;
import net.spookly.dimensions.config.DimensionsConfig;
import net.spookly.dimensions.config.FileConfigSource;
import net.spookly.dimensions.control.CommandDispatcher;
import net.spookly.dimensions.control.RedisControlChannel;
import net.spookly.dimensions.extension.ServiceLoaderExtensionSource;
import net.spookly.dimensions.listen.ListenTransport;
import net.spookly.dimensions.orchestrator.Dimensions;
import net.spookly.dimensions.util.ConsoleLog;
import net.spookly.dimensions.util.DimensionsLog;

/**
 * Standalone entry point for the Dimensions proxy process.
 */
public final class DimensionsMain {
    private static final String DEFAULT_CONFIG = "config/dimensions.yaml";

    private DimensionsMain() {
    }

    /**
     * Boot the listeners, the control channel and the optional REST API.
     */
    public static void main(String[] args) {
        CliOptions cli = parseArgs(args);
        Path configPath = cli.configPath;
        DimensionsConfig config = ConfigLoader.load(configPath);
        emitWarnings(config, configPath);
        if (cli.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (cli.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        System.out.println("Dimensions config loaded: " + config.servers.size() + " listen port(s)");

        DimensionsLog log = ConsoleLog.INSTANCE;
        DimensionsConfig.OptionsConfig options = config.options;
        ListenTransport transport = new ListenTransport();
        Dimensions dimensions = Dimensions.builder()
                .config(config)
                .configSource(new FileConfigSource(configPath))
                .listenServerFactory(transport.factory(log))
                .extensionSource(new ServiceLoaderExtensionSource(
                        () -> Paths.get(options.extensionsDirectory()),
                        DimensionsMain.class.getClassLoader(),
                        log))
                .reportingSurfaceFactory(RestApi.factory(log))
                .log(log)
                .build();
        try {
            dimensions.start();
        } catch (RuntimeException e) {
            dimensions.shutdown();
            transport.close();
            throw e;
        }

        CommandDispatcher dispatcher = new CommandDispatcher(dimensions, log);
        RedisControlChannel controlChannel = new RedisControlChannel(
                config.control.redisUri, config.control.channel, dispatcher, log);
        try {
            controlChannel.start();
        } catch (RuntimeException e) {
            log.error("RedisError: " + e);
        }

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            controlChannel.close();
            dispatcher.close();
            dimensions.shutdown();
            transport.close();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(DimensionsConfig config, Path configPath) {
        for (String warning : ConfigWarnings.collect(config, configPath)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
