package com.sectionviewer;

import com.sectionviewer.core.ViewerConfig;
import com.sectionviewer.core.ViewerLoop;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.LogManager;

/**
 * Entry point for SectionViewer.
 * <p>
 * Usage:
 *   java -jar section-viewer.jar                       # cube model, control channel on 25570
 *   java -jar section-viewer.jar --model nested        # two nested boxes
 *   java -jar section-viewer.jar --config viewer.properties
 *   java -jar section-viewer.jar --no-server --ticks 100
 */
public class Main {
    public static void main(String[] args) {
        configureLogging();
        System.out.println("SectionViewer starting...");

        String configPath = null;
        String port = null;
        String model = null;
        boolean noServer = false;
        long maxTicks = -1;

        // Parse command-line arguments
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 < args.length) {
                        configPath = args[++i];
                    } else {
                        System.err.println("--config requires a file path argument");
                        System.exit(1);
                    }
                }
                case "--port" -> {
                    if (i + 1 < args.length) {
                        port = args[++i];
                    }
                }
                case "--model" -> {
                    if (i + 1 < args.length) {
                        model = args[++i];
                    }
                }
                case "--no-server" -> noServer = true;
                case "--ticks" -> {
                    if (i + 1 < args.length) {
                        try {
                            maxTicks = Long.parseLong(args[++i]);
                        } catch (NumberFormatException e) {
                            System.err.println("--ticks requires a number");
                            System.exit(1);
                        }
                    }
                }
                case "--help", "-h" -> {
                    System.out.println("SectionViewer - cross-section clipping for triangle meshes");
                    System.out.println("Usage: java -jar section-viewer.jar [options]");
                    System.out.println();
                    System.out.println("Options:");
                    System.out.println("  --config <file>   Load settings from a properties file");
                    System.out.println("  --port <port>     Control channel port (default: 25570)");
                    System.out.println("  --model <name>    Built-in model: cube, nested (default: cube)");
                    System.out.println("  --no-server       Run without the WebSocket control channel");
                    System.out.println("  --ticks <n>       Exit after n update ticks");
                    System.out.println("  --help, -h        Show this help message");
                    System.exit(0);
                }
                default -> System.err.println("Unknown argument: " + args[i]);
            }
        }

        ViewerConfig config = ViewerConfig.load(configPath != null ? Path.of(configPath) : null);
        if (port != null) config.set(ViewerConfig.CONTROL_PORT, port);
        if (model != null) config.set(ViewerConfig.MODEL, model);
        if (noServer) config.set(ViewerConfig.CONTROL_ENABLED, "false");

        ViewerLoop loop = new ViewerLoop(config);
        loop.setMaxTicks(maxTicks);
        Runtime.getRuntime().addShutdownHook(new Thread(loop::requestStop, "shutdown"));
        loop.run();
    }

    private static void configureLogging() {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
