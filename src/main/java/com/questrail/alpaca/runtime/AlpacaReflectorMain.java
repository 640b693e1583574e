package com.questrail.alpaca.runtime;

import com.questrail.alpaca.config.ConfigurationException;
import com.questrail.alpaca.config.ReflectorConfig;
import com.questrail.alpaca.config.ReflectorConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point: {@code AlpacaReflectorMain <config.yaml>}.
 *
 * <p>Runs until the JVM is asked to exit; the shutdown hook stops the runtime.
 * Exit status 2 is a usage or configuration error, 1 a startup failure.</p>
 */
public final class AlpacaReflectorMain {

    private static final Logger log = LoggerFactory.getLogger(AlpacaReflectorMain.class);

    private AlpacaReflectorMain() {}

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("usage: AlpacaReflectorMain <config.yaml>");
            System.exit(2);
        }

        ReflectorConfig config;
        try {
            config = new ReflectorConfigLoader().load(Path.of(args[0]));
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        AlpacaReflectorRuntime runtime = AlpacaReflectorRuntime.builder()
                .withConfig(config)
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            runtime.stop();
            stopped.countDown();
        }, "alpaca-shutdown"));

        try {
            runtime.start();
        } catch (IOException e) {
            log.error("Failed to start reflector", e);
            System.exit(1);
        }

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
