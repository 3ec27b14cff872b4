package org.genemeta.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.genemeta.cli.CommandLineInterface;
import org.genemeta.node.GeneMetaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Runs the study-load worker and the HTTP query API until the JVM is terminated.
 */
@Command(
    name = "serve",
    description = "Start the study-load worker and the HTTP query API"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }

        final GeneMetaNode node = new GeneMetaNode(config);
        final CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping node");
            node.close();
            shutdown.countDown();
        }, "shutdown-hook"));

        node.startServing();
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            node.close();
        }
        return 0;
    }
}
