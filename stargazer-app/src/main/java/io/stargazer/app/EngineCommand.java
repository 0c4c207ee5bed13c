/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stargazer.api.FatalFetchException;
import io.stargazer.engine.TopologyEngine;
import io.stargazer.engine.config.ConfigParser;
import io.stargazer.engine.config.EngineConfig;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Options and lifecycle shared by the commands that query a cluster.
 */
abstract class EngineCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineCommand.class);

    @ParentCommand
    private Stargazer parent;

    @Spec
    CommandSpec spec;

    @Option(names = { "-n", "--namespace" }, description = "namespace to inspect, 'all' for every namespace (default: ${DEFAULT-VALUE})", defaultValue = TopologyEngine.ALL_NAMESPACES)
    String namespace;

    @Option(names = { "-c", "--config" }, description = "engine configuration file")
    File configFile;

    @Option(names = { "-o", "--output" }, description = "output format, one of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})", defaultValue = "json")
    OutputFormat output;

    @Override
    public Integer call() throws Exception {
        var config = loadConfig();
        try (var client = parent.newClient(); var engine = parent.newEngine(client, config)) {
            var result = run(engine);
            spec.commandLine().getOut().println(output.write(result));
            spec.commandLine().getOut().flush();
            return 0;
        }
        catch (FatalFetchException e) {
            LOGGER.error("Cannot compute topology: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * @return the value to print
     */
    abstract Object run(TopologyEngine engine);

    EngineConfig loadConfig() throws IOException {
        if (configFile == null) {
            return EngineConfig.DEFAULT;
        }
        if (!configFile.exists()) {
            throw new ParameterException(spec.commandLine(), String.format("Given configuration file does not exist: %s", configFile.toPath().toAbsolutePath()));
        }
        try (InputStream stream = Files.newInputStream(configFile.toPath())) {
            return new ConfigParser().parseConfiguration(stream);
        }
    }
}
