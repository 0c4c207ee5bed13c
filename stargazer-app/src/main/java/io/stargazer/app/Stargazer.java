/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import io.stargazer.engine.TopologyEngine;
import io.stargazer.engine.config.EngineConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Stargazer application entrypoint
 */
@Command(name = "stargazer", mixinStandardHelpOptions = true, versionProvider = Stargazer.VersionProvider.class, description = "Explains which service to service connections a Kubernetes cluster allows, and why", subcommands = {
        TopologyCommand.class, TraceCommand.class, RecommendationsCommand.class, ScoreCommand.class })
public class Stargazer implements Callable<Integer> {

    private static final String UNKNOWN = "unknown";

    private final Supplier<KubernetesClient> clientSupplier;
    private final BiFunction<KubernetesClient, EngineConfig, TopologyEngine> engineFactory;

    @Spec
    private CommandSpec spec;

    Stargazer() {
        this(() -> new KubernetesClientBuilder().build(), TopologyEngine::new);
    }

    Stargazer(Supplier<KubernetesClient> clientSupplier, BiFunction<KubernetesClient, EngineConfig, TopologyEngine> engineFactory) {
        this.clientSupplier = clientSupplier;
        this.engineFactory = engineFactory;
    }

    KubernetesClient newClient() {
        return clientSupplier.get();
    }

    TopologyEngine newEngine(KubernetesClient client, EngineConfig config) {
        return engineFactory.apply(client, config);
    }

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Stargazer entry point
     * @param args args
     */
    public static void main(String... args) {
        int exitCode = commandLine(new Stargazer()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(Stargazer stargazer) {
        return new CommandLine(stargazer).setCaseInsensitiveEnumValuesAllowed(true);
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            try (InputStream resource = this.getClass().getClassLoader().getResourceAsStream("META-INF/metadata.properties")) {
                if (resource != null) {
                    Properties properties = new Properties();
                    properties.load(resource);
                    return new String[]{ "stargazer: " + properties.getProperty("stargazer.version", UNKNOWN) };
                }
            }
            return new String[]{ UNKNOWN };
        }
    }
}
