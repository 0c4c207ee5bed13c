/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.client.KubernetesClient;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.model.PathTrace;
import io.stargazer.api.model.ResourceKind;
import io.stargazer.engine.TopologyEngine;
import io.stargazer.engine.config.EngineConfig;

import picocli.CommandLine;

import static java.util.UUID.randomUUID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StargazerTest {

    @Mock
    KubernetesClient client;

    @Mock
    TopologyEngine engine;

    private final AtomicReference<EngineConfig> config = new AtomicReference<>();
    private CommandLine cmd;
    private StringWriter soutWriter;
    private StringWriter serrWriter;

    @BeforeEach
    void setup() {
        Stargazer app = new Stargazer(() -> client, (kubernetesClient, engineConfig) -> {
            if (!config.compareAndSet(null, engineConfig)) {
                throw new IllegalStateException("engine already created");
            }
            return engine;
        });
        soutWriter = new StringWriter();
        serrWriter = new StringWriter();
        cmd = Stargazer.commandLine(app);
        cmd.setOut(new PrintWriter(soutWriter));
        cmd.setErr(new PrintWriter(serrWriter));
    }

    @Test
    void testExitsWithoutSubcommand() {
        assertThat(cmd.execute()).isEqualTo(2);
        assertThat(stdErr()).contains("Missing required subcommand");
    }

    @Test
    void testVersion() {
        assertThat(cmd.execute("-V")).isZero();
        assertThat(stdOut()).containsPattern(Pattern.compile("stargazer: \\S+"));
    }

    @Test
    void testExitsIfConfigurationNonExistent(@TempDir Path dir) {
        String nonExistent = dir.resolve(randomUUID().toString()).toString();
        assertThat(cmd.execute("score", "-c", nonExistent)).isEqualTo(2);
        assertThat(stdErr()).contains("Given configuration file does not exist: " + nonExistent);
    }

    @Test
    void testExitsIfConfigurationNotExpectedFormat(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(randomUUID().toString());
        Files.writeString(file, "absolute garbage");
        assertThat(cmd.execute("score", "-c", file.toString())).isEqualTo(1);
        assertThat(stdErr()).contains("java.lang.IllegalArgumentException: Couldn't parse configuration");
    }

    @Test
    void testPassesConfigurationToEngine(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(randomUUID().toString());
        Files.writeString(file, "maxFindingsPerCheck: 3\n");
        when(engine.getComplianceScore(any())).thenReturn(Map.of("score", 100));

        assertThat(cmd.execute("score", "-c", file.toString())).isZero();
        assertThat(config.get().maxFindingsPerCheck()).isEqualTo(3);
    }

    @Test
    void testScoreIsPrintedAsJson() {
        var score = new LinkedHashMap<String, Object>();
        score.put("score", 50);
        score.put("passed", 1);
        score.put("total", 2);
        when(engine.getComplianceScore(any())).thenReturn(score);

        assertThat(cmd.execute("score", "-n", "ns1")).isZero();

        verify(engine).getTopology("ns1");
        assertThat(config.get()).isSameAs(EngineConfig.DEFAULT);
        assertThat(stdOut()).contains("\"score\" : 50", "\"passed\" : 1", "\"total\" : 2");
    }

    @Test
    void testTraceIsPrintedAsYaml() {
        when(engine.tracePath(eq("web"), eq("db"), eq("ns1"), any())).thenReturn(PathTrace.builder("web", "db").build());

        assertThat(cmd.execute("trace", "web", "db", "-n", "ns1", "-o", "yaml")).isZero();

        assertThat(stdOut()).contains("source: \"web\"", "allowed: false", "reason: \"No connection path found\"")
                .doesNotContain("blockedAt");
    }

    @Test
    void testNamespaceDefaultsToAllNamespaces() {
        when(engine.getComplianceScore(any())).thenReturn(Map.of());

        assertThat(cmd.execute("score")).isZero();

        verify(engine).getTopology(TopologyEngine.ALL_NAMESPACES);
    }

    @Test
    void testExitsIfTopologyCannotBeComputed() {
        when(engine.getTopology("ns1")).thenThrow(new FatalFetchException(ResourceKind.SERVICES, "ns1", new IllegalStateException("forbidden")));

        assertThat(cmd.execute("topology", "-n", "ns1")).isEqualTo(1);
        assertThat(stdErr()).contains("Failed to fetch SERVICES in namespace 'ns1': forbidden");
        verify(engine).close();
    }

    private String stdErr() {
        return serrWriter.toString();
    }

    private String stdOut() {
        return soutWriter.toString();
    }
}
