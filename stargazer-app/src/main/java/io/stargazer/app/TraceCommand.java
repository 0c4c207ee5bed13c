/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import io.stargazer.engine.TopologyEngine;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "trace", description = "Trace the path between two endpoints hop by hop, stopping at the first blocked hop")
class TraceCommand extends EngineCommand {

    @Parameters(index = "0", description = "source: ingress-gateway, egress-gateway, a service name or namespace/name")
    String source;

    @Parameters(index = "1", description = "destination: egress-gateway, a service name or namespace/name")
    String destination;

    @Override
    Object run(TopologyEngine engine) {
        return engine.tracePath(source, destination, namespace, engine.getTopology(namespace));
    }
}
