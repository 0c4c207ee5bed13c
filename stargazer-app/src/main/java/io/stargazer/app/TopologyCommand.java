/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import io.stargazer.engine.TopologyEngine;

import picocli.CommandLine.Command;

@Command(name = "topology", description = "Print the service graph with the verdict of every connection")
class TopologyCommand extends EngineCommand {

    @Override
    Object run(TopologyEngine engine) {
        return engine.getTopology(namespace);
    }
}
