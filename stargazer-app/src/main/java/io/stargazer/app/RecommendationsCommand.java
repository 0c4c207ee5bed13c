/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import io.stargazer.engine.TopologyEngine;

import picocli.CommandLine.Command;

@Command(name = "recommendations", description = "List best practice findings with ready to apply fixes")
class RecommendationsCommand extends EngineCommand {

    @Override
    Object run(TopologyEngine engine) {
        return engine.getRecommendations(engine.getTopology(namespace));
    }
}
