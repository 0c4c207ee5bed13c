/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.app;

import io.stargazer.engine.TopologyEngine;

import picocli.CommandLine.Command;

@Command(name = "score", description = "Print the compliance score and the result of every best practice check")
class ScoreCommand extends EngineCommand {

    @Override
    Object run(TopologyEngine engine) {
        return engine.getComplianceScore(engine.getTopology(namespace));
    }
}
