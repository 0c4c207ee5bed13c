/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * An external destination declared by an Istio {@code ServiceEntry}.
 */
public record ExternalService(String name,
                              String namespace,
                              List<String> hosts,
                              List<String> ports,
                              String location,
                              String resolution) {

    public ExternalService {
        hosts = List.copyOf(hosts);
        ports = List.copyOf(ports);
    }
}
