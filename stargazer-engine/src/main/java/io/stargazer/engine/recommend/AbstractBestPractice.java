/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.List;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.Severity;

import edu.umd.cs.findbugs.annotations.Nullable;

abstract class AbstractBestPractice implements BestPractice {

    private final String id;
    private final String name;
    private final Category category;
    private final Severity severity;

    AbstractBestPractice(String id, String name, Category category, Severity severity) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.severity = severity;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Category category() {
        return category;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    CheckResult passed() {
        return CheckResult.pass(id, name);
    }

    CheckResult result(List<Recommendation> findings) {
        return new CheckResult(id, name, findings.isEmpty(), findings);
    }

    CheckResult failed(Recommendation finding) {
        return new CheckResult(id, name, false, List.of(finding));
    }

    Recommendation finding(String findingId, String title, String description, Fix fix, String impact) {
        return finding(findingId, title, description, null, null, fix, impact);
    }

    Recommendation finding(String findingId, String title, String description, @Nullable String service, @Nullable String namespace, Fix fix,
                           String impact) {
        return new Recommendation(findingId, title, description, category, severity, service, namespace, fix, impact);
    }
}
