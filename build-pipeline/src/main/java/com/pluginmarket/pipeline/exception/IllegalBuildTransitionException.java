package com.pluginmarket.pipeline.exception;

import com.pluginmarket.pipeline.model.BuildStatus;
import lombok.Getter;

@Getter
public class IllegalBuildTransitionException extends RuntimeException {

    private final String buildId;
    private final BuildStatus from;
    private final BuildStatus to;

    public IllegalBuildTransitionException(String buildId, BuildStatus from, BuildStatus to) {
        super(String.format("Build %s cannot move from %s to %s",
                buildId, from == null ? null : from.value(), to == null ? null : to.value()));
        this.buildId = buildId;
        this.from = from;
        this.to = to;
    }
}
