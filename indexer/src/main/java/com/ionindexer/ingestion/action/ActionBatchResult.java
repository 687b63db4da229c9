package com.ionindexer.ingestion.action;

import com.ionindexer.domain.action.Action;

import java.util.List;

public record ActionBatchResult(List<Action> actions, List<ActionFailure> failures) {

    public ActionBatchResult {
        actions = List.copyOf(actions);
        failures = List.copyOf(failures);
    }
}
