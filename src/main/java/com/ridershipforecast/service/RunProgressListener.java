package com.ridershipforecast.service;

import com.ridershipforecast.model.ServiceOutcome;

@FunctionalInterface
public interface RunProgressListener {

    RunProgressListener NONE = (outcome, completed, total) -> { };

    void serviceCompleted(ServiceOutcome outcome, int completed, int total);
}
