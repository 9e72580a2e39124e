package com.orchestrator.domain.integration;

import com.orchestrator.domain.model.RawResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PollResult {

    public enum State {
        PENDING,
        SUCCEEDED,
        FAILED
    }

    private static final PollResult PENDING = new PollResult(State.PENDING, null, null);

    State state;
    RawResult rows;
    String error;

    public static PollResult pending() {
        return PENDING;
    }

    public static PollResult succeeded(RawResult rows) {
        return new PollResult(State.SUCCEEDED, rows, null);
    }

    public static PollResult failed(String error) {
        return new PollResult(State.FAILED, null, error);
    }
}
