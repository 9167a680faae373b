package com.ryuqq.rollups.application.error;

/**
 * 러너가 수행하는 외부 호출 단계.
 *
 * <p>모든 {@link RunnerException}은 실패한 단계를 가리키며,
 * {@link #description()}은 로그와 예외 메시지에 그대로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunnerOperation {

    CREATE_SESSION("failed to create session in compute engine"),
    ADVANCE("failed to send advance-state input to compute engine"),
    FINISH_EPOCH("failed to finish epoch in compute engine"),
    GET_EPOCH_CLAIM("failed to get epoch claim from compute engine"),
    FIND_FINISH_EPOCH_INPUT("failed to find finish epoch input event"),
    CONSUME_INPUT("failed to consume input from event log"),
    PEEK_CLAIM("failed to get whether claim was produced"),
    PRODUCE_CLAIM("failed to produce claim in event log"),
    GET_STORAGE_DIRECTORY("failed to get storage directory"),
    GET_LATEST_SNAPSHOT("failed to get latest snapshot"),
    SET_LATEST_SNAPSHOT("failed to set latest snapshot"),
    VERIFY_PARENT("parent id doesn't match");

    private final String description;

    RunnerOperation(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
