package com.signalplatform.common.exception;

import com.signalplatform.common.model.FailureKind;

public class JudgeException extends RuntimeException {
    private final String judgeId;
    private final FailureKind failureKind;

    public JudgeException(String judgeId, FailureKind failureKind, String message) {
        super("[" + judgeId + "] " + message);
        this.judgeId     = judgeId;
        this.failureKind = failureKind;
    }

    public JudgeException(String judgeId, FailureKind failureKind, String message, Throwable cause) {
        super("[" + judgeId + "] " + message, cause);
        this.judgeId     = judgeId;
        this.failureKind = failureKind;
    }

    public String getJudgeId() {
        return judgeId;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }
}
