package com.signalplatform.common.model;

/** Why a judge produced no usable opinion. */
public enum FailureKind {
    TIMEOUT,
    TRANSPORT,
    MALFORMED_RESPONSE
}
