package io.swarmmesh.agent;

public enum DelegationStatus {
    SENT,
    COMPLETED,
    FAILED,
    DECLINED
}
