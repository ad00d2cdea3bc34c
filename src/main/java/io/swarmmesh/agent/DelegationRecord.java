package io.swarmmesh.agent;

public record DelegationRecord(
        String taskId,
        String peerId,
        DelegationStatus status,
        String output,
        String error,
        long updatedAtMs
) {
    public static DelegationRecord sent(String taskId, String peerId, long nowMs) {
        return new DelegationRecord(taskId, peerId, DelegationStatus.SENT, null, null, nowMs);
    }

    public DelegationRecord resolve(DelegationStatus nextStatus, String nextOutput, String nextError, long nowMs) {
        return new DelegationRecord(taskId, peerId, nextStatus, nextOutput, nextError, nowMs);
    }
}
