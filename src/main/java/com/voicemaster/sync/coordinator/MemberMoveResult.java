package com.voicemaster.sync.coordinator;

import com.voicemaster.sync.core.outcome.Outcome;

/**
 * Outcomes of the leave and join halves of one {@code memberMoved} event. A half is
 * {@code null} when the event had no such side.
 */
public record MemberMoveResult(Outcome<LifecycleAction> leave, Outcome<LifecycleAction> join) {

    public static MemberMoveResult none() {
        return new MemberMoveResult(null, null);
    }

    public boolean isSuccess() {
        return (leave == null || leave.isSuccess()) && (join == null || join.isSuccess());
    }
}
