package com.tradecontrol.common;

import lombok.Value;

/**
 * Outcome of a pure state transition: the state to carry forward plus whatever the
 * operation reports back to its caller.
 *
 * @param <S> state type
 * @param <R> result type
 */
@Value
public class Transition<S, R> {

    S state;
    R result;

    public static <S, R> Transition<S, R> of(S state, R result) {
        return new Transition<>(state, result);
    }
}
