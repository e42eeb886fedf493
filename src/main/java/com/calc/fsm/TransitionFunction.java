package com.calc.fsm;

import java.util.Optional;

/**
 * Transition function of a {@link StateMachine}.
 *
 * @param <S> State type
 */
@FunctionalInterface
public interface TransitionFunction<S> {

    /**
     * Compute the state reached from {@code current} on {@code character}.
     *
     * @param current   Current state
     * @param character Input character
     * @return Next state, or empty if the automaton halts
     */
    Optional<S> next(S current, char character);
}
