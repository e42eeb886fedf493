package com.calc.fsm;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic finite-state machine that finds the longest prefix of an
 * input it can consume while staying in defined states.
 * <p>
 * Instances are immutable. The state of a run lives inside {@link #run(CharSequence)},
 * so one machine can be shared and reused freely.
 *
 * @param <S> State type
 */
public final class StateMachine<S> {

    private final Set<S> states;
    private final S initialState;
    private final Set<S> acceptingStates;
    private final TransitionFunction<S> transitions;

    private StateMachine(Builder<S> builder) {
        this.states = Set.copyOf(builder.states);
        this.initialState = builder.initialState;
        this.acceptingStates = Set.copyOf(builder.acceptingStates);
        this.transitions = builder.transitions;
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * Run this machine on {@code input}.
     * <p>
     * Characters are consumed until the transition function halts or the
     * input ends. The consumed prefix is returned if the last reached state
     * is accepting. The prefix does not have to cover the whole input.
     *
     * @param input Input to match
     * @return Matched prefix, or empty if the last reached state is not accepting
     */
    public Optional<String> run(CharSequence input) {
        S current = initialState;
        int size = 0;

        while (size < input.length()) {
            Optional<S> next = transitions.next(current, input.charAt(size));
            if (next.isEmpty()) {
                break;
            }
            S state = next.get();
            if (!states.contains(state)) {
                throw new IllegalStateException("Transition from " + current
                        + " leads to undeclared state " + state);
            }
            current = state;
            size++;
        }

        if (acceptingStates.contains(current)) {
            return Optional.of(input.subSequence(0, size).toString());
        }
        return Optional.empty();
    }

    /**
     * Check whether the whole input is accepted.
     */
    public boolean accepts(CharSequence input) {
        return run(input)
                .map(match -> match.length() == input.length())
                .orElse(false);
    }

    public Set<S> getStates() {
        return states;
    }

    public S getInitialState() {
        return initialState;
    }

    public Set<S> getAcceptingStates() {
        return acceptingStates;
    }

    /**
     * Builder for {@link StateMachine}.
     */
    public static final class Builder<S> {
        private final Set<S> states = new LinkedHashSet<>();
        private final Set<S> acceptingStates = new LinkedHashSet<>();
        private S initialState;
        private TransitionFunction<S> transitions;

        private Builder() {
        }

        public Builder<S> states(Collection<S> states) {
            this.states.addAll(states);
            return this;
        }

        public Builder<S> initialState(S initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder<S> acceptingStates(Collection<S> acceptingStates) {
            this.acceptingStates.addAll(acceptingStates);
            return this;
        }

        public Builder<S> transitions(TransitionFunction<S> transitions) {
            this.transitions = transitions;
            return this;
        }

        public StateMachine<S> build() {
            Objects.requireNonNull(initialState, "initialState");
            Objects.requireNonNull(transitions, "transitions");
            if (states.isEmpty()) {
                throw new IllegalArgumentException("State set cannot be empty");
            }
            if (!states.contains(initialState)) {
                throw new IllegalArgumentException("Initial state " + initialState + " is not a declared state");
            }
            for (S accepting : acceptingStates) {
                if (!states.contains(accepting)) {
                    throw new IllegalArgumentException("Accepting state " + accepting + " is not a declared state");
                }
            }
            return new StateMachine<>(this);
        }
    }
}
