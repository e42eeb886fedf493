package com.calc.fsm;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recognizes floating-point literals.
 * <p>
 * Grammar:
 * <pre>
 * number := digit+ ('.' digit+)? (('e' | 'E') ('+' | '-')? digit+)?
 * </pre>
 * A phase marker ({@code .}, {@code e}, sign) must be followed by at least one
 * digit, so {@code 2.}, {@code 83e} and {@code 91.e4} are rejected.
 */
public final class NumberRecognizer {

    private final StateMachine<NumberState> machine;

    public NumberRecognizer() {
        this.machine = StateMachine.<NumberState>builder()
                .states(EnumSet.allOf(NumberState.class))
                .initialState(NumberState.INITIAL)
                .acceptingStates(Arrays.stream(NumberState.values())
                        .filter(NumberState::isAccepting)
                        .collect(Collectors.toSet()))
                .transitions(NumberRecognizer::next)
                .build();
    }

    /**
     * Match the longest number literal at the start of {@code input}.
     *
     * @param input Remaining source text
     * @return Literal text, or empty if the input does not start with a valid literal
     */
    public Optional<String> recognize(CharSequence input) {
        return machine.run(input);
    }

    StateMachine<NumberState> machine() {
        return machine;
    }

    static Optional<NumberState> next(NumberState current, char c) {
        boolean digit = isDigit(c);
        NumberState next = switch (current) {
            case INITIAL -> digit ? NumberState.INTEGER : null;
            case INTEGER -> {
                if (digit) {
                    yield NumberState.INTEGER;
                }
                if (c == '.') {
                    yield NumberState.BEGIN_FRACTIONAL;
                }
                yield isExponentMarker(c) ? NumberState.BEGIN_EXPONENT : null;
            }
            case BEGIN_FRACTIONAL -> digit ? NumberState.FRACTIONAL : null;
            case FRACTIONAL -> {
                if (digit) {
                    yield NumberState.FRACTIONAL;
                }
                yield isExponentMarker(c) ? NumberState.BEGIN_EXPONENT : null;
            }
            case BEGIN_EXPONENT -> {
                if (digit) {
                    yield NumberState.EXPONENT;
                }
                yield c == '+' || c == '-' ? NumberState.BEGIN_SIGNED_EXPONENT : null;
            }
            case BEGIN_SIGNED_EXPONENT, EXPONENT -> digit ? NumberState.EXPONENT : null;
        };
        return Optional.ofNullable(next);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E';
    }
}
