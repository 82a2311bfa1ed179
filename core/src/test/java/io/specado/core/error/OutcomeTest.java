package io.specado.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OutcomeTest {

    @Test
    void successCarriesValueOnly() {
        Outcome<String> outcome = Outcome.success("{}");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.kind()).isEqualTo(ErrorKind.SUCCESS);
        assertThat(outcome.value()).isEqualTo("{}");
        assertThat(outcome.message()).isNull();
    }

    @Test
    void failureCarriesKindAndMessage() {
        Outcome<String> outcome = Outcome.failure(ErrorKind.TIMEOUT_ERROR, "too slow");

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.value()).isNull();
        assertThat(outcome.message()).isEqualTo("too slow");
    }

    @Test
    void failureFromException() {
        Outcome<String> outcome = Outcome.failure(new ModelNotFoundException("Model 'x' not found", "x"));

        assertThat(outcome.kind()).isEqualTo(ErrorKind.MODEL_NOT_FOUND);
        assertThat(outcome.message()).isEqualTo("Model 'x' not found");
    }

    @Test
    void failureCannotBeSuccess() {
        assertThatThrownBy(() -> Outcome.failure(ErrorKind.SUCCESS, "nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapOnlyTouchesSuccess() {
        assertThat(Outcome.success(2).map(v -> v * 21).value()).isEqualTo(42);

        Outcome<Integer> failed = Outcome.<Integer>failure(ErrorKind.NETWORK_ERROR, "down").map(v -> v * 21);
        assertThat(failed.kind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(failed.message()).isEqualTo("down");
    }
}
