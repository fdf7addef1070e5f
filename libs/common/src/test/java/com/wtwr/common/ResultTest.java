package com.wtwr.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Result")
class ResultTest {

    @Nested
    @DisplayName("Ok")
    class OkBranch {

        @Test
        @DisplayName("maps and flat-maps the value")
        void mapsValue() {
            Result<Integer> result = Result.ok("abc").map(String::length).flatMap(n -> Result.ok(n * 2));

            assertThat(result.isOk()).isTrue();
            assertThat(result.value()).isEqualTo(6);
        }

        @Test
        @DisplayName("flatMap can turn success into failure")
        void flatMapCanFail() {
            Result<Integer> result = Result.ok(1).flatMap(n -> Result.err(ApiError.notFound("gone")));

            assertThat(result.isErr()).isTrue();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.NOT_FOUND);
        }

        @Test
        @DisplayName("has no error")
        void hasNoError() {
            assertThatThrownBy(() -> Result.ok(1).error()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("peek runs the action")
        void peekRuns() {
            var seen = new AtomicInteger();
            Result.ok(7).peek(seen::set);
            assertThat(seen.get()).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Err")
    class ErrBranch {

        private final ApiError error = ApiError.badRequest("bad");

        @Test
        @DisplayName("short-circuits map, flatMap and peek")
        void shortCircuits() {
            var calls = new AtomicInteger();
            Result<String> result = Result.<String>err(error)
                    .peek(v -> calls.incrementAndGet())
                    .map(v -> {
                        calls.incrementAndGet();
                        return v + "!";
                    })
                    .flatMap(v -> {
                        calls.incrementAndGet();
                        return Result.ok(v);
                    });

            assertThat(calls.get()).isZero();
            assertThat(result.error()).isSameAs(error);
        }

        @Test
        @DisplayName("fold takes the error branch")
        void foldTakesErrorBranch() {
            String folded = Result.<String>err(error).fold(v -> "ok", e -> e.message());
            assertThat(folded).isEqualTo("bad");
        }

        @Test
        @DisplayName("has no value")
        void hasNoValue() {
            assertThatThrownBy(() -> Result.err(error).value())
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
