package com.acme.sourcing.core;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResultTest {

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    @DisplayName("success - should expose the value and no error")
    void testSuccess() {
      Result<String, Integer> result = Result.success("ok");

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.isFailure()).isFalse();
      assertThat(result.getOrNull()).isEqualTo("ok");
      assertThat(result.errorOrNull()).isNull();
    }

    @Test
    @DisplayName("failure - should expose the error and no value")
    void testFailure() {
      Result<String, Integer> result = Result.failure(42);

      assertThat(result.isFailure()).isTrue();
      assertThat(result.getOrNull()).isNull();
      assertThat(result.errorOrNull()).isEqualTo(42);
    }

    @Test
    @DisplayName("failure - should reject a null error")
    void testFailureRejectsNull() {
      assertThatThrownBy(() -> Result.failure(null))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("cannot be null");
    }
  }

  @Nested
  @DisplayName("Combinators")
  class Combinators {

    @Test
    @DisplayName("map - should transform success and leave failure untouched")
    void testMap() {
      Result<Integer, String> ok = Result.success(2);
      Result<Integer, String> failed = Result.failure("boom");

      assertThat(ok.map(v -> v * 10).getOrNull()).isEqualTo(20);
      assertThat(failed.map(v -> v * 10).errorOrNull()).isEqualTo("boom");
    }

    @Test
    @DisplayName("mapError - should transform only the error")
    void testMapError() {
      Result<Integer, String> failed = Result.failure("boom");

      assertThat(failed.mapError(String::length).errorOrNull()).isEqualTo(4);
      assertThat(Result.<Integer, String>success(1).mapError(String::length).getOrNull())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("flatMap - should short-circuit on the first failure")
    void testFlatMap() {
      Result<Integer, String> chained =
          Result.<Integer, String>success(1)
              .flatMap(v -> Result.failure("second step failed"))
              .flatMap(v -> Result.success(99));

      assertThat(chained.errorOrNull()).isEqualTo("second step failed");
    }

    @Test
    @DisplayName("onSuccess/onFailure - should run only the matching side effect")
    void testSideEffects() {
      List<String> seen = new ArrayList<>();

      Result.<String, String>success("v").onSuccess(seen::add).onFailure(e -> seen.add("x"));
      Result.<String, String>failure("e").onSuccess(v -> seen.add("y")).onFailure(seen::add);

      assertThat(seen).containsExactly("v", "e");
    }

    @Test
    @DisplayName("fold - should pick the branch for the outcome")
    void testFold() {
      String onSuccess = Result.<Integer, String>success(3).fold(v -> "value " + v, e -> "error " + e);
      String onFailure = Result.<Integer, String>failure("x").fold(v -> "value " + v, e -> "error " + e);

      assertThat(onSuccess).isEqualTo("value 3");
      assertThat(onFailure).isEqualTo("error x");
    }
  }
}
