package io.applyflow.forms.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class InvalidStateExceptionTest {

  @Test
  void carriesViolationsAsProblemProperty() {
    var ex = new InvalidStateException("Invalid form logic", "2 problems", List.of("a", "b"));

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(ex.getBody().getTitle()).isEqualTo("Invalid form logic");
    assertThat(ex.getBody().getDetail()).isEqualTo("2 problems");
    assertThat(ex.getViolations()).containsExactly("a", "b");
  }

  @Test
  void hasNoViolationsByDefault() {
    assertThat(new InvalidStateException("Title", "Detail").getViolations()).isEmpty();
  }

  @Test
  void notFoundNamesResource() {
    var ex = new ResourceNotFoundException("Field", "f_1");

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(ex.getBody().getTitle()).isEqualTo("Field not found");
    assertThat(ex.getBody().getDetail()).isEqualTo("No field found with id f_1");
  }
}
