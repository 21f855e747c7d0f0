package warden.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.problem.CredentialProblem;

@DisplayName("BoundaryStatus")
class BoundaryStatusTest {

    @Test
    @DisplayName("should expose stable numeric codes")
    void codes() {
        assertEquals(0, BoundaryStatus.OK.code());
        assertEquals(1, BoundaryStatus.OUT_OF_MEMORY.code());
        assertEquals(2, BoundaryStatus.INVALID_ARGUMENT.code());
        assertEquals(3, BoundaryStatus.NOT_FOUND.code());
        assertEquals(99, BoundaryStatus.UNKNOWN.code());
    }

    @Test
    @DisplayName("should map failures to their status")
    void mapsFailures() {
        assertEquals(BoundaryStatus.OK, BoundaryStatus.of(null));
        assertEquals(BoundaryStatus.OUT_OF_MEMORY, BoundaryStatus.of(new OutOfMemoryError()));
        assertEquals(BoundaryStatus.INVALID_ARGUMENT, BoundaryStatus.of(new IllegalArgumentException()));
        assertEquals(BoundaryStatus.INVALID_ARGUMENT, BoundaryStatus.of(CredentialProblem.invalidConfig("x")));
        assertEquals(BoundaryStatus.NOT_FOUND, BoundaryStatus.of(CredentialProblem.tokenNotFound("k")));
        assertEquals(BoundaryStatus.NOT_FOUND, BoundaryStatus.of(CredentialProblem.sessionNotFound()));
        assertEquals(BoundaryStatus.UNKNOWN, BoundaryStatus.of(CredentialProblem.lockTimeout("k")));
        assertEquals(BoundaryStatus.UNKNOWN, BoundaryStatus.of(new IllegalStateException()));
    }
}
