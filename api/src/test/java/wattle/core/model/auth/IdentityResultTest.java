package wattle.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jboss.logging.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Operation results")
class IdentityResultTest {

    @Nested
    @DisplayName("IdentityResult")
    class Identity {

        @Test
        @DisplayName("should share the success instance")
        void shouldShareSuccess() {
            assertSame(IdentityResult.success(), IdentityResult.success());
            assertTrue(IdentityResult.success().succeeded());
            assertTrue(IdentityResult.success().errors().isEmpty());
        }

        @Test
        @DisplayName("should log success at DEBUG and failure at WARN")
        void shouldMapLevels() {
            assertEquals(Logger.Level.DEBUG, IdentityResult.success().logLevel());
            assertEquals(Logger.Level.WARN, IdentityResult.failed().logLevel());
        }

        @Test
        @DisplayName("should render failures with their error codes")
        void shouldRenderFailures() {
            var result = IdentityResult.failed(new IdentityError("InvalidEmail", null));

            assertFalse(result.succeeded());
            assertEquals("", result.errors().get(0).description());
            assertEquals("Failed : InvalidEmail", result.toString());
            assertEquals("Failed : ", IdentityResult.failed().toString());
            assertEquals("Succeeded", IdentityResult.success().toString());
        }
    }

    @Nested
    @DisplayName("SignInResult")
    class SignIn {

        @ParameterizedTest
        @EnumSource(
                value = SignInResult.class,
                names = {"FAILED", "LOCKED_OUT", "NOT_ALLOWED"})
        @DisplayName("should log unsuccessful outcomes at WARN")
        void shouldWarnOnFailure(SignInResult result) {
            assertEquals(Logger.Level.WARN, result.logLevel());
            assertFalse(result.succeeded());
        }

        @ParameterizedTest
        @EnumSource(
                value = SignInResult.class,
                names = {"SUCCEEDED", "REQUIRES_TWO_FACTOR"})
        @DisplayName("should log routine outcomes at DEBUG")
        void shouldDebugOnRoutine(SignInResult result) {
            assertEquals(Logger.Level.DEBUG, result.logLevel());
        }

        @Test
        @DisplayName("should expose outcome predicates")
        void shouldExposePredicates() {
            assertTrue(SignInResult.LOCKED_OUT.isLockedOut());
            assertTrue(SignInResult.NOT_ALLOWED.isNotAllowed());
            assertTrue(SignInResult.REQUIRES_TWO_FACTOR.requiresTwoFactor());
            assertEquals("Lockedout", SignInResult.LOCKED_OUT.toString());
        }
    }
}
