package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.RequestContext;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthMiddlewareTest {

    private static RequestContext withAuthorization(String value) {
        Map<String, String> headers = value != null ? Map.of("Authorization", value) : Map.of();
        return new RequestContext("GET", URI.create("http://localhost/private"), headers, "127.0.0.1");
    }

    @Test
    void missingToken_isUnauthorized() {
        @SuppressWarnings("unchecked")
        Predicate<String> validator = mock(Predicate.class);
        AuthMiddleware auth = new AuthMiddleware(validator);

        assertThatThrownBy(() -> auth.preHandle(withAuthorization(null)))
                .isInstanceOfSatisfying(MiddlewareException.class, e -> assertThat(e.getStatus()).isEqualTo(401));
        assertThatThrownBy(() -> auth.preHandle(withAuthorization("")))
                .isInstanceOfSatisfying(MiddlewareException.class, e -> assertThat(e.getStatus()).isEqualTo(401));
        verify(validator, never()).test(anyString());
    }

    @Test
    void rejectedToken_isForbidden() {
        @SuppressWarnings("unchecked")
        Predicate<String> validator = mock(Predicate.class);
        when(validator.test("Bearer nope")).thenReturn(false);
        AuthMiddleware auth = new AuthMiddleware(validator);

        assertThatThrownBy(() -> auth.preHandle(withAuthorization("Bearer nope")))
                .isInstanceOfSatisfying(MiddlewareException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(403);
                    assertThat(e.getMessage()).isEqualTo("Forbidden");
                });
    }

    @Test
    void acceptedToken_continuesPipeline() {
        AuthMiddleware auth = new AuthMiddleware(token -> true);

        assertThat(auth.preHandle(withAuthorization("anything"))).isNull();
    }

    @Test
    void sharedSecret_acceptsBareAndBearerForms() {
        Predicate<String> validator = AuthMiddleware.sharedSecret("s3cret");

        assertThat(validator.test("s3cret")).isTrue();
        assertThat(validator.test("Bearer s3cret")).isTrue();
        assertThat(validator.test("Bearer other")).isFalse();
        assertThat(validator.test("s3cret2")).isFalse();
    }

    @Test
    void sharedSecret_blankAcceptsAnyToken() {
        Predicate<String> validator = AuthMiddleware.sharedSecret("");

        assertThat(validator.test("whatever")).isTrue();
        assertThat(validator.test("")).isFalse();
    }
}
