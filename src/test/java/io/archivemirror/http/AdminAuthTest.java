package io.archivemirror.http;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

final class AdminAuthTest {

    @Test
    void parsesCommaSeparatedTokensWithoutDuplicates() {
        AdminAuth auth = AdminAuth.parse(Arrays.asList(" alpha , beta", null, "alpha,,gamma "));
        Assertions.assertEquals(List.of("alpha", "beta", "gamma"), auth.tokens());
        Assertions.assertTrue(auth.enabled());
        Assertions.assertTrue(auth.accepts("beta"));
        Assertions.assertTrue(auth.accepts(" gamma "));
        Assertions.assertFalse(auth.accepts("delta"));
        Assertions.assertFalse(auth.accepts("alph"));
        Assertions.assertFalse(auth.accepts(""));
        Assertions.assertFalse(auth.accepts(null));
    }

    @Test
    void disabledWhenNoTokensGiven() {
        Assertions.assertFalse(AdminAuth.disabled().enabled());
        Assertions.assertFalse(AdminAuth.parse(null).enabled());
        Assertions.assertFalse(AdminAuth.parse(List.of(" , ")).enabled());
        Assertions.assertFalse(AdminAuth.disabled().accepts("anything"));
    }
}
