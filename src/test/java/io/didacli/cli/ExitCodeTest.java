package io.didacli.cli;

import io.didacli.error.ApiException;
import io.didacli.error.AuthException;
import io.didacli.error.NetworkException;
import io.didacli.error.NotFoundException;
import io.didacli.error.NotImplementedException;
import io.didacli.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ExitCodeTest {

    @Test
    void mapsErrorTaxonomyToStableCodes() {
        Assertions.assertEquals(2, ExitCode.forError(new ValidationException("bad")));
        Assertions.assertEquals(3, ExitCode.forError(new AuthException("no token")));
        Assertions.assertEquals(4, ExitCode.forError(new NotFoundException("Task", "p/t")));
        Assertions.assertEquals(5, ExitCode.forError(new NetworkException("down")));
        Assertions.assertEquals(6, ExitCode.forError(new NotImplementedException()));
        Assertions.assertEquals(1, ExitCode.forError(new ApiException("server error", 500, "project", "")));
        Assertions.assertEquals(1, ExitCode.forError(new IllegalStateException("other")));
    }
}
