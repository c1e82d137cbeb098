package io.didacli.auth;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

final class PkceTest {

    @Test
    void challengeMatchesRfc7636Example() {
        Assertions.assertEquals(
                "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM",
                Pkce.challengeFor("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk")
        );
    }

    @Test
    void createdPairIsUrlSafeAndConsistent() {
        Pkce pkce = Pkce.create(new SecureRandom());

        Assertions.assertEquals(43, pkce.verifier().length());
        Assertions.assertTrue(pkce.verifier().matches("[A-Za-z0-9_-]+"));
        Assertions.assertEquals(Pkce.challengeFor(pkce.verifier()), pkce.challenge());
        Assertions.assertEquals("S256", pkce.method());
        Assertions.assertNotEquals(pkce.verifier(), Pkce.create().verifier());
    }

    @Test
    void stateIsRandomAndUnpadded() {
        String state = Pkce.randomState();
        Assertions.assertEquals(22, state.length());
        Assertions.assertFalse(state.contains("="));
        Assertions.assertNotEquals(state, Pkce.randomState());
    }
}
