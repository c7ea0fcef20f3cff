package com.simqueue.auth;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StaticSessionValidatorTest {

    @Test
    public void testParse() {
        StaticSessionValidator validator = StaticSessionValidator.parse(" dev-token:1, analyst:7 ,");

        assertEquals(2, validator.size());
        assertEquals(Optional.of(1L), validator.resolveUserId("dev-token"));
        assertEquals(Optional.of(7L), validator.resolveUserId("analyst"));
        assertTrue(validator.resolveUserId("nobody").isEmpty());
        assertTrue(validator.resolveUserId(null).isEmpty());
    }

    @Test
    public void testEmptyTable() {
        assertEquals(0, StaticSessionValidator.parse("").size());
        assertEquals(0, StaticSessionValidator.parse(null).size());
    }

    @Test
    public void testMalformedEntries() {
        assertThrows(IllegalArgumentException.class, () -> StaticSessionValidator.parse("token-without-user"));
        assertThrows(IllegalArgumentException.class, () -> StaticSessionValidator.parse("token:"));
        assertThrows(IllegalArgumentException.class, () -> StaticSessionValidator.parse("token:abc"));
    }

    @Test
    public void testAllowAll() throws Exception {
        assertTrue(PermissionChecker.allowAll().hasPermission(42L, PermissionChecker.RUN_SIMULATION));
    }
}
