package com.questrail.meshinfo.poller;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReverseDnsNameResolverTest {

    @Test
    void meshSuffixIsStrippedCaseInsensitively() {
        assertEquals("N0CALL-HAP", ReverseDnsNameResolver.stripMeshSuffix("N0CALL-HAP.local.mesh"));
        assertEquals("N0CALL-HAP", ReverseDnsNameResolver.stripMeshSuffix("N0CALL-HAP.LOCAL.MESH"));
        assertEquals("router.example.org", ReverseDnsNameResolver.stripMeshSuffix("router.example.org"));
        assertEquals("mesh", ReverseDnsNameResolver.stripMeshSuffix("mesh"));
    }

    @Test
    void addressWithoutReverseEntryResolvesToEmptyName() {
        // TEST-NET-1 addresses have no PTR records
        String name = new ReverseDnsNameResolver().lookup("192.0.2.1");

        assertNotNull(name);
        assertNotEquals("192.0.2.1", name);
    }
}
