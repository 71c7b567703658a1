package com.spreadsheet.calc.functions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest {

    private final FunctionRegistry registry = FunctionRegistry.getInstance();

    @Test
    void testLookupIsCaseInsensitive() {
        assertNotNull(registry.get("sum"));
        assertSame(registry.get("SUM"), registry.get("Sum"));
        assertNull(registry.get("NOSUCH"));
        assertNull(registry.get(null));
    }

    @Test
    void testArity() {
        FunctionDefinition round = registry.get("ROUND");
        assertEquals(1, round.getMinArgs());
        assertEquals(Integer.valueOf(2), round.getMaxArgs());
        assertNull(registry.get("SUM").getMaxArgs());
        assertEquals(0, registry.get("PI").getMinArgs());
    }

    @Test
    void testVolatileFunctions() {
        assertTrue(registry.isVolatile("NOW"));
        assertTrue(registry.isVolatile("today"));
        assertTrue(registry.isVolatile("RAND"));
        assertTrue(registry.isVolatile("RANDBETWEEN"));
        assertFalse(registry.isVolatile("SUM"));
        assertFalse(registry.isVolatile("NOSUCH"));
    }

    @Test
    void testEveryFamilyIsRegistered() {
        for (String name : new String[]{"SUM", "IF", "LEN", "ISBLANK", "DATE", "VLOOKUP", "COUNTIFS",
                "SUMPRODUCT", "SEQUENCE", "CEILING.MATH", "SWITCH"}) {
            assertTrue(registry.contains(name), name);
        }
        assertEquals(registry.size(), registry.names().size());
        assertTrue(registry.size() > 100);
    }

    @Test
    void testNamesAreSortedAndReadOnly() {
        assertEquals("ABS", registry.names().iterator().next());
        assertThrows(UnsupportedOperationException.class, () -> registry.names().add("X"));
    }
}
