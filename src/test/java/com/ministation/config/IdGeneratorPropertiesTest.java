package com.ministation.config;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IdGeneratorPropertiesTest {

    @Test
    void trailingNumber_ShouldTakeLastDigitRun() {
        assertEquals(3, IdGeneratorProperties.trailingNumber("station-3"));
        assertEquals(12, IdGeneratorProperties.trailingNumber("node7-rack12"));
        assertEquals(4, IdGeneratorProperties.trailingNumber("edge4-a"));
        assertEquals(-1, IdGeneratorProperties.trailingNumber("station"));
        assertEquals(-1, IdGeneratorProperties.trailingNumber(""));
        assertEquals(-1, IdGeneratorProperties.trailingNumber(null));
    }

    @Test
    void effectiveWorkerId_ShouldPreferExplicitValue() {
        IdGeneratorProperties props = new IdGeneratorProperties();
        props.setWorkerId(5);
        props.setInstanceId("station-3");
        assertEquals(OptionalLong.of(5), props.effectiveWorkerId());
    }

    @Test
    void effectiveWorkerId_ShouldDeriveFromInstanceIdAndWrap() {
        IdGeneratorProperties props = new IdGeneratorProperties();
        props.setInstanceId("station-3");
        assertEquals(OptionalLong.of(2), props.effectiveWorkerId());

        props.setInstanceId("station-35");
        assertEquals(OptionalLong.of(2), props.effectiveWorkerId());

        props.setDatacenterId(33);
        assertEquals(1, props.effectiveDatacenterId());
    }

    @Test
    void effectiveWorkerId_ShouldBeEmptyWithoutHint() {
        IdGeneratorProperties props = new IdGeneratorProperties();
        assertEquals(OptionalLong.empty(), props.effectiveWorkerId());

        props.setInstanceId("station-0");
        assertEquals(OptionalLong.empty(), props.effectiveWorkerId());
    }
}
