package com.diagramforge.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withSameComponents_returnsDeterministicId() {
        String id1 = IdGenerator.generate("api", "db");
        String id2 = IdGenerator.generate("api", "db");

        assertThat(id1).isEqualTo(id2);
        assertThat(id1).hasSize(16).matches("[0-9a-f]+");
    }

    @Test
    void generate_withDifferentOrder_returnsDifferentIds() {
        assertThat(IdGenerator.generate("api", "db")).isNotEqualTo(IdGenerator.generate("db", "api"));
    }

    @Test
    void generate_withNullComponents_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate((String[]) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
    }

    @Test
    void generate_withEmptyArray_throwsException() {
        assertThatThrownBy(IdGenerator::generate)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generateFullHash_returnsSha256Hex() {
        assertThat(IdGenerator.generateFullHash("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void generate_isPrefixOfFullHashOfJoinedComponents() {
        assertThat(IdGenerator.generate("a", "b"))
            .isEqualTo(IdGenerator.generateFullHash("a:b").substring(0, 16));
    }
}
