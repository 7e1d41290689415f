package com.vistaplan.orchestrator;

import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;

/** Test object helpers shared across packages. */
public final class TestEntities {

    private TestEntities() {}

    /** Set the id that JPA would normally assign on persist. */
    public static <T> T withId(T entity) {
        return withId(entity, UUID.randomUUID());
    }

    public static <T> T withId(T entity, UUID id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }
}
