package com.socialhub.backend.support;

import java.lang.reflect.Field;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.socialhub.backend.global.jpa.AbstractTimestampedEntity;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.UserRole;

/**
 * Builds detached entities for unit tests. Ids and audit columns are normally assigned by
 * Hibernate, so they are set reflectively here.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static AppUser user(UUID id, String email) {
        AppUser user = new AppUser();
        user.setEmail(email);
        user.setFirstName("Test");
        user.setLastName("User");
        user.setPasswordHash("hash");
        user.setRole(UserRole.USER);
        setField(AppUser.class, user, "id", id);
        return user;
    }

    public static <T> T withId(T entity, UUID id) {
        setField(entity.getClass(), entity, "id", id);
        return entity;
    }

    public static <T extends AbstractTimestampedEntity> T createdAt(T entity, OffsetDateTime createdAt) {
        setField(AbstractTimestampedEntity.class, entity, "createdAt", createdAt);
        setField(AbstractTimestampedEntity.class, entity, "updatedAt", createdAt);
        return entity;
    }

    private static void setField(Class<?> owner, Object target, String name, Object value) {
        try {
            Field field = owner.getDeclaredField(name);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
