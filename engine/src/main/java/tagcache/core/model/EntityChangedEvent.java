package tagcache.core.model;

import java.util.Objects;

/**
 * Domain-level mutation observed by a cache client.
 *
 * <p>Fired as a CDI event after the system of record committed the change.
 *
 * @param entityType the changed entity type, also the tag its cache entries carry
 * @param entityId   the changed record id (may be null for bulk changes)
 * @param changeType what happened to the record
 */
public record EntityChangedEvent(String entityType, String entityId, ChangeType changeType) {

    public EntityChangedEvent {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(changeType, "changeType");
    }

    public static EntityChangedEvent created(String entityType, String entityId) {
        return new EntityChangedEvent(entityType, entityId, ChangeType.CREATED);
    }

    public static EntityChangedEvent updated(String entityType, String entityId) {
        return new EntityChangedEvent(entityType, entityId, ChangeType.UPDATED);
    }

    public static EntityChangedEvent deleted(String entityType, String entityId) {
        return new EntityChangedEvent(entityType, entityId, ChangeType.DELETED);
    }

    public enum ChangeType {
        CREATED,
        UPDATED,
        DELETED
    }
}
