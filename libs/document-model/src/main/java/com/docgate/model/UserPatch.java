package com.docgate.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A validated set of changes to a {@link UserDocument}.
 * <p>
 * Keys are {@link UserField} values, so a patch cannot name an immutable field.
 *
 * @param expectedRev revision the caller based the change on (null when not supplied)
 * @param changes     new values by field; a null value clears the field
 */
public record UserPatch(String expectedRev, Map<UserField, String> changes) {

    public UserPatch {
        EnumMap<UserField, String> copy = new EnumMap<>(UserField.class);
        if (changes != null) {
            copy.putAll(changes);
        }
        changes = Collections.unmodifiableMap(copy);
    }

    public boolean touches(UserField field) {
        return changes.containsKey(field);
    }

    public String valueOf(UserField field) {
        return changes.get(field);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
