package com.docgate.security;

import com.docgate.model.DocumentCodec;
import com.docgate.model.DocumentKind;
import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantPatch;
import com.docgate.model.UserField;
import com.docgate.model.UserPatch;
import com.docgate.model.error.ImmutableFieldException;
import com.docgate.model.error.InvalidRequestException;
import com.docgate.model.error.MalformedIdentifierException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns untyped JSON write bodies into typed patches.
 * <p>
 * The whole body is inspected before anything is rejected. Immutable fields win over every other
 * problem: a body naming {@code ownerId} and an unknown field fails with an
 * {@link ImmutableFieldException} listing {@code ownerId}. {@code _rev} is read as the caller's
 * expected revision.
 */
public final class PatchPolicy {

    public static final String REV = "_rev";

    public static final Set<String> IMMUTABLE_USER_FIELDS = Set.of(
            "_id", "type", "subject", "personalTenantId", "deleted", "createdAt", "updatedAt");

    public static final Set<String> IMMUTABLE_TENANT_FIELDS = Set.of(
            "_id", "type", "ownerId", "memberIds", "personal", "deleted", "createdAt", "updatedAt");

    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };

    private PatchPolicy() {
        // utility class
    }

    public static UserPatch userPatch(JsonNode body) {
        requireObject(body);
        rejectImmutable(body, IMMUTABLE_USER_FIELDS);

        List<String> errors = new ArrayList<>();
        Map<UserField, String> changes = new EnumMap<>(UserField.class);
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (REV.equals(entry.getKey())) {
                continue;
            }
            UserField field = UserField.fromJsonName(entry.getKey()).orElse(null);
            if (field == null) {
                errors.add("field not allowed: " + entry.getKey());
                continue;
            }
            JsonNode value = entry.getValue();
            switch (field) {
                case DISPLAY_NAME, EMAIL -> {
                    if (value.isNull()) {
                        changes.put(field, null);
                    } else if (value.isTextual()) {
                        changes.put(field, value.textValue());
                    } else {
                        errors.add(field.jsonName() + " must be a string or null");
                    }
                }
                case ACTIVE_TENANT_ID -> {
                    if (!value.isTextual()) {
                        errors.add("activeTenantId must be a tenant id");
                    } else if (isTenantId(value.textValue())) {
                        changes.put(field, value.textValue());
                    } else {
                        errors.add("activeTenantId is not a tenant id: " + value.textValue());
                    }
                }
            }
        }
        throwIfAny(errors);
        return new UserPatch(expectedRev(body, errors), changes);
    }

    public static TenantPatch tenantPatch(JsonNode body) {
        requireObject(body);
        rejectImmutable(body, IMMUTABLE_TENANT_FIELDS);
        return readTenantFields(body, false);
    }

    /**
     * Reads the body of a tenant creation. Same rules as {@link #tenantPatch(JsonNode)}, except that
     * {@code name} is required and {@code _rev} is refused.
     */
    public static TenantPatch tenantCreate(JsonNode body) {
        requireObject(body);
        rejectImmutable(body, IMMUTABLE_TENANT_FIELDS);
        if (body.has(REV)) {
            throw new InvalidRequestException("a new tenant cannot carry _rev");
        }
        return readTenantFields(body, true);
    }

    private static TenantPatch readTenantFields(JsonNode body, boolean nameRequired) {
        List<String> errors = new ArrayList<>();
        String name = null;
        Map<String, Object> metadata = null;
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            switch (entry.getKey()) {
                case REV -> {
                    // expected revision, read below
                }
                case "name" -> {
                    if (value.isTextual() && !value.textValue().isBlank()) {
                        name = value.textValue();
                    } else {
                        errors.add("name must be a non-blank string");
                    }
                }
                case "metadata" -> {
                    if (value.isObject()) {
                        metadata = DocumentCodec.objectMapper().convertValue(value, METADATA);
                    } else {
                        errors.add("metadata must be an object");
                    }
                }
                default -> errors.add("field not allowed: " + entry.getKey());
            }
        }
        if (nameRequired && name == null && !body.has("name")) {
            errors.add("name is required");
        }
        throwIfAny(errors);
        return new TenantPatch(expectedRev(body, errors), name, metadata);
    }

    private static void requireObject(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("request body must be a JSON object");
        }
    }

    private static void rejectImmutable(JsonNode body, Set<String> immutable) {
        List<String> offending = new ArrayList<>();
        body.fieldNames().forEachRemaining(name -> {
            if (immutable.contains(name)) {
                offending.add(name);
            }
        });
        if (!offending.isEmpty()) {
            throw new ImmutableFieldException(offending);
        }
    }

    private static String expectedRev(JsonNode body, List<String> errors) {
        JsonNode rev = body.get(REV);
        if (rev == null || rev.isNull()) {
            return null;
        }
        if (!rev.isTextual() || rev.textValue().isBlank()) {
            errors.add("_rev must be a non-blank string");
            throwIfAny(errors);
        }
        return rev.textValue();
    }

    private static boolean isTenantId(String value) {
        try {
            IdentifierMapper.externalToInternal(DocumentKind.TENANT, value);
            return true;
        } catch (MalformedIdentifierException e) {
            return false;
        }
    }

    private static void throwIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new InvalidRequestException(String.join("; ", errors));
        }
    }
}
