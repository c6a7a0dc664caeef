package com.docgate.gateway.table;

import com.docgate.model.DocumentCodec;
import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.VirtualDocument;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Shapes stored documents into what clients see: user ids without their namespace prefix. */
final class DocumentViews {

    private DocumentViews() {
        // utility class
    }

    static ObjectNode view(VirtualDocument document) {
        ObjectNode json = DocumentCodec.toJson(document);
        json.put("_id", IdentifierMapper.internalToExternal(document.id()));
        if (document instanceof TenantDocument tenant) {
            json.put("ownerId", IdentifierMapper.internalToExternal(tenant.ownerId()));
            ArrayNode members = json.putArray("memberIds");
            tenant.memberIds().forEach(member -> members.add(IdentifierMapper.internalToExternal(member)));
        }
        return json;
    }

    static ObjectNode deleted(String externalId, String rev) {
        ObjectNode json = DocumentCodec.objectMapper().createObjectNode();
        json.put("ok", true);
        json.put("id", externalId);
        json.put("rev", rev);
        json.put("deleted", true);
        return json;
    }
}
