package com.syncline.service.core.feed;

import com.syncline.service.core.model.VersionToken;
import java.util.UUID;

/**
 * @param relationId partner (sharing user) id or album id
 * @param createId token stamped when the relationship was created
 */
public record RelationshipGrant(GrantKind kind, UUID relationId, VersionToken createId) {}
