package com.syncline.service.core.support;

import com.syncline.service.core.checkpoint.SyncCheckpoint;
import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.checkpoint.SyncSessionStore;
import com.syncline.service.core.feed.FeedQuery;
import com.syncline.service.core.feed.GrantKind;
import com.syncline.service.core.feed.RelationshipGrant;
import com.syncline.service.core.feed.SyncFeed;
import com.syncline.service.core.feed.SyncFeedRepository;
import com.syncline.service.core.feed.SyncRow;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncRequestType;
import com.syncline.service.core.model.VersionToken;
import com.syncline.service.core.tombstone.Tombstone;
import com.syncline.service.core.tombstone.TombstoneKind;
import com.syncline.service.core.tombstone.TombstoneLog;
import com.syncline.service.core.tombstone.TombstoneScope;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fake of every storage port. Feed rows are addressed by who may see them: a user id for user-scoped
 * feeds or a relation id for backfill feeds. Tombstone scopes are resolved against the registered grants and
 * album owners the same way the SQL predicates resolve them against the partner and album tables.
 */
public class InMemorySyncStore implements SyncFeedRepository, TombstoneLog, SyncCheckpointStore, SyncSessionStore {

    private record FeedRow(String feed, VersionToken token, SyncPayload payload, UUID visibleTo) {}

    private final List<FeedRow> rows = new ArrayList<>();
    private final List<RelationshipGrant> grants = new ArrayList<>();
    private final Map<RelationshipGrant, UUID> grantees = new LinkedHashMap<>();
    private final List<Tombstone> tombstones = new ArrayList<>();
    private final Map<UUID, Map<String, SyncCheckpoint>> checkpoints = new ConcurrentHashMap<>();
    private final Set<UUID> pendingReset = new HashSet<>();
    private final Map<UUID, Set<SyncRequestType>> streamedGroups = new ConcurrentHashMap<>();
    private final Map<UUID, UUID> albumOwners = new LinkedHashMap<>();
    private final List<FeedQuery> queries = new ArrayList<>();

    public void addRow(SyncFeed<?> feed, VersionToken token, SyncPayload payload, UUID visibleTo) {
        rows.add(new FeedRow(feed.name(), token, payload, visibleTo));
    }

    public void removeRows(SyncFeed<?> feed, UUID visibleTo) {
        rows.removeIf(r -> r.feed().equals(feed.name()) && r.visibleTo().equals(visibleTo));
    }

    public void addGrant(GrantKind kind, UUID userId, UUID relationId, VersionToken createId) {
        RelationshipGrant grant = new RelationshipGrant(kind, relationId, createId);
        grants.add(grant);
        grantees.put(grant, userId);
    }

    public void removeGrant(GrantKind kind, UUID userId, UUID relationId) {
        grants.removeIf(g -> g.kind() == kind && g.relationId().equals(relationId) && grantees.get(g).equals(userId));
        grantees.keySet().retainAll(grants);
    }

    public void addAlbum(UUID albumId, UUID ownerId) {
        albumOwners.put(albumId, ownerId);
    }

    public void storeRawCheckpoint(UUID sessionId, String type, String ack) {
        checkpoints.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(type, new SyncCheckpoint(sessionId, type, ack, Instant.EPOCH));
    }

    public String rawCheckpoint(UUID sessionId, SyncEntityType type) {
        SyncCheckpoint checkpoint = checkpoints.getOrDefault(sessionId, Map.of()).get(type.name());
        return checkpoint == null ? null : checkpoint.ack();
    }

    public List<FeedQuery> queries() {
        return queries;
    }

    // ---- SyncFeedRepository ---------------------------------------------------

    @Override
    public <P extends SyncPayload> List<SyncRow<P>> read(SyncFeed<P> feed, FeedQuery query) {
        queries.add(query);
        UUID owner = feed.scope() == SyncFeed.Scope.RELATION ? query.relationId() : query.userId();
        return rows.stream()
                .filter(r -> r.feed().equals(feed.name()))
                .filter(r -> r.visibleTo().equals(owner))
                .filter(r -> query.after() == null || r.token().compareTo(query.after()) > 0)
                .filter(r -> r.token().compareTo(query.before()) < 0)
                .filter(r -> !ceilingApplies(feed, query) || r.token().compareTo(query.ceiling()) <= 0)
                .sorted(Comparator.comparing(FeedRow::token))
                .limit(query.limit())
                .map(r -> new SyncRow<>(r.token(), feed.payloadType().cast(r.payload())))
                .toList();
    }

    /** Backfill feeds bound their own token; user-scoped feeds bound a joined link token the fake does not model. */
    private static boolean ceilingApplies(SyncFeed<?> feed, FeedQuery query) {
        return query.ceiling() != null && feed.scope() == SyncFeed.Scope.RELATION;
    }

    @Override
    public List<RelationshipGrant> grantsSince(GrantKind kind, UUID userId, VersionToken fromCreateId) {
        return grants.stream()
                .filter(g -> g.kind() == kind && grantees.get(g).equals(userId))
                .filter(g -> fromCreateId == null || g.createId().compareTo(fromCreateId) >= 0)
                .sorted(Comparator.comparing(RelationshipGrant::createId))
                .toList();
    }

    // ---- TombstoneLog ---------------------------------------------------------

    @Override
    public void append(Tombstone tombstone) {
        tombstones.add(tombstone);
    }

    @Override
    public List<Tombstone> read(TombstoneKind kind, TombstoneScope scope, FeedQuery query) {
        return tombstones.stream()
                .filter(t -> t.kind() == kind && visible(t, scope, query.userId()))
                .filter(t -> query.after() == null || t.id().compareTo(query.after()) > 0)
                .filter(t -> t.id().compareTo(query.before()) < 0)
                .sorted(Comparator.comparing(Tombstone::id))
                .limit(query.limit())
                .toList();
    }

    private boolean visible(Tombstone t, TombstoneScope scope, UUID userId) {
        String user = userId.toString();
        return switch (scope) {
            case GLOBAL -> true;
            case OWNER -> userId.equals(t.scopeOwnerId());
            case PARTNER_OWNED -> relationsOf(GrantKind.PARTNER, userId).contains(t.scopeOwnerId());
            case PARTNER_PAIR -> user.equals(t.entityId()) || user.equals(t.extraId());
            case ALBUM_SCOPED -> visibleAlbums(userId).contains(t.entityId());
            case ALBUM_MEMBER -> visibleAlbums(userId).contains(t.entityId()) || user.equals(t.extraId());
        };
    }

    private Set<UUID> relationsOf(GrantKind kind, UUID userId) {
        Set<UUID> relations = new HashSet<>();
        for (RelationshipGrant grant : grants) {
            if (grant.kind() == kind && grantees.get(grant).equals(userId)) {
                relations.add(grant.relationId());
            }
        }
        return relations;
    }

    private Set<String> visibleAlbums(UUID userId) {
        Set<String> albums = new HashSet<>();
        albumOwners.forEach((album, owner) -> {
            if (owner.equals(userId)) {
                albums.add(album.toString());
            }
        });
        relationsOf(GrantKind.ALBUM_MEMBERSHIP, userId).forEach(album -> albums.add(album.toString()));
        return albums;
    }

    @Override
    public List<String> deletedEntityIds(TombstoneKind kind, Collection<UUID> scopeOwnerIds, Instant deletedAfter) {
        return tombstones.stream()
                .filter(t -> t.kind() == kind && scopeOwnerIds.contains(t.scopeOwnerId()))
                .filter(t -> t.deletedAt().isAfter(deletedAfter))
                .map(Tombstone::entityId)
                .toList();
    }

    @Override
    public int purgeDeletedBefore(Instant cutoff) {
        int before = tombstones.size();
        tombstones.removeIf(t -> t.deletedAt().isBefore(cutoff));
        return before - tombstones.size();
    }

    // ---- SyncCheckpointStore --------------------------------------------------

    @Override
    public List<SyncCheckpoint> findBySession(UUID sessionId) {
        return List.copyOf(checkpoints.getOrDefault(sessionId, Map.of()).values());
    }

    @Override
    public int advance(UUID sessionId, Collection<SyncAck> acks) {
        Map<String, SyncCheckpoint> session = checkpoints.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>());
        int advanced = 0;
        for (SyncAck ack : acks) {
            SyncCheckpoint current = session.get(ack.type().name());
            if (current == null || ack.isAfter(SyncAck.parse(current.ack()))) {
                session.put(
                        ack.type().name(),
                        new SyncCheckpoint(sessionId, ack.type().name(), ack.encode(), Instant.EPOCH));
                advanced++;
            }
        }
        return advanced;
    }

    @Override
    public int deleteAll(UUID sessionId) {
        Map<String, SyncCheckpoint> removed = checkpoints.remove(sessionId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public int deleteTypes(UUID sessionId, Collection<SyncEntityType> types) {
        Map<String, SyncCheckpoint> session = checkpoints.get(sessionId);
        if (session == null) {
            return 0;
        }
        int removed = 0;
        for (SyncEntityType type : types) {
            if (session.remove(type.name()) != null) {
                removed++;
            }
        }
        return removed;
    }

    // ---- SyncSessionStore -----------------------------------------------------

    @Override
    public boolean isPendingSyncReset(UUID sessionId) {
        return pendingReset.contains(sessionId);
    }

    @Override
    public void setPendingSyncReset(UUID sessionId, boolean pending) {
        if (pending) {
            pendingReset.add(sessionId);
        } else {
            pendingReset.remove(sessionId);
        }
    }

    @Override
    public void addStreamedGroups(UUID sessionId, Set<SyncRequestType> groups) {
        streamedGroups.computeIfAbsent(sessionId, k -> EnumSet.noneOf(SyncRequestType.class)).addAll(groups);
    }

    @Override
    public Set<SyncRequestType> findStreamedGroups(UUID sessionId) {
        Set<SyncRequestType> groups = streamedGroups.get(sessionId);
        return groups == null ? EnumSet.noneOf(SyncRequestType.class) : EnumSet.copyOf(groups);
    }
}
