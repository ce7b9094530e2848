package io.fullerstack.csms.auth;

import io.fullerstack.csms.model.IdTag;
import io.fullerstack.csms.model.Verdict;
import io.fullerstack.csms.store.ChargingStore;
import io.fullerstack.csms.store.StorageReads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves identity tags to authorization verdicts, keeping an advisory copy of each verdict
 * for a fixed lifetime.
 * <p>
 * Verdict precedence, evaluated in order:
 * <ol>
 *   <li>tag unknown: INVALID</li>
 *   <li>tag blocked: BLOCKED</li>
 *   <li>tag expiry in the past: EXPIRED</li>
 *   <li>tag stored with any other non-accepted status: that status</li>
 *   <li>parent present and the parent's own verdict is not ACCEPTED: the parent's verdict
 *       (one level, the parent's parent is not consulted)</li>
 *   <li>otherwise ACCEPTED</li>
 * </ol>
 * <p>
 * The cache lifetime bounds the staleness of the copy. The tag's own expiry bounds the
 * validity of an ACCEPTED verdict: a cached acceptance whose tag (or parent) expired since
 * it was cached resolves to EXPIRED without a store lookup.
 * </p>
 * <p>
 * Each tag maps to a future verdict. The store lookup runs outside the map's locks, by the
 * thread that installed the future; concurrent resolutions of the same tag wait on that one
 * lookup, and resolutions of different tags never wait on each other. A failed lookup is
 * not cached.
 * </p>
 */
public class AuthorizationCache {
    private static final Logger logger = LoggerFactory.getLogger(AuthorizationCache.class);

    private final ChargingStore store;
    private final StorageReads reads;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CompletableFuture<CachedVerdict>> entries;

    public AuthorizationCache(ChargingStore store, StorageReads reads, Duration ttl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.reads = Objects.requireNonNull(reads, "reads must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.entries = new ConcurrentHashMap<>();
    }

    /**
     * Resolves the verdict for a tag.
     *
     * @throws io.fullerstack.csms.store.StorageException if the store lookup fails after its retry
     */
    public Verdict resolve(String tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        Instant now = clock.instant();

        CompletableFuture<CachedVerdict> entry = entries.get(tag);
        if (entry == null || isStale(entry, now)) {
            CompletableFuture<CachedVerdict> fresh = new CompletableFuture<>();
            entry = entries.compute(tag, (key, current) ->
                current != null && !isStale(current, now) ? current : fresh);
            if (entry == fresh) {
                load(tag, fresh, now);
            }
        } else {
            logger.trace("Authorization cache hit for {}", tag);
        }
        return await(entry).verdictAt(now);
    }

    private void load(String tag, CompletableFuture<CachedVerdict> fresh, Instant now) {
        try {
            fresh.complete(evaluate(tag, now));
        } catch (RuntimeException e) {
            entries.remove(tag, fresh);
            fresh.completeExceptionally(e);
        }
    }

    private static CachedVerdict await(CompletableFuture<CachedVerdict> entry) {
        try {
            return entry.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * An in-flight lookup is never stale; a failed one always is.
     */
    private static boolean isStale(CompletableFuture<CachedVerdict> entry, Instant now) {
        if (!entry.isDone()) {
            return false;
        }
        if (entry.isCompletedExceptionally()) {
            return true;
        }
        return entry.join().isStaleAt(now);
    }

    /**
     * Forces the next {@link #resolve(String)} of this tag to go to the store.
     */
    public void invalidate(String tag) {
        if (entries.remove(tag) != null) {
            logger.debug("Invalidated cached verdict for {}", tag);
        }
    }

    /**
     * Drops every cached verdict, e.g. on a cache-clear command.
     */
    public void invalidateAll() {
        int size = entries.size();
        entries.clear();
        logger.info("Authorization cache cleared ({} entries)", size);
    }

    public int size() {
        return entries.size();
    }

    private CachedVerdict evaluate(String tag, Instant now) {
        Optional<IdTag> idTag = reads.read("id tag " + tag, () -> store.findIdTag(tag));
        if (idTag.isEmpty()) {
            logger.info("Unknown id tag {}", tag);
            return new CachedVerdict(Verdict.INVALID, null, now.plus(ttl));
        }

        IdTag own = idTag.get();
        Verdict ownVerdict = ownVerdict(own, now);
        if (!ownVerdict.isAccepted()) {
            logger.info("Id tag {} resolved to {}", tag, ownVerdict);
            return new CachedVerdict(ownVerdict, null, now.plus(ttl));
        }

        Instant validUntil = own.expiryDate();
        if (own.hasParent()) {
            Optional<IdTag> parent = reads.read("parent id tag " + own.parentTag(),
                () -> store.findIdTag(own.parentTag()));
            Verdict parentVerdict = parent.map(p -> ownVerdict(p, now)).orElse(Verdict.INVALID);
            if (!parentVerdict.isAccepted()) {
                logger.info("Id tag {} defers to parent {}: {}", tag, own.parentTag(), parentVerdict);
                return new CachedVerdict(parentVerdict, null, now.plus(ttl));
            }
            validUntil = earliest(validUntil, parent.get().expiryDate());
        }

        return new CachedVerdict(Verdict.ACCEPTED, validUntil, now.plus(ttl));
    }

    /**
     * Verdict of a single tag, ignoring its parent.
     */
    private static Verdict ownVerdict(IdTag idTag, Instant now) {
        if (idTag.status() == Verdict.BLOCKED) {
            return Verdict.BLOCKED;
        }
        if (idTag.isExpiredAt(now)) {
            return Verdict.EXPIRED;
        }
        return idTag.status();
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    /**
     * A cached verdict.
     *
     * @param verdict     verdict at the time of evaluation
     * @param validUntil  expiry of an ACCEPTED verdict (tag or parent expiry), null if none
     * @param cachedUntil end of the cache lifetime of this copy
     */
    private record CachedVerdict(Verdict verdict, Instant validUntil, Instant cachedUntil) {

        boolean isStaleAt(Instant now) {
            return !now.isBefore(cachedUntil);
        }

        Verdict verdictAt(Instant now) {
            if (verdict.isAccepted() && validUntil != null && validUntil.isBefore(now)) {
                return Verdict.EXPIRED;
            }
            return verdict;
        }
    }
}
