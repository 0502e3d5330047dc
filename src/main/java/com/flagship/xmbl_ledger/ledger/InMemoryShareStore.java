package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.share.Share;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Heap-backed store with an incrementally maintained owner index.
 *
 * Not thread-safe; callers serialize access (see {@link XmblLedger}).
 */
public class InMemoryShareStore implements ShareStore {

    private final NavigableMap<Long, Share> shares = new TreeMap<>();
    private final NavigableMap<String, SortedSet<Long>> sharesByOwner = new TreeMap<>();
    private final Map<String, BigInteger> depositByOwner = new TreeMap<>();
    private LedgerState state = LedgerState.initial();

    @Override
    public void lockForWrite() {
        // Single process, single heap: the ledger lock is sufficient
    }

    @Override
    public LedgerState loadState() {
        return state;
    }

    @Override
    public void saveState(LedgerState state) {
        this.state = state;
    }

    @Override
    public Optional<Share> findById(long shareId) {
        return Optional.ofNullable(shares.get(shareId));
    }

    @Override
    public List<Share> findByOwner(String ownerId) {
        SortedSet<Long> ids = sharesByOwner.get(ownerId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(shares::get).toList();
    }

    @Override
    public List<Share> findAll() {
        return List.copyOf(shares.values());
    }

    @Override
    public List<HolderPosition> holderPositions() {
        List<HolderPosition> positions = new ArrayList<>();
        for (String ownerId : sharesByOwner.keySet()) {
            holderPosition(ownerId).ifPresent(positions::add);
        }
        return positions;
    }

    @Override
    public Optional<HolderPosition> holderPosition(String ownerId) {
        SortedSet<Long> ids = sharesByOwner.get(ownerId);
        if (ids == null) {
            return Optional.empty();
        }
        List<Long> weighted = ids.stream()
            .filter(id -> shares.get(id).getDepositValue().signum() > 0)
            .toList();
        if (weighted.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new HolderPosition(ownerId, weighted, depositByOwner.get(ownerId)));
    }

    @Override
    public void insert(Share share) {
        if (shares.containsKey(share.getId())) {
            throw new IllegalStateException("Share id already in use: " + share.getId());
        }
        shares.put(share.getId(), share);
        index(share);
    }

    @Override
    public void update(Share share) {
        Share previous = shares.get(share.getId());
        if (previous == null) {
            throw new IllegalStateException("Share not found: " + share.getId());
        }
        unindex(previous);
        shares.put(share.getId(), share);
        index(share);
    }

    @Override
    public void delete(long shareId) {
        Share removed = shares.remove(shareId);
        if (removed != null) {
            unindex(removed);
        }
    }

    private void index(Share share) {
        sharesByOwner.computeIfAbsent(share.getOwnerId(), owner -> new TreeSet<>()).add(share.getId());
        depositByOwner.merge(share.getOwnerId(), share.getDepositValue(), Amounts::add);
    }

    private void unindex(Share share) {
        String owner = share.getOwnerId();
        SortedSet<Long> ids = sharesByOwner.get(owner);
        if (ids != null) {
            ids.remove(share.getId());
            if (ids.isEmpty()) {
                sharesByOwner.remove(owner);
                depositByOwner.remove(owner);
                return;
            }
        }
        depositByOwner.computeIfPresent(owner, (key, total) -> Amounts.subtract(total, share.getDepositValue()));
    }
}
