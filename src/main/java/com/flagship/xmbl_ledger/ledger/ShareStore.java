package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.share.Share;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for the share table, the owner index and the ledger-wide state.
 *
 * Implementations are not expected to serialize writers themselves;
 * {@link XmblLedger} does that. {@link #lockForWrite()} is the hook for
 * stores that must additionally lock shared storage (a database row) for
 * the rest of the current transaction.
 */
public interface ShareStore {

    /**
     * Acquires whatever storage-level lock is needed so that the calling
     * operation observes and produces a serializable view of the ledger.
     */
    void lockForWrite();

    LedgerState loadState();

    void saveState(LedgerState state);

    Optional<Share> findById(long shareId);

    /**
     * Shares owned by {@code ownerId}, ascending by id.
     */
    List<Share> findByOwner(String ownerId);

    /**
     * Every share, ascending by id.
     */
    List<Share> findAll();

    /**
     * Positions of every holder owning at least one share with a positive
     * deposit value, ascending by owner id.
     */
    List<HolderPosition> holderPositions();

    Optional<HolderPosition> holderPosition(String ownerId);

    /**
     * Inserts a new share.
     *
     * @throws IllegalStateException if a share with the same id exists
     */
    void insert(Share share);

    /**
     * Replaces an existing share (same id), keeping the owner index in sync.
     *
     * @throws IllegalStateException if no share with that id exists
     */
    void update(Share share);

    default void updateAll(Collection<? extends Share> shares) {
        shares.forEach(this::update);
    }

    void delete(long shareId);
}
