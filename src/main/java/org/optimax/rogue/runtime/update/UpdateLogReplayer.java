package org.optimax.rogue.runtime.update;

import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.UnknownEntityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Client-side consumer of the update log. Applies records to a view in strictly ascending
 * order and reports any failure as a {@link DesyncException} so the transport can request a
 * full resync.
 */
public final class UpdateLogReplayer {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateLogReplayer.class);

    private GameState state;
    private long lastOrder;

    public UpdateLogReplayer(GameState state) {
        this.state = state;
        this.lastOrder = 0L;
    }

    public GameState getState() {
        return state;
    }

    public long getLastOrder() {
        return lastOrder;
    }

    /**
     * Call when a tick starts, before its first record.
     */
    public void beginTick() {
        state.refreshAttributes();
    }

    /**
     * @throws DesyncException if the record is out of order or cannot be applied
     */
    public void accept(GameStateUpdate update) {
        if (update.getOrder() <= lastOrder) {
            throw new DesyncException(update.getOrder(), "record arrived after order " + lastOrder);
        }
        try {
            update.apply(state);
        } catch (UnknownEntityException | IllegalStateException e) {
            throw new DesyncException(update.getOrder(), e.getMessage(), e);
        }
        lastOrder = update.getOrder();
    }

    public void acceptAll(List<? extends GameStateUpdate> updates) {
        for (GameStateUpdate update : updates) {
            accept(update);
        }
    }

    /**
     * Replaces the view with a fresh one from the server. The order counter is kept: the
     * server never reuses an order.
     */
    public void resync(GameState freshState) {
        LOG.debug("Resynchronised at tick {} after update {}", freshState.getTick(), lastOrder);
        this.state = freshState;
    }
}
