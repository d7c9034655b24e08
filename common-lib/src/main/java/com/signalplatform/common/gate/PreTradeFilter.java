package com.signalplatform.common.gate;

import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;

/**
 * One market-condition check of the pre-trade gate.
 *
 * <p>Filters are pure: the verdict depends on the snapshot alone (including its
 * {@code observedAt}), never on the wall clock. They may assume the gate has already
 * checked that the snapshot holds enough candles.
 */
public interface PreTradeFilter {

    String name();

    /** A failing critical filter vetoes the trade regardless of the aggregate score. */
    boolean critical();

    FilterResult evaluate(MicrostructureSnapshot snapshot);
}
