package com.trading.fincalc.solver;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of cash flows handed to the root finder.
 *
 * <p>
 * Times are non-decreasing and non-negative; at least two flows are required.
 * By convention the first flow is the (negative) investment.
 */
public final class CashFlowSeries {
    private final List<CashFlow> flows;

    private CashFlowSeries(List<CashFlow> flows) {
        if (flows.size() < 2)
            throw new IllegalArgumentException("A cash flow series needs at least 2 flows, got " + flows.size());
        for (int i = 1; i < flows.size(); i++) {
            if (flows.get(i).time().compareTo(flows.get(i - 1).time()) < 0) {
                throw new IllegalArgumentException("Cash flow times must be non-decreasing: flow " + i
                        + " at t=" + flows.get(i).time() + " follows t=" + flows.get(i - 1).time());
            }
        }
        this.flows = Collections.unmodifiableList(flows);
    }

    /** Places the amounts at t = 0, 1, 2, ... */
    public static CashFlowSeries periodic(BigDecimal... amounts) {
        return periodic(List.of(amounts));
    }

    /** Places the amounts at t = 0, 1, 2, ... */
    public static CashFlowSeries periodic(List<BigDecimal> amounts) {
        List<CashFlow> list = new ArrayList<>(amounts.size());
        for (int t = 0; t < amounts.size(); t++)
            list.add(new CashFlow(BigDecimal.valueOf(t), amounts.get(t)));
        return new CashFlowSeries(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CashFlow> flows() {
        return flows;
    }

    public int size() {
        return flows.size();
    }

    public CashFlow get(int index) {
        return flows.get(index);
    }

    @Override
    public String toString() {
        return "CashFlowSeries" + flows;
    }

    /** Accumulates flows in time order. */
    public static final class Builder {
        private final List<CashFlow> flows = new ArrayList<>();

        private Builder() {
        }

        public Builder add(BigDecimal time, BigDecimal amount) {
            flows.add(new CashFlow(time, amount));
            return this;
        }

        public Builder add(long time, BigDecimal amount) {
            return add(BigDecimal.valueOf(time), amount);
        }

        public CashFlowSeries build() {
            return new CashFlowSeries(new ArrayList<>(flows));
        }
    }
}
