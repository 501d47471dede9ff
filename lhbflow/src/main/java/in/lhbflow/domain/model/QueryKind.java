package in.lhbflow.domain.model;

import java.util.List;

/**
 * Logical query types served by the data provider adapter.
 */
public enum QueryKind {
    TRADE_FLOW(List.of(
        "ths_lhb_buy_amount_stock",
        "ths_lhb_sell_amount_stock",
        "ths_lhb_net_buy_amount_stock",
        "ths_lhb_turnover_ratio_stock",
        "ths_lhb_reason_stock")),

    SEAT_DETAIL(List.of(
        "ths_lhb_seat_name_stock",
        "ths_lhb_seat_type_stock",
        "ths_lhb_buy_amount_seat_stock",
        "ths_lhb_sell_amount_seat_stock")),

    HISTORY_QUOTES(List.of(
        "open", "high", "low", "close", "volume", "amount",
        "turn", "pctChg", "avgPrice", "pe_ttm", "pb", "total_mv")),

    INSTRUMENT_LIST(List.of("ths_stock_code_stock"));

    private final List<String> defaultIndicators;

    QueryKind(List<String> defaultIndicators) {
        this.defaultIndicators = defaultIndicators;
    }

    /**
     * Indicator set used when a query does not name its own.
     */
    public List<String> defaultIndicators() {
        return defaultIndicators;
    }
}
