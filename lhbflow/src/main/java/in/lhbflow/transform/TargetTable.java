package in.lhbflow.transform;

import java.util.List;
import java.util.Set;

/**
 * Downstream tables fed by the adapter, with the columns that identify a row.
 */
public enum TargetTable {
    TRADE_FLOW("trade_flow", List.of("trade_date", "code")),
    SEAT_DAILY("seat_daily", List.of("trade_date", "code", "seat_name")),
    DAILY_QUOTES("daily_quotes", List.of("trade_date", "code"));

    /** Columns coerced to numbers; unparseable values become 0. */
    public static final Set<String> NUMERIC_COLUMNS = Set.of(
        "buy_amt", "sell_amt", "net_amt", "lhb_buy", "lhb_sell", "lhb_net_buy", "lhb_turnover_ratio",
        "open", "high", "low", "close", "volume", "amount", "turnover", "pct_chg",
        "avg_price", "pe_ttm", "pb", "total_mv");

    /** Columns stored as strings; null becomes empty. */
    public static final Set<String> TEXT_COLUMNS = Set.of("code", "name", "seat_name", "seat_type", "reason");

    private final String tableName;
    private final List<String> keyColumns;

    TargetTable(String tableName, List<String> keyColumns) {
        this.tableName = tableName;
        this.keyColumns = keyColumns;
    }

    public String tableName() {
        return tableName;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }
}
