package in.lhbflow.infrastructure.terminal;

/**
 * Logical query types understood by the upstream terminal.
 *
 * Positional parameters per operation:
 * <ul>
 *   <li>INSTRUMENT_LIST / DATA_POOL: reportName, time, filter, fields</li>
 *   <li>HISTORY_QUOTES: codes, indicators, jsonParam, startDate, endDate</li>
 *   <li>BASIC_DATA: codes, indicators, param</li>
 * </ul>
 */
public enum TerminalOperation {
    INSTRUMENT_LIST("data_pool", 4),
    DATA_POOL("data_pool", 4),
    HISTORY_QUOTES("cmd_history_quotation", 5),
    BASIC_DATA("basic_data_service", 3);

    private final String endpoint;
    private final int arity;

    TerminalOperation(String endpoint, int arity) {
        this.endpoint = endpoint;
        this.arity = arity;
    }

    public String endpoint() {
        return endpoint;
    }

    public int arity() {
        return arity;
    }
}
