package in.lhbflow.infrastructure.provider.resolve;

import in.lhbflow.infrastructure.terminal.TerminalOperation;

import java.util.List;
import java.util.Objects;

/**
 * One concrete way of asking the terminal for the same data.
 *
 * @param description human readable label used in traces and logs
 * @param operation   terminal operation to invoke
 * @param params      positional parameters, exactly {@code operation.arity()} of them
 */
public record InvocationShape(String description, TerminalOperation operation, List<String> params) {

    public InvocationShape {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(operation, "operation");
        params = List.copyOf(params);
        if (params.size() != operation.arity()) {
            throw new IllegalArgumentException(operation + " takes " + operation.arity()
                + " parameters, got " + params.size());
        }
    }

    public static InvocationShape of(String description, TerminalOperation operation, String... params) {
        return new InvocationShape(description, operation, List.of(params));
    }
}
