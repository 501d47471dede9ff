package in.lhbflow.infrastructure.provider.resolve;

import java.util.OptionalInt;

/**
 * Decides whether a normalized answer ends the fallback sequence.
 */
@FunctionalInterface
public interface SuccessPredicate {

    boolean test(OptionalInt statusCode, int rowCount);

    /**
     * Rows present and no error code (a missing code counts as success).
     */
    SuccessPredicate NON_EMPTY_OK = (statusCode, rowCount) -> rowCount > 0 && statusCode.orElse(0) == 0;
}
