package io.tempora.cli;

import com.google.common.base.Optional;

/**
 * Ends a command with an exit code instead of a stack trace.
 */
public class ExitException
        extends Exception
{
    private final int code;

    private ExitException(int code, String error)
    {
        super(error);
        this.code = code;
    }

    /**
     * Exit code 0 when error is null, 1 otherwise.
     */
    public static ExitException usageExit(String error)
    {
        return new ExitException(error == null ? 0 : 1, error);
    }

    public int getCode()
    {
        return code;
    }

    public Optional<String> getError()
    {
        return Optional.fromNullable(getMessage());
    }
}
