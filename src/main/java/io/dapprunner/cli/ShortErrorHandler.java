package io.dapprunner.cli;

import io.dapprunner.descriptor.DescriptorException;
import picocli.CommandLine;

/**
 * Keeps CLI failures short and focused on the root cause. Descriptor errors exit with code 2.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int DESCRIPTOR_ERROR_EXIT_CODE = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("dapprunner.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof DescriptorException) {
            return DESCRIPTOR_ERROR_EXIT_CODE;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
