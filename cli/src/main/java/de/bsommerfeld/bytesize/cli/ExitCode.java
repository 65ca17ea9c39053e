package de.bsommerfeld.bytesize.cli;

/**
 * Process exit codes. Every failure, including invalid arguments, is 1.
 */
final class ExitCode {
    static final int OK = 0;
    static final int ERROR = 1;

    private ExitCode() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ExitCode.class.getName()));
    }
}
