package io.blockring.bench;

/** Bad command line or configuration input; reported to the operator, exit status 1. */
final class CliException extends RuntimeException {

    CliException(String msg) {
        super(msg);
    }

    CliException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
