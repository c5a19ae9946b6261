package io.idlequeue;

import io.idlequeue.cli.IdleQueueCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new IdleQueueCommand()).execute(args);
        System.exit(code);
    }
}
