package io.didacli;

import io.didacli.cli.DidaCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = DidaCommand.newCommandLine(new DidaCommand()).execute(args);
        System.exit(code);
    }
}
