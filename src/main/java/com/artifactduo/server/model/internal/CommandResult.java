package com.artifactduo.server.model.internal;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class CommandResult {

    private String command;

    private int exitCode; // -1 表示命令没有返回 exit code

    private String output;

    private CommandResult() {}

    public static CommandResult of(String command, int exitCode, String output) {
        return new CommandResult().setCommand(command).setExitCode(exitCode).setOutput(output);
    }

    public boolean isSuccess() {
        return this.exitCode == 0;
    }
}
