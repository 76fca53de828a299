package com.questrail.videowall;

import com.questrail.videowall.cli.VideoWallCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new VideoWallCommand()).execute(args);
        System.exit(code);
    }
}
