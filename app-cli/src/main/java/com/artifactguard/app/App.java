package com.artifactguard.app;

import com.artifactguard.app.cli.ScanCommand;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    private App() {}

    public static void main(String[] args) {
        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        int exit = ScanCommand.commandLine(new ScanCommand()).execute(args);
        System.exit(exit);
    }
}
