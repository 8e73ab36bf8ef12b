package com.phylogenetics.nexus.cli;

import java.io.PrintWriter;
import java.io.StringWriter;

import com.phylogenetics.nexus.NexusToolsApplication;

import picocli.CommandLine;

/**
 * Runs the nexus-tools command line in-process and captures what it prints.
 */
class CliTestSupport {

    final StringWriter out = new StringWriter();

    int run(String... args) {
        CommandLine cmd = NexusToolsApplication.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        return cmd.execute(args);
    }

    String output() {
        return out.toString();
    }
}
