/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Policy Control Compiler
 */

package com.acme.grc;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "policy-control",
        mixinStandardHelpOptions = true,
        version = Reports.TOOL_VERSION,
        description = "Compiles policy text into control hierarchies, traces control links to evidence and synthesizes evidence SQL.",
        subcommands = {
                CompileCommand.class,
                TraceCommand.class,
                SynthesizeCommand.class,
                RollupCommand.class
        }
)
public class PolicyControlApp implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PolicyControlApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }
}
