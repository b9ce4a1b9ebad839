package com.acme.grc;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.config.SettingsLoader;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/** Options every subcommand accepts. */
public class CommonOptions {

    @CommandLine.Option(names = "--config", description = "YAML file overriding grc-defaults.yaml.")
    Path config;

    @CommandLine.Option(names = "--out", description = "Output JSON report path. Default: policy_control_<command>_<timestamp>.json")
    String out;

    GrcSettings settings(CommandLine.Model.CommandSpec spec) {
        try {
            return SettingsLoader.load(config);
        } catch (IOException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read --config " + config + ": " + e.getMessage(), e);
        }
    }
}
