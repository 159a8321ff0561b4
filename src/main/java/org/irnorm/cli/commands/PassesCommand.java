package org.irnorm.cli.commands;

import org.irnorm.cli.CommandLineInterface;
import org.irnorm.config.NormalizerConfig;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassRegistry;
import org.irnorm.compiler.passes.PassScheduler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "passes", description = "Lists the configured pass pipeline.")
public class PassesCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--all", description = "List every registered pass, not only the configured ones.")
    private boolean all;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PassRegistry registry = PassRegistry.initializeWithDefaults();
        List<String> names = all
                ? registry.names()
                : NormalizerConfig.fromConfig(parent.getConfig()).passes();
        List<INormalizationPass> passes = new PassScheduler(registry, names).passes();
        for (int i = 0; i < passes.size(); i++) {
            INormalizationPass pass = passes.get(i);
            out.printf("%2d  %-10s  %s%n", i + 1, pass.tier(), pass.name());
        }
        return 0;
    }
}
