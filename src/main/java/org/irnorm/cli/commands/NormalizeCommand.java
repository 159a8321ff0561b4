package org.irnorm.cli.commands;

import org.irnorm.cli.CommandLineInterface;
import org.irnorm.compiler.Normalizer;
import org.irnorm.compiler.api.NormalizationException;
import org.irnorm.compiler.api.NormalizationResult;
import org.irnorm.compiler.codec.IrFormatException;
import org.irnorm.compiler.codec.IrJsonCodec;
import org.irnorm.compiler.codec.IrPrinter;
import org.irnorm.compiler.diagnostics.Diagnostic;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.config.NormalizerConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "normalize", description = "Normalizes an IR tree given as JSON.")
public class NormalizeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The IR JSON file to normalize.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Where to write the result (default: standard output).")
    private File output;

    @Option(names = "--dump", description = "Write the human-readable tree dump instead of JSON.")
    private boolean dump;

    @Option(names = {"-v", "--verbosity"}, description = "Log verbosity (0=error .. 4=trace).")
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        IrJsonCodec codec = new IrJsonCodec();
        IrNode unit;
        try {
            unit = codec.fromJson(Files.readString(file.toPath(), StandardCharsets.UTF_8));
        } catch (IrFormatException e) {
            err.println("Invalid IR in " + file + ": " + e.getMessage());
            return 2;
        } catch (MalformedInputException e) {
            err.println("Invalid IR in " + file + ": not UTF-8 text");
            return 2;
        }

        Normalizer normalizer = new Normalizer(NormalizerConfig.fromConfig(parent.getConfig()));
        if (verbosity != null) {
            normalizer.setVerbosity(verbosity);
        }
        NormalizationResult result;
        try {
            result = normalizer.normalize(unit);
        } catch (NormalizationException e) {
            err.println(e.getMessage());
            return 1;
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic);
        }

        String text = dump ? IrPrinter.print(result.tree()) : codec.toJson(result.tree());
        if (output != null) {
            Files.writeString(output.toPath(), text + System.lineSeparator(), StandardCharsets.UTF_8);
        } else {
            spec.commandLine().getOut().println(text);
        }
        return 0;
    }
}
