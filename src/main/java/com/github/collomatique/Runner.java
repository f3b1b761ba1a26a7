package com.github.collomatique;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.github.collomatique.eval.EvalException;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.parser.CheckedAst;
import com.github.collomatique.parser.ParsingException;
import com.github.collomatique.parser.SemanticException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a standalone collo-ml file: the rendered docstring of its {@code main()} function, then
 * the value it returns. Diagnostics go to the same output, one per line.
 */
@Slf4j
public class Runner implements ConfigReader.ConfigTarget {

    private List<String> lookupPath = new ArrayList<>();
    private final PrintStream out;

    public Runner() {
        this(System.out);
    }

    public Runner(PrintStream out) {
        this.out = out;
    }

    @Override
    public void setLookupPath(List<String> lookupPath) {
        this.lookupPath = lookupPath;
    }

    public void runFile(String file) {
        var path = resolve(file);
        String source;
        try {
            source = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.debug("running {}", path);

        CheckedAst ast;
        try {
            ast = CheckedAst.compile(source);
        } catch (ParsingException e) {
            out.println("parse error " + e.kind() + " line " + e.span().line(source));
            return;
        } catch (SemanticException e) {
            for (var error : e.errors()) {
                out.println("error " + error.kind() + " line " + error.span().line(source));
            }
            return;
        }
        for (var warning : ast.warnings()) {
            out.println("warning " + warning.kind() + " line " + warning.span().line(source));
        }

        var main = ast.unit().functions().get("main");
        if (main == null || !main.params().isEmpty()) {
            return;
        }
        try {
            for (var line : ast.docstring(ObjectEnv.EMPTY, "main", List.of())) {
                out.println(line);
            }
            out.println(ast.quickEvalFn("main", List.of()));
        } catch (EvalException e) {
            out.println("eval error " + e.kind() + " line " + e.span().line(source));
        }
    }

    private Path resolve(String file) {
        var resolvedPath = Path.of(file);
        if (!resolvedPath.isAbsolute()) {
            for (String lookupPathEntry : lookupPath) {
                var path = Path.of(lookupPathEntry, file);
                if (Files.isRegularFile(path)) {
                    return path;
                }
            }
        }
        return resolvedPath;
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("usage: Runner <script.colloml>");
            System.exit(2);
        }
        var runner = new Runner();
        ConfigReader.readConfig().applyConfig(runner);
        runner.runFile(args[0]);
    }
}
